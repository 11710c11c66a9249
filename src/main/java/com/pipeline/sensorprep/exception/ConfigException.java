package com.pipeline.sensorprep.exception;

/**
 * 处理参数组合非法（策略、方法、阈值等）。
 */
public class ConfigException extends PreparationException {

    public ConfigException(String message) {
        super(message);
    }
}
