package com.pipeline.sensorprep.exception;

/**
 * 填充策略链执行完毕后仍无法消除全部缺失值。
 */
public class ResolutionException extends PreparationException {

    public ResolutionException(String message) {
        super(message);
    }
}
