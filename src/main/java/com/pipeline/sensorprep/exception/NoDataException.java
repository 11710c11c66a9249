package com.pipeline.sensorprep.exception;

/**
 * 请求的时间窗口内没有任何数据行。
 */
public class NoDataException extends PreparationException {

    public NoDataException(String message) {
        super(message);
    }
}
