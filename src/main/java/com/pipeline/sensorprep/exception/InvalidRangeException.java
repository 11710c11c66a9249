package com.pipeline.sensorprep.exception;

/**
 * 请求的起始时间晚于结束时间。
 */
public class InvalidRangeException extends PreparationException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
