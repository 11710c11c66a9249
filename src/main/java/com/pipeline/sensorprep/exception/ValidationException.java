package com.pipeline.sensorprep.exception;

/**
 * 时间列缺陷或清洗后仍残留缺失值。
 */
public class ValidationException extends PreparationException {

    public ValidationException(String message) {
        super(message);
    }
}
