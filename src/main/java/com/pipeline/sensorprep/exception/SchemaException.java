package com.pipeline.sensorprep.exception;

/**
 * 列缺失、全空或类型不符。
 */
public class SchemaException extends PreparationException {

    public SchemaException(String message) {
        super(message);
    }
}
