package com.pipeline.sensorprep.exception;

/**
 * 源文件读取或结果持久化过程中的I/O失败。
 */
public class DataSourceException extends PreparationException {

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
