package com.pipeline.sensorprep.exception;

/**
 * 数据准备过程中所有失败的基类。
 *
 * 各阶段一旦失败立即中止整次运行，不做自动重试；
 * 异常消息须包含足以定位问题的列名、时间戳或计数信息。
 */
public class PreparationException extends RuntimeException {

    public PreparationException(String message) {
        super(message);
    }

    public PreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}
