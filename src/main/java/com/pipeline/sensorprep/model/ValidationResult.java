package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 配置校验结果：收集全部错误后一次性报告，而不是遇到第一个错误就中止
 */
public class ValidationResult implements Serializable {
    private final List<String> errors = new ArrayList<>();

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public void addError(String error) {
        this.errors.add(error);
    }

    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }

    /**
     * @throws ConfigException 存在任一错误时，消息中列出全部错误
     */
    public void throwIfInvalid() {
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", errors));
        }
    }
}
