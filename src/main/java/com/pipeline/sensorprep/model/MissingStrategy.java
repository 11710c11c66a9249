package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 缺失值处理策略
 */
public enum MissingStrategy {
    /** 删除含缺失值的行 */
    DROP("drop"),
    /** 按填充方法补全缺失值 */
    FILL("fill");

    private final String configName;

    MissingStrategy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * 解析配置中的取值，大小写不敏感。
     *
     * @throws ConfigException 取值不在可选范围内
     */
    public static MissingStrategy fromConfig(String value) {
        if (value != null) {
            for (MissingStrategy candidate : values()) {
                if (candidate.configName.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new ConfigException("Unknown missing-value strategy '" + value + "', expected one of "
                + Arrays.stream(values()).map(MissingStrategy::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
