package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 时间列缺失值或无法解析值的处理策略
 */
public enum TimeDefectPolicy {
    /** 丢弃该行并记录 */
    DROP("drop"),
    /** 整体失败 */
    ERROR("error");

    private final String configName;

    TimeDefectPolicy(String configName) {
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
    public static TimeDefectPolicy fromConfig(String value) {
        if (value != null) {
            for (TimeDefectPolicy candidate : values()) {
                if (candidate.configName.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new ConfigException("Unknown time column policy '" + value + "', expected one of "
                + Arrays.stream(values()).map(TimeDefectPolicy::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
