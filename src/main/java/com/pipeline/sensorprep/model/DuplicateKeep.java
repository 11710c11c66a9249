package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 时间戳重复时的保留策略
 */
public enum DuplicateKeep {
    /** 保留原始顺序中的第一条 */
    FIRST("first"),
    /** 保留原始顺序中的最后一条 */
    LAST("last"),
    /** 不删除，仅报告重复数量 */
    NONE("none");

    private final String configName;

    DuplicateKeep(String configName) {
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
    public static DuplicateKeep fromConfig(String value) {
        if (value != null) {
            for (DuplicateKeep candidate : values()) {
                if (candidate.configName.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new ConfigException("Unknown duplicate policy '" + value + "', expected one of "
                + Arrays.stream(values()).map(DuplicateKeep::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
