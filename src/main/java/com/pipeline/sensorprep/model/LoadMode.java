package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 加载模式
 */
public enum LoadMode {
    /** 单日，部分加载 */
    SINGLE_DAY("single_day"),
    /** 任意时间范围，部分加载 */
    TIME_RANGE("time_range"),
    /** 全量加载 */
    FULL_DATA("full_data");

    private final String configName;

    LoadMode(String configName) {
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
    public static LoadMode fromConfig(String value) {
        if (value != null) {
            for (LoadMode candidate : values()) {
                if (candidate.configName.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new ConfigException("Unknown mode '" + value + "', expected one of "
                + Arrays.stream(values()).map(LoadMode::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
