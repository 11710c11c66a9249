package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 缺失值填充方法
 */
public enum FillMethod {
    /** 前向填充 */
    FFILL("ffill"),
    /** 后向填充 */
    BFILL("bfill"),
    /** 均值（保留1位小数） */
    MEAN("mean"),
    /** 中位数（保留1位小数） */
    MEDIAN("median"),
    /** 众数 */
    MODE("mode"),
    /** 固定值 */
    CONSTANT("constant"),
    /** 线性插值 */
    INTERPOLATE("interpolate");

    private final String configName;

    FillMethod(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /** 可与时间窗口配合使用的方法 */
    public boolean supportsTimeWindow() {
        return this == MEAN || this == MEDIAN || this == MODE;
    }

    /**
     * 解析配置中的取值，大小写不敏感。
     *
     * @throws ConfigException 取值不在可选范围内
     */
    public static FillMethod fromConfig(String value) {
        if (value != null) {
            for (FillMethod candidate : values()) {
                if (candidate.configName.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new ConfigException("Unknown fill method '" + value + "', expected one of "
                + Arrays.stream(values()).map(FillMethod::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
