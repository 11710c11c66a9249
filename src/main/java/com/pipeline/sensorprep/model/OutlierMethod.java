package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 离群值检测方法
 */
public enum OutlierMethod {
    /** 标准分数：|x - mean| / std 超过阈值 */
    Z_SCORE("z_score"),
    /** 四分位距：超出 [Q1 - k*IQR, Q3 + k*IQR] */
    IQR("iqr");

    private final String configName;

    OutlierMethod(String configName) {
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
    public static OutlierMethod fromConfig(String value) {
        if (value != null) {
            for (OutlierMethod candidate : values()) {
                if (candidate.configName.equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
        }
        throw new ConfigException("Unknown outlier method '" + value + "', expected one of "
                + Arrays.stream(values()).map(OutlierMethod::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
