package com.pipeline.sensorprep.storage;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 持久化时的取值格式：时间 yyyy-MM-dd HH:mm:ss，小数使用普通记数法
 */
final class StoredValues {

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private StoredValues() {}

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return TIME_FORMAT.format((LocalDateTime) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        return value.toString();
    }

    /** 表名、文件名中只保留字母、数字与下划线 */
    static String sanitize(String label) {
        return label.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
