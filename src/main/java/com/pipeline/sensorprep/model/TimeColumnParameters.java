package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.io.Serializable;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Objects;

/**
 * 时间列规范化参数（不可变）
 */
public final class TimeColumnParameters implements Serializable {

    public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";

    private final String timeColumn;
    private final String timeFormat;
    private final DuplicateKeep duplicateKeep;
    private final TimeDefectPolicy missingHandling;
    private final TimeDefectPolicy failedConversionHandling;
    /** 是否逐条记录被丢弃的时间值（审计用） */
    private final boolean logDiscarded;

    private transient DateTimeFormatter formatter;

    public TimeColumnParameters(String timeColumn, String timeFormat, DuplicateKeep duplicateKeep,
                                TimeDefectPolicy missingHandling, TimeDefectPolicy failedConversionHandling,
                                boolean logDiscarded) {
        if (timeColumn == null || timeColumn.isBlank()) {
            throw new ConfigException("Time column name must be a non-empty string");
        }
        this.timeColumn = timeColumn;
        this.timeFormat = (timeFormat == null || timeFormat.isBlank()) ? DEFAULT_TIME_FORMAT : timeFormat;
        this.duplicateKeep = Objects.requireNonNull(duplicateKeep, "duplicateKeep");
        this.missingHandling = Objects.requireNonNull(missingHandling, "missingHandling");
        this.failedConversionHandling = Objects.requireNonNull(failedConversionHandling, "failedConversionHandling");
        this.logDiscarded = logDiscarded;
        this.formatter = createFormatter(this.timeFormat);
    }

    /** 默认策略：保留首条重复、缺失与解析失败均丢弃 */
    public static TimeColumnParameters defaults(String timeColumn, String timeFormat) {
        return new TimeColumnParameters(timeColumn, timeFormat, DuplicateKeep.FIRST,
                TimeDefectPolicy.DROP, TimeDefectPolicy.DROP, false);
    }

    public String getTimeColumn() { return timeColumn; }
    public String getTimeFormat() { return timeFormat; }
    public DuplicateKeep getDuplicateKeep() { return duplicateKeep; }
    public TimeDefectPolicy getMissingHandling() { return missingHandling; }
    public TimeDefectPolicy getFailedConversionHandling() { return failedConversionHandling; }
    public boolean isLogDiscarded() { return logDiscarded; }

    public DateTimeFormatter getFormatter() {
        if (formatter == null) {
            formatter = createFormatter(timeFormat);
        }
        return formatter;
    }

    /**
     * 构建严格模式的格式化器。
     * 严格模式下纪元年（y）缺少纪元字段无法解析，因此引号外的 y 一律按公历年（u）处理，
     * 如 "dd/MM/yy" 与 "d.M.y"。
     *
     * @throws ConfigException 格式串非法
     */
    public static DateTimeFormatter createFormatter(String pattern) {
        try {
            return DateTimeFormatter.ofPattern(toProlepticYear(pattern))
                    .withResolverStyle(ResolverStyle.STRICT);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid time format '" + pattern + "': " + e.getMessage());
        }
    }

    static String toProlepticYear(String pattern) {
        StringBuilder converted = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            converted.append(!quoted && c == 'y' ? 'u' : c);
        }
        return converted.toString();
    }

    @Override
    public String toString() {
        return "TimeColumnParameters{column='" + timeColumn + "', format='" + timeFormat
                + "', duplicates=" + duplicateKeep
                + ", missing=" + missingHandling
                + ", failedConversion=" + failedConversionHandling + "}";
    }
}
