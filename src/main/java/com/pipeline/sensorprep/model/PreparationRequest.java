package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * 一次数据准备请求：加载模式 + 可选的时间边界。
 *
 * 单日模式只有起点，终点由范围定位器推算为当日 23:59:59。
 */
public final class PreparationRequest implements Serializable {

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final LoadMode mode;
    private final LocalDateTime start;
    private final LocalDateTime end;

    private PreparationRequest(LoadMode mode, LocalDateTime start, LocalDateTime end) {
        this.mode = mode;
        this.start = start;
        this.end = end;
    }

    public static PreparationRequest singleDay(LocalDate day) {
        return new PreparationRequest(LoadMode.SINGLE_DAY, Objects.requireNonNull(day, "day").atStartOfDay(), null);
    }

    public static PreparationRequest timeRange(LocalDateTime start, LocalDateTime end) {
        return new PreparationRequest(LoadMode.TIME_RANGE,
                Objects.requireNonNull(start, "start"), Objects.requireNonNull(end, "end"));
    }

    public static PreparationRequest fullData() {
        return new PreparationRequest(LoadMode.FULL_DATA, null, null);
    }

    /**
     * 按字符串边界构建请求。
     * 仅含日期的起点取当日 00:00:00，仅含日期的终点取当日 23:59:59。
     */
    public static PreparationRequest of(LoadMode mode, String date, String startDate, String endDate) {
        switch (mode) {
            case SINGLE_DAY:
                return singleDay(parseDay(date, "date"));
            case TIME_RANGE:
                return timeRange(parseBound(startDate, "start_date", false), parseBound(endDate, "end_date", true));
            default:
                return fullData();
        }
    }

    public LoadMode getMode() { return mode; }
    public LocalDateTime getStart() { return start; }
    public LocalDateTime getEnd() { return end; }

    public boolean isPartial() {
        return mode != LoadMode.FULL_DATA;
    }

    /** 结果文件及表名使用的标签 */
    public String label() {
        switch (mode) {
            case SINGLE_DAY:
                return start.toLocalDate().toString();
            case TIME_RANGE:
                return COMPACT.format(start) + "_" + COMPACT.format(end);
            default:
                return "full_data";
        }
    }

    private static LocalDate parseDay(String text, String key) {
        if (text == null || text.isBlank()) {
            throw new ConfigException("Invalid '" + key + "' configuration: must be a non-empty string");
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigException("Invalid '" + key + "' configuration: must be in 'yyyy-MM-dd' format, got '"
                    + text + "'");
        }
    }

    private static LocalDateTime parseBound(String text, String key, boolean endOfDay) {
        if (text == null || text.isBlank()) {
            throw new ConfigException("Invalid '" + key + "' configuration: must be a non-empty string");
        }
        String trimmed = text.trim();
        if (trimmed.length() > 10) {
            try {
                return LocalDateTime.parse(trimmed, DATE_TIME);
            } catch (DateTimeParseException e) {
                throw new ConfigException("Invalid '" + key
                        + "' configuration: must be 'yyyy-MM-dd' or 'yyyy-MM-dd HH:mm:ss', got '" + text + "'");
            }
        }
        LocalDate day = parseDay(trimmed, key);
        return endOfDay ? day.atTime(23, 59, 59) : day.atStartOfDay();
    }

    @Override
    public String toString() {
        return "PreparationRequest{mode=" + mode + ", start=" + start + ", end=" + end + "}";
    }
}
