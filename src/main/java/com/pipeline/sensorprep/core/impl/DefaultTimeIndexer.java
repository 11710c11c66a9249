package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.core.TimeIndexer;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.model.DuplicateKeep;
import com.pipeline.sensorprep.model.TabularDataset;
import com.pipeline.sensorprep.model.TimeColumnParameters;
import com.pipeline.sensorprep.model.TimeDefectPolicy;
import com.pipeline.sensorprep.model.TimeIndex;
import com.pipeline.sensorprep.model.TimeIndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * 时间索引构建器默认实现。
 *
 * 处理顺序：类型校验 → 缺失值策略 → 按格式解析 → 解析失败策略 → 稳定排序 → 去重。
 * 时间值类型支持：文本（按配置格式解析）、日期时间、数值（按整数文本解析）。
 */
public class DefaultTimeIndexer implements TimeIndexer {

    private static final Logger log = LoggerFactory.getLogger(DefaultTimeIndexer.class);

    static final String STAGE = "time-index";

    /** 错误信息中最多列出的示例数 */
    private static final int MAX_EXAMPLES = 10;

    private final TimeColumnParameters parameters;
    private final PreparationListener listener;

    public DefaultTimeIndexer(TimeColumnParameters parameters, PreparationListener listener) {
        this.parameters = parameters;
        this.listener = listener;
    }

    @Override
    public TimeIndex build(TabularDataset source) {
        String column = parameters.getTimeColumn();
        log.info("Starting the processing of the '{}' column.", column);

        if (source == null || source.isEmpty()) {
            throw new SchemaException("The input data is empty, there is no '" + column + "' value to index.");
        }
        if (!source.hasColumn(column)) {
            throw new SchemaException("The specified time column '" + column + "' does not exist, available columns: "
                    + source.getColumnNames());
        }

        List<Object> values = source.getColumn(column);
        validateTypes(column, values);

        List<TimeIndexEntry> entries = parseAll(column, values);

        // List.sort 为稳定排序，相同时间戳保持原始行顺序
        entries.sort(Comparator.comparing(TimeIndexEntry::getTimestamp));

        TimeIndex index = new TimeIndex(resolveDuplicates(column, entries));
        log.info("The '{}' column has been processed and indexed: {}", column, index);
        return index;
    }

    private void validateTypes(String column, List<Object> values) {
        Set<String> kinds = new LinkedHashSet<>();
        List<String> unsupported = new ArrayList<>();
        boolean anyValue = false;
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value == null) {
                continue;
            }
            anyValue = true;
            String kind = kindOf(value);
            if (kind == null) {
                if (unsupported.size() < MAX_EXAMPLES) {
                    unsupported.add("row " + i + ": " + value.getClass().getSimpleName());
                }
            } else {
                kinds.add(kind);
            }
        }
        if (!unsupported.isEmpty()) {
            throw new SchemaException("The time column '" + column + "' contains unsupported value types "
                    + "(expected string, datetime or numeric): " + unsupported);
        }
        if (kinds.size() > 1) {
            throw new SchemaException("The time column '" + column + "' mixes value types " + kinds
                    + ", expected a single type.");
        }
        if (!anyValue) {
            throw new ValidationException("The time column '" + column + "' contains only missing values.");
        }
    }

    private List<TimeIndexEntry> parseAll(String column, List<Object> values) {
        DateTimeFormatter formatter = parameters.getFormatter();
        List<TimeIndexEntry> entries = new ArrayList<>(values.size());
        List<String> missing = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (int position = 0; position < values.size(); position++) {
            Object value = values.get(position);
            if (value == null) {
                missing.add("row " + position);
                continue;
            }
            LocalDateTime timestamp = toTimestamp(value, formatter);
            if (timestamp == null) {
                failed.add("row " + position + ": '" + value + "'");
                continue;
            }
            entries.add(new TimeIndexEntry(position, timestamp));
        }

        if (!missing.isEmpty()) {
            if (parameters.getMissingHandling() == TimeDefectPolicy.ERROR) {
                throw new ValidationException("The time column '" + column + "' contains " + missing.size()
                        + " missing values, e.g. " + examples(missing) + ". Please clean the data before processing.");
            }
            discard("missing value in '" + column + "'", missing);
        }
        if (!failed.isEmpty()) {
            if (parameters.getFailedConversionHandling() == TimeDefectPolicy.ERROR) {
                throw new ValidationException(failed.size() + " values in '" + column
                        + "' could not be converted to datetime with format '" + parameters.getTimeFormat()
                        + "', e.g. " + examples(failed));
            }
            discard("unparseable value in '" + column + "' (format '" + parameters.getTimeFormat() + "')", failed);
        }
        if (entries.isEmpty()) {
            throw new ValidationException("No valid timestamps remain in '" + column + "' after dropping "
                    + missing.size() + " missing and " + failed.size() + " unparseable values.");
        }
        return entries;
    }

    private List<TimeIndexEntry> resolveDuplicates(String column, List<TimeIndexEntry> sorted) {
        // 时间戳 -> 该时间戳下的全部行位置（已按原始顺序）
        TreeMap<LocalDateTime, List<TimeIndexEntry>> groups = new TreeMap<>();
        for (TimeIndexEntry entry : sorted) {
            groups.computeIfAbsent(entry.getTimestamp(), k -> new ArrayList<>()).add(entry);
        }
        int duplicateCount = sorted.size() - groups.size();
        if (duplicateCount == 0) {
            return sorted;
        }

        List<String> duplicatedTimes = new ArrayList<>();
        groups.forEach((ts, group) -> {
            if (group.size() > 1) {
                duplicatedTimes.add(ts.toString());
            }
        });

        DuplicateKeep keep = parameters.getDuplicateKeep();
        if (keep == DuplicateKeep.NONE) {
            listener.onWarning(STAGE, "Duplicates in column '" + column + "' were found but not removed ("
                    + duplicateCount + " duplicate rows). Duplicated time values: " + duplicatedTimes);
            return sorted;
        }

        List<TimeIndexEntry> kept = new ArrayList<>(groups.size());
        List<String> removed = new ArrayList<>();
        for (List<TimeIndexEntry> group : groups.values()) {
            TimeIndexEntry survivor = keep == DuplicateKeep.FIRST ? group.get(0) : group.get(group.size() - 1);
            kept.add(survivor);
            for (TimeIndexEntry entry : group) {
                if (entry != survivor) {
                    removed.add("row " + entry.getPosition() + " @ " + entry.getTimestamp());
                }
            }
        }
        listener.onWarning(STAGE, duplicateCount + " duplicate rows were found in the '" + column
                + "' column and removed (keep=" + keep + "). Duplicated time values: " + duplicatedTimes);
        discard("duplicate timestamp in '" + column + "'", removed);
        return kept;
    }

    private void discard(String reason, List<String> details) {
        if (parameters.isLogDiscarded()) {
            for (String detail : details) {
                log.info("Discarded {} ({})", detail, reason);
            }
        }
        listener.onRowsDiscarded(STAGE, reason, details);
    }

    /**
     * 把单个时间值转换为时间戳。
     *
     * @return 无法解析时返回null
     */
    static LocalDateTime toTimestamp(Object value, DateTimeFormatter formatter) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        String text;
        if (value instanceof Number) {
            text = numberText((Number) value);
        } else {
            text = value.toString().trim();
        }
        try {
            TemporalAccessor parsed = formatter.parseBest(text, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof LocalDateTime) {
                return (LocalDateTime) parsed;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String numberText(Number number) {
        if (number instanceof Long || number instanceof Integer) {
            return number.toString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return String.valueOf(d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    private static String kindOf(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof LocalDateTime || value instanceof LocalDate) {
            return "datetime";
        }
        if (value instanceof Number) {
            return "numeric";
        }
        return null;
    }

    private static String examples(List<String> items) {
        if (items.size() <= MAX_EXAMPLES) {
            return items.toString();
        }
        return items.subList(0, MAX_EXAMPLES) + " and " + (items.size() - MAX_EXAMPLES) + " more";
    }
}
