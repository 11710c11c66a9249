package com.pipeline.sensorprep.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 单元格取值的类型推断与归一化。
 *
 * 推断按列进行：全部非空值为布尔 -> Boolean；全部为整数 -> Long
 * （列中存在缺失时拓宽为Double）；全部为数值 -> Double；其余保持原文本。
 */
public final class CellValues {

    private static final Set<String> MISSING_TOKENS = Set.of(
            "", "na", "n/a", "nan", "null", "none", "#n/a", "-nan", "<na>");

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile(
            "[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?|[-+]?(inf|infinity)", Pattern.CASE_INSENSITIVE);

    private CellValues() {}

    public static boolean isMissingToken(String raw) {
        return raw == null || MISSING_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 对一列原始文本做类型推断。
     */
    public static List<Object> inferColumn(List<String> raw) {
        List<String> cells = new ArrayList<>(raw.size());
        boolean allBoolean = true;
        boolean allInteger = true;
        boolean allDecimal = true;
        boolean anyValue = false;
        boolean anyMissing = false;

        for (String value : raw) {
            if (isMissingToken(value)) {
                cells.add(null);
                anyMissing = true;
                continue;
            }
            String trimmed = value.trim();
            cells.add(trimmed);
            anyValue = true;
            if (!"true".equalsIgnoreCase(trimmed) && !"false".equalsIgnoreCase(trimmed)) {
                allBoolean = false;
            }
            if (!INTEGER.matcher(trimmed).matches()) {
                allInteger = false;
            }
            if (!DECIMAL.matcher(trimmed).matches()) {
                allDecimal = false;
            }
        }

        List<Object> typed = new ArrayList<>(cells.size());
        if (!anyValue) {
            cells.forEach(c -> typed.add(null));
            return typed;
        }
        for (String cell : cells) {
            if (cell == null) {
                typed.add(null);
            } else if (allBoolean) {
                typed.add(Boolean.valueOf(cell.toLowerCase(Locale.ROOT)));
            } else if (allInteger && !anyMissing && fitsLong(cell)) {
                typed.add(Long.valueOf(cell.startsWith("+") ? cell.substring(1) : cell));
            } else if (allInteger || allDecimal) {
                typed.add(parseDouble(cell));
            } else {
                typed.add(cell);
            }
        }
        if (allInteger && !anyMissing) {
            return normalizeNumbers(typed);
        }
        return typed;
    }

    /**
     * 数值列统一类型：全部为整数值且无缺失时用Long，否则全部用Double。
     * 列中含非数值（文本、布尔、时间）时原样返回。
     */
    public static List<Object> normalizeNumbers(List<Object> values) {
        boolean anyNumber = false;
        boolean allIntegral = true;
        for (Object value : values) {
            if (value == null) {
                allIntegral = false;
                continue;
            }
            if (!(value instanceof Number)) {
                return values;
            }
            anyNumber = true;
            double d = ((Number) value).doubleValue();
            if (!(value instanceof Long) && (d != Math.rint(d) || Double.isInfinite(d) || Math.abs(d) > 9.0e15)) {
                allIntegral = false;
            }
        }
        if (!anyNumber) {
            return values;
        }
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                normalized.add(null);
            } else if (allIntegral) {
                normalized.add(((Number) value).longValue());
            } else {
                normalized.add(((Number) value).doubleValue());
            }
        }
        return normalized;
    }

    private static boolean fitsLong(String cell) {
        try {
            Long.parseLong(cell.startsWith("+") ? cell.substring(1) : cell);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static Double parseDouble(String cell) {
        String lower = cell.toLowerCase(Locale.ROOT);
        if (lower.endsWith("inf") || lower.endsWith("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.valueOf(cell);
    }
}
