package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.io.Serializable;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 清洗参数包（不可变）。
 *
 * 由调用方构建并按值传入清洗管道，运行期间不会被修改。
 * build() 时校验参数组合，非法组合抛出 {@link ConfigException}。
 */
public final class ProcessingParameters implements Serializable {

    private static final Pattern WINDOW_PATTERN =
            Pattern.compile("^(\\d+)\\s*(ms|s|sec|min|t|h|d)$");

    private final MissingStrategy strategy;
    private final FillMethod fillMethod;
    private final Double fillValue;
    /** 居中时间窗口宽度；null表示全局填充 */
    private final Duration timeWindow;
    private final OutlierMethod outlierMethod;
    private final double outlierThreshold;

    private ProcessingParameters(Builder builder) {
        this.strategy = builder.strategy;
        this.fillMethod = builder.fillMethod;
        this.fillValue = builder.fillValue;
        this.timeWindow = builder.timeWindow;
        this.outlierMethod = builder.outlierMethod;
        this.outlierThreshold = builder.outlierThreshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    public MissingStrategy getStrategy() { return strategy; }
    public FillMethod getFillMethod() { return fillMethod; }
    public Double getFillValue() { return fillValue; }
    public Duration getTimeWindow() { return timeWindow; }
    public boolean hasTimeWindow() { return timeWindow != null; }
    public OutlierMethod getOutlierMethod() { return outlierMethod; }
    public double getOutlierThreshold() { return outlierThreshold; }

    public Builder toBuilder() {
        return new Builder()
                .strategy(strategy)
                .fillMethod(fillMethod)
                .fillValue(fillValue)
                .timeWindow(timeWindow)
                .outlierMethod(outlierMethod)
                .outlierThreshold(outlierThreshold);
    }

    /**
     * 解析时间窗口宽度。
     * 支持 "500ms"、"30s"、"5min"（或 "5T"）、"1h"、"2d"，以及ISO-8601格式如 "PT5M"。
     *
     * @return 窗口宽度；输入为空时返回null
     * @throws ConfigException 无法解析或宽度不为正
     */
    public static Duration parseTimeWindow(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        Duration window;
        Matcher matcher = WINDOW_PATTERN.matcher(normalized);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "ms":
                    window = Duration.ofMillis(amount);
                    break;
                case "s":
                case "sec":
                    window = Duration.ofSeconds(amount);
                    break;
                case "min":
                case "t":
                    window = Duration.ofMinutes(amount);
                    break;
                case "h":
                    window = Duration.ofHours(amount);
                    break;
                default:
                    window = Duration.ofDays(amount);
            }
        } else {
            try {
                window = Duration.parse(text.trim().toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new ConfigException("Invalid time window '" + text
                        + "', use e.g. '30s', '5min', '1h', '2d' or 'PT5M'");
            }
        }
        if (window.isZero() || window.isNegative()) {
            throw new ConfigException("Time window '" + text + "' must be positive");
        }
        return window;
    }

    @Override
    public String toString() {
        return "ProcessingParameters{strategy=" + strategy
                + ", fillMethod=" + fillMethod
                + ", fillValue=" + fillValue
                + ", timeWindow=" + timeWindow
                + ", outlierMethod=" + outlierMethod
                + ", outlierThreshold=" + outlierThreshold + "}";
    }

    public static final class Builder {
        private MissingStrategy strategy = MissingStrategy.FILL;
        private FillMethod fillMethod = FillMethod.MEAN;
        private Double fillValue;
        private Duration timeWindow;
        private OutlierMethod outlierMethod = OutlierMethod.Z_SCORE;
        private double outlierThreshold = 3.0;

        private Builder() {}

        public Builder strategy(MissingStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder fillMethod(FillMethod fillMethod) {
            this.fillMethod = fillMethod;
            return this;
        }

        public Builder fillValue(Double fillValue) {
            this.fillValue = fillValue;
            return this;
        }

        public Builder timeWindow(Duration timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder timeWindow(String timeWindow) {
            this.timeWindow = parseTimeWindow(timeWindow);
            return this;
        }

        public Builder outlierMethod(OutlierMethod outlierMethod) {
            this.outlierMethod = outlierMethod;
            return this;
        }

        public Builder outlierThreshold(double outlierThreshold) {
            this.outlierThreshold = outlierThreshold;
            return this;
        }

        public ProcessingParameters build() {
            if (strategy == null) {
                throw new ConfigException("Missing-value strategy must be set");
            }
            if (outlierMethod == null) {
                throw new ConfigException("Outlier method must be set");
            }
            if (!(outlierThreshold > 0) || Double.isInfinite(outlierThreshold)) {
                throw new ConfigException("Outlier threshold must be a positive number, got " + outlierThreshold);
            }
            if (strategy == MissingStrategy.FILL) {
                if (fillMethod == null) {
                    throw new ConfigException("Fill method must be set when strategy is 'fill'");
                }
                if (fillMethod == FillMethod.CONSTANT && fillValue == null) {
                    throw new ConfigException("No fill value provided for filling missing values with a constant");
                }
                if (timeWindow != null && !fillMethod.supportsTimeWindow()) {
                    throw new ConfigException("Fill method '" + fillMethod
                            + "' cannot be combined with a time window, use mean, median or mode");
                }
            }
            if (timeWindow != null && (timeWindow.isZero() || timeWindow.isNegative())) {
                throw new ConfigException("Time window must be positive, got " + timeWindow);
            }
            return new ProcessingParameters(this);
        }
    }
}
