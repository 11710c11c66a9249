package com.pipeline.sensorprep.fill;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个数值列的工作副本：时间轴（升序） + 可为null的取值。
 * 填充策略直接在该副本上原地修改。
 */
public class NumericSeries {

    private final String column;
    private final LocalDateTime[] times;
    private final Double[] values;

    public NumericSeries(String column, List<LocalDateTime> times, List<?> values) {
        if (times.size() != values.size()) {
            throw new IllegalArgumentException("Column '" + column + "' has " + values.size()
                    + " values but " + times.size() + " timestamps");
        }
        this.column = column;
        this.times = times.toArray(new LocalDateTime[0]);
        this.values = new Double[values.size()];
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            Double number = value == null ? null : ((Number) value).doubleValue();
            // NaN 视同缺失
            this.values[i] = number == null || number.isNaN() ? null : number;
        }
    }

    public String getColumn() { return column; }

    public int size() { return values.length; }

    public LocalDateTime getTime(int i) { return times[i]; }

    LocalDateTime[] times() { return times; }

    public Double get(int i) { return values[i]; }

    public boolean isMissing(int i) { return values[i] == null; }

    public void set(int i, double value) { values[i] = value; }

    public int missingCount() {
        int count = 0;
        for (Double value : values) {
            if (value == null) count++;
        }
        return count;
    }

    public boolean isComplete() {
        return missingCount() == 0;
    }

    /** 当前全部非缺失值 */
    public List<Double> observed() {
        List<Double> observed = new ArrayList<>(values.length);
        for (Double value : values) {
            if (value != null) observed.add(value);
        }
        return observed;
    }

    /** 仍缺失的位置对应的时间戳 */
    public List<LocalDateTime> missingTimes() {
        List<LocalDateTime> missing = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) missing.add(times[i]);
        }
        return missing;
    }

    Double[] snapshot() {
        return values.clone();
    }

    public List<Object> toColumn() {
        List<Object> column = new ArrayList<>(values.length);
        for (Double value : values) {
            column.add(value);
        }
        return column;
    }
}
