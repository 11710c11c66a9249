package com.pipeline.sensorprep.fill;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 填充所用的统计量。均值与中位数保留1位小数，众数取原值。
 */
public enum Statistic {
    MEAN("mean"),
    MEDIAN("median"),
    MODE("mode");

    private final String label;

    Statistic(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return 统计结果；没有可用数据时返回null
     */
    public Double compute(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        switch (this) {
            case MEAN:
                return round1(StatUtils.mean(toArray(values)));
            case MEDIAN:
                return round1(new Median().evaluate(toArray(values)));
            default:
                return (Double) mode(values);
        }
    }

    /**
     * 众数：出现次数最多的取值；并列时取最小者（布尔值 false 先于 true，文本按字典序）。
     *
     * @return 众数；全部为null时返回null
     */
    public static Object mode(Collection<?> values) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object value : values) {
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count > bestCount || (count == bestCount && VALUE_ORDER.compare(entry.getKey(), best) < 0)) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best;
    }

    public static double round1(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static final Comparator<Object> VALUE_ORDER = Statistic::compareValues;

    /** 数值按大小比较，同类可比较对象按自然顺序，其余按文本 */
    @SuppressWarnings("unchecked")
    private static int compareValues(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass() == b.getClass()) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    @Override
    public String toString() {
        return label;
    }
}
