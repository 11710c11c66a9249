package com.pipeline.sensorprep.fill;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 居中时间窗口填充。
 *
 * 对每个缺失位置 t，取原始数据中时间落在 [t - width/2, t + width/2] 内的有效值计算统计量。
 * 统计只基于填充前的原始值，本策略填入的值不参与其它位置的计算。
 * 窗口内没有有效值的位置保持缺失。要求时间轴升序。
 */
public class CenteredWindowFillStrategy implements FillStrategy {

    private final Duration width;
    private final Statistic statistic;

    public CenteredWindowFillStrategy(Duration width, Statistic statistic) {
        this.width = width;
        this.statistic = statistic;
    }

    @Override
    public String getName() {
        return "window-" + statistic.getLabel() + "(" + width + ")";
    }

    @Override
    public int fill(NumericSeries series) {
        Duration half = width.dividedBy(2);
        LocalDateTime[] times = series.times();
        Double[] original = series.snapshot();

        int filled = 0;
        for (int i = 0; i < original.length; i++) {
            if (original[i] != null) {
                continue;
            }
            int from = lowerBound(times, times[i].minus(half));
            int to = upperBound(times, times[i].plus(half));
            List<Double> window = new ArrayList<>();
            for (int k = from; k < to; k++) {
                if (original[k] != null) {
                    window.add(original[k]);
                }
            }
            Double value = statistic.compute(window);
            if (value != null) {
                series.set(i, value);
                filled++;
            }
        }
        return filled;
    }

    /** 第一个时间 >= target 的位置 */
    private static int lowerBound(LocalDateTime[] times, LocalDateTime target) {
        int lo = 0;
        int hi = times.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid].isBefore(target)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** 第一个时间 > target 的位置 */
    private static int upperBound(LocalDateTime[] times, LocalDateTime target) {
        int lo = 0;
        int hi = times.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid].isAfter(target)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
