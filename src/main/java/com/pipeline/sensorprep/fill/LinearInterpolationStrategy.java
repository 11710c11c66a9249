package com.pipeline.sensorprep.fill;

/**
 * 线性插值：按行位置在前后两个有效值之间插值。
 * 只处理两侧都有有效值的缺口，首尾缺失值留给后续策略。
 */
public class LinearInterpolationStrategy implements FillStrategy {

    @Override
    public String getName() {
        return "interpolate";
    }

    @Override
    public int fill(NumericSeries series) {
        int filled = 0;
        int previous = -1;
        for (int i = 0; i < series.size(); i++) {
            if (series.isMissing(i)) {
                continue;
            }
            if (previous >= 0 && i - previous > 1) {
                double from = series.get(previous);
                double to = series.get(i);
                int span = i - previous;
                for (int k = previous + 1; k < i; k++) {
                    series.set(k, from + (to - from) * (k - previous) / span);
                    filled++;
                }
            }
            previous = i;
        }
        return filled;
    }
}
