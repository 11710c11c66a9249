package com.pipeline.sensorprep.fill;

/**
 * 前向填充：用前一个有效值补全缺失值，开头的缺失值保持不变
 */
public class ForwardFillStrategy implements FillStrategy {

    @Override
    public String getName() {
        return "ffill";
    }

    @Override
    public int fill(NumericSeries series) {
        int filled = 0;
        Double last = null;
        for (int i = 0; i < series.size(); i++) {
            if (series.isMissing(i)) {
                if (last != null) {
                    series.set(i, last);
                    filled++;
                }
            } else {
                last = series.get(i);
            }
        }
        return filled;
    }
}
