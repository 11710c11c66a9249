package com.pipeline.sensorprep.fill;

/**
 * 后向填充：用后一个有效值补全缺失值，末尾的缺失值保持不变
 */
public class BackwardFillStrategy implements FillStrategy {

    @Override
    public String getName() {
        return "bfill";
    }

    @Override
    public int fill(NumericSeries series) {
        int filled = 0;
        Double next = null;
        for (int i = series.size() - 1; i >= 0; i--) {
            if (series.isMissing(i)) {
                if (next != null) {
                    series.set(i, next);
                    filled++;
                }
            } else {
                next = series.get(i);
            }
        }
        return filled;
    }
}
