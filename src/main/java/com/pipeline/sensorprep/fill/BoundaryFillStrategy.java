package com.pipeline.sensorprep.fill;

/**
 * 边界填充：开头的缺失值取第一个有效值，末尾的缺失值取最后一个有效值。
 * 中间的缺失值不处理。
 */
public class BoundaryFillStrategy implements FillStrategy {

    @Override
    public String getName() {
        return "boundary";
    }

    @Override
    public int fill(NumericSeries series) {
        int first = -1;
        int last = -1;
        for (int i = 0; i < series.size(); i++) {
            if (!series.isMissing(i)) {
                if (first < 0) first = i;
                last = i;
            }
        }
        if (first < 0) {
            return 0;
        }
        int filled = 0;
        for (int i = 0; i < first; i++) {
            series.set(i, series.get(first));
            filled++;
        }
        for (int i = last + 1; i < series.size(); i++) {
            series.set(i, series.get(last));
            filled++;
        }
        return filled;
    }
}
