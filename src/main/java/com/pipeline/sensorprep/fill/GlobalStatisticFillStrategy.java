package com.pipeline.sensorprep.fill;

/**
 * 用整列的统计量（均值 / 中位数 / 众数）补全全部缺失值。
 * 列中没有任何有效值时无法计算，不做填充。
 */
public class GlobalStatisticFillStrategy implements FillStrategy {

    private final Statistic statistic;

    public GlobalStatisticFillStrategy(Statistic statistic) {
        this.statistic = statistic;
    }

    @Override
    public String getName() {
        return statistic.getLabel();
    }

    @Override
    public int fill(NumericSeries series) {
        Double value = statistic.compute(series.observed());
        if (value == null) {
            return 0;
        }
        int filled = 0;
        for (int i = 0; i < series.size(); i++) {
            if (series.isMissing(i)) {
                series.set(i, value);
                filled++;
            }
        }
        return filled;
    }
}
