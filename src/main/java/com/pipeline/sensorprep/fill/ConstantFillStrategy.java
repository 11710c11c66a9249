package com.pipeline.sensorprep.fill;

import com.pipeline.sensorprep.exception.ConfigException;

/**
 * 用固定值补全全部缺失值
 */
public class ConstantFillStrategy implements FillStrategy {

    private final double value;

    /**
     * @throws ConfigException 未提供填充值
     */
    public ConstantFillStrategy(Double value) {
        if (value == null) {
            throw new ConfigException("No fill value provided for filling missing values with a constant");
        }
        this.value = value;
    }

    @Override
    public String getName() {
        return "constant";
    }

    @Override
    public int fill(NumericSeries series) {
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
