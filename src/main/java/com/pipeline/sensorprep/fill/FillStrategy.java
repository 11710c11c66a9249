package com.pipeline.sensorprep.fill;

/**
 * 缺失值填充策略：回退链中的一个环节。
 *
 * 策略只填充自己能够确定的位置，无法处理的缺失值留给链中的下一个策略。
 */
public interface FillStrategy {

    String getName();

    /**
     * 在序列上原地填充缺失值。
     *
     * @return 本次填充的数量
     */
    int fill(NumericSeries series);
}
