package com.pipeline.sensorprep.fill;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.model.ProcessingParameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 填充回退链：按顺序尝试各策略，直到序列不再有缺失值。
 *
 * 由参数包构建的链：
 * <pre>
 *   ffill        ffill → bfill
 *   bfill        bfill → ffill
 *   mean/median/mode    全局统计量
 *   constant     固定值
 *   interpolate  线性插值 → bfill → ffill
 *   带时间窗口    居中窗口统计量 → 边界填充 → 全局统计量
 * </pre>
 */
public class FillChain {

    private final List<FillStrategy> strategies;

    public FillChain(List<FillStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("A fill chain needs at least one strategy");
        }
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
    }

    public static FillChain forParameters(ProcessingParameters parameters) {
        switch (parameters.getFillMethod()) {
            case FFILL:
                return new FillChain(Arrays.asList(new ForwardFillStrategy(), new BackwardFillStrategy()));
            case BFILL:
                return new FillChain(Arrays.asList(new BackwardFillStrategy(), new ForwardFillStrategy()));
            case CONSTANT:
                return new FillChain(Collections.singletonList(new ConstantFillStrategy(parameters.getFillValue())));
            case INTERPOLATE:
                return new FillChain(Arrays.asList(new LinearInterpolationStrategy(),
                        new BackwardFillStrategy(), new ForwardFillStrategy()));
            default:
                Statistic statistic = Statistic.valueOf(parameters.getFillMethod().name());
                if (parameters.hasTimeWindow()) {
                    return new FillChain(Arrays.asList(
                            new CenteredWindowFillStrategy(parameters.getTimeWindow(), statistic),
                            new BoundaryFillStrategy(),
                            new GlobalStatisticFillStrategy(statistic)));
                }
                return new FillChain(Collections.singletonList(new GlobalStatisticFillStrategy(statistic)));
        }
    }

    /**
     * 依次执行各策略，每个策略只处理前一个策略遗留的缺失值。
     *
     * @return 执行完毕后序列是否已无缺失值
     */
    public boolean apply(NumericSeries series, PreparationListener listener) {
        for (int i = 0; i < strategies.size() && !series.isComplete(); i++) {
            FillStrategy strategy = strategies.get(i);
            int filled = strategy.fill(series);
            if (filled > 0) {
                listener.onFill(series.getColumn(), strategy.getName(), filled, i > 0);
            }
        }
        return series.isComplete();
    }
}
