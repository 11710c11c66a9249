package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.exception.NoDataException;
import com.pipeline.sensorprep.exception.ResolutionException;
import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.fill.FillChain;
import com.pipeline.sensorprep.fill.NumericSeries;
import com.pipeline.sensorprep.model.MissingStrategy;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 缺失值处理，只作用于数值列（时间列除外）。
 *
 * drop：删除任一数值列存在缺失的行，并上报被删除行的时间戳；
 * fill：对每个存在缺失的数值列执行由参数包构建的填充回退链。
 * 带时间窗口时回退链走完仍有缺失则失败；不带时间窗口时只记录警告，由完整性检查兜底。
 */
public class ResolveMissingStep implements CleaningStep {

    private static final Logger log = LoggerFactory.getLogger(ResolveMissingStep.class);

    @Override
    public String getStepId() {
        return "resolve-missing";
    }

    @Override
    public void execute(StepContext context) {
        List<String> numericColumns = new ArrayList<>();
        for (String column : Columns.valueColumns(context)) {
            if (Columns.isNumeric(context.getDataset().getColumn(column))) {
                numericColumns.add(column);
            }
        }

        ProcessingParameters parameters = context.getParameters();
        if (parameters.getStrategy() == MissingStrategy.DROP) {
            dropRows(context, numericColumns);
        } else {
            fillColumns(context, numericColumns, parameters);
        }
    }

    private void dropRows(StepContext context, List<String> columns) {
        TabularDataset dataset = context.getDataset();
        List<LocalDateTime> times = Columns.timestamps(context);
        boolean[] keep = new boolean[dataset.getRowCount()];
        List<String> dropped = new ArrayList<>();
        for (int row = 0; row < keep.length; row++) {
            keep[row] = true;
            for (String column : columns) {
                if (Columns.isMissing(dataset.getValue(column, row))) {
                    keep[row] = false;
                    dropped.add(String.valueOf(times.get(row)));
                    break;
                }
            }
        }
        if (dropped.isEmpty()) {
            return;
        }

        int removed = dataset.retainRows(keep);
        context.getListener().onRowsDiscarded(getStepId(), "missing values in numeric columns", dropped);
        log.info("Dropped {} rows with missing values, {} rows remain.", removed, dataset.getRowCount());
        if (dataset.isEmpty()) {
            throw new NoDataException("No rows remain after dropping " + removed + " rows with missing values.");
        }
    }

    private void fillColumns(StepContext context, List<String> columns, ProcessingParameters parameters) {
        TabularDataset dataset = context.getDataset();
        List<LocalDateTime> times = null;
        FillChain chain = null;

        for (String column : columns) {
            int missing = Columns.missingCount(dataset.getColumn(column));
            if (missing == 0) {
                continue;
            }
            if (times == null) {
                times = Columns.timestamps(context);
                if (parameters.hasTimeWindow()) {
                    requireAscending(context.getTimeColumn(), times);
                }
                chain = FillChain.forParameters(parameters);
            }
            log.info("{} missing values found in '{}', handling with {}{}.", missing, column,
                    parameters.getFillMethod(),
                    parameters.hasTimeWindow() ? " over a " + parameters.getTimeWindow() + " window" : "");

            NumericSeries series = new NumericSeries(column, times, dataset.getColumn(column));
            boolean complete = chain.apply(series, context.getListener());
            dataset.setColumn(column, series.toColumn());

            if (!complete) {
                if (parameters.hasTimeWindow()) {
                    throw new ResolutionException("Column '" + column + "' still has " + series.missingCount()
                            + " missing values after the " + parameters.getTimeWindow()
                            + " window fill and its fallbacks at " + series.missingTimes()
                            + "; consider a larger time window.");
                }
                context.getListener().onWarning(getStepId(), "Cannot fill " + series.missingCount()
                        + " missing values in '" + column + "' with " + parameters.getFillMethod()
                        + ", skipping.");
            }
        }
    }

    private static void requireAscending(String timeColumn, List<LocalDateTime> times) {
        for (int i = 1; i < times.size(); i++) {
            if (times.get(i).isBefore(times.get(i - 1))) {
                throw new ValidationException("The time column '" + timeColumn + "' is not sorted at row " + i
                        + " (" + times.get(i - 1) + " > " + times.get(i) + "), a time window fill needs sorted data.");
            }
        }
    }
}
