package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.model.OutlierMethod;
import com.pipeline.sensorprep.model.OutlierReport;
import com.pipeline.sensorprep.model.TabularDataset;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 离群值检测（仅报告，不修改数据）。
 *
 * z_score：|x - mean| / std > threshold，std 为样本标准差，零方差列跳过；
 * iqr：x < Q1 - k*IQR 或 x > Q3 + k*IQR，k 取阈值，分位数按线性插值计算。
 */
public class DetectOutliersStep implements CleaningStep {

    private static final Logger log = LoggerFactory.getLogger(DetectOutliersStep.class);

    @Override
    public String getStepId() {
        return "detect-outliers";
    }

    @Override
    public void execute(StepContext context) {
        OutlierMethod method = context.getParameters().getOutlierMethod();
        double threshold = context.getParameters().getOutlierThreshold();
        OutlierReport report = new OutlierReport(method, threshold);
        TabularDataset dataset = context.getDataset();
        List<LocalDateTime> times = Columns.timestamps(context);

        for (String column : context.getSensorColumns()) {
            if (!dataset.hasColumn(column) || !Columns.isNumeric(dataset.getColumn(column))) {
                continue;
            }
            List<Object> values = dataset.getColumn(column);
            List<Integer> rows = new ArrayList<>(values.size());
            for (int i = 0; i < values.size(); i++) {
                if (!Columns.isMissing(values.get(i))) {
                    rows.add(i);
                }
            }
            double[] data = new double[rows.size()];
            for (int i = 0; i < data.length; i++) {
                data[i] = ((Number) values.get(rows.get(i))).doubleValue();
            }

            double[] bounds = method == OutlierMethod.Z_SCORE ? zScoreBounds(data, threshold) : iqrBounds(data, threshold);
            if (bounds == null) {
                report.addSkipped(column);
                context.getListener().onWarning(getStepId(), "Column '" + column
                        + "' has zero variance, skipping outlier detection.");
                continue;
            }

            List<LocalDateTime> flagged = new ArrayList<>();
            for (int i = 0; i < data.length; i++) {
                if (data[i] < bounds[0] || data[i] > bounds[1]) {
                    flagged.add(times.get(rows.get(i)));
                }
            }
            OutlierReport.ColumnOutliers outliers = new OutlierReport.ColumnOutliers(column, bounds[0], bounds[1], flagged);
            report.addColumn(outliers);
            context.getListener().onOutliers(method, outliers);
        }

        context.setOutlierReport(report);
        log.info("Outlier detection with {} (threshold {}) flagged {} values.", method, threshold, report.getTotalCount());
    }

    /**
     * @return [下界, 上界]；样本不足或零方差时返回null
     */
    private static double[] zScoreBounds(double[] data, double threshold) {
        if (data.length < 2) {
            return null;
        }
        double mean = StatUtils.mean(data);
        double std = new StandardDeviation().evaluate(data, mean);
        if (!(std > 0)) {
            return null;
        }
        return new double[]{mean - threshold * std, mean + threshold * std};
    }

    private static double[] iqrBounds(double[] data, double k) {
        if (data.length == 0) {
            return null;
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(data);
        double q1 = percentile.evaluate(25);
        double q3 = percentile.evaluate(75);
        double iqr = q3 - q1;
        return new double[]{q1 - k * iqr, q3 + k * iqr};
    }
}
