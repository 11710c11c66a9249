package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.model.OutlierMethod;
import com.pipeline.sensorprep.model.OutlierReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 把诊断事件转发到日志
 */
public class LoggingPreparationListener implements PreparationListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingPreparationListener.class);

    @Override
    public void onWarning(String stage, String message) {
        log.warn("[{}] {}", stage, message);
    }

    @Override
    public void onRowsDiscarded(String stage, String reason, List<String> details) {
        log.warn("[{}] {} rows discarded: {}", stage, details.size(), reason);
        for (String detail : details) {
            log.debug("[{}] discarded {}", stage, detail);
        }
    }

    @Override
    public void onFill(String column, String strategy, int filled, boolean fallback) {
        if (fallback) {
            log.warn("{} values in '{}' filled by fallback strategy {}", filled, column, strategy);
        } else {
            log.info("{} values in '{}' filled by {}", filled, column, strategy);
        }
    }

    @Override
    public void onOutliers(OutlierMethod method, OutlierReport.ColumnOutliers outliers) {
        if (outliers.getCount() == 0) {
            log.debug("No outliers in '{}' ({})", outliers.getColumn(), method);
            return;
        }
        log.info("{} outliers detected in '{}' using {} outside [{}, {}]: {}", outliers.getCount(),
                outliers.getColumn(), method, outliers.getLowerBound(), outliers.getUpperBound(),
                outliers.getFlaggedTimestamps());
    }
}
