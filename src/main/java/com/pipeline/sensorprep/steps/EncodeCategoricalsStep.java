package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.fill.Statistic;
import com.pipeline.sensorprep.model.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 非数值列编码。
 *
 * 布尔列 -> 0/1；文本列按首次出现顺序编码为 0,1,2,...（二值列即为 0/1）。
 * 编码前用该列众数填充缺失值，无法求众数时记录警告并保留缺失。
 */
public class EncodeCategoricalsStep implements CleaningStep {

    private static final Logger log = LoggerFactory.getLogger(EncodeCategoricalsStep.class);

    @Override
    public String getStepId() {
        return "encode-categoricals";
    }

    @Override
    public void execute(StepContext context) {
        TabularDataset dataset = context.getDataset();
        for (String column : Columns.valueColumns(context)) {
            List<Object> values = dataset.getColumn(column);
            if (Columns.isNumeric(values)) {
                continue;
            }
            List<Object> filled = fillWithMode(context, column, values);
            if (Columns.isBoolean(values)) {
                dataset.setColumn(column, encodeBoolean(filled));
                log.info("Boolean column '{}' encoded as 0/1.", column);
            } else {
                Map<Object, Long> codes = new LinkedHashMap<>();
                dataset.setColumn(column, encodeCategories(filled, codes));
                if (!codes.isEmpty()) {
                    log.info("Categorical column '{}' encoded by first-seen order: {}", column, codes);
                }
            }
        }
    }

    private List<Object> fillWithMode(StepContext context, String column, List<Object> values) {
        int missing = Columns.missingCount(values);
        if (missing == 0) {
            return values;
        }
        Object mode = Statistic.mode(values);
        if (mode == null) {
            context.getListener().onWarning(getStepId(), "No mode for column '" + column + "', "
                    + missing + " missing values left unfilled.");
            return values;
        }
        List<Object> filled = new ArrayList<>(values.size());
        for (Object value : values) {
            filled.add(Columns.isMissing(value) ? mode : value);
        }
        log.info("{} missing values in '{}' filled with mode {}.", missing, column, mode);
        return filled;
    }

    private static List<Object> encodeBoolean(List<Object> values) {
        List<Object> encoded = new ArrayList<>(values.size());
        for (Object value : values) {
            encoded.add(value == null ? null : (Boolean) value ? 1L : 0L);
        }
        return encoded;
    }

    private static List<Object> encodeCategories(List<Object> values, Map<Object, Long> codes) {
        List<Object> encoded = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                encoded.add(null);
                continue;
            }
            encoded.add(codes.computeIfAbsent(value, k -> (long) codes.size()));
        }
        return encoded;
    }
}
