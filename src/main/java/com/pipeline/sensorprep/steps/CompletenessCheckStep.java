package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.model.TabularDataset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 最终完整性检查：任何列仍含缺失值即失败，并列出每列对应的时间戳
 */
public class CompletenessCheckStep implements CleaningStep {

    @Override
    public String getStepId() {
        return "completeness-check";
    }

    @Override
    public void execute(StepContext context) {
        TabularDataset dataset = context.getDataset();
        List<Object> times = dataset.getColumn(context.getTimeColumn());
        Map<String, List<Object>> gaps = new LinkedHashMap<>();
        for (String column : dataset.getColumnNames()) {
            List<Object> values = dataset.getColumn(column);
            for (int row = 0; row < values.size(); row++) {
                if (Columns.isMissing(values.get(row))) {
                    Object where = column.equals(context.getTimeColumn()) ? "row " + row : times.get(row);
                    gaps.computeIfAbsent(column, k -> new ArrayList<>()).add(where);
                }
            }
        }
        if (gaps.isEmpty()) {
            return;
        }
        StringBuilder message = new StringBuilder("Missing values remain after cleaning:");
        gaps.forEach((column, where) -> message.append(' ').append(column).append(" at ").append(where).append(';'));
        message.setLength(message.length() - 1);
        throw new ValidationException(message.toString());
    }
}
