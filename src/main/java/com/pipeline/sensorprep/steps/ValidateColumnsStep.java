package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.model.TabularDataset;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 校验时间列和全部声明的传感器列都存在且不全为空
 */
public class ValidateColumnsStep implements CleaningStep {

    @Override
    public String getStepId() {
        return "validate-columns";
    }

    @Override
    public void execute(StepContext context) {
        TabularDataset dataset = context.getDataset();
        Set<String> required = new LinkedHashSet<>();
        required.add(context.getTimeColumn());
        required.addAll(context.getSensorColumns());

        List<String> missing = new ArrayList<>();
        List<String> empty = new ArrayList<>();
        for (String column : required) {
            if (!dataset.hasColumn(column)) {
                missing.add(column);
            } else if (Columns.missingCount(dataset.getColumn(column)) == dataset.getRowCount()) {
                empty.add(column);
            }
        }
        if (missing.isEmpty() && empty.isEmpty()) {
            return;
        }

        StringBuilder message = new StringBuilder("Column validation failed.");
        if (!missing.isEmpty()) {
            message.append(" Missing columns: ").append(missing)
                    .append(", available columns: ").append(dataset.getColumnNames()).append('.');
        }
        if (!empty.isEmpty()) {
            message.append(" Columns containing only missing values: ").append(empty).append('.');
        }
        throw new SchemaException(message.toString());
    }
}
