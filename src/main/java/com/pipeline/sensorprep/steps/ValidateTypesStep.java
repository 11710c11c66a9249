package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.exception.SchemaException;

import java.util.ArrayList;
import java.util.List;

/**
 * 编码后校验：全部非时间列只能包含数值
 */
public class ValidateTypesStep implements CleaningStep {

    @Override
    public String getStepId() {
        return "validate-types";
    }

    @Override
    public void execute(StepContext context) {
        List<String> invalid = new ArrayList<>();
        for (String column : Columns.valueColumns(context)) {
            for (Object value : context.getDataset().getColumn(column)) {
                if (value != null && !(value instanceof Number)) {
                    invalid.add(column + " (" + value.getClass().getSimpleName() + ")");
                    break;
                }
            }
        }
        if (!invalid.isEmpty()) {
            throw new SchemaException("Columns with non-numeric values after encoding: " + invalid);
        }
    }
}
