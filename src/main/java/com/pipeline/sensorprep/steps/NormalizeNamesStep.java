package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.exception.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 列名规范化：去除首尾空白、转小写、空格替换为下划线。
 * 时间列名与传感器列名同步更新。
 */
public class NormalizeNamesStep implements CleaningStep {

    private static final Logger log = LoggerFactory.getLogger(NormalizeNamesStep.class);

    @Override
    public String getStepId() {
        return "normalize-names";
    }

    @Override
    public void execute(StepContext context) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (String column : context.getDataset().getColumnNames()) {
            String normalized = normalize(column);
            if (!normalized.equals(column)) {
                renames.put(column, normalized);
            }
        }
        if (!renames.isEmpty()) {
            try {
                context.getDataset().renameColumns(renames);
            } catch (IllegalArgumentException e) {
                throw new SchemaException("Column names collide after normalization " + renames + ": "
                        + e.getMessage());
            }
            log.info("Column names normalized: {}", renames);
        }

        List<String> sensors = new ArrayList<>();
        for (String sensor : context.getSensorColumns()) {
            sensors.add(normalize(sensor));
        }
        context.updateColumnNames(normalize(context.getTimeColumn()), sensors);
    }

    public static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
