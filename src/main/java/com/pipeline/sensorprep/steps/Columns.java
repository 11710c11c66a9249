package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.exception.SchemaException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 各清洗步骤共用的列判定工具
 */
final class Columns {

    private Columns() {}

    /** 至少有一个有效值，且全部有效值为数值（布尔不算数值） */
    static boolean isNumeric(List<Object> values) {
        boolean anyValue = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                return false;
            }
            anyValue = true;
        }
        return anyValue;
    }

    static boolean isBoolean(List<Object> values) {
        boolean anyValue = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Boolean)) {
                return false;
            }
            anyValue = true;
        }
        return anyValue;
    }

    static boolean isMissing(Object value) {
        return value == null || (value instanceof Double && ((Double) value).isNaN());
    }

    static int missingCount(List<Object> values) {
        int count = 0;
        for (Object value : values) {
            if (isMissing(value)) count++;
        }
        return count;
    }

    /** 除时间列外的全部列，按数据集列顺序 */
    static List<String> valueColumns(StepContext context) {
        List<String> columns = context.getDataset().getColumnNames();
        columns.remove(context.getTimeColumn());
        return columns;
    }

    /**
     * 工作数据集的时间轴。
     *
     * @throws SchemaException 时间列中存在非时间戳取值
     */
    static List<LocalDateTime> timestamps(StepContext context) {
        String timeColumn = context.getTimeColumn();
        List<Object> values = context.getDataset().getColumn(timeColumn);
        List<LocalDateTime> times = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!(value instanceof LocalDateTime)) {
                throw new SchemaException("The time column '" + timeColumn + "' holds a non-timestamp value at row "
                        + i + ": " + value + "; load the data through the time indexer first.");
            }
            times.add((LocalDateTime) value);
        }
        return times;
    }
}
