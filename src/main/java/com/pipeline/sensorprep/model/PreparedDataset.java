package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 清洗完成的数据集及其下游消费所需的附属信息。
 *
 * 时间列位于首列，其余列全部为数值且无缺失；
 * divisionColumns 按声明顺序给出每个传感器分组对应的列名。
 */
public class PreparedDataset implements Serializable {
    private final PreparationRequest request;
    private final TabularDataset dataset;
    private final String timeColumn;
    private final Map<String, List<String>> divisionColumns;
    private final OutlierReport outlierReport;

    public PreparedDataset(PreparationRequest request, TabularDataset dataset, String timeColumn,
                           Map<String, List<String>> divisionColumns, OutlierReport outlierReport) {
        this.request = request;
        this.dataset = dataset;
        this.timeColumn = timeColumn;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        divisionColumns.forEach((name, cols) -> copy.put(name, Collections.unmodifiableList(new ArrayList<>(cols))));
        this.divisionColumns = Collections.unmodifiableMap(copy);
        this.outlierReport = outlierReport;
    }

    public PreparationRequest getRequest() { return request; }
    public TabularDataset getDataset() { return dataset; }
    public String getTimeColumn() { return timeColumn; }
    public Map<String, List<String>> getDivisionColumns() { return divisionColumns; }
    public OutlierReport getOutlierReport() { return outlierReport; }

    public List<LocalDateTime> getTime() {
        List<LocalDateTime> time = new ArrayList<>(dataset.getRowCount());
        for (Object value : dataset.getColumn(timeColumn)) {
            time.add((LocalDateTime) value);
        }
        return time;
    }

    /** 取出某个分组下的全部列：列名 -> 取值 */
    public Map<String, List<Object>> getDivision(String division) {
        List<String> columns = divisionColumns.get(division);
        if (columns == null) {
            throw new IllegalArgumentException("Unknown sensor division '" + division + "'");
        }
        Map<String, List<Object>> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, dataset.getColumn(column));
        }
        return values;
    }

    @Override
    public String toString() {
        return "PreparedDataset{request=" + request + ", rows=" + dataset.getRowCount()
                + ", divisions=" + divisionColumns.keySet() + "}";
    }
}
