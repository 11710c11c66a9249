package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 清洗管道的输出：清洗后的数据集、规范化后的列名以及离群值报告
 */
public class CleaningResult implements Serializable {
    private final TabularDataset dataset;
    private final String timeColumn;
    private final List<String> sensorColumns;
    private final OutlierReport outlierReport;

    public CleaningResult(TabularDataset dataset, String timeColumn, List<String> sensorColumns,
                          OutlierReport outlierReport) {
        this.dataset = dataset;
        this.timeColumn = timeColumn;
        this.sensorColumns = Collections.unmodifiableList(new ArrayList<>(sensorColumns));
        this.outlierReport = outlierReport;
    }

    public TabularDataset getDataset() { return dataset; }
    public String getTimeColumn() { return timeColumn; }
    public List<String> getSensorColumns() { return sensorColumns; }
    public OutlierReport getOutlierReport() { return outlierReport; }
}
