package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.model.OutlierReport;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 步骤上下文默认实现。
 * 封装一次管道运行中全部步骤共享的工作数据集、参数与列名。
 */
public class DefaultStepContext implements StepContext {

    private final TabularDataset dataset;
    private final ProcessingParameters parameters;
    private final PreparationListener listener;

    private String timeColumn;
    private List<String> sensorColumns;

    /** 离群值检测步骤写入，未执行检测时为null */
    private OutlierReport outlierReport;

    public DefaultStepContext(TabularDataset dataset,
                              String timeColumn,
                              List<String> sensorColumns,
                              ProcessingParameters parameters,
                              PreparationListener listener) {
        this.dataset = dataset;
        this.timeColumn = timeColumn;
        this.sensorColumns = Collections.unmodifiableList(new ArrayList<>(sensorColumns));
        this.parameters = parameters;
        this.listener = listener;
    }

    @Override
    public TabularDataset getDataset() {
        return dataset;
    }

    @Override
    public ProcessingParameters getParameters() {
        return parameters;
    }

    @Override
    public String getTimeColumn() {
        return timeColumn;
    }

    @Override
    public List<String> getSensorColumns() {
        return sensorColumns;
    }

    @Override
    public void updateColumnNames(String timeColumn, List<String> sensorColumns) {
        this.timeColumn = timeColumn;
        this.sensorColumns = Collections.unmodifiableList(new ArrayList<>(sensorColumns));
    }

    @Override
    public PreparationListener getListener() {
        return listener;
    }

    @Override
    public void setOutlierReport(OutlierReport report) {
        this.outlierReport = report;
    }

    @Override
    public OutlierReport getOutlierReport() {
        return outlierReport;
    }
}
