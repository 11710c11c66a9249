package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.OutlierReport;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;

import java.util.List;

/**
 * 清洗步骤上下文接口：步骤与管道交互的唯一桥梁。
 *
 * 提供当前工作数据集、参数包、时间列与传感器列名以及诊断监听器。
 * 列名规范化步骤执行后，时间列名和传感器列名随之更新。
 */
public interface StepContext {

    TabularDataset getDataset();

    ProcessingParameters getParameters();

    String getTimeColumn();

    /**
     * @return 声明的传感器列名，按声明顺序
     */
    List<String> getSensorColumns();

    /**
     * 列名规范化后更新时间列名与传感器列名。
     */
    void updateColumnNames(String timeColumn, List<String> sensorColumns);

    PreparationListener getListener();

    void setOutlierReport(OutlierReport report);

    OutlierReport getOutlierReport();
}
