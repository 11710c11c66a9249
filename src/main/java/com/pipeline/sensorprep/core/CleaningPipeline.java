package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.CleaningResult;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;

import java.util.List;

/**
 * 清洗管道接口。
 *
 * 执行顺序：
 *   NormalizeNames → ValidateColumns → ResolveMissing → EncodeCategoricals
 *   → ValidateTypes → DetectOutliers → FinalCompletenessCheck
 */
public interface CleaningPipeline {

    /**
     * 对数据集执行完整的校验与清洗。输入数据集不会被修改。
     *
     * @param dataset       加载得到的数据集，包含时间列和传感器列
     * @param timeColumn    时间列名（规范化前）
     * @param sensorColumns 声明的传感器列名（规范化前）
     * @param parameters    清洗参数包
     * @return 清洗结果：全部非时间列为数值且无缺失
     */
    CleaningResult run(TabularDataset dataset, String timeColumn, List<String> sensorColumns,
                       ProcessingParameters parameters);

    /**
     * 只返回清洗后的数据集。
     */
    default TabularDataset fullValidation(TabularDataset dataset, String timeColumn, List<String> sensorColumns,
                                          ProcessingParameters parameters) {
        return run(dataset, timeColumn, sensorColumns, parameters).getDataset();
    }
}
