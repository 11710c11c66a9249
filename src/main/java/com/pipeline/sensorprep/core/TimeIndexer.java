package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.TabularDataset;
import com.pipeline.sensorprep.model.TimeIndex;

/**
 * 时间索引构建器接口。
 *
 * 只依赖时间列：校验类型、处理缺失与解析失败、稳定排序并按策略去重，
 * 得到覆盖整个文件的有序时间索引。
 */
public interface TimeIndexer {

    /**
     * 构建时间索引。
     *
     * @param source 至少包含时间列的数据集，行顺序即源文件数据行顺序
     * @return 按时间升序的索引，时间戳相同的项保持原始行顺序
     * @throws com.pipeline.sensorprep.exception.SchemaException     数据为空、时间列不存在或类型不受支持
     * @throws com.pipeline.sensorprep.exception.ValidationException 时间值缺失/无法解析且策略为error，或处理后无剩余行
     */
    TimeIndex build(TabularDataset source);
}
