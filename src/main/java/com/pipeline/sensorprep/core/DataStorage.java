package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.PreparedDataset;

/**
 * 数据存储器接口：清洗结果的持久化层。
 *
 * 写出的列顺序固定为：时间列在前，传感器列按声明顺序在后；
 * 相同输入与参数下多次运行的输出必须逐字节一致。
 */
public interface DataStorage {

    /**
     * 持久化一次运行的清洗结果。
     *
     * @param prepared 清洗结果
     * @return 结果写入位置的描述（文件路径或表名）
     * @throws com.pipeline.sensorprep.exception.DataSourceException 写入失败
     */
    String store(PreparedDataset prepared);

    /**
     * 释放存储器持有的资源。
     */
    void shutdown();
}
