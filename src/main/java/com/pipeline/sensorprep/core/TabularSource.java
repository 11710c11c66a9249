package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.TabularDataset;

import java.util.List;

/**
 * 表格数据源接口：原始文件解码能力的唯一抽象。
 *
 * 首行为表头，其后每行是一条数据。数据行位置从0开始计数，不含表头；
 * 空白行不计入位置，且对同一文件的任意两次读取保持一致，
 * 这是"先定位窗口、再物化窗口"两阶段读取能够对齐的前提。
 *
 * 实现按文件扩展名选择：CSV 或电子表格。
 */
public interface TabularSource {

    /**
     * 读取指定列的一个连续行块。
     *
     * @param columns  需要读取的列名（按表头原样匹配），结果列按此顺序排列
     * @param skipRows 跳过的前导数据行数
     * @param maxRows  最多读取的行数；负数表示读到文件末尾
     * @return 读取结果；缺失单元格为null
     * @throws com.pipeline.sensorprep.exception.SchemaException     请求的列在表头中不存在
     * @throws com.pipeline.sensorprep.exception.DataSourceException 文件无法读取
     */
    TabularDataset read(List<String> columns, int skipRows, int maxRows);

    /**
     * 读取指定列的全部数据行。
     */
    default TabularDataset read(List<String> columns) {
        return read(columns, 0, -1);
    }

    /**
     * @return 数据源位置描述，用于日志和错误信息
     */
    String getLocation();
}
