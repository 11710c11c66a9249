package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.PreparationRequest;
import com.pipeline.sensorprep.model.PreparedDataset;

/**
 * 数据准备编排接口。
 *
 * 根据请求模式选择部分加载或全量加载，执行清洗管道，
 * 按传感器分组划分列，并把结果交给持久化层。
 * 遇到第一个组件失败立即向上抛出，不做局部重试。
 */
public interface PreparationRunner {

    PreparedDataset run(PreparationRequest request);
}
