package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.OutlierMethod;
import com.pipeline.sensorprep.model.OutlierReport;

import java.util.List;

/**
 * 诊断事件监听器：由调用方注入到各组件。
 *
 * 组件通过它上报警告、丢弃的行、回退填充和离群值统计，
 * 而不是直接依赖进程级的全局日志状态。事件仅用于诊断，不影响处理结果。
 */
public interface PreparationListener {

    /**
     * 非致命警告（重复时间戳、无法计算众数、零方差列等）。
     *
     * @param stage   产生警告的阶段名
     * @param message 警告内容
     */
    void onWarning(String stage, String message);

    /**
     * 行被丢弃（时间列缺失、时间解析失败、重复时间戳、缺失值删除策略）。
     *
     * @param stage   阶段名
     * @param reason  丢弃原因
     * @param details 每条被丢弃行的描述（行位置或时间戳）
     */
    void onRowsDiscarded(String stage, String reason, List<String> details);

    /**
     * 某个填充策略补全了部分缺失值。
     *
     * @param column   列名
     * @param strategy 策略名
     * @param filled   本次补全的数量
     * @param fallback 是否为回退策略（非链中的第一个策略）
     */
    void onFill(String column, String strategy, int filled, boolean fallback);

    /**
     * 单列离群值检测结果。
     */
    void onOutliers(OutlierMethod method, OutlierReport.ColumnOutliers outliers);
}
