package com.pipeline.sensorprep.core;

/**
 * 清洗步骤接口：清洗状态机中的一个状态。
 *
 * 各步骤按固定顺序执行，每一步都直接修改工作数据集；
 * 任一步骤抛出异常即中止整次运行，不跳过、不重试。
 *
 * 实现约定：
 * - 步骤实例本身无状态，所有运行期数据都经由 StepContext 读写
 * - 对已满足该步骤目标的数据集再次执行应不产生任何变化
 */
public interface CleaningStep {

    /**
     * @return 步骤标识，用于日志与诊断事件
     */
    String getStepId();

    /**
     * 执行本步骤。
     *
     * @param context 当前运行的步骤上下文
     */
    void execute(StepContext context);
}
