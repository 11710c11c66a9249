package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.RowWindow;
import com.pipeline.sensorprep.model.TabularDataset;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 选择性加载器接口。
 *
 * 部分加载分为两个显式阶段：
 *   resolveWindow（只读时间列，定位行窗口） → materializeWindow（只读所需列的窗口行）
 * 带有自身索引的存储可以直接构造 {@link RowWindow} 跳过第一阶段。
 *
 * 输出数据集的首列为规范化后的时间列（LocalDateTime）。
 */
public interface SelectiveLoader {

    /**
     * 第一阶段：读取时间列并定位请求范围对应的行窗口。
     *
     * @param end 为null表示从start开始的一整天
     */
    RowWindow resolveWindow(LocalDateTime start, LocalDateTime end);

    /**
     * 第二阶段：读取窗口内的传感器列，并按位置回填已解析的时间值。
     */
    TabularDataset materializeWindow(RowWindow window, List<String> sensorColumns);

    /**
     * 部分加载：依次执行两个阶段。
     */
    default TabularDataset loadWindow(List<String> sensorColumns, LocalDateTime start, LocalDateTime end) {
        return materializeWindow(resolveWindow(start, end), sensorColumns);
    }

    /**
     * 全量加载：一次读取全部所需列，再做时间规范化（排序、去重）和时间跨度过滤。
     *
     * @throws com.pipeline.sensorprep.exception.NoDataException 过滤后结果为空
     */
    TabularDataset loadFull(List<String> sensorColumns);
}
