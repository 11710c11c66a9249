package com.pipeline.sensorprep.core;

import com.pipeline.sensorprep.model.RowWindow;
import com.pipeline.sensorprep.model.TimeIndex;

import java.time.LocalDateTime;

/**
 * 范围定位器接口：把日期或时间范围解析为连续的行窗口。
 */
public interface RangeLocator {

    /**
     * 定位时间范围 [start, end]（闭区间）。
     *
     * @param index 时间索引
     * @param start 起始时间
     * @param end   结束时间；为null时取 start + 1天 - 1秒，即从start起的一整天
     * @return 覆盖全部命中项的行窗口
     * @throws com.pipeline.sensorprep.exception.InvalidRangeException start晚于end
     * @throws com.pipeline.sensorprep.exception.NoDataException       范围内没有任何时间戳
     */
    RowWindow locate(TimeIndex index, LocalDateTime start, LocalDateTime end);

    default RowWindow locate(TimeIndex index, LocalDateTime start) {
        return locate(index, start, null);
    }
}
