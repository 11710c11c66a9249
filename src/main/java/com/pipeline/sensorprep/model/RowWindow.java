package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 行窗口：覆盖请求时间范围的闭区间 [startIndex, endIndex]（源数据行位置）。
 *
 * 同时携带窗口内命中的索引项（按时间升序），供物化阶段回填时间列。
 * 命中按行位置选取，窗口内的重复时间戳全部保留。
 */
public class RowWindow implements Serializable {
    private final int startIndex;
    private final int endIndex;
    private final List<TimeIndexEntry> matches;
    private final LocalDateTime requestedStart;
    private final LocalDateTime requestedEnd;

    public RowWindow(int startIndex, int endIndex, List<TimeIndexEntry> matches,
                     LocalDateTime requestedStart, LocalDateTime requestedEnd) {
        if (startIndex < 0 || startIndex > endIndex) {
            throw new IllegalArgumentException("Invalid row window [" + startIndex + ", " + endIndex + "]");
        }
        if (matches == null || matches.isEmpty()) {
            throw new IllegalArgumentException("Row window must contain at least one matching row");
        }
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
        this.requestedStart = requestedStart;
        this.requestedEnd = requestedEnd;
    }

    public int getStartIndex() { return startIndex; }
    public int getEndIndex() { return endIndex; }
    public List<TimeIndexEntry> getMatches() { return matches; }
    public LocalDateTime getRequestedEnd() { return requestedEnd; }

    /** 物理读取时需要读取的行数 */
    public int getRowCount() {
        return endIndex - startIndex + 1;
    }

    public List<LocalDateTime> getTimestamps() {
        List<LocalDateTime> timestamps = new ArrayList<>(matches.size());
        for (TimeIndexEntry entry : matches) {
            timestamps.add(entry.getTimestamp());
        }
        return timestamps;
    }

    @Override
    public String toString() {
        return "RowWindow{[" + startIndex + ", " + endIndex + "], matches=" + matches.size()
                + ", requested=" + requestedStart + ".." + requestedEnd + "}";
    }
}
