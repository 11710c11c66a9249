package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 规范化后的时间索引。
 *
 * 按时间戳升序排列，时间戳相同的项保持源文件中的原始顺序；
 * 是否允许重复时间戳取决于构建时的去重策略。
 * 每次加载重新构建，用完即弃，从不持久化。
 */
public class TimeIndex implements Serializable {
    private final List<TimeIndexEntry> entries;

    public TimeIndex(List<TimeIndexEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<TimeIndexEntry> getEntries() { return entries; }

    public TimeIndexEntry get(int i) { return entries.get(i); }

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    public LocalDateTime getFirstTimestamp() {
        return entries.isEmpty() ? null : entries.get(0).getTimestamp();
    }

    public LocalDateTime getLastTimestamp() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1).getTimestamp();
    }

    /** 按索引顺序返回全部源行位置 */
    public List<Integer> getPositions() {
        List<Integer> positions = new ArrayList<>(entries.size());
        for (TimeIndexEntry entry : entries) {
            positions.add(entry.getPosition());
        }
        return positions;
    }

    /** 按索引顺序返回全部时间戳 */
    public List<LocalDateTime> getTimestamps() {
        List<LocalDateTime> timestamps = new ArrayList<>(entries.size());
        for (TimeIndexEntry entry : entries) {
            timestamps.add(entry.getTimestamp());
        }
        return timestamps;
    }

    @Override
    public String toString() {
        return "TimeIndex{size=" + entries.size() + ", from=" + getFirstTimestamp()
                + ", to=" + getLastTimestamp() + "}";
    }
}
