package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 时间索引项：源文件中的数据行位置（不含表头，从0开始） + 解析后的时间戳
 */
public class TimeIndexEntry implements Serializable {
    private final int position;
    private final LocalDateTime timestamp;

    public TimeIndexEntry(int position, LocalDateTime timestamp) {
        this.position = position;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public int getPosition() { return position; }
    public LocalDateTime getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeIndexEntry)) return false;
        TimeIndexEntry other = (TimeIndexEntry) o;
        return position == other.position && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, timestamp);
    }

    @Override
    public String toString() {
        return "#" + position + "@" + timestamp;
    }
}
