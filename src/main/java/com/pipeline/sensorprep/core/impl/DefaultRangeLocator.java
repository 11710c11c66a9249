package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.RangeLocator;
import com.pipeline.sensorprep.exception.InvalidRangeException;
import com.pipeline.sensorprep.exception.NoDataException;
import com.pipeline.sensorprep.model.RowWindow;
import com.pipeline.sensorprep.model.TimeIndex;
import com.pipeline.sensorprep.model.TimeIndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 范围定位器默认实现。
 *
 * 命中项按行位置收集，窗口取命中项行位置的最小值与最大值。
 */
public class DefaultRangeLocator implements RangeLocator {

    private static final Logger log = LoggerFactory.getLogger(DefaultRangeLocator.class);

    @Override
    public RowWindow locate(TimeIndex index, LocalDateTime start, LocalDateTime end) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(start, "start");

        boolean singleDay = end == null;
        LocalDateTime effectiveEnd = singleDay ? start.plusDays(1).minusSeconds(1) : end;

        if (start.isAfter(effectiveEnd)) {
            throw new InvalidRangeException("Invalid date range: start " + start + " is later than end " + effectiveEnd);
        }

        List<TimeIndexEntry> matches = new ArrayList<>();
        int minPosition = Integer.MAX_VALUE;
        int maxPosition = Integer.MIN_VALUE;
        for (TimeIndexEntry entry : index.getEntries()) {
            LocalDateTime ts = entry.getTimestamp();
            if (ts.isBefore(start) || ts.isAfter(effectiveEnd)) {
                continue;
            }
            matches.add(entry);
            minPosition = Math.min(minPosition, entry.getPosition());
            maxPosition = Math.max(maxPosition, entry.getPosition());
        }

        if (matches.isEmpty()) {
            if (singleDay) {
                throw new NoDataException("No data found for the specified date: " + start.toLocalDate());
            }
            throw new NoDataException("No data found in the specified date range: " + start + " to " + effectiveEnd);
        }

        RowWindow window = new RowWindow(minPosition, maxPosition, matches, start, effectiveEnd);
        log.info("Extracted date range from {} (row {}) till {} (row {}), {} matching rows.",
                matches.get(0).getTimestamp(), minPosition,
                matches.get(matches.size() - 1).getTimestamp(), maxPosition, matches.size());
        return window;
    }
}
