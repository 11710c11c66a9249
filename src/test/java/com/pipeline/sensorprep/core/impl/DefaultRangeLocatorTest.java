package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.exception.InvalidRangeException;
import com.pipeline.sensorprep.exception.NoDataException;
import com.pipeline.sensorprep.model.RowWindow;
import com.pipeline.sensorprep.model.TimeIndex;
import com.pipeline.sensorprep.model.TimeIndexEntry;
import org.junit.Test;

import java.util.Arrays;

import static com.pipeline.sensorprep.TestDatasets.ts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class DefaultRangeLocatorTest {

    private final DefaultRangeLocator locator = new DefaultRangeLocator();

    private static TimeIndex index() {
        return new TimeIndex(Arrays.asList(
                new TimeIndexEntry(0, ts("2025-01-01 00:00:00")),
                new TimeIndexEntry(1, ts("2025-01-01 12:00:00")),
                new TimeIndexEntry(2, ts("2025-01-02 00:00:00")),
                new TimeIndexEntry(3, ts("2025-01-02 12:00:00")),
                new TimeIndexEntry(4, ts("2025-01-03 00:00:00"))));
    }

    @Test
    public void testSingleDayCoversWholeDay() {
        RowWindow window = locator.locate(index(), ts("2025-01-02 00:00:00"));

        assertEquals(2, window.getStartIndex());
        assertEquals(3, window.getEndIndex());
        assertEquals(2, window.getRowCount());
        assertEquals(ts("2025-01-02 23:59:59"), window.getRequestedEnd());
    }

    @Test
    public void testRangeBoundsAreInclusive() {
        RowWindow window = locator.locate(index(), ts("2025-01-01 12:00:00"), ts("2025-01-03 00:00:00"));

        assertEquals(1, window.getStartIndex());
        assertEquals(4, window.getEndIndex());
        assertEquals(4, window.getMatches().size());
    }

    @Test
    public void testStartAfterEndRejected() {
        assertThrows(InvalidRangeException.class,
                () -> locator.locate(index(), ts("2025-01-03 00:00:00"), ts("2025-01-01 00:00:00")));
    }

    @Test
    public void testNoMatchesForDay() {
        NoDataException e = assertThrows(NoDataException.class,
                () -> locator.locate(index(), ts("2025-02-01 00:00:00")));
        assertEquals("No data found for the specified date: 2025-02-01", e.getMessage());
    }

    @Test
    public void testNoMatchesForRange() {
        NoDataException e = assertThrows(NoDataException.class,
                () -> locator.locate(index(), ts("2025-01-01 01:00:00"), ts("2025-01-01 02:00:00")));
        assertEquals("No data found in the specified date range: 2025-01-01T01:00 to 2025-01-01T02:00",
                e.getMessage());
    }

    @Test
    public void testWindowUsesSourcePositionsOfMatches() {
        // 源文件中行位置与时间顺序不一致
        TimeIndex index = new TimeIndex(Arrays.asList(
                new TimeIndexEntry(3, ts("2025-01-02 01:00:00")),
                new TimeIndexEntry(1, ts("2025-01-02 02:00:00")),
                new TimeIndexEntry(0, ts("2025-01-03 00:00:00"))));

        RowWindow window = locator.locate(index, ts("2025-01-02 00:00:00"));

        assertEquals(1, window.getStartIndex());
        assertEquals(3, window.getEndIndex());
    }
}
