package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;
import org.junit.Test;

import java.time.LocalDateTime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PreparationRequestTest {

    @Test
    public void testSingleDay() {
        PreparationRequest request = PreparationRequest.of(LoadMode.SINGLE_DAY, "2025-01-02", null, null);

        assertEquals(LocalDateTime.of(2025, 1, 2, 0, 0), request.getStart());
        assertNull(request.getEnd());
        assertTrue(request.isPartial());
        assertEquals("2025-01-02", request.label());
    }

    @Test
    public void testDateOnlyRangeCoversWholeEndDay() {
        PreparationRequest request = PreparationRequest.of(LoadMode.TIME_RANGE, null, "2025-01-01", "2025-01-03");

        assertEquals(LocalDateTime.of(2025, 1, 1, 0, 0), request.getStart());
        assertEquals(LocalDateTime.of(2025, 1, 3, 23, 59, 59), request.getEnd());
        assertEquals("20250101T000000_20250103T235959", request.label());
    }

    @Test
    public void testRangeWithTimes() {
        PreparationRequest request = PreparationRequest.of(LoadMode.TIME_RANGE, null,
                "2025-01-01 06:00:00", "2025-01-01 18:30:00");

        assertEquals(LocalDateTime.of(2025, 1, 1, 6, 0), request.getStart());
        assertEquals(LocalDateTime.of(2025, 1, 1, 18, 30), request.getEnd());
    }

    @Test
    public void testFullData() {
        PreparationRequest request = PreparationRequest.of(LoadMode.FULL_DATA, "ignored", null, null);

        assertFalse(request.isPartial());
        assertEquals("full_data", request.label());
    }

    @Test(expected = ConfigException.class)
    public void testSingleDayRequiresDate() {
        PreparationRequest.of(LoadMode.SINGLE_DAY, " ", null, null);
    }

    @Test(expected = ConfigException.class)
    public void testMalformedBound() {
        PreparationRequest.of(LoadMode.TIME_RANGE, null, "2025/01/01", "2025-01-02");
    }
}
