package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.exception.NoDataException;
import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.model.RowWindow;
import com.pipeline.sensorprep.model.TabularDataset;
import com.pipeline.sensorprep.model.TimeColumnParameters;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.pipeline.sensorprep.TestDatasets.ts;
import static com.pipeline.sensorprep.TestDatasets.values;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DefaultSelectiveLoaderTest {

    private TabularSource source;
    private DefaultSelectiveLoader loader;

    @Before
    public void setUp() {
        source = mock(TabularSource.class);
        when(source.getLocation()).thenReturn("mock.csv");
        PreparationListener listener = mock(PreparationListener.class);
        loader = new DefaultSelectiveLoader(source, "time",
                new DefaultTimeIndexer(TimeColumnParameters.defaults("time", "yyyy-MM-dd HH:mm:ss"), listener),
                new DefaultRangeLocator());
    }

    private void stubTimeColumn(Object... times) {
        when(source.read(Collections.singletonList("time")))
                .thenReturn(new TabularDataset().addColumn("time", values(times)));
    }

    @Test
    public void testPartialLoadReadsTimeColumnThenOnlyTheWindow() {
        stubTimeColumn("2025-01-01 00:00:00", "2025-01-01 12:00:00", "2025-01-02 00:00:00",
                "2025-01-02 12:00:00", "2025-01-03 00:00:00");
        when(source.read(Collections.singletonList("temp"), 2, 2))
                .thenReturn(new TabularDataset().addColumn("temp", values(20.0, 21.0)));

        TabularDataset result = loader.loadWindow(Arrays.asList("temp", "time", "temp"),
                ts("2025-01-02 00:00:00"), null);

        assertEquals(Arrays.asList("time", "temp"), result.getColumnNames());
        assertEquals(values(ts("2025-01-02 00:00:00"), ts("2025-01-02 12:00:00")), result.getColumn("time"));
        assertEquals(values(20.0, 21.0), result.getColumn("temp"));
        verify(source).read(Collections.singletonList("time"));
        verify(source).read(Collections.singletonList("temp"), 2, 2);
        verify(source, never()).read(Arrays.asList("time", "temp"));
    }

    @Test
    public void testWindowRowsRealignedToTimeOrder() {
        stubTimeColumn("2025-01-02 12:00:00", "2025-01-02 00:00:00", "2025-01-03 00:00:00");
        when(source.read(Collections.singletonList("temp"), 0, 2))
                .thenReturn(new TabularDataset().addColumn("temp", values(12.0, 0.0)));

        TabularDataset result = loader.loadWindow(Collections.singletonList("temp"), ts("2025-01-02 00:00:00"), null);

        assertEquals(values(ts("2025-01-02 00:00:00"), ts("2025-01-02 12:00:00")), result.getColumn("time"));
        assertEquals(values(0.0, 12.0), result.getColumn("temp"));
    }

    @Test
    public void testDuplicateInsideWindowIsDropped() {
        stubTimeColumn("2025-01-02 00:00:00", "2025-01-02 00:00:00", "2025-01-02 06:00:00");
        when(source.read(Collections.singletonList("temp"), 0, 3))
                .thenReturn(new TabularDataset().addColumn("temp", values(1.0, 2.0, 3.0)));

        RowWindow window = loader.resolveWindow(ts("2025-01-02 00:00:00"), null);
        TabularDataset result = loader.materializeWindow(window, Collections.singletonList("temp"));

        assertEquals(3, window.getRowCount());
        assertEquals(values(1.0, 3.0), result.getColumn("temp"));
    }

    @Test
    public void testShortBlockIsRejected() {
        stubTimeColumn("2025-01-02 00:00:00", "2025-01-02 06:00:00");
        when(source.read(Collections.singletonList("temp"), 0, 2))
                .thenReturn(new TabularDataset().addColumn("temp", values(1.0)));

        assertThrows(ValidationException.class,
                () -> loader.loadWindow(Collections.singletonList("temp"), ts("2025-01-02 00:00:00"), null));
    }

    @Test
    public void testNoDataForRequestedDaySkipsSecondRead() {
        stubTimeColumn("2025-01-01 00:00:00");

        assertThrows(NoDataException.class,
                () -> loader.loadWindow(Collections.singletonList("temp"), ts("2025-01-05 00:00:00"), null));
        verify(source, never()).read(anyList(), anyInt(), anyInt());
    }

    @Test
    public void testFullLoadSortsAndDeduplicates() {
        when(source.read(Arrays.asList("time", "temp"))).thenReturn(new TabularDataset()
                .addColumn("time", values("2025-01-02 00:00:00", "2025-01-01 00:00:00", "2025-01-01 00:00:00"))
                .addColumn("temp", values(2.0, 1.0, 1.5)));

        TabularDataset result = loader.loadFull(Collections.singletonList("temp"));

        assertEquals(values(ts("2025-01-01 00:00:00"), ts("2025-01-02 00:00:00")), result.getColumn("time"));
        assertEquals(values(1.0, 2.0), result.getColumn("temp"));
    }
}
