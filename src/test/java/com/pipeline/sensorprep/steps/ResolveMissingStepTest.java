package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.impl.DefaultStepContext;
import com.pipeline.sensorprep.exception.NoDataException;
import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.model.FillMethod;
import com.pipeline.sensorprep.model.MissingStrategy;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;
import org.junit.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.pipeline.sensorprep.TestDatasets.daily;
import static com.pipeline.sensorprep.TestDatasets.ts;
import static com.pipeline.sensorprep.TestDatasets.values;
import static com.pipeline.sensorprep.steps.StepTestSupport.context;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.verify;

public class ResolveMissingStepTest {

    private static final ProcessingParameters DROP = ProcessingParameters.builder()
            .strategy(MissingStrategy.DROP)
            .build();

    @Test
    public void testDropRemovesRowsAndReportsTimestamps() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 4))
                .addColumn("a", values(1.0, null, 3.0, 4.0))
                .addColumn("b", values(1L, 2L, 3L, null));
        DefaultStepContext context = context(dataset, DROP, "a", "b");

        new ResolveMissingStep().execute(context);

        assertEquals(2, dataset.getRowCount());
        assertEquals(values(1.0, 3.0), dataset.getColumn("a"));
        verify(context.getListener()).onRowsDiscarded("resolve-missing", "missing values in numeric columns",
                Arrays.asList("2025-01-02T00:00", "2025-01-04T00:00"));
    }

    @Test
    public void testDropIgnoresNonNumericColumns() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 2))
                .addColumn("a", values(1.0, 2.0))
                .addColumn("state", values("on", null));

        new ResolveMissingStep().execute(context(dataset, DROP, "a", "state"));

        assertEquals(2, dataset.getRowCount());
    }

    @Test
    public void testDropEverythingFails() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 2))
                .addColumn("a", values(1.0, null))
                .addColumn("b", values(null, 2.0));

        assertThrows(NoDataException.class, () -> new ResolveMissingStep().execute(context(dataset, DROP, "a", "b")));
    }

    @Test
    public void testFillKeepsIntegerColumnsWithoutGaps() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 3))
                .addColumn("a", values(1L, 2L, 3L))
                .addColumn("b", values(1.0, null, 3.0));

        new ResolveMissingStep().execute(context(dataset, "a", "b"));

        assertEquals(values(1L, 2L, 3L), dataset.getColumn("a"));
        assertEquals(values(1.0, 2.0, 3.0), dataset.getColumn("b"));
    }

    @Test
    public void testWindowFillOverTimeAxis() {
        ProcessingParameters parameters = ProcessingParameters.builder()
                .fillMethod(FillMethod.MEAN)
                .timeWindow("2d")
                .build();
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 6))
                .addColumn("sensor1", values(1L, 2L, null, 4L, 5L, null));

        new ResolveMissingStep().execute(context(dataset, parameters, "sensor1"));

        assertEquals(values(1.0, 2.0, 3.0, 4.0, 5.0, 5.0), dataset.getColumn("sensor1"));
    }

    @Test
    public void testWindowFillRequiresSortedTime() {
        ProcessingParameters parameters = ProcessingParameters.builder()
                .fillMethod(FillMethod.MEAN)
                .timeWindow("1h")
                .build();
        List<LocalDateTime> times = Arrays.asList(ts("2025-01-02 00:00:00"), ts("2025-01-01 00:00:00"));
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", times)
                .addColumn("a", values(null, 1.0));

        assertThrows(ValidationException.class,
                () -> new ResolveMissingStep().execute(context(dataset, parameters, "a")));
    }

    @Test
    public void testFillWithNoNumericColumnsIsNoop() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 2))
                .addColumn("flag", values(true, null));

        new ResolveMissingStep().execute(context(dataset, "flag"));

        assertEquals(Collections.singletonList(null), dataset.getColumn("flag").subList(1, 2));
    }
}
