package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.model.TabularDataset;
import org.junit.Test;

import static com.pipeline.sensorprep.TestDatasets.daily;
import static com.pipeline.sensorprep.TestDatasets.values;
import static com.pipeline.sensorprep.steps.StepTestSupport.context;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class CompletenessCheckStepTest {

    @Test
    public void testListsEveryColumnAndTimestamp() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 3))
                .addColumn("a", values(1.0, null, 3.0))
                .addColumn("b", values(null, 2L, Double.NaN));

        ValidationException e = assertThrows(ValidationException.class,
                () -> new CompletenessCheckStep().execute(context(dataset, "a", "b")));

        assertEquals("Missing values remain after cleaning: a at [2025-01-02T00:00];"
                + " b at [2025-01-01T00:00, 2025-01-03T00:00]", e.getMessage());
    }

    @Test
    public void testCompleteDatasetPasses() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 2))
                .addColumn("a", values(1.0, 2.0));

        new CompletenessCheckStep().execute(context(dataset, "a"));
    }
}
