package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.core.StepContext;
import com.pipeline.sensorprep.core.impl.DefaultStepContext;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;
import org.junit.Test;

import java.util.Arrays;

import static com.pipeline.sensorprep.TestDatasets.daily;
import static com.pipeline.sensorprep.TestDatasets.values;
import static com.pipeline.sensorprep.steps.StepTestSupport.context;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;

public class NormalizeAndValidateColumnsStepTest {

    @Test
    public void testNormalizeNamesUpdatesDatasetAndContext() {
        TabularDataset dataset = new TabularDataset()
                .addColumn(" Time ", daily("2025-01-01 00:00:00", 2))
                .addColumn("Inlet Temp", values(1.0, 2.0));
        StepContext context = new DefaultStepContext(dataset, " Time ", Arrays.asList("Inlet Temp"),
                ProcessingParameters.builder().build(), mock(PreparationListener.class));

        new NormalizeNamesStep().execute(context);

        assertEquals(Arrays.asList("time", "inlet_temp"), dataset.getColumnNames());
        assertEquals("time", context.getTimeColumn());
        assertEquals(Arrays.asList("inlet_temp"), context.getSensorColumns());
    }

    @Test
    public void testNormalizeCollisionFails() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 1))
                .addColumn("Flow", values(1.0))
                .addColumn("flow", values(2.0));

        assertThrows(SchemaException.class, () -> new NormalizeNamesStep().execute(context(dataset, "flow")));
    }

    @Test
    public void testValidateColumnsNamesMissingAndEmptyColumns() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 2))
                .addColumn("a", values(1.0, 2.0))
                .addColumn("b", values(null, null));

        SchemaException e = assertThrows(SchemaException.class,
                () -> new ValidateColumnsStep().execute(context(dataset, "a", "b", "c")));

        assertTrue(e.getMessage().contains("[c]"));
        assertTrue(e.getMessage().contains("only missing values: [b]"));
    }

    @Test
    public void testValidateColumnsPasses() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", daily("2025-01-01 00:00:00", 2))
                .addColumn("a", values(null, 2.0));

        new ValidateColumnsStep().execute(context(dataset, "a"));
    }
}
