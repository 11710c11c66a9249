package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.model.CleaningResult;
import com.pipeline.sensorprep.model.FillMethod;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static com.pipeline.sensorprep.TestDatasets.daily;
import static com.pipeline.sensorprep.TestDatasets.values;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DefaultCleaningPipelineTest {

    private DefaultCleaningPipeline pipeline;
    private ProcessingParameters parameters;

    @Before
    public void setUp() {
        pipeline = new DefaultCleaningPipeline(mock(PreparationListener.class));
        parameters = ProcessingParameters.builder().fillMethod(FillMethod.FFILL).build();
    }

    private static TabularDataset raw() {
        return new TabularDataset()
                .addColumn("Time", daily("2025-01-01 00:00:00", 4))
                .addColumn("Inlet Temp", values(20.5, null, 21.5, 22.0))
                .addColumn("Pump On", values(true, null, false, true))
                .addColumn("Valve", values("open", "closed", "open", null));
    }

    @Test
    public void testProducesNumericCompleteDataset() {
        CleaningResult result = pipeline.run(raw(), "Time", Arrays.asList("Inlet Temp", "Pump On", "Valve"),
                parameters);

        TabularDataset cleaned = result.getDataset();
        assertEquals("time", result.getTimeColumn());
        assertEquals(Arrays.asList("inlet_temp", "pump_on", "valve"), result.getSensorColumns());
        assertEquals(values(20.5, 20.5, 21.5, 22.0), cleaned.getColumn("inlet_temp"));
        assertEquals(values(1L, 1L, 0L, 1L), cleaned.getColumn("pump_on"));
        assertEquals(values(0L, 1L, 0L, 0L), cleaned.getColumn("valve"));
        assertNotNull(result.getOutlierReport());
    }

    @Test
    public void testInputIsNotModified() {
        TabularDataset input = raw();

        pipeline.run(input, "Time", Arrays.asList("Inlet Temp"), parameters);

        assertEquals(Arrays.asList("Time", "Inlet Temp", "Pump On", "Valve"), input.getColumnNames());
        assertEquals(values(20.5, null, 21.5, 22.0), input.getColumn("Inlet Temp"));
    }

    @Test
    public void testSecondRunIsNoop() {
        List<String> sensors = Arrays.asList("Inlet Temp", "Pump On", "Valve");
        CleaningResult first = pipeline.run(raw(), "Time", sensors, parameters);

        TabularDataset again = pipeline.fullValidation(first.getDataset(), first.getTimeColumn(),
                first.getSensorColumns(), parameters);

        assertEquals(first.getDataset().getColumnNames(), again.getColumnNames());
        for (String column : again.getColumnNames()) {
            assertEquals(first.getDataset().getColumn(column), again.getColumn(column));
        }
    }

    @Test
    public void testFailingStepAbortsRun() {
        CleaningStep failing = mock(CleaningStep.class);
        CleaningStep after = mock(CleaningStep.class);
        when(failing.getStepId()).thenReturn("failing");
        doThrow(new SchemaException("boom")).when(failing).execute(any());
        DefaultCleaningPipeline custom = new DefaultCleaningPipeline(Arrays.asList(failing, after),
                mock(PreparationListener.class));

        assertThrows(SchemaException.class, () -> custom.run(raw(), "Time", Arrays.asList("Inlet Temp"), parameters));
        verify(after, never()).execute(any());
    }

    @Test
    public void testDefaultStepOrder() {
        StringBuilder ids = new StringBuilder();
        for (CleaningStep step : pipeline.getSteps()) {
            ids.append(step.getStepId()).append(' ');
        }
        assertEquals("normalize-names validate-columns resolve-missing encode-categoricals validate-types "
                + "detect-outliers completeness-check ", ids.toString());
    }
}
