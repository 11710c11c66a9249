package com.pipeline.sensorprep.steps;

import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.core.impl.DefaultStepContext;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;

import java.util.Arrays;

import static org.mockito.Mockito.mock;

/**
 * 构造步骤上下文
 */
final class StepTestSupport {

    static final String TIME = "time";

    private StepTestSupport() {}

    static DefaultStepContext context(TabularDataset dataset, ProcessingParameters parameters, String... sensors) {
        return new DefaultStepContext(dataset, TIME, Arrays.asList(sensors), parameters, mock(PreparationListener.class));
    }

    static DefaultStepContext context(TabularDataset dataset, String... sensors) {
        return context(dataset, ProcessingParameters.builder().build(), sensors);
    }
}
