package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.CleaningPipeline;
import com.pipeline.sensorprep.core.CleaningStep;
import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.exception.PreparationException;
import com.pipeline.sensorprep.model.CleaningResult;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.TabularDataset;
import com.pipeline.sensorprep.steps.CompletenessCheckStep;
import com.pipeline.sensorprep.steps.DetectOutliersStep;
import com.pipeline.sensorprep.steps.EncodeCategoricalsStep;
import com.pipeline.sensorprep.steps.NormalizeNamesStep;
import com.pipeline.sensorprep.steps.ResolveMissingStep;
import com.pipeline.sensorprep.steps.ValidateColumnsStep;
import com.pipeline.sensorprep.steps.ValidateTypesStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 清洗管道默认实现。
 * 在输入数据集的副本上按固定顺序串联执行各清洗步骤，任一步骤失败即中止。
 */
public class DefaultCleaningPipeline implements CleaningPipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultCleaningPipeline.class);

    private final List<CleaningStep> steps;
    private final PreparationListener listener;

    public DefaultCleaningPipeline(PreparationListener listener) {
        this(defaultSteps(), listener);
    }

    public DefaultCleaningPipeline(List<CleaningStep> steps, PreparationListener listener) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.listener = listener;
    }

    public static List<CleaningStep> defaultSteps() {
        return Arrays.asList(
                new NormalizeNamesStep(),
                new ValidateColumnsStep(),
                new ResolveMissingStep(),
                new EncodeCategoricalsStep(),
                new ValidateTypesStep(),
                new DetectOutliersStep(),
                new CompletenessCheckStep());
    }

    public List<CleaningStep> getSteps() {
        return steps;
    }

    @Override
    public CleaningResult run(TabularDataset dataset, String timeColumn, List<String> sensorColumns,
                              ProcessingParameters parameters) {
        DefaultStepContext context = new DefaultStepContext(
                dataset.copy(), timeColumn, sensorColumns, parameters, listener);
        log.info("Cleaning {} with {}", dataset, parameters);

        for (CleaningStep step : steps) {
            long startTime = System.currentTimeMillis();
            try {
                step.execute(context);
            } catch (PreparationException e) {
                log.error("Cleaning step '{}' failed: {}", step.getStepId(), e.getMessage());
                throw e;
            }
            log.debug("Cleaning step '{}' completed in {}ms, {}", step.getStepId(),
                    System.currentTimeMillis() - startTime, context.getDataset());
        }

        log.info("Data validation and cleaning completed: {}", context.getDataset());
        return new CleaningResult(context.getDataset(), context.getTimeColumn(), context.getSensorColumns(),
                context.getOutlierReport());
    }
}
