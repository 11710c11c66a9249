package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.CleaningPipeline;
import com.pipeline.sensorprep.core.DataStorage;
import com.pipeline.sensorprep.core.PreparationRunner;
import com.pipeline.sensorprep.core.SelectiveLoader;
import com.pipeline.sensorprep.model.CleaningResult;
import com.pipeline.sensorprep.model.PreparationRequest;
import com.pipeline.sensorprep.model.PreparedDataset;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.SensorDivision;
import com.pipeline.sensorprep.model.TabularDataset;
import com.pipeline.sensorprep.steps.NormalizeNamesStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 数据准备编排默认实现。
 *
 * 加载（部分/全量） → 清洗 → 按传感器分组划分列 → 持久化。
 * 输出数据集的列顺序：时间列在前，传感器列按分组声明顺序在后。
 */
public class DefaultPreparationRunner implements PreparationRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultPreparationRunner.class);

    private final SelectiveLoader loader;
    private final CleaningPipeline pipeline;
    private final DataStorage storage;
    private final String timeColumn;
    private final List<SensorDivision> divisions;
    private final ProcessingParameters parameters;

    public DefaultPreparationRunner(SelectiveLoader loader,
                                    CleaningPipeline pipeline,
                                    DataStorage storage,
                                    String timeColumn,
                                    List<SensorDivision> divisions,
                                    ProcessingParameters parameters) {
        this.loader = loader;
        this.pipeline = pipeline;
        this.storage = storage;
        this.timeColumn = timeColumn;
        this.divisions = Collections.unmodifiableList(new ArrayList<>(divisions));
        this.parameters = parameters;
    }

    @Override
    public PreparedDataset run(PreparationRequest request) {
        long startTime = System.currentTimeMillis();
        List<String> sensors = sensorColumns();
        log.info("Preparing {} for {} sensor columns in {} divisions.", request, sensors.size(), divisions.size());

        TabularDataset loaded = request.isPartial()
                ? loader.loadWindow(sensors, request.getStart(), request.getEnd())
                : loader.loadFull(sensors);

        CleaningResult result = pipeline.run(loaded, timeColumn, sensors, parameters);
        TabularDataset cleaned = result.getDataset();

        List<String> leading = new ArrayList<>();
        leading.add(result.getTimeColumn());
        leading.addAll(result.getSensorColumns());
        cleaned.moveToFront(leading);

        PreparedDataset prepared = new PreparedDataset(request, cleaned, result.getTimeColumn(),
                divisionColumns(cleaned), result.getOutlierReport());
        String location = storage.store(prepared);

        log.info("Prepared {} in {}ms, stored at {}", prepared, System.currentTimeMillis() - startTime, location);
        return prepared;
    }

    /** 全部分组的传感器列，按声明顺序去重 */
    List<String> sensorColumns() {
        LinkedHashSet<String> sensors = new LinkedHashSet<>();
        for (SensorDivision division : divisions) {
            sensors.addAll(division.getSensors());
        }
        return new ArrayList<>(sensors);
    }

    private Map<String, List<String>> divisionColumns(TabularDataset cleaned) {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        for (SensorDivision division : divisions) {
            List<String> names = new ArrayList<>();
            for (String sensor : division.getSensors()) {
                String normalized = NormalizeNamesStep.normalize(sensor);
                if (cleaned.hasColumn(normalized) && !names.contains(normalized)) {
                    names.add(normalized);
                }
            }
            columns.put(division.getName(), names);
        }
        return columns;
    }
}
