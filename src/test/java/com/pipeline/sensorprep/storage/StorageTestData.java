package com.pipeline.sensorprep.storage;

import com.pipeline.sensorprep.model.OutlierMethod;
import com.pipeline.sensorprep.model.OutlierReport;
import com.pipeline.sensorprep.model.PreparationRequest;
import com.pipeline.sensorprep.model.PreparedDataset;
import com.pipeline.sensorprep.model.TabularDataset;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pipeline.sensorprep.TestDatasets.hourly;
import static com.pipeline.sensorprep.TestDatasets.values;

final class StorageTestData {

    private StorageTestData() {}

    static PreparedDataset prepared() {
        TabularDataset dataset = new TabularDataset()
                .addColumn("time", hourly("2025-01-02 00:00:00", 2))
                .addColumn("temp", values(0.0000125, 21.5))
                .addColumn("pump_on", values(1L, 0L));
        Map<String, List<String>> divisions = new LinkedHashMap<>();
        divisions.put("temperature", Arrays.asList("temp"));
        divisions.put("status", Arrays.asList("pump_on"));
        return new PreparedDataset(PreparationRequest.singleDay(LocalDate.of(2025, 1, 2)), dataset, "time",
                divisions, new OutlierReport(OutlierMethod.Z_SCORE, 3.0));
    }
}
