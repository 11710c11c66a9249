package com.pipeline.sensorprep.model;

import com.pipeline.sensorprep.exception.ConfigException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 传感器分组：同一物理量类别（如 temperature、pressure）下的传感器列名，保持声明顺序
 */
public final class SensorDivision implements Serializable {
    private final String name;
    private final List<String> sensors;

    public SensorDivision(String name, List<String> sensors) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("Sensor division name must be a non-empty string");
        }
        if (sensors == null || sensors.isEmpty()) {
            throw new ConfigException("Sensor division '" + name + "' must list at least one sensor column");
        }
        this.name = name;
        this.sensors = Collections.unmodifiableList(new ArrayList<>(sensors));
    }

    public String getName() { return name; }
    public List<String> getSensors() { return sensors; }

    @Override
    public String toString() {
        return name + sensors;
    }
}
