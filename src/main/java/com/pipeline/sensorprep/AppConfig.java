package com.pipeline.sensorprep;

import com.pipeline.sensorprep.exception.ConfigException;
import com.pipeline.sensorprep.model.DuplicateKeep;
import com.pipeline.sensorprep.model.FillMethod;
import com.pipeline.sensorprep.model.LoadMode;
import com.pipeline.sensorprep.model.MissingStrategy;
import com.pipeline.sensorprep.model.OutlierMethod;
import com.pipeline.sensorprep.model.PreparationRequest;
import com.pipeline.sensorprep.model.ProcessingParameters;
import com.pipeline.sensorprep.model.SensorDivision;
import com.pipeline.sensorprep.model.TimeColumnParameters;
import com.pipeline.sensorprep.model.TimeDefectPolicy;
import com.pipeline.sensorprep.model.ValidationResult;
import com.pipeline.sensorprep.source.TabularSources;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * 应用配置类。
 * 对应配置文件（Properties格式）中的全部参数，并负责构建各类不可变参数包。
 */
public class AppConfig {

    // ---- 输入输出 ----
    private String inputFile;
    private String outputDir = "output";
    private String storageType = "csv";

    // ---- 处理范围 ----
    private String mode;
    private String date;
    private String startDate;
    private String endDate;

    // ---- 时间列 ----
    private String timeColumn;
    private String timeFormat = TimeColumnParameters.DEFAULT_TIME_FORMAT;
    private String duplicatesKeep = "first";
    private String missingHandling = "drop";
    private String failedConversionHandling = "drop";
    private boolean logDiscarded = false;

    // ---- 清洗 ----
    private String strategy = "fill";
    private String fillMethod = "mean";
    private String fillValue;
    private String timeWindow;
    private String outlierMethod = "z_score";
    private String outlierThreshold = "3.0";

    // ---- 传感器分组：分组名 -> 列名，保持声明顺序 ----
    private final List<String> divisionNames = new ArrayList<>();
    private final Map<String, List<String>> divisionSensors = new HashMap<>();

    /**
     * @throws ConfigException 配置文件不存在或无法读取
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(Paths.get(configPath))) {
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException("Failed to load config from " + configPath + ": " + e.getMessage());
        }
        return fromProperties(props);
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.inputFile = trimmed(props, "input.file", null);
        config.outputDir = trimmed(props, "output.dir", "output");
        config.storageType = trimmed(props, "storage.type", "csv");

        config.mode = trimmed(props, "processing.mode", null);
        config.date = trimmed(props, "processing.date", null);
        config.startDate = trimmed(props, "processing.start_date", null);
        config.endDate = trimmed(props, "processing.end_date", null);

        config.timeColumn = trimmed(props, "time.column", null);
        config.timeFormat = props.getProperty("time.format", TimeColumnParameters.DEFAULT_TIME_FORMAT);
        config.duplicatesKeep = trimmed(props, "time.duplicates.keep", "first");
        config.missingHandling = trimmed(props, "time.missing.handling", "drop");
        config.failedConversionHandling = trimmed(props, "time.failed.conversion.handling", "drop");
        config.logDiscarded = Boolean.parseBoolean(trimmed(props, "time.log.discarded", "false"));

        config.strategy = trimmed(props, "cleaning.strategy", "fill");
        config.fillMethod = trimmed(props, "cleaning.fill.method", "mean");
        config.fillValue = trimmed(props, "cleaning.fill.value", null);
        config.timeWindow = trimmed(props, "cleaning.time.window", null);
        config.outlierMethod = trimmed(props, "outlier.method", "z_score");
        config.outlierThreshold = trimmed(props, "outlier.threshold", "3.0");

        for (String division : splitList(props.getProperty("sensors.divisions"))) {
            if (!config.divisionSensors.containsKey(division)) {
                config.divisionNames.add(division);
                config.divisionSensors.put(division, splitList(props.getProperty("sensors." + division)));
            }
        }
        return config;
    }

    /**
     * 校验全部配置项，收集所有错误后一并返回。
     */
    public ValidationResult validate() {
        ValidationResult result = ValidationResult.success();

        if (inputFile == null) {
            result.addError("'input.file' is required");
        } else if (!TabularSources.isSupported(inputFile)) {
            result.addError("Unsupported file format '" + inputFile + "', please choose a csv or excel file");
        }
        if (!"csv".equalsIgnoreCase(storageType) && !"sqlite".equalsIgnoreCase(storageType)) {
            result.addError("Unknown storage type '" + storageType + "', expected csv or sqlite");
        }
        if (timeColumn == null) {
            result.addError("'time.column' is required");
        } else {
            collect(result, this::getTimeColumnParameters);
        }

        if (mode == null) {
            result.addError("'processing.mode' is required");
        } else {
            collect(result, this::getRequest);
        }
        collect(result, this::getProcessingParameters);
        validateDivisions(result);
        return result;
    }

    private void validateDivisions(ValidationResult result) {
        if (divisionNames.isEmpty()) {
            result.addError("'sensors.divisions' must list at least one sensor division");
            return;
        }
        Map<String, String> owner = new HashMap<>();
        for (String division : divisionNames) {
            List<String> sensors = divisionSensors.get(division);
            if (sensors.isEmpty()) {
                result.addError("Sensor division '" + division + "' has no columns, set 'sensors." + division + "'");
            }
            for (String sensor : sensors) {
                String previous = owner.putIfAbsent(sensor, division);
                if (previous != null) {
                    result.addError("Sensor column '" + sensor + "' is declared in both '" + previous
                            + "' and '" + division + "'");
                }
                if (sensor.equals(timeColumn)) {
                    result.addError("Sensor division '" + division + "' lists the time column '" + sensor + "'");
                }
            }
        }
    }

    /** 尝试构建参数包，把构建失败记为校验错误 */
    private static void collect(ValidationResult result, Supplier<?> build) {
        try {
            build.get();
        } catch (ConfigException e) {
            result.addError(e.getMessage());
        }
    }

    // ---- 参数包 ----

    public PreparationRequest getRequest() {
        return PreparationRequest.of(LoadMode.fromConfig(mode), date, startDate, endDate);
    }

    public TimeColumnParameters getTimeColumnParameters() {
        return new TimeColumnParameters(timeColumn, timeFormat,
                DuplicateKeep.fromConfig(duplicatesKeep),
                TimeDefectPolicy.fromConfig(missingHandling),
                TimeDefectPolicy.fromConfig(failedConversionHandling),
                logDiscarded);
    }

    public ProcessingParameters getProcessingParameters() {
        MissingStrategy missingStrategy = MissingStrategy.fromConfig(strategy);
        ProcessingParameters.Builder builder = ProcessingParameters.builder()
                .strategy(missingStrategy)
                .fillMethod(missingStrategy == MissingStrategy.FILL ? FillMethod.fromConfig(fillMethod) : null)
                .fillValue(parseDouble("cleaning.fill.value", fillValue))
                .outlierMethod(OutlierMethod.fromConfig(outlierMethod))
                .outlierThreshold(parseDouble("outlier.threshold", outlierThreshold));
        if (missingStrategy == MissingStrategy.FILL) {
            builder.timeWindow(timeWindow);
        }
        return builder.build();
    }

    public List<SensorDivision> getDivisions() {
        List<SensorDivision> divisions = new ArrayList<>(divisionNames.size());
        for (String name : divisionNames) {
            divisions.add(new SensorDivision(name, divisionSensors.get(name)));
        }
        return divisions;
    }

    // ---- Getters ----
    public Path getInputFile() { return Paths.get(inputFile); }
    public Path getOutputDir() { return Paths.get(outputDir); }
    public String getStorageType() { return storageType.toLowerCase(Locale.ROOT); }
    public String getTimeColumn() { return timeColumn; }

    private static Double parseDouble(String key, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new ConfigException("'" + key + "' must be a number, got '" + value + "'");
        }
    }

    private static String trimmed(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : Arrays.asList(value.split(","))) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "AppConfig{inputFile='" + inputFile + "'"
                + ", outputDir='" + outputDir + "'"
                + ", storage=" + storageType
                + ", mode=" + mode
                + ", timeColumn='" + timeColumn + "'"
                + ", strategy=" + strategy + "/" + fillMethod
                + ", outlier=" + outlierMethod + "@" + outlierThreshold
                + ", divisions=" + divisionNames + "}";
    }
}
