package com.pipeline.sensorprep;

import com.pipeline.sensorprep.exception.ConfigException;
import com.pipeline.sensorprep.model.PreparedDataset;
import com.pipeline.sensorprep.storage.CsvDataStorage;
import com.pipeline.sensorprep.storage.SQLiteDataStorage;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

import static com.pipeline.sensorprep.TestDatasets.ts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

public class SensorPrepApplicationTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path input;
    private Path outputDir;

    @Before
    public void setUp() throws IOException {
        input = folder.getRoot().toPath().resolve("sensor_log.csv");
        outputDir = folder.getRoot().toPath().resolve("output");
        Files.write(input, ("timestamp,Temp A,pressure,valve\n"
                + "2025-01-01 00:00:00,20.0,1.0,true\n"
                + "2025-01-01 12:00:00,21.0,1.1,true\n"
                + "2025-01-02 00:00:00,22.0,,true\n"
                + "2025-01-02 12:00:00,,1.3,false\n"
                + "2025-01-03 00:00:00,24.0,1.4,false\n").getBytes(StandardCharsets.UTF_8));
    }

    private Properties properties() {
        Properties props = new Properties();
        props.setProperty("input.file", input.toString());
        props.setProperty("output.dir", outputDir.toString());
        props.setProperty("processing.mode", "single_day");
        props.setProperty("processing.date", "2025-01-02");
        props.setProperty("time.column", "timestamp");
        props.setProperty("sensors.divisions", "temperature,pressure,status");
        props.setProperty("sensors.temperature", "Temp A");
        props.setProperty("sensors.pressure", "pressure");
        props.setProperty("sensors.status", "valve");
        return props;
    }

    @Test
    public void testSingleDayToCsv() throws IOException {
        PreparedDataset prepared = new SensorPrepApplication().run(AppConfig.fromProperties(properties()));

        assertEquals(2, prepared.getDataset().getRowCount());
        assertEquals(Arrays.asList(ts("2025-01-02 00:00:00"), ts("2025-01-02 12:00:00")), prepared.getTime());
        assertEquals(Arrays.asList("timestamp", "temp_a", "pressure", "valve"),
                prepared.getDataset().getColumnNames());
        assertEquals(Arrays.asList("temp_a"), prepared.getDivisionColumns().get("temperature"));

        Path file = outputDir.resolve("cleaned_2025-01-02.csv");
        assertEquals("timestamp,temp_a,pressure,valve\n"
                + "2025-01-02 00:00:00,22.0,1.3,1\n"
                + "2025-01-02 12:00:00,22.0,1.3,0\n", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    public void testFullDataToSqlite() {
        Properties props = properties();
        props.setProperty("processing.mode", "full_data");
        props.setProperty("storage.type", "sqlite");
        props.setProperty("cleaning.fill.method", "ffill");

        PreparedDataset prepared = new SensorPrepApplication().run(AppConfig.fromProperties(props));

        assertEquals(5, prepared.getDataset().getRowCount());
        assertEquals(Arrays.asList(20.0, 21.0, 22.0, 22.0, 24.0), prepared.getDataset().getColumn("temp_a"));
        assertTrue(Files.exists(outputDir.resolve("prepared.db")));
    }

    @Test(expected = ConfigException.class)
    public void testInvalidConfigurationStopsBeforeLoading() {
        Properties props = properties();
        props.setProperty("sensors.pressure", "Temp A");

        new SensorPrepApplication().run(AppConfig.fromProperties(props));
    }

    @Test
    public void testLaunchReportsEveryFailureAsExitCode() throws IOException {
        Path config = folder.newFile("application.properties").toPath();
        Files.write(config, "time.column=timestamp\n".getBytes(StandardCharsets.UTF_8));
        SensorPrepApplication application = mock(SensorPrepApplication.class);

        assertEquals(0, SensorPrepApplication.launch(config.toString(), application));

        doThrow(new IllegalArgumentException("Unknown column 'x'")).when(application).run(any(AppConfig.class));
        assertEquals(1, SensorPrepApplication.launch(config.toString(), application));

        doThrow(new ConfigException("Invalid configuration")).when(application).run(any(AppConfig.class));
        assertEquals(1, SensorPrepApplication.launch(config.toString(), application));

        assertEquals(1, SensorPrepApplication.launch(folder.getRoot().toPath().resolve("absent.properties").toString(),
                application));
    }

    @Test
    public void testCreateStorage() {
        Properties props = properties();
        assertTrue(SensorPrepApplication.createStorage(AppConfig.fromProperties(props)) instanceof CsvDataStorage);

        props.setProperty("storage.type", "sqlite");
        assertTrue(SensorPrepApplication.createStorage(AppConfig.fromProperties(props)) instanceof SQLiteDataStorage);
    }
}
