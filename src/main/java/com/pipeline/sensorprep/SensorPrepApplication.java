package com.pipeline.sensorprep;

import com.pipeline.sensorprep.core.DataStorage;
import com.pipeline.sensorprep.core.PreparationListener;
import com.pipeline.sensorprep.core.SelectiveLoader;
import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.core.impl.DefaultCleaningPipeline;
import com.pipeline.sensorprep.core.impl.DefaultPreparationRunner;
import com.pipeline.sensorprep.core.impl.DefaultRangeLocator;
import com.pipeline.sensorprep.core.impl.DefaultSelectiveLoader;
import com.pipeline.sensorprep.core.impl.DefaultTimeIndexer;
import com.pipeline.sensorprep.core.impl.LoggingPreparationListener;
import com.pipeline.sensorprep.exception.PreparationException;
import com.pipeline.sensorprep.model.PreparedDataset;
import com.pipeline.sensorprep.model.TimeColumnParameters;
import com.pipeline.sensorprep.source.TabularSources;
import com.pipeline.sensorprep.storage.CsvDataStorage;
import com.pipeline.sensorprep.storage.SQLiteDataStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 系统启动引导类。
 * 一条命令完成一次数据准备：校验配置、加载数据、清洗、持久化。
 *
 * 用法：java -jar sensor-prep.jar [配置文件路径]
 */
public class SensorPrepApplication {

    private static final Logger log = LoggerFactory.getLogger(SensorPrepApplication.class);

    private final PreparationListener listener;

    public SensorPrepApplication() {
        this(new LoggingPreparationListener());
    }

    public SensorPrepApplication(PreparationListener listener) {
        this.listener = listener;
    }

    public PreparedDataset run(AppConfig config) {
        log.info("=== Sensor Data Preparation ===");
        log.info("Starting with config: {}", config);
        config.validate().throwIfInvalid();

        // 1. 数据源与时间索引
        TabularSource source = TabularSources.forFile(config.getInputFile());
        TimeColumnParameters timeParameters = config.getTimeColumnParameters();
        SelectiveLoader loader = new DefaultSelectiveLoader(source, config.getTimeColumn(),
                new DefaultTimeIndexer(timeParameters, listener), new DefaultRangeLocator());

        // 2. 存储层
        DataStorage storage = createStorage(config);

        // 3. 编排执行
        DefaultPreparationRunner runner = new DefaultPreparationRunner(loader,
                new DefaultCleaningPipeline(listener), storage, config.getTimeColumn(),
                config.getDivisions(), config.getProcessingParameters());
        try {
            PreparedDataset prepared = runner.run(config.getRequest());
            log.info("=== Preparation finished: {} ===", prepared);
            return prepared;
        } finally {
            storage.shutdown();
        }
    }

    static DataStorage createStorage(AppConfig config) {
        if ("sqlite".equals(config.getStorageType())) {
            return new SQLiteDataStorage(config.getOutputDir().toString());
        }
        return new CsvDataStorage(config.getOutputDir());
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/application.properties";
        System.exit(launch(configPath, new SensorPrepApplication()));
    }

    /**
     * 执行一次数据准备，任何失败都记录错误日志。
     *
     * @return 进程退出码：成功为0，失败为1
     */
    static int launch(String configPath, SensorPrepApplication application) {
        try {
            application.run(AppConfig.load(configPath));
            return 0;
        } catch (PreparationException e) {
            log.error("Data preparation failed: {}", e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            log.error("Data preparation failed unexpectedly: {}", e.toString(), e);
            return 1;
        }
    }
}
