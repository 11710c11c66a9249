package com.pipeline.sensorprep.storage;

import com.pipeline.sensorprep.core.DataStorage;
import com.pipeline.sensorprep.exception.DataSourceException;
import com.pipeline.sensorprep.model.PreparedDataset;
import com.pipeline.sensorprep.model.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 把清洗结果写为CSV文件：{outputDir}/cleaned_{label}.csv。
 * 同名文件直接覆盖，列顺序与数据集一致。
 */
public class CsvDataStorage implements DataStorage {

    private static final Logger log = LoggerFactory.getLogger(CsvDataStorage.class);

    private final Path outputDir;

    public CsvDataStorage(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public String store(PreparedDataset prepared) {
        TabularDataset dataset = prepared.getDataset();
        Path file = outputDir.resolve("cleaned_" + prepared.getRequest().label() + ".csv");
        List<String> columns = dataset.getColumnNames();

        try {
            Files.createDirectories(outputDir);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writeRow(writer, columns);
                for (int row = 0; row < dataset.getRowCount(); row++) {
                    StringBuilder line = new StringBuilder();
                    for (int c = 0; c < columns.size(); c++) {
                        if (c > 0) line.append(',');
                        line.append(escape(StoredValues.format(dataset.getValue(columns.get(c), row))));
                    }
                    writer.write(line.toString());
                    writer.write('\n');
                }
            }
        } catch (IOException e) {
            throw new DataSourceException("Failed to write cleaned data to " + file + ": " + e.getMessage(), e);
        }

        log.info("Data stored successfully to {} ({} rows).", file, dataset.getRowCount());
        return file.toString();
    }

    @Override
    public void shutdown() {
        // 每次写入都自行关闭文件
    }

    private static void writeRow(BufferedWriter writer, List<String> cells) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) line.append(',');
            line.append(escape(cells.get(i)));
        }
        writer.write(line.toString());
        writer.write('\n');
    }

    private static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
