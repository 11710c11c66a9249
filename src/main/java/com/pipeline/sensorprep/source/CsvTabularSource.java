package com.pipeline.sensorprep.source;

import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.exception.DataSourceException;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.model.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV 数据源。
 *
 * 支持双引号包裹的字段（字段内可含分隔符、换行和 "" 转义），
 * 自动去除 UTF-8 BOM；完全空白的行被忽略且不计入行位置。
 * 逐行流式读取，跳过的行只做解析不做类型推断。
 */
public class CsvTabularSource implements TabularSource {

    private static final Logger log = LoggerFactory.getLogger(CsvTabularSource.class);

    private final Path file;
    private final char delimiter;

    public CsvTabularSource(Path file) {
        this(file, ',');
    }

    public CsvTabularSource(Path file, char delimiter) {
        this.file = file;
        this.delimiter = delimiter;
    }

    @Override
    public TabularDataset read(List<String> columns, int skipRows, int maxRows) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<String> header = readHeader(reader);
            int[] indices = resolveColumns(header, columns);

            List<List<String>> raw = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                raw.add(new ArrayList<>());
            }

            int skipped = 0;
            int taken = 0;
            List<String> record;
            while ((maxRows < 0 || taken < maxRows) && (record = nextRecord(reader)) != null) {
                if (isBlank(record)) {
                    continue;
                }
                if (skipped < skipRows) {
                    skipped++;
                    continue;
                }
                for (int c = 0; c < indices.length; c++) {
                    int idx = indices[c];
                    raw.get(c).add(idx < record.size() ? record.get(idx) : null);
                }
                taken++;
            }

            TabularDataset dataset = new TabularDataset(taken);
            for (int c = 0; c < columns.size(); c++) {
                dataset.addColumn(columns.get(c), CellValues.inferColumn(raw.get(c)));
            }

            if (skipRows == 0 && maxRows < 0) {
                log.info("Successfully read CSV file: {} with column(s) {} ({} rows).", file, columns, taken);
            } else {
                log.info("Successfully read CSV file: {} with column(s) {}, rows {}..{}.",
                        file, columns, skipRows, skipRows + taken - 1);
            }
            return dataset;

        } catch (IOException e) {
            throw new DataSourceException("Failed to read CSV file " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getLocation() {
        return file.toString();
    }

    private List<String> readHeader(BufferedReader reader) throws IOException {
        List<String> header = nextRecord(reader);
        if (header == null || isBlank(header)) {
            throw new SchemaException("The file " + file + " is empty, no header row found.");
        }
        List<String> names = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (i == 0 && !name.isEmpty() && name.charAt(0) == '\uFEFF') {
                name = name.substring(1);
            }
            names.add(name.trim());
        }
        return names;
    }

    private int[] resolveColumns(List<String> header, List<String> columns) {
        int[] indices = new int[columns.size()];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            indices[i] = header.indexOf(columns.get(i));
            if (indices[i] < 0) {
                missing.add(columns.get(i));
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException("Columns " + missing + " not found in " + file
                    + ", available columns: " + header);
        }
        return indices;
    }

    /**
     * 读取一条完整记录（引号内的换行属于字段内容）。
     *
     * @return 字段列表；到达文件末尾返回null
     */
    private List<String> nextRecord(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        // 只有位于字段开头的引号才开启引用段，字段中间的引号按字面保留
        boolean fieldStart = true;

        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inQuotes) {
                    if (c == '"') {
                        if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                            current.append('"');
                            i++;
                        } else {
                            inQuotes = false;
                        }
                    } else {
                        current.append(c);
                    }
                } else if (c == '"' && fieldStart) {
                    inQuotes = true;
                    fieldStart = false;
                } else if (c == delimiter) {
                    fields.add(current.toString());
                    current.setLength(0);
                    fieldStart = true;
                } else if (c != '\r') {
                    current.append(c);
                    fieldStart = false;
                }
            }
            if (!inQuotes) {
                break;
            }
            line = reader.readLine();
            if (line == null) {
                log.warn("Unterminated quoted field at end of {}", file);
                break;
            }
            current.append('\n');
        }
        fields.add(current.toString());
        return fields;
    }

    private static boolean isBlank(List<String> record) {
        return record.size() == 1 && record.get(0).isBlank();
    }
}
