package com.pipeline.sensorprep.source;

import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.exception.ConfigException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 按文件扩展名选择数据源实现
 */
public final class TabularSources {

    private TabularSources() {}

    public static boolean isSupported(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".csv") || lower.endsWith(".xlsx") || lower.endsWith(".xls");
    }

    /**
     * @throws ConfigException 扩展名既不是CSV也不是电子表格
     */
    public static TabularSource forFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return new CsvTabularSource(file);
        }
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return new SpreadsheetTabularSource(file);
        }
        throw new ConfigException("Unsupported file format '" + file.getFileName()
                + "', please choose a csv or excel file");
    }
}
