package com.pipeline.sensorprep.source;

import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.exception.ConfigException;
import com.pipeline.sensorprep.model.TabularDataset;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;

import static com.pipeline.sensorprep.TestDatasets.values;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class SpreadsheetTabularSourceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path workbook() throws IOException {
        Path file = folder.getRoot().toPath().resolve("data.xlsx");
        try (Workbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = wb.createSheet("log");
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));

            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("time");
            header.createCell(1).setCellValue("temp");
            header.createCell(2).setCellValue("pump");

            for (int i = 0; i < 3; i++) {
                // 第3行留空
                Row row = sheet.createRow(i < 2 ? i + 1 : i + 2);
                row.createCell(0).setCellValue(LocalDateTime.of(2025, 1, 1, i, 0));
                row.getCell(0).setCellStyle(dateStyle);
                row.createCell(1).setCellValue(10 + i);
                row.createCell(2).setCellValue(i % 2 == 0);
            }
            wb.write(out);
        }
        return file;
    }

    @Test
    public void testReadsNativeCellTypes() throws IOException {
        TabularSource source = TabularSources.forFile(workbook());

        TabularDataset data = source.read(Arrays.asList("time", "temp", "pump"));

        assertEquals(3, data.getRowCount());
        assertEquals(LocalDateTime.of(2025, 1, 1, 2, 0), data.getValue("time", 2));
        assertEquals(values(10L, 11L, 12L), data.getColumn("temp"));
        assertEquals(values(true, false, true), data.getColumn("pump"));
    }

    @Test
    public void testSkipsBlankRowsWhenCountingPositions() throws IOException {
        TabularSource source = TabularSources.forFile(workbook());

        TabularDataset data = source.read(Collections.singletonList("temp"), 2, 1);

        assertEquals(values(12L), data.getColumn("temp"));
    }

    @Test
    public void testFactoryRejectsUnknownExtension() {
        assertThrows(ConfigException.class, () -> TabularSources.forFile(Path.of("data.json")));
        assertTrue(TabularSources.isSupported("LOG.XLS"));
        assertFalse(TabularSources.isSupported("log.txt"));
    }
}
