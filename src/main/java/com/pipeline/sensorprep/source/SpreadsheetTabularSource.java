package com.pipeline.sensorprep.source;

import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.exception.DataSourceException;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.model.TabularDataset;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 电子表格数据源（.xlsx / .xls），读取第一个工作表。
 *
 * 单元格保留原生类型：数值 -> Double/Long，布尔 -> Boolean，
 * 日期格式的数值 -> LocalDateTime，文本 -> String；空行被忽略且不计入行位置。
 */
public class SpreadsheetTabularSource implements TabularSource {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetTabularSource.class);

    private final Path file;
    private final DataFormatter formatter = new DataFormatter();

    public SpreadsheetTabularSource(Path file) {
        this.file = file;
    }

    @Override
    public TabularDataset read(List<String> columns, int skipRows, int maxRows) {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            Sheet sheet = firstSheet(workbook);
            int headerRow = sheet.getFirstRowNum();
            List<String> header = headerOf(sheet.getRow(headerRow));
            int[] indices = resolveColumns(header, columns);

            List<List<Object>> values = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                values.add(new ArrayList<>());
            }

            int skipped = 0;
            int taken = 0;
            for (int r = headerRow + 1; r <= sheet.getLastRowNum(); r++) {
                if (maxRows >= 0 && taken >= maxRows) {
                    break;
                }
                Row row = sheet.getRow(r);
                if (isBlank(row)) {
                    continue;
                }
                if (skipped < skipRows) {
                    skipped++;
                    continue;
                }
                for (int c = 0; c < indices.length; c++) {
                    values.get(c).add(cellValue(row.getCell(indices[c])));
                }
                taken++;
            }

            TabularDataset dataset = new TabularDataset(taken);
            for (int c = 0; c < columns.size(); c++) {
                dataset.addColumn(columns.get(c), CellValues.normalizeNumbers(values.get(c)));
            }
            log.info("Successfully read spreadsheet {} with column(s) {}, {} rows after skipping {}.",
                    file, columns, taken, skipped);
            return dataset;

        } catch (IOException e) {
            throw new DataSourceException("Failed to read spreadsheet " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getLocation() {
        return file.toString();
    }

    private Sheet firstSheet(Workbook workbook) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new SchemaException("The spreadsheet " + file + " contains no sheets.");
        }
        return workbook.getSheetAt(0);
    }

    private List<String> headerOf(Row row) {
        if (row == null || isBlank(row)) {
            throw new SchemaException("The spreadsheet " + file + " is empty, no header row found.");
        }
        List<String> header = new ArrayList<>();
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            header.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
        }
        return header;
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

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case STRING:
                String text = cell.getStringCellValue();
                return CellValues.isMissingToken(text) ? null : text.trim();
            default:
                return null;
        }
    }

    private boolean isBlank(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (cell.getCellType() != CellType.BLANK
                    && !(cell.getCellType() == CellType.STRING && cell.getStringCellValue().isBlank())) {
                return false;
            }
        }
        return true;
    }
}
