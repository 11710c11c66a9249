package com.pipeline.sensorprep.core.impl;

import com.pipeline.sensorprep.core.RangeLocator;
import com.pipeline.sensorprep.core.SelectiveLoader;
import com.pipeline.sensorprep.core.TabularSource;
import com.pipeline.sensorprep.core.TimeIndexer;
import com.pipeline.sensorprep.exception.NoDataException;
import com.pipeline.sensorprep.exception.ValidationException;
import com.pipeline.sensorprep.model.RowWindow;
import com.pipeline.sensorprep.model.TabularDataset;
import com.pipeline.sensorprep.model.TimeIndex;
import com.pipeline.sensorprep.model.TimeIndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 选择性加载器默认实现。
 *
 * 部分加载发起两次物理读取：
 * 1. 只读时间列，构建时间索引并定位行窗口
 * 2. 只读传感器列，跳过 startIndex 行、恰好读取 endIndex - startIndex + 1 行
 * 之后按行位置把已解析的时间值回填到读出的行块上，并把时间列移到首列。
 */
public class DefaultSelectiveLoader implements SelectiveLoader {

    private static final Logger log = LoggerFactory.getLogger(DefaultSelectiveLoader.class);

    private final TabularSource source;
    private final String timeColumn;
    private final TimeIndexer timeIndexer;
    private final RangeLocator rangeLocator;

    public DefaultSelectiveLoader(TabularSource source, String timeColumn,
                                  TimeIndexer timeIndexer, RangeLocator rangeLocator) {
        this.source = source;
        this.timeColumn = timeColumn;
        this.timeIndexer = timeIndexer;
        this.rangeLocator = rangeLocator;
    }

    @Override
    public RowWindow resolveWindow(LocalDateTime start, LocalDateTime end) {
        TabularDataset timeData = source.read(Collections.singletonList(timeColumn));
        TimeIndex index = timeIndexer.build(timeData);
        return rangeLocator.locate(index, start, end);
    }

    @Override
    public TabularDataset materializeWindow(RowWindow window, List<String> sensorColumns) {
        List<String> columns = valueColumns(sensorColumns);
        TabularDataset block = source.read(columns, window.getStartIndex(), window.getRowCount());
        if (block.getRowCount() != window.getRowCount()) {
            throw new ValidationException("Read " + block.getRowCount() + " rows from " + source.getLocation()
                    + " for row window [" + window.getStartIndex() + ", " + window.getEndIndex() + "], expected "
                    + window.getRowCount() + "; the source changed between reads.");
        }

        // 行块中第 i 行对应源数据行 startIndex + i
        List<Integer> offsets = new ArrayList<>(window.getMatches().size());
        boolean aligned = window.getMatches().size() == block.getRowCount();
        for (int i = 0; i < window.getMatches().size(); i++) {
            int offset = window.getMatches().get(i).getPosition() - window.getStartIndex();
            offsets.add(offset);
            aligned &= offset == i;
        }
        TabularDataset rows = aligned ? block : block.selectRows(offsets);
        if (!aligned) {
            log.debug("Row block [{}, {}] realigned to {} matching rows in time order.",
                    window.getStartIndex(), window.getEndIndex(), offsets.size());
        }

        TabularDataset result = withTime(rows, window.getTimestamps(), columns);
        log.info("Data was partially loaded from {}: {} rows, columns {}.",
                source.getLocation(), result.getRowCount(), result.getColumnNames());
        return result;
    }

    @Override
    public TabularDataset loadFull(List<String> sensorColumns) {
        List<String> columns = new ArrayList<>();
        columns.add(timeColumn);
        columns.addAll(valueColumns(sensorColumns));
        TabularDataset data = source.read(columns);

        TimeIndex index = timeIndexer.build(data);
        LocalDateTime start = index.getFirstTimestamp();
        LocalDateTime end = index.getLastTimestamp();

        List<Integer> positions = new ArrayList<>(index.size());
        List<LocalDateTime> timestamps = new ArrayList<>(index.size());
        for (TimeIndexEntry entry : index.getEntries()) {
            if (!entry.getTimestamp().isBefore(start) && !entry.getTimestamp().isAfter(end)) {
                positions.add(entry.getPosition());
                timestamps.add(entry.getTimestamp());
            }
        }
        if (positions.isEmpty()) {
            throw new NoDataException("No data found in the specified date range: " + start + " to " + end);
        }

        TabularDataset rows = data.selectRows(positions);
        TabularDataset result = withTime(rows, timestamps, columns.subList(1, columns.size()));
        log.info("Data was fully loaded from {}: {} rows from {} to {}, columns {}.",
                source.getLocation(), result.getRowCount(), start, end, result.getColumnNames());
        return result;
    }

    /** 传感器列去重并排除时间列，保持声明顺序 */
    private List<String> valueColumns(List<String> sensorColumns) {
        LinkedHashSet<String> unique = new LinkedHashSet<>(sensorColumns);
        unique.remove(timeColumn);
        return new ArrayList<>(unique);
    }

    private TabularDataset withTime(TabularDataset rows, List<LocalDateTime> timestamps, List<String> columns) {
        TabularDataset result = new TabularDataset();
        result.addColumn(timeColumn, timestamps);
        for (String column : columns) {
            result.addColumn(column, rows.getColumn(column));
        }
        return result;
    }
}
