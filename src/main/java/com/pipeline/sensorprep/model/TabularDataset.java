package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列式存储的表格数据集。
 *
 * 列名集合在一次处理过程中保持稳定且有序；缺失值以null表示。
 * 数据集由单次运行独占，非线程安全。
 */
public class TabularDataset implements Serializable {

    private final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
    private int rowCount;

    public TabularDataset() {}

    public TabularDataset(int rowCount) {
        this.rowCount = rowCount;
    }

    /**
     * 追加一列。首列决定行数，此后每列长度必须一致。
     */
    public TabularDataset addColumn(String name, List<?> values) {
        if (columns.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate column '" + name + "'");
        }
        if (columns.isEmpty() && rowCount == 0) {
            rowCount = values.size();
        } else if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
                    + " values, expected " + rowCount);
        }
        columns.put(name, new ArrayList<>(values));
        return this;
    }

    /** 替换已有列的全部取值 */
    public void setColumn(String name, List<?> values) {
        if (!columns.containsKey(name)) {
            throw new IllegalArgumentException("Unknown column '" + name + "'");
        }
        if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
                    + " values, expected " + rowCount);
        }
        columns.put(name, new ArrayList<>(values));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Object> getColumn(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'");
        }
        return Collections.unmodifiableList(values);
    }

    public Object getValue(String column, int row) {
        return getColumn(column).get(row);
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * 按给定映射重命名列，保持列顺序。
     * 两个原列映射到同一新名称时抛出异常。
     */
    public void renameColumns(Map<String, String> renames) {
        LinkedHashMap<String, List<Object>> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            String target = renames.getOrDefault(entry.getKey(), entry.getKey());
            if (renamed.put(target, entry.getValue()) != null) {
                throw new IllegalArgumentException("Renaming produces duplicate column '" + target + "'");
            }
        }
        columns.clear();
        columns.putAll(renamed);
    }

    /**
     * 调整列顺序：先放置给定列，其余列保持原有相对顺序跟随其后。
     */
    public void moveToFront(List<String> leading) {
        LinkedHashMap<String, List<Object>> reordered = new LinkedHashMap<>();
        for (String name : leading) {
            reordered.put(name, getColumnInternal(name));
        }
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            reordered.putIfAbsent(entry.getKey(), entry.getValue());
        }
        columns.clear();
        columns.putAll(reordered);
    }

    /**
     * 仅保留标记为true的行。
     *
     * @return 被移除的行数
     */
    public int retainRows(boolean[] keep) {
        if (keep.length != rowCount) {
            throw new IllegalArgumentException("Row mask has " + keep.length + " entries, expected " + rowCount);
        }
        int kept = 0;
        for (boolean k : keep) {
            if (k) kept++;
        }
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            List<Object> filtered = new ArrayList<>(kept);
            List<Object> values = entry.getValue();
            for (int i = 0; i < rowCount; i++) {
                if (keep[i]) {
                    filtered.add(values.get(i));
                }
            }
            entry.setValue(filtered);
        }
        int removed = rowCount - kept;
        rowCount = kept;
        return removed;
    }

    /**
     * 按行位置列表抽取一个新数据集，位置可重排，不可越界。
     */
    public TabularDataset selectRows(List<Integer> positions) {
        TabularDataset selected = new TabularDataset(positions.size());
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            List<Object> source = entry.getValue();
            List<Object> values = new ArrayList<>(positions.size());
            for (int position : positions) {
                values.add(source.get(position));
            }
            selected.columns.put(entry.getKey(), values);
        }
        return selected;
    }

    public TabularDataset copy() {
        TabularDataset copy = new TabularDataset(rowCount);
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            copy.columns.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    private List<Object> getColumnInternal(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "'");
        }
        return values;
    }

    @Override
    public String toString() {
        return "TabularDataset{rows=" + rowCount + ", columns=" + columns.keySet() + "}";
    }
}
