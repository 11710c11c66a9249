package com.pipeline.sensorprep.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 离群值检测结果（仅供参考，检测不会修改或删除任何数据）
 */
public class OutlierReport implements Serializable {

    private final OutlierMethod method;
    private final double threshold;
    private final Map<String, ColumnOutliers> columns = new LinkedHashMap<>();
    private final List<String> skippedColumns = new ArrayList<>();

    public OutlierReport(OutlierMethod method, double threshold) {
        this.method = method;
        this.threshold = threshold;
    }

    public void addColumn(ColumnOutliers outliers) {
        columns.put(outliers.getColumn(), outliers);
    }

    /** 记录因零方差等原因未能检测的列 */
    public void addSkipped(String column) {
        skippedColumns.add(column);
    }

    public OutlierMethod getMethod() { return method; }
    public double getThreshold() { return threshold; }
    public Map<String, ColumnOutliers> getColumns() { return Collections.unmodifiableMap(columns); }
    public List<String> getSkippedColumns() { return Collections.unmodifiableList(skippedColumns); }

    public int getOutlierCount(String column) {
        ColumnOutliers outliers = columns.get(column);
        return outliers == null ? 0 : outliers.getCount();
    }

    public int getTotalCount() {
        int total = 0;
        for (ColumnOutliers outliers : columns.values()) {
            total += outliers.getCount();
        }
        return total;
    }

    @Override
    public String toString() {
        return "OutlierReport{method=" + method + ", total=" + getTotalCount()
                + ", skipped=" + skippedColumns + "}";
    }

    /**
     * 单列检测结果：判定边界与被标记的时间戳。
     * z_score 方法下边界为 mean ± threshold * std。
     */
    public static class ColumnOutliers implements Serializable {
        private final String column;
        private final double lowerBound;
        private final double upperBound;
        private final List<LocalDateTime> flaggedTimestamps;

        public ColumnOutliers(String column, double lowerBound, double upperBound,
                              List<LocalDateTime> flaggedTimestamps) {
            this.column = column;
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
            this.flaggedTimestamps = Collections.unmodifiableList(new ArrayList<>(flaggedTimestamps));
        }

        public String getColumn() { return column; }
        public double getLowerBound() { return lowerBound; }
        public double getUpperBound() { return upperBound; }
        public List<LocalDateTime> getFlaggedTimestamps() { return flaggedTimestamps; }
        public int getCount() { return flaggedTimestamps.size(); }
    }
}
