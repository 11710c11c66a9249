package com.pipeline.sensorprep.storage;

import com.pipeline.sensorprep.core.DataStorage;
import com.pipeline.sensorprep.exception.DataSourceException;
import com.pipeline.sensorprep.model.PreparedDataset;
import com.pipeline.sensorprep.model.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * 基于SQLite的结果存储。
 *
 * 核心设计：
 * - 所有结果写入同一个库文件 {outputDir}/prepared.db
 * - 每次运行一张表 cleaned_{label}，重复运行时整表重建
 * - 整数列存为INTEGER，其余数值列存为REAL，时间列存为文本
 * - 传感器分组记录在 division_columns 表中
 */
public class SQLiteDataStorage implements DataStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDataStorage.class);

    private static final String DB_FILE = "prepared.db";

    /** 存储根目录 */
    private final String storageRoot;

    /** 延迟创建的库连接 */
    private Connection connection;

    public SQLiteDataStorage(String storageRoot) {
        this.storageRoot = storageRoot;

        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new DataSourceException("Failed to create storage directory: " + storageRoot, null);
        }
        log.info("SQLiteDataStorage initialized. Root: {}", storageRoot);
    }

    @Override
    public synchronized String store(PreparedDataset prepared) {
        TabularDataset dataset = prepared.getDataset();
        String table = "cleaned_" + StoredValues.sanitize(prepared.getRequest().label());
        List<String> columns = dataset.getColumnNames();

        try {
            Connection conn = getConnection();
            conn.setAutoCommit(false);
            try {
                recreateTable(conn, table, dataset, prepared.getTimeColumn());
                insertRows(conn, table, dataset, prepared.getTimeColumn());
                storeDivisions(conn, table, prepared.getDivisionColumns());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Failed to store table '{}': {}", table, e.getMessage(), e);
            throw new DataSourceException("Failed to store cleaned data into table " + table + ": "
                    + e.getMessage(), e);
        }

        log.info("Data stored successfully to table '{}' ({} rows, columns {}).", table, dataset.getRowCount(), columns);
        return table;
    }

    @Override
    public synchronized void shutdown() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close SQLite connection: {}", e.getMessage());
        }
        connection = null;
        log.info("SQLiteDataStorage shut down.");
    }

    String getDatabasePath() {
        return storageRoot + File.separator + DB_FILE;
    }

    private Connection getConnection() throws SQLException {
        if (connection == null) {
            connection = DriverManager.getConnection("jdbc:sqlite:" + getDatabasePath());
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("CREATE TABLE IF NOT EXISTS division_columns ("
                        + "table_name TEXT NOT NULL, "
                        + "division TEXT NOT NULL, "
                        + "column_name TEXT NOT NULL, "
                        + "position INTEGER NOT NULL, "
                        + "PRIMARY KEY (table_name, division, column_name))");
            }
        }
        return connection;
    }

    private void recreateTable(Connection conn, String table, TabularDataset dataset, String timeColumn)
            throws SQLException {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(quote(table)).append(" (");
        List<String> columns = dataset.getColumnNames();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            if (i > 0) sql.append(", ");
            sql.append(quote(column)).append(' ');
            if (column.equals(timeColumn)) {
                sql.append("TEXT NOT NULL");
            } else {
                sql.append(isIntegral(dataset.getColumn(column)) ? "INTEGER" : "REAL");
            }
        }
        sql.append(')');

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS " + quote(table));
            stmt.execute(sql.toString());
        }
    }

    private void insertRows(Connection conn, String table, TabularDataset dataset, String timeColumn)
            throws SQLException {
        List<String> columns = dataset.getColumnNames();
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(table)).append(" VALUES (");
        for (int i = 0; i < columns.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
        }
        sql.append(')');

        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int row = 0; row < dataset.getRowCount(); row++) {
                for (int c = 0; c < columns.size(); c++) {
                    Object value = dataset.getValue(columns.get(c), row);
                    if (columns.get(c).equals(timeColumn)) {
                        stmt.setString(c + 1, StoredValues.format(value));
                    } else if (value instanceof Long || value instanceof Integer) {
                        stmt.setLong(c + 1, ((Number) value).longValue());
                    } else {
                        stmt.setDouble(c + 1, ((Number) value).doubleValue());
                    }
                }
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void storeDivisions(Connection conn, String table, Map<String, List<String>> divisions)
            throws SQLException {
        try (PreparedStatement delete = conn.prepareStatement("DELETE FROM division_columns WHERE table_name = ?")) {
            delete.setString(1, table);
            delete.executeUpdate();
        }
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO division_columns (table_name, division, column_name, position) VALUES (?, ?, ?, ?)")) {
            for (Map.Entry<String, List<String>> entry : divisions.entrySet()) {
                List<String> columns = entry.getValue();
                for (int i = 0; i < columns.size(); i++) {
                    stmt.setString(1, table);
                    stmt.setString(2, entry.getKey());
                    stmt.setString(3, columns.get(i));
                    stmt.setInt(4, i);
                    stmt.addBatch();
                }
            }
            stmt.executeBatch();
        }
    }

    private static boolean isIntegral(List<Object> values) {
        for (Object value : values) {
            if (!(value instanceof Long) && !(value instanceof Integer)) {
                return false;
            }
        }
        return true;
    }

    private static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
