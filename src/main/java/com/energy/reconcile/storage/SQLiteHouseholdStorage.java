package com.energy.reconcile.storage;

import com.energy.reconcile.core.HouseholdStorage;
import com.energy.reconcile.exception.StorageException;
import com.energy.reconcile.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 基于SQLite的家庭数据存储实现。
 *
 * 核心设计：
 * - 单个数据库文件，一个家庭一张表（原始表 raw_&lt;id&gt;，处理后表 household_&lt;id&gt;），
 *   &lt;id&gt; 为清理后的标识加原始标识的哈希前缀，不同标识不会落到同一张表
 * - households 表记录家庭标识与表名的对应关系
 * - 列类型：时间戳为 TIMESTAMP（毫秒），数值列 REAL，诊断列 BOOLEAN（0/1/NULL），其他 TEXT
 * - anomaly_report 表按（家庭, 列）保存异常报告
 */
public class SQLiteHouseholdStorage implements HouseholdStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteHouseholdStorage.class);

    private static final String TYPE_TIMESTAMP = "TIMESTAMP";
    private static final String TYPE_REAL = "REAL";
    private static final String TYPE_BOOLEAN = "BOOLEAN";
    private static final String TYPE_TEXT = "TEXT";

    /** 存储根目录 */
    private final String storageRoot;

    private final Connection connection;

    public SQLiteHouseholdStorage(String storageRoot) {
        this(storageRoot, "households.db");
    }

    public SQLiteHouseholdStorage(String storageRoot, String databaseName) {
        this.storageRoot = storageRoot;

        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new StorageException("Failed to create storage directory: " + storageRoot);
        }

        String dbPath = storageRoot + File.separator + databaseName;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                // 启用WAL模式
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("CREATE TABLE IF NOT EXISTS households ("
                        + "household_id TEXT PRIMARY KEY, "
                        + "raw_table TEXT, "
                        + "processed_table TEXT)");
                stmt.execute("CREATE TABLE IF NOT EXISTS anomaly_report ("
                        + "household_id TEXT NOT NULL, "
                        + "column_name TEXT NOT NULL, "
                        + "has_column INTEGER NOT NULL, "
                        + "gap_within_bound INTEGER NOT NULL, "
                        + "no_negative_diff INTEGER NOT NULL, "
                        + "no_unexpected_zero INTEGER NOT NULL, "
                        + "enough_coverage INTEGER NOT NULL, "
                        + "worst_gap_start INTEGER, "
                        + "worst_gap_seconds INTEGER, "
                        + "negative_diff_timestamps TEXT, "
                        + "zero_range_start INTEGER, "
                        + "zero_range_end INTEGER, "
                        + "coverage REAL, "
                        + "PRIMARY KEY (household_id, column_name))");
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize database " + dbPath, e);
        }
        log.info("SQLiteHouseholdStorage initialized at: {}", dbPath);
    }

    // ==================== 家庭数据表 ====================

    @Override
    public synchronized List<String> listRawHouseholds() {
        List<String> ids = new ArrayList<>();
        String sql = "SELECT household_id FROM households WHERE raw_table IS NOT NULL ORDER BY household_id";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
            return ids;
        } catch (SQLException e) {
            throw new StorageException("Failed to list households", e);
        }
    }

    @Override
    public synchronized HouseholdTable loadRawHousehold(String householdId) {
        String table = lookupTable(householdId, "raw_table");
        return (table != null) ? loadTable(table) : null;
    }

    @Override
    public synchronized void saveRawHousehold(String householdId, HouseholdTable table) {
        String tableName = "raw_" + tableSuffix(householdId);
        checkTableOwner(householdId, tableName);
        writeTable(tableName, table);
        registerTable(householdId, "raw_table", tableName);
        log.info("Raw table for household '{}' saved ({} rows).", householdId, table.rowCount());
    }

    @Override
    public synchronized void saveHousehold(String householdId, HouseholdTable table) {
        String tableName = "household_" + tableSuffix(householdId);
        checkTableOwner(householdId, tableName);
        writeTable(tableName, table);
        registerTable(householdId, "processed_table", tableName);
        log.info("Processed table for household '{}' saved ({} rows, {} columns).",
                householdId, table.rowCount(), table.getColumnNames().size());
    }

    @Override
    public synchronized HouseholdTable loadHousehold(String householdId) {
        String table = lookupTable(householdId, "processed_table");
        return (table != null) ? loadTable(table) : null;
    }

    // ==================== 异常报告 ====================

    @Override
    public synchronized void saveAnomalyReports(String householdId, Map<String, AnomalyReport> reports) {
        String insert = "INSERT INTO anomaly_report (household_id, column_name, has_column, gap_within_bound, "
                + "no_negative_diff, no_unexpected_zero, enough_coverage, worst_gap_start, worst_gap_seconds, "
                + "negative_diff_timestamps, zero_range_start, zero_range_end, coverage) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        inTransaction(() -> {
            try (PreparedStatement delete = connection.prepareStatement(
                    "DELETE FROM anomaly_report WHERE household_id = ?")) {
                delete.setString(1, householdId);
                delete.executeUpdate();
            }
            try (PreparedStatement stmt = connection.prepareStatement(insert)) {
                for (AnomalyReport report : reports.values()) {
                    stmt.setString(1, householdId);
                    stmt.setString(2, report.getColumn());
                    stmt.setInt(3, report.hasColumn() ? 1 : 0);
                    stmt.setInt(4, report.isGapWithinBound() ? 1 : 0);
                    stmt.setInt(5, report.isNoNegativeDiff() ? 1 : 0);
                    stmt.setInt(6, report.isNoUnexpectedZero() ? 1 : 0);
                    stmt.setInt(7, report.isEnoughCoverage() ? 1 : 0);
                    setInstant(stmt, 8, report.getWorstGapStart().orElse(null));
                    if (report.getWorstGap().isPresent()) {
                        stmt.setLong(9, report.getWorstGap().get().getSeconds());
                    } else {
                        stmt.setNull(9, Types.INTEGER);
                    }
                    stmt.setString(10, joinMillis(report.getNegativeDiffTimestamps()));
                    setInstant(stmt, 11, report.getZeroRangeStart().orElse(null));
                    setInstant(stmt, 12, report.getZeroRangeEnd().orElse(null));
                    stmt.setDouble(13, report.getCoverage());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
        }, "save anomaly reports for household " + householdId);
        log.info("Saved {} anomaly reports for household '{}'.", reports.size(), householdId);
    }

    @Override
    public synchronized Map<String, AnomalyReport> loadAnomalyReports(String householdId) {
        Map<String, AnomalyReport> reports = new LinkedHashMap<>();
        String sql = "SELECT * FROM anomaly_report WHERE household_id = ? ORDER BY rowid";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, householdId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    AnomalyReport report = mapResultSetToReport(rs);
                    reports.put(report.getColumn(), report);
                }
            }
            return reports;
        } catch (SQLException e) {
            throw new StorageException("Failed to load anomaly reports for household " + householdId, e);
        }
    }

    // ==================== 内部工具方法 ====================

    private void writeTable(String tableName, HouseholdTable table) {
        List<Column> columns = new ArrayList<>(table.getColumns());
        StringBuilder create = new StringBuilder("CREATE TABLE ").append(quote(tableName)).append(" (")
                .append(quote(table.getTimestampColumn())).append(' ').append(TYPE_TIMESTAMP).append(" NOT NULL");
        StringBuilder insert = new StringBuilder("INSERT INTO ").append(quote(tableName)).append(" VALUES (?");
        for (Column column : columns) {
            create.append(", ").append(quote(column.getName())).append(' ').append(sqlType(column));
            insert.append(", ?");
        }
        create.append(')');
        insert.append(')');

        inTransaction(() -> {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS " + quote(tableName));
                stmt.execute(create.toString());
            }
            try (PreparedStatement stmt = connection.prepareStatement(insert.toString())) {
                for (int row = 0; row < table.rowCount(); row++) {
                    stmt.setLong(1, table.getTimestamp(row).toEpochMilli());
                    for (int c = 0; c < columns.size(); c++) {
                        bindCell(stmt, c + 2, columns.get(c), row);
                    }
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
        }, "write table " + tableName);
    }

    private HouseholdTable loadTable(String tableName) {
        if (!tableExists(tableName)) {
            log.warn("Table '{}' is registered but does not exist.", tableName);
            return null;
        }
        try {
            List<String> names = new ArrayList<>();
            List<String> types = new ArrayList<>();
            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(tableName) + ")")) {
                while (rs.next()) {
                    names.add(rs.getString("name"));
                    String type = rs.getString("type");
                    types.add(type != null ? type.toUpperCase(Locale.ROOT) : "");
                }
            }
            int tsIndex = timestampIndex(names, types);

            List<Instant> timestamps = new ArrayList<>();
            List<List<Object>> cells = new ArrayList<>();
            for (int c = 0; c < names.size(); c++) {
                cells.add(new ArrayList<>());
            }
            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT * FROM " + quote(tableName) + " ORDER BY rowid")) {
                while (rs.next()) {
                    for (int c = 0; c < names.size(); c++) {
                        if (c == tsIndex) {
                            long millis = rs.getLong(c + 1);
                            if (rs.wasNull()) {
                                throw new StorageException("Table '" + tableName + "' has a row without timestamp");
                            }
                            timestamps.add(Instant.ofEpochMilli(millis));
                        } else {
                            cells.get(c).add(readCell(rs, c + 1, types.get(c)));
                        }
                    }
                }
            }

            HouseholdTable table = new HouseholdTable(names.get(tsIndex), timestamps);
            for (int c = 0; c < names.size(); c++) {
                if (c != tsIndex) {
                    table.putColumn(toColumn(names.get(c), types.get(c), cells.get(c)));
                }
            }
            return table;
        } catch (SQLException e) {
            throw new StorageException("Failed to load table " + tableName, e);
        }
    }

    private static int timestampIndex(List<String> names, List<String> types) {
        int idx = types.indexOf(TYPE_TIMESTAMP);
        if (idx < 0) idx = names.indexOf(HouseholdTable.READING_DATE);
        return Math.max(idx, 0);
    }

    private static String sqlType(Column column) {
        if (column instanceof ValueColumn) return TYPE_REAL;
        if (column instanceof FlagColumn) return TYPE_BOOLEAN;
        return TYPE_TEXT;
    }

    private static boolean isTextType(String type) {
        return type.contains("TEXT") || type.contains("CHAR") || type.contains("CLOB");
    }

    private static void bindCell(PreparedStatement stmt, int index, Column column, int row) throws SQLException {
        if (!column.isKnown(row)) {
            stmt.setNull(index, column instanceof TextColumn ? Types.VARCHAR : Types.NUMERIC);
        } else if (column instanceof ValueColumn) {
            stmt.setDouble(index, ((ValueColumn) column).getDouble(row));
        } else if (column instanceof FlagColumn) {
            stmt.setInt(index, ((FlagColumn) column).get(row) == TriState.TRUE ? 1 : 0);
        } else {
            stmt.setString(index, ((TextColumn) column).get(row));
        }
    }

    private static Object readCell(ResultSet rs, int index, String type) throws SQLException {
        if (type.equals(TYPE_BOOLEAN)) {
            int v = rs.getInt(index);
            return rs.wasNull() ? TriState.UNKNOWN : TriState.of(v != 0);
        }
        if (isTextType(type)) {
            return rs.getString(index);
        }
        double v = rs.getDouble(index);
        return rs.wasNull() ? null : v;
    }

    private static Column toColumn(String name, String type, List<Object> cells) {
        if (type.equals(TYPE_BOOLEAN)) {
            FlagColumn column = new FlagColumn(name, cells.size());
            for (int i = 0; i < cells.size(); i++) column.set(i, (TriState) cells.get(i));
            return column;
        }
        if (isTextType(type)) {
            TextColumn column = new TextColumn(name, cells.size());
            for (int i = 0; i < cells.size(); i++) column.set(i, (String) cells.get(i));
            return column;
        }
        ValueColumn column = new ValueColumn(name, cells.size());
        for (int i = 0; i < cells.size(); i++) {
            if (cells.get(i) != null) column.set(i, (Double) cells.get(i));
        }
        return column;
    }

    private String lookupTable(String householdId, String field) {
        String sql = "SELECT " + field + " FROM households WHERE household_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, householdId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to look up household " + householdId, e);
        }
    }

    /** 表名已登记在其他家庭名下时拒绝写入，避免覆盖其他家庭的数据 */
    private void checkTableOwner(String householdId, String tableName) {
        String sql = "SELECT household_id FROM households "
                + "WHERE (raw_table = ? OR processed_table = ?) AND household_id <> ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, tableName);
            stmt.setString(2, tableName);
            stmt.setString(3, householdId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    throw new StorageException("Table " + tableName + " for household '" + householdId
                            + "' is already owned by household '" + rs.getString(1) + "'");
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to check table owner for household " + householdId, e);
        }
    }

    private void registerTable(String householdId, String field, String tableName) {
        String sql = "INSERT INTO households (household_id, " + field + ") VALUES (?, ?) "
                + "ON CONFLICT(household_id) DO UPDATE SET " + field + " = excluded." + field;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, householdId);
            stmt.setString(2, tableName);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to register table for household " + householdId, e);
        }
    }

    private boolean tableExists(String tableName) {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type='table' AND name=?")) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to check table " + tableName, e);
        }
    }

    private AnomalyReport mapResultSetToReport(ResultSet rs) throws SQLException {
        AnomalyReport.Builder builder = AnomalyReport.builder(rs.getString("column_name"))
                .hasColumn(rs.getInt("has_column") != 0)
                .gapWithinBound(rs.getInt("gap_within_bound") != 0)
                .noNegativeDiff(rs.getInt("no_negative_diff") != 0)
                .noUnexpectedZero(rs.getInt("no_unexpected_zero") != 0)
                .enoughCoverage(rs.getInt("enough_coverage") != 0)
                .coverage(rs.getDouble("coverage"));

        Instant gapStart = getInstant(rs, "worst_gap_start");
        long gapSeconds = rs.getLong("worst_gap_seconds");
        if (gapStart != null && !rs.wasNull()) {
            builder.worstGap(gapStart, Duration.ofSeconds(gapSeconds));
        }
        String negatives = rs.getString("negative_diff_timestamps");
        if (negatives != null && !negatives.isEmpty()) {
            for (String millis : negatives.split(",")) {
                builder.addNegativeDiffTimestamp(Instant.ofEpochMilli(Long.parseLong(millis)));
            }
        }
        Instant zeroStart = getInstant(rs, "zero_range_start");
        Instant zeroEnd = getInstant(rs, "zero_range_end");
        if (zeroStart != null) {
            builder.zeroRange(zeroStart, zeroEnd);
        }
        return builder.build();
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value != null) {
            stmt.setLong(index, value.toEpochMilli());
        } else {
            stmt.setNull(index, Types.INTEGER);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static String joinMillis(List<Instant> timestamps) {
        StringBuilder sb = new StringBuilder();
        for (Instant ts : timestamps) {
            if (sb.length() > 0) sb.append(',');
            sb.append(ts.toEpochMilli());
        }
        return sb.toString();
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }

    private void inTransaction(SqlWork work, String description) {
        try {
            connection.setAutoCommit(false);
            try {
                work.run();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", description, e.getMessage(), e);
            throw new StorageException("Failed to " + description, e);
        }
    }

    /** 将家庭标识转为合法的SQLite表名 */
    static String sanitizeTableName(String householdId) {
        return householdId.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    /**
     * 家庭标识对应的表名后缀：清理后的标识加 SHA-256 的前 8 位十六进制，
     * 例如 "h-1" 与 "h_1" 得到不同的后缀
     */
    static String tableSuffix(String householdId) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(householdId.getBytes(StandardCharsets.UTF_8));
            return sanitizeTableName(householdId) + "_" + HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    public String getStorageRoot() {
        return storageRoot;
    }

    /** 关闭连接 */
    @Override
    public synchronized void shutdown() {
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            log.warn("Error while closing SQLite connection: {}", e.getMessage(), e);
        }
        log.info("SQLiteHouseholdStorage shut down.");
    }
}
