package top.guoziyang.dbrpc.backend.driver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.tree.TreeHandler;
import top.guoziyang.dbrpc.backend.tree.TreeRequest;
import top.guoziyang.dbrpc.backup.BackupManager;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.Error;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.SchemaDefinition;
import top.guoziyang.dbrpc.schema.SqlIdentifiers;
import top.guoziyang.dbrpc.schema.TableSchema;

/**
 * SqliteDriver - 基于xerial sqlite-jdbc的驱动引擎
 *
 * 连接设置：
 * - PRAGMA foreign_keys = ON：外键约束生效
 * - PRAGMA journal_mode = WAL：读写不互相阻塞，崩溃后可恢复
 * - PRAGMA busy_timeout：其他进程（例如备份工具）持有文件锁时短暂等待
 *
 * 执行流程（以insert为例）：
 * 1. 校验表名和列名的格式（不进入通道）
 * 2. 通过TransactionManager获得连接通道
 * 3. PRAGMA table_info确认表和列存在
 * 4. 用参数绑定执行语句，值从不拼进SQL
 * 5. SQLException包装成STORAGE_ERROR，带上操作名和表名
 *
 * 后台线程：
 * dbrpc-tx-reaper定期调用TransactionManager.reapIdle，回滚空闲事务。
 */
public class SqliteDriver implements DatabaseDriver {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDriver.class);

    static final String SETTINGS_TABLE = "db_settings";
    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String DEFAULT_SCHEMA_VERSION = "0.0.0";

    private static final Set<String> TRANSACTION_KEYWORDS =
        Set.of("BEGIN", "COMMIT", "ROLLBACK", "END", "SAVEPOINT", "RELEASE");

    private final Path databasePath;
    private final Path defaultBackupDir;
    private final TransactionManager tm;
    private final TreeHandler treeHandler;
    private final ScheduledExecutorService reaper;

    SqliteDriver(Path databasePath, Path defaultBackupDir, TransactionManager tm, TreeHandler treeHandler,
                 long idleTimeoutMillis) {
        this.databasePath = databasePath;
        this.defaultBackupDir = defaultBackupDir;
        this.tm = tm;
        this.treeHandler = treeHandler;
        this.reaper = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("dbrpc-tx-reaper").setDaemon(true).build());
        long period = Math.max(50L, Math.min(5_000L, idleTimeoutMillis / 4));
        reaper.scheduleWithFixedDelay(this::reap, period, period, TimeUnit.MILLISECONDS);
    }

    public static SqliteDriver open(DriverConfig config, TreeHandler treeHandler) {
        Path path = config.getDatabasePath().toAbsolutePath();
        Connection conn;
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            conn = DriverManager.getConnection("jdbc:sqlite:" + path);
        } catch (IOException | SQLException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Cannot open database " + path, e);
        }
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON");
            st.execute("PRAGMA journal_mode = WAL");
            st.execute("PRAGMA busy_timeout = 5000");
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException closeErr) {
                e.addSuppressed(closeErr);
            }
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Cannot configure database " + path, e);
        }
        LOG.info("Opened database {}", path);
        TransactionManager tm = TransactionManager.create(conn, config.getLockTimeoutMillis(),
            config.getTransactionIdleTimeoutMillis());
        return new SqliteDriver(path, config.getBackupDir(), tm, treeHandler,
            config.getTransactionIdleTimeoutMillis());
    }

    private void reap() {
        try {
            tm.reapIdle();
        } catch (RuntimeException e) {
            LOG.error("Idle transaction reaper failed", e);
        }
    }

    // ========== DDL ==========

    @Override
    public boolean createTable(TableSchema schema, String txId) {
        return call("create_table", schema.getName(), txId, conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate(schema.toCreateSql());
            }
            LOG.debug("Created table {}", schema.getName());
            return true;
        });
    }

    @Override
    public boolean dropTable(String table, String txId) {
        SqlIdentifiers.check(table, "table");
        return call("drop_table", table, txId, conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("DROP TABLE IF EXISTS " + table);
            }
            return true;
        });
    }

    @Override
    public Map<String, Object> alterTable(String table, List<ColumnDef> addColumns, String renameTo, String txId) {
        SqlIdentifiers.check(table, "table");
        List<ColumnDef> columns = addColumns == null ? Collections.<ColumnDef>emptyList() : addColumns;
        if (columns.isEmpty() && renameTo == null) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "alter_table needs add_columns or rename_to");
        }
        if (renameTo != null) {
            SqlIdentifiers.check(renameTo, "table");
        }
        return call("alter_table", table, txId, conn -> {
            Set<String> known = columnsOf(conn, table);
            for (ColumnDef column : columns) {
                if (known.contains(column.getName())) {
                    throw DriverException.of(ErrorCode.INVALID_SCHEMA,
                        "Column " + column.getName() + " already exists in " + table);
                }
                checkAddable(table, column);
            }
            if (renameTo != null && tableExists(conn, renameTo)) {
                throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Table " + renameTo + " already exists");
            }
            return atomically(conn, () -> {
                List<Object> added = new ArrayList<>();
                try (Statement st = conn.createStatement()) {
                    for (ColumnDef column : columns) {
                        st.executeUpdate("ALTER TABLE " + table + " ADD COLUMN " + column.toSql());
                        added.add(column.getName());
                    }
                    if (renameTo != null) {
                        st.executeUpdate("ALTER TABLE " + table + " RENAME TO " + renameTo);
                    }
                }
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("table", renameTo != null ? renameTo : table);
                result.put("added_columns", added);
                result.put("renamed_to", renameTo);
                return result;
            });
        });
    }

    /**
     * SQLite的ADD COLUMN不能加主键列，也不能加没有默认值的NOT NULL列
     */
    static void checkAddable(String table, ColumnDef column) {
        if (column.isPrimaryKey()) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA,
                "Cannot add primary key column " + column.getName() + " to existing table " + table);
        }
        if (column.isNotNull() && column.getDefaultValue() == null) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA,
                "Cannot add NOT NULL column " + column.getName() + " without default to " + table);
        }
    }

    // ========== DML ==========

    @Override
    public long insert(String table, Map<String, Object> data, String txId) {
        SqlIdentifiers.check(table, "table");
        if (data == null || data.isEmpty()) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "data parameter is required");
        }
        return call("insert", table, txId, conn -> {
            checkColumns(table, columnsOf(conn, table), data.keySet());
            List<String> marks = Collections.nCopies(data.size(), "?");
            String sql = "INSERT INTO " + table + " (" + String.join(", ", data.keySet()) + ") VALUES ("
                + String.join(", ", marks) + ")";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                SqlValues.bind(ps, new ArrayList<>(data.values()));
                ps.executeUpdate();
            }
            return lastRowId(conn);
        });
    }

    @Override
    public int update(String table, Map<String, Object> where, Map<String, Object> data, String txId) {
        SqlIdentifiers.check(table, "table");
        if (data == null || data.isEmpty()) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "data parameter is required");
        }
        return call("update", table, txId, conn -> {
            Set<String> known = columnsOf(conn, table);
            checkColumns(table, known, data.keySet());
            List<Object> args = new ArrayList<>();
            List<String> sets = new ArrayList<>();
            for (Map.Entry<String, Object> e : data.entrySet()) {
                sets.add(e.getKey() + " = ?");
                args.add(e.getValue());
            }
            String sql = "UPDATE " + table + " SET " + String.join(", ", sets) + whereClause(table, known, where, args);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                SqlValues.bind(ps, args);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int delete(String table, Map<String, Object> where, String txId) {
        SqlIdentifiers.check(table, "table");
        return call("delete", table, txId, conn -> {
            Set<String> known = columnsOf(conn, table);
            List<Object> args = new ArrayList<>();
            String sql = "DELETE FROM " + table + whereClause(table, known, where, args);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                SqlValues.bind(ps, args);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public List<Map<String, Object>> select(String table, Map<String, Object> where, List<String> columns,
                                            Long limit, Long offset, List<String> orderBy, String txId) {
        SqlIdentifiers.check(table, "table");
        if ((limit != null && limit < 0) || (offset != null && offset < 0)) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "limit and offset must not be negative");
        }
        return call("select", table, txId, conn -> {
            Set<String> known = columnsOf(conn, table);
            String projection = "*";
            if (columns != null && !columns.isEmpty()) {
                checkColumns(table, known, columns);
                projection = String.join(", ", columns);
            }
            List<Object> args = new ArrayList<>();
            StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(table)
                .append(whereClause(table, known, where, args));
            if (orderBy != null && !orderBy.isEmpty()) {
                sql.append(" ORDER BY ").append(orderClause(table, known, orderBy));
            }
            if (limit != null || offset != null) {
                sql.append(" LIMIT ?");
                args.add(limit == null ? -1L : limit);
                if (offset != null) {
                    sql.append(" OFFSET ?");
                    args.add(offset);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                SqlValues.bind(ps, args);
                try (ResultSet rs = ps.executeQuery()) {
                    return SqlValues.readAll(rs);
                }
            }
        });
    }

    @Override
    public Map<String, Object> execute(String sql, List<Object> params, String txId) {
        if (sql == null || sql.trim().isEmpty()) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "sql parameter is required");
        }
        String first = sql.trim().split("\\s+", 2)[0].replace(";", "").toUpperCase(Locale.ROOT);
        if (TRANSACTION_KEYWORDS.contains(first)) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS,
                "Transaction control statements are not allowed in execute, use begin_transaction");
        }
        List<Object> args = params == null ? Collections.emptyList() : params;
        return call("execute", null, txId, conn -> {
            Map<String, Object> result = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                SqlValues.bind(ps, args);
                if (ps.execute()) {
                    try (ResultSet rs = ps.getResultSet()) {
                        List<Map<String, Object>> rows = SqlValues.readAll(rs);
                        result.put("affected_rows", 0L);
                        result.put("last_row_id", lastRowId(conn));
                        result.put("data", rows);
                    }
                } else {
                    result.put("affected_rows", (long) Math.max(0, ps.getUpdateCount()));
                    result.put("last_row_id", lastRowId(conn));
                }
            }
            return result;
        });
    }

    // ========== 事务 ==========

    @Override
    public String beginTransaction() {
        return tm.begin();
    }

    @Override
    public boolean commitTransaction(String txId) {
        tm.commit(txId);
        return true;
    }

    @Override
    public boolean rollbackTransaction(String txId) {
        tm.rollback(txId);
        return true;
    }

    @Override
    public String activeTransaction() {
        return tm.activeTransaction();
    }

    // ========== 元数据 ==========

    @Override
    public List<Map<String, Object>> getTableInfo(String table) {
        SqlIdentifiers.check(table, "table");
        return call("get_table_info", table, null, conn -> {
            List<Map<String, Object>> info = tableInfo(conn, table);
            if (info.isEmpty()) {
                throw tableNotFound(table);
            }
            return info;
        });
    }

    @Override
    public String getSchemaVersion() {
        return call("get_schema_version", SETTINGS_TABLE, null, SqliteDriver::readSchemaVersion);
    }

    @Override
    public Map<String, Object> syncSchema(SchemaDefinition definition, Path backupDir) {
        BackupManager backups = new BackupManager(backupDir != null ? backupDir : defaultBackupDir);
        return call("sync_schema", null, null,
            conn -> new SchemaSync(conn, databasePath, backups).sync(definition));
    }

    // ========== 语法树 ==========

    @Override
    public Map<String, Object> queryTree(TreeRequest request) {
        if (treeHandler == null) {
            throw Error.TreeNotSupportedException;
        }
        return treeHandler.query(request);
    }

    @Override
    public Map<String, Object> modifyTree(TreeRequest request) {
        if (treeHandler == null) {
            throw Error.TreeNotSupportedException;
        }
        return treeHandler.modify(request);
    }

    @Override
    public void close() {
        reaper.shutdownNow();
        tm.close();
        LOG.info("Closed database {}", databasePath);
    }

    // ========== 内部工具 ==========

    private <T> T call(String operation, String table, String txId, ConnectionWork<T> work) {
        try {
            return tm.withConnection(txId, work);
        } catch (SQLException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR,
                operation + " failed" + (table == null ? "" : " on " + table), e);
        }
    }

    /**
     * 在自动提交模式下把多条语句包进一个事务；已经在事务里时直接执行
     */
    static <T> T atomically(Connection conn, SqlBlock<T> block) throws SQLException {
        if (!conn.getAutoCommit()) {
            return block.run();
        }
        conn.setAutoCommit(false);
        try {
            T result = block.run();
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    @FunctionalInterface
    interface SqlBlock<T> {
        T run() throws SQLException;
    }

    static List<Map<String, Object>> tableInfo(Connection conn, String table) throws SQLException {
        List<Map<String, Object>> info = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                Map<String, Object> column = new LinkedHashMap<>();
                column.put("cid", rs.getLong("cid"));
                column.put("name", rs.getString("name"));
                column.put("type", rs.getString("type"));
                column.put("not_null", rs.getInt("notnull") != 0);
                column.put("default", rs.getString("dflt_value"));
                column.put("primary_key", rs.getInt("pk") > 0);
                info.add(column);
            }
        }
        return info;
    }

    static Set<String> columnsOf(Connection conn, String table) throws SQLException {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> column : tableInfo(conn, table)) {
            names.add((String) column.get("name"));
        }
        if (names.isEmpty()) {
            throw tableNotFound(table);
        }
        return names;
    }

    static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    static String readSchemaVersion(Connection conn) throws SQLException {
        if (!tableExists(conn, SETTINGS_TABLE)) {
            return DEFAULT_SCHEMA_VERSION;
        }
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT value FROM " + SETTINGS_TABLE + " WHERE key = ?")) {
            ps.setString(1, SCHEMA_VERSION_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getString(1) != null ? rs.getString(1) : DEFAULT_SCHEMA_VERSION;
            }
        }
    }

    private static long lastRowId(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static void checkColumns(String table, Set<String> known, Collection<String> names) {
        for (String name : names) {
            SqlIdentifiers.check(name, "column");
            if (!known.contains(name)) {
                throw DriverException.of(ErrorCode.COLUMN_NOT_FOUND, "Column " + name + " not found in " + table);
            }
        }
    }

    /**
     * 等值条件的合取，值为null时生成 IS NULL
     */
    private static String whereClause(String table, Set<String> known, Map<String, Object> where, List<Object> args) {
        if (where == null || where.isEmpty()) {
            return "";
        }
        checkColumns(table, known, where.keySet());
        List<String> terms = new ArrayList<>();
        for (Map.Entry<String, Object> e : where.entrySet()) {
            if (e.getValue() == null) {
                terms.add(e.getKey() + " IS NULL");
            } else {
                terms.add(e.getKey() + " = ?");
                args.add(e.getValue());
            }
        }
        return " WHERE " + String.join(" AND ", terms);
    }

    private static String orderClause(String table, Set<String> known, List<String> orderBy) {
        List<String> terms = new ArrayList<>();
        for (String entry : orderBy) {
            String[] parts = entry.trim().split("\\s+");
            if (parts.length > 2) {
                throw DriverException.of(ErrorCode.INVALID_PARAMS, "Invalid order_by entry: " + entry);
            }
            checkColumns(table, known, Collections.singletonList(parts[0]));
            String direction = "ASC";
            if (parts.length == 2) {
                direction = parts[1].toUpperCase(Locale.ROOT);
                if (!direction.equals("ASC") && !direction.equals("DESC")) {
                    throw DriverException.of(ErrorCode.INVALID_PARAMS, "Invalid order_by direction: " + entry);
                }
            }
            terms.add(parts[0] + " " + direction);
        }
        return String.join(", ", terms);
    }

    private static DriverException tableNotFound(String table) {
        return DriverException.of(ErrorCode.TABLE_NOT_FOUND, "Table not found: " + table);
    }
}
