package top.guoziyang.dbrpc.backend.driver;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.backup.BackupManager;
import top.guoziyang.dbrpc.backup.BackupRecord;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.IndexDef;
import top.guoziyang.dbrpc.schema.SchemaDefinition;
import top.guoziyang.dbrpc.schema.TableSchema;

/**
 * 结构同步 - 把数据库调整到声明式结构定义的样子
 *
 * 比较规则：
 * - 定义里有、库里没有的表：创建（created）
 * - 表存在但缺列：ALTER TABLE ADD COLUMN（altered）
 * - 缺索引：CREATE INDEX
 * - 列类型不一致、库里多出的表和列：只给出warning，从不删除
 * - 无法用ADD COLUMN补上的列（主键列、没有默认值的NOT NULL列）：记为error，整个同步不执行
 *
 * 执行步骤：
 * 1. 比较，得到要执行的语句列表
 * 2. 有变更且数据库非空时，先用 VACUUM INTO 做快照备份
 * 3. 在一个事务里执行全部语句并写入 db_settings.schema_version
 * 4. 任何一步失败则整体回滚，返回success=false，快照UUID保留在结果里供恢复
 *
 * 调用方必须已持有连接通道且没有活跃事务。
 */
class SchemaSync {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaSync.class);

    static final String CREATED = "created";
    static final String ALTERED = "altered";
    static final String UNCHANGED = "unchanged";

    private final Connection conn;
    private final Path databasePath;
    private final BackupManager backups;

    SchemaSync(Connection conn, Path databasePath, BackupManager backups) {
        this.conn = conn;
        this.databasePath = databasePath;
        this.backups = backups;
    }

    Map<String, Object> sync(SchemaDefinition definition) throws SQLException {
        Set<String> liveTables = userTables();
        Set<String> liveIndexes = indexes();

        Map<String, Object> tables = new LinkedHashMap<>();
        List<String> statements = new ArrayList<>();
        List<Object> warnings = new ArrayList<>();
        List<Object> errors = new ArrayList<>();

        for (TableSchema table : definition.getTables().values()) {
            if (!liveTables.contains(table.getName())) {
                statements.add(table.toCreateSql());
                tables.put(table.getName(), CREATED);
                continue;
            }
            Map<String, String> liveColumns = columnTypes(table.getName());
            boolean altered = false;
            for (ColumnDef column : table.getColumns()) {
                String liveType = liveColumns.get(column.getName());
                if (liveType == null) {
                    try {
                        SqliteDriver.checkAddable(table.getName(), column);
                        statements.add("ALTER TABLE " + table.getName() + " ADD COLUMN " + column.toSql());
                        altered = true;
                    } catch (DriverException e) {
                        errors.add(e.getMessage());
                    }
                } else if (!liveType.equalsIgnoreCase(column.getType())) {
                    warnings.add("Column " + table.getName() + "." + column.getName() + " has type " + liveType
                        + ", expected " + column.getType());
                }
            }
            for (String live : liveColumns.keySet()) {
                if (table.getColumn(live) == null) {
                    warnings.add("Extra column " + table.getName() + "." + live + " is kept");
                }
            }
            tables.put(table.getName(), altered ? ALTERED : UNCHANGED);
        }
        for (String live : liveTables) {
            if (!definition.getTables().containsKey(live) && !live.equals(SqliteDriver.SETTINGS_TABLE)) {
                warnings.add("Extra table " + live + " is kept");
            }
        }
        for (IndexDef index : definition.getIndexes()) {
            if (liveIndexes.contains(index.getName())) {
                continue;
            }
            if (!definition.getTables().containsKey(index.getTable()) && !liveTables.contains(index.getTable())) {
                errors.add("Index " + index.getName() + " refers to unknown table " + index.getTable());
                continue;
            }
            statements.add(index.toCreateSql());
        }

        String currentVersion = SqliteDriver.readSchemaVersion(conn);
        boolean versionChanged = definition.getVersion() != null && !definition.getVersion().equals(currentVersion);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", errors.isEmpty());
        result.put("backup_uuid", null);
        result.put("tables", tables);
        result.put("changes_applied", 0L);
        result.put("warnings", warnings);
        result.put("errors", errors);
        if (!errors.isEmpty()) {
            LOG.warn("Schema sync refused: {}", errors);
            return result;
        }
        if (statements.isEmpty() && !versionChanged) {
            return result;
        }

        if (hasData(liveTables)) {
            BackupRecord backup = backups.createDatabaseBackup(databasePath, "Schema synchronization backup",
                target -> vacuumInto(target));
            result.put("backup_uuid", backup.getUuid());
        }

        try {
            SqliteDriver.atomically(conn, () -> {
                try (Statement st = conn.createStatement()) {
                    for (String sql : statements) {
                        st.executeUpdate(sql);
                    }
                }
                if (definition.getVersion() != null) {
                    writeVersion(definition.getVersion());
                }
                return null;
            });
        } catch (SQLException e) {
            LOG.error("Schema sync failed, rolled back", e);
            result.put("success", false);
            errors.add("Schema sync failed and was rolled back: " + e.getMessage());
            return result;
        }
        result.put("changes_applied", (long) statements.size());
        LOG.info("Schema synced to version {} ({} changes)", definition.getVersion(), statements.size());
        return result;
    }

    private void vacuumInto(Path target) {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("VACUUM INTO '" + target.toString().replace("'", "''") + "'");
        } catch (SQLException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR,
                "Snapshot of " + databasePath + " failed", e);
        }
    }

    private void writeVersion(String version) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("CREATE TABLE IF NOT EXISTS " + SqliteDriver.SETTINGS_TABLE
                + " (key TEXT PRIMARY KEY, value TEXT)");
        }
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT OR REPLACE INTO " + SqliteDriver.SETTINGS_TABLE + " (key, value) VALUES (?, ?)")) {
            ps.setString(1, SqliteDriver.SCHEMA_VERSION_KEY);
            ps.setString(2, version);
            ps.executeUpdate();
        }
    }

    private Set<String> userTables() throws SQLException {
        return names("SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%'");
    }

    private Set<String> indexes() throws SQLException {
        return names("SELECT name FROM sqlite_master WHERE type = 'index' AND name NOT LIKE 'sqlite_%'");
    }

    private Set<String> names(String sql) throws SQLException {
        Set<String> names = new LinkedHashSet<>();
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private Map<String, String> columnTypes(String table) throws SQLException {
        Map<String, String> types = new LinkedHashMap<>();
        for (Map<String, Object> column : SqliteDriver.tableInfo(conn, table)) {
            types.put((String) column.get("name"), (String) column.get("type"));
        }
        return types;
    }

    /**
     * 只要有一张用户表里有数据，就认为数据库非空
     */
    private boolean hasData(Set<String> liveTables) throws SQLException {
        for (String table : liveTables) {
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT 1 FROM \"" + table.replace("\"", "\"\"") + "\" LIMIT 1")) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }
}
