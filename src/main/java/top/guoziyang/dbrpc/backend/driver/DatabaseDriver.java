package top.guoziyang.dbrpc.backend.driver;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.tree.TreeHandler;
import top.guoziyang.dbrpc.backend.tree.TreeRequest;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.SchemaDefinition;
import top.guoziyang.dbrpc.schema.TableSchema;

/**
 * DatabaseDriver - 驱动引擎，唯一直接接触数据库连接的组件
 *
 * 所有方法都可以被多个工作线程并发调用，内部通过TransactionManager串行化。
 * 带txId参数的方法在txId非null时作为该事务的一部分执行。
 *
 * 错误约定：
 * - 参数、表名、列名不合法：INVALID_PARAMS / TABLE_NOT_FOUND / COLUMN_NOT_FOUND
 * - 事务ID无效：TRANSACTION_NOT_FOUND
 * - 等待连接超时：LOCK_TIMEOUT
 * - 底层SQLException：STORAGE_ERROR，消息里带有操作名和表名
 */
public interface DatabaseDriver {

    boolean createTable(TableSchema schema, String txId);

    boolean dropTable(String table, String txId);

    /**
     * 修改表结构：添加列，或重命名表（两者可同时进行，先加列后改名）
     *
     * @return {table, added_columns, renamed_to}
     */
    Map<String, Object> alterTable(String table, List<ColumnDef> addColumns, String renameTo, String txId);

    /**
     * @return 新行的rowid
     */
    long insert(String table, Map<String, Object> data, String txId);

    /**
     * @return 受影响的行数
     */
    int update(String table, Map<String, Object> where, Map<String, Object> data, String txId);

    /**
     * @return 受影响的行数
     */
    int delete(String table, Map<String, Object> where, String txId);

    List<Map<String, Object>> select(String table, Map<String, Object> where, List<String> columns,
                                     Long limit, Long offset, List<String> orderBy, String txId);

    /**
     * 执行原始SQL
     *
     * @return {affected_rows, last_row_id, data?}，查询语句才有data
     */
    Map<String, Object> execute(String sql, List<Object> params, String txId);

    String beginTransaction();

    boolean commitTransaction(String txId);

    boolean rollbackTransaction(String txId);

    /**
     * @return 每列一项：{cid, name, type, not_null, default, primary_key}
     */
    List<Map<String, Object>> getTableInfo(String table);

    /**
     * @return db_settings里记录的版本，没有记录时为 "0.0.0"
     */
    String getSchemaVersion();

    /**
     * @param backupDir 快照目录，null时使用配置的默认目录
     * @return {success, backup_uuid, tables, changes_applied, warnings, errors}
     */
    Map<String, Object> syncSchema(SchemaDefinition definition, Path backupDir);

    Map<String, Object> queryTree(TreeRequest request);

    Map<String, Object> modifyTree(TreeRequest request);

    /**
     * @return 当前持有连接通道的事务ID，没有时为null
     */
    String activeTransaction();

    void close();

    public static DatabaseDriver open(DriverConfig config, TreeHandler treeHandler) {
        return SqliteDriver.open(config, treeHandler);
    }
}
