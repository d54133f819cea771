package top.guoziyang.dbrpc.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.SchemaDefinition;
import top.guoziyang.dbrpc.schema.TableSchema;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 数据库访问接口 - 远程客户端和进程内客户端的共同入口
 *
 * 两层：
 * - call：通用入口，返回原始Result，不会因为Error结果抛异常
 * - 每个RPC方法一个包装方法：参数按wire上的key组装，Error结果抛出DriverException
 *
 * transaction_id为null的调用各自独立提交；带上事务ID的调用在该事务中执行。
 * 提交和回滚以HIGH优先级发送，尽快释放事务占用的连接通道。
 */
public interface DatabaseApi extends AutoCloseable {

    /**
     * @param timeoutMillis 本次调用的超时时间
     * @return 恰好一个Result
     */
    Result call(Method method, Map<String, Object> params, Priority priority, long timeoutMillis);

    /**
     * 使用默认超时
     */
    Result call(Method method, Map<String, Object> params, Priority priority);

    default Result call(Method method, Map<String, Object> params) {
        return call(method, params, Priority.NORMAL);
    }

    @Override
    void close();

    default boolean createTable(TableSchema schema, String txId) {
        Map<String, Object> p = params(txId);
        p.put("schema", schema.toMap());
        return Results.booleanValue(call(Method.CREATE_TABLE, p), "success");
    }

    default boolean dropTable(String table, String txId) {
        Map<String, Object> p = params(txId);
        p.put("table_name", table);
        return Results.booleanValue(call(Method.DROP_TABLE, p), "success");
    }

    default Map<String, Object> alterTable(String table, List<ColumnDef> addColumns, String renameTo, String txId) {
        Map<String, Object> p = params(txId);
        p.put("table_name", table);
        if (addColumns != null) {
            List<Object> columns = new ArrayList<>();
            for (ColumnDef column : addColumns) {
                columns.add(column.toMap());
            }
            p.put("add_columns", columns);
        }
        p.put("rename_to", renameTo);
        return Results.data(call(Method.ALTER_TABLE, p));
    }

    default long insert(String table, Map<String, Object> data, String txId) {
        Map<String, Object> p = params(txId);
        p.put("table_name", table);
        p.put("data", data);
        return Results.longValue(call(Method.INSERT, p), "row_id");
    }

    default int update(String table, Map<String, Object> where, Map<String, Object> data, String txId) {
        Map<String, Object> p = params(txId);
        p.put("table_name", table);
        p.put("where", where);
        p.put("data", data);
        return (int) Results.longValue(call(Method.UPDATE, p), "affected_rows");
    }

    default int delete(String table, Map<String, Object> where, String txId) {
        Map<String, Object> p = params(txId);
        p.put("table_name", table);
        p.put("where", where);
        return (int) Results.longValue(call(Method.DELETE, p), "affected_rows");
    }

    default List<Map<String, Object>> select(String table, Map<String, Object> where) {
        return select(table, where, null, null, null, null, null);
    }

    default List<Map<String, Object>> select(String table, Map<String, Object> where, List<String> columns,
                                             Long limit, Long offset, List<String> orderBy, String txId) {
        Map<String, Object> p = params(txId);
        p.put("table_name", table);
        p.put("where", where);
        p.put("columns", columns);
        p.put("limit", limit);
        p.put("offset", offset);
        p.put("order_by", orderBy);
        return Results.rows(call(Method.SELECT, p));
    }

    default Map<String, Object> execute(String sql, List<Object> sqlParams, String txId) {
        Map<String, Object> p = params(txId);
        p.put("sql", sql);
        p.put("params", sqlParams);
        return Results.data(call(Method.EXECUTE, p));
    }

    default String beginTransaction() {
        return Results.stringValue(call(Method.BEGIN_TRANSACTION, params(null)), "transaction_id");
    }

    default boolean commitTransaction(String txId) {
        Map<String, Object> p = params(null);
        p.put("transaction_id", txId);
        return Results.booleanValue(call(Method.COMMIT_TRANSACTION, p, Priority.HIGH), "success");
    }

    default boolean rollbackTransaction(String txId) {
        Map<String, Object> p = params(null);
        p.put("transaction_id", txId);
        return Results.booleanValue(call(Method.ROLLBACK_TRANSACTION, p, Priority.HIGH), "success");
    }

    default List<Map<String, Object>> getTableInfo(String table) {
        Map<String, Object> p = params(null);
        p.put("table_name", table);
        return Results.rows(call(Method.GET_TABLE_INFO, p));
    }

    default String getSchemaVersion() {
        return Results.stringValue(call(Method.GET_SCHEMA_VERSION, params(null)), "version");
    }

    default Map<String, Object> syncSchema(SchemaDefinition definition, String backupDir) {
        Map<String, Object> p = params(null);
        p.put("schema_definition", definition.toMap());
        p.put("backup_dir", backupDir);
        return Results.data(call(Method.SYNC_SCHEMA, p));
    }

    /**
     * @param treeParams {file_id, filter, ...}，原样交给树处理器
     */
    default Map<String, Object> queryTree(Map<String, Object> treeParams) {
        return Results.data(call(Method.QUERY_TREE, treeParams));
    }

    default Map<String, Object> modifyTree(Map<String, Object> treeParams) {
        return Results.data(call(Method.MODIFY_TREE, treeParams));
    }

    default Map<String, Object> healthCheck() {
        return Results.data(call(Method.HEALTH_CHECK, params(null), Priority.HIGH));
    }

    static Map<String, Object> params(String txId) {
        Map<String, Object> p = new LinkedHashMap<>();
        if (txId != null) {
            p.put("transaction_id", txId);
        }
        return p;
    }
}
