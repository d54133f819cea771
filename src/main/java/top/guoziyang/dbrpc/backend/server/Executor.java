package top.guoziyang.dbrpc.backend.server;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.tree.TreeRequest;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.SchemaDefinition;
import top.guoziyang.dbrpc.schema.TableSchema;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Params;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;

/**
 * Executor - 请求执行器，把RPC方法分发到驱动引擎
 *
 * 分发表：
 * 启动时构建一张封闭的 EnumMap&lt;Method, MethodHandler&gt;，每个方法一个处理器，
 * 运行期间不再变化。服务器在入队前已经拒绝了未知方法，
 * 这里再检查一次是为了进程内调用（EmbeddedClient）同样安全。
 *
 * 参数约定（与wire上的key一致）：
 * - table_name / data / where / columns / limit / offset / order_by
 * - transaction_id：可选，带上时作为该事务的一部分执行
 * - schema / schema_definition / backup_dir / sql / params
 *
 * 错误处理：
 * - DriverException → Result.error，保留错误码
 * - 其他RuntimeException → INTERNAL_ERROR，并记录完整堆栈
 * 执行器从不向外抛出异常，每个请求都恰好得到一个Result。
 */
public class Executor {

    private static final Logger LOG = LoggerFactory.getLogger(Executor.class);

    private final DatabaseDriver driver;
    private final Supplier<Map<String, Object>> runtimeStats;
    private final Map<Method, MethodHandler> handlers;

    /**
     * @param runtimeStats health_check附带的运行时统计，可以为null
     */
    public Executor(DatabaseDriver driver, Supplier<Map<String, Object>> runtimeStats) {
        this.driver = driver;
        this.runtimeStats = runtimeStats;
        this.handlers = Collections.unmodifiableMap(buildHandlers());
    }

    private EnumMap<Method, MethodHandler> buildHandlers() {
        EnumMap<Method, MethodHandler> map = new EnumMap<>(Method.class);
        map.put(Method.CREATE_TABLE, this::createTable);
        map.put(Method.DROP_TABLE, p -> success("success",
            driver.dropTable(p.requireString("table_name"), tx(p))));
        map.put(Method.ALTER_TABLE, this::alterTable);
        map.put(Method.INSERT, p -> success("row_id",
            driver.insert(p.requireString("table_name"), p.requireMap("data"), tx(p))));
        map.put(Method.UPDATE, p -> success("affected_rows",
            (long) driver.update(p.requireString("table_name"), p.requireMap("where"), p.requireMap("data"), tx(p))));
        map.put(Method.DELETE, p -> success("affected_rows",
            (long) driver.delete(p.requireString("table_name"), p.requireMap("where"), tx(p))));
        map.put(Method.SELECT, p -> Result.rows(driver.select(p.requireString("table_name"), p.getMap("where"),
            p.getStringList("columns"), p.getLong("limit"), p.getLong("offset"), p.getStringList("order_by"), tx(p))));
        map.put(Method.EXECUTE, p -> Result.success(
            driver.execute(p.requireString("sql"), p.getList("params"), tx(p))));
        map.put(Method.BEGIN_TRANSACTION, p -> success("transaction_id", driver.beginTransaction()));
        map.put(Method.COMMIT_TRANSACTION, p -> success("success",
            driver.commitTransaction(p.requireString("transaction_id"))));
        map.put(Method.ROLLBACK_TRANSACTION, p -> success("success",
            driver.rollbackTransaction(p.requireString("transaction_id"))));
        map.put(Method.GET_TABLE_INFO, p -> Result.rows(driver.getTableInfo(p.requireString("table_name"))));
        map.put(Method.GET_SCHEMA_VERSION, p -> success("version", driver.getSchemaVersion()));
        map.put(Method.SYNC_SCHEMA, this::syncSchema);
        map.put(Method.QUERY_TREE, p -> Result.success(driver.queryTree(TreeRequest.forQuery(p))));
        map.put(Method.MODIFY_TREE, p -> Result.success(driver.modifyTree(TreeRequest.forModify(p))));
        map.put(Method.HEALTH_CHECK, p -> Result.success(health()));
        return map;
    }

    /**
     * 执行一个请求
     *
     * @return 恰好一个Result，不抛出异常
     */
    public Result execute(Request request) {
        Method method = Method.of(request.getMethod());
        MethodHandler handler = method == null ? null : handlers.get(method);
        if (handler == null) {
            return Result.error(ErrorCode.UNKNOWN_METHOD, "Unknown method: " + request.getMethod());
        }
        LOG.debug("Execute: {}", request);
        try {
            return handler.handle(request.params());
        } catch (DriverException e) {
            LOG.debug("{} failed: {}", request, e.getLocalizedMessage());
            return Result.error(e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure executing {}", request, e);
            return Result.error(ErrorCode.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Result createTable(Params p) {
        TableSchema schema = TableSchema.fromMap(p.requireMap("schema"));
        return success("success", driver.createTable(schema, tx(p)));
    }

    @SuppressWarnings("unchecked")
    private Result alterTable(Params p) {
        List<ColumnDef> columns = new ArrayList<>();
        List<Object> raw = p.getList("add_columns");
        if (raw != null) {
            for (Object column : raw) {
                if (!(column instanceof Map)) {
                    throw DriverException.of(ErrorCode.INVALID_PARAMS, "add_columns entries must be maps");
                }
                columns.add(ColumnDef.fromMap((Map<String, Object>) column));
            }
        }
        return Result.success(driver.alterTable(p.requireString("table_name"), columns, p.getString("rename_to"), tx(p)));
    }

    private Result syncSchema(Params p) {
        SchemaDefinition definition = SchemaDefinition.fromMap(p.requireMap("schema_definition"));
        String backupDir = p.getString("backup_dir");
        return Result.success(driver.syncSchema(definition, backupDir == null ? null : Path.of(backupDir)));
    }

    private Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("active_transaction", driver.activeTransaction());
        if (runtimeStats != null) {
            health.putAll(runtimeStats.get());
        }
        return health;
    }

    private static String tx(Params p) {
        String txId = p.getString("transaction_id");
        return txId == null || txId.isEmpty() ? null : txId;
    }

    private static Result success(String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return Result.success(data);
    }
}
