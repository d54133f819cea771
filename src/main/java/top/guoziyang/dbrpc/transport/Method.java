package top.guoziyang.dbrpc.transport;

import java.util.HashMap;
import java.util.Map;

/**
 * RPC方法目录 - 驱动对外暴露的稳定方法名
 *
 * 方法名是wire协议的一部分，一旦发布不能修改。
 * 服务器启动时为每个方法注册一个处理器，不在目录中的方法名
 * 在接收阶段就被当作协议错误拒绝，不会进入请求队列。
 *
 * readOnly标记用于客户端重试策略：请求已发出但响应丢失时，
 * 只有只读方法可以安全重发。
 */
public enum Method {
    CREATE_TABLE("create_table", false),
    DROP_TABLE("drop_table", false),
    ALTER_TABLE("alter_table", false),
    INSERT("insert", false),
    UPDATE("update", false),
    DELETE("delete", false),
    SELECT("select", true),
    EXECUTE("execute", false),
    BEGIN_TRANSACTION("begin_transaction", false),
    COMMIT_TRANSACTION("commit_transaction", false),
    ROLLBACK_TRANSACTION("rollback_transaction", false),
    GET_TABLE_INFO("get_table_info", true),
    GET_SCHEMA_VERSION("get_schema_version", true),
    SYNC_SCHEMA("sync_schema", false),
    QUERY_TREE("query_tree", true),
    MODIFY_TREE("modify_tree", false),
    HEALTH_CHECK("health_check", true);

    private static final Map<String, Method> BY_WIRE_NAME = new HashMap<>();

    static {
        for (Method m : values()) {
            BY_WIRE_NAME.put(m.wireName, m);
        }
    }

    private final String wireName;
    private final boolean readOnly;

    Method(String wireName, boolean readOnly) {
        this.wireName = wireName;
        this.readOnly = readOnly;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * 查找方法，未知方法返回null
     */
    public static Method of(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }
}
