package top.guoziyang.dbrpc.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Params;

/**
 * 索引定义：{name, table, columns, unique}
 */
public class IndexDef {

    private final String name;
    private final String table;
    private final List<String> columns;
    private final boolean unique;

    public IndexDef(String name, String table, List<String> columns, boolean unique) {
        this.name = SqlIdentifiers.check(name, "index");
        this.table = SqlIdentifiers.check(table, "table");
        if (columns == null || columns.isEmpty()) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Index " + name + " without columns");
        }
        this.columns = Collections.unmodifiableList(SqlIdentifiers.checkAll(columns, "column"));
        this.unique = unique;
    }

    public static IndexDef fromMap(Map<String, Object> map) {
        Params p = new Params(map);
        return new IndexDef(p.getString("name"), p.getString("table"), p.getStringList("columns"),
            p.getBoolean("unique", false));
    }

    public String getName() {
        return name;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isUnique() {
        return unique;
    }

    public String toCreateSql() {
        return "CREATE " + (unique ? "UNIQUE " : "") + "INDEX IF NOT EXISTS " + name
            + " ON " + table + " (" + String.join(", ", columns) + ")";
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("table", table);
        map.put("columns", columns);
        map.put("unique", unique);
        return map;
    }
}
