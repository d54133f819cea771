package top.guoziyang.dbrpc.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Params;

/**
 * 声明式的完整数据库结构 - sync_schema的输入
 *
 * map表示：
 * {
 *   version: "1.2.0",
 *   tables: {table_name: {columns: [...], constraints: [...]}},
 *   indexes: [{name, table, columns, unique}]
 * }
 *
 * tables也可以写成带name字段的列表。
 */
public class SchemaDefinition {

    private final String version;
    private final Map<String, TableSchema> tables;
    private final List<IndexDef> indexes;

    public SchemaDefinition(String version, List<TableSchema> tables, List<IndexDef> indexes) {
        this.version = version;
        Map<String, TableSchema> byName = new LinkedHashMap<>();
        for (TableSchema table : tables) {
            if (byName.put(table.getName(), table) != null) {
                throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Duplicate table " + table.getName());
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
        this.indexes = indexes == null
            ? Collections.<IndexDef>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(indexes));
    }

    @SuppressWarnings("unchecked")
    public static SchemaDefinition fromMap(Map<String, Object> map) {
        Params p = new Params(map);
        List<TableSchema> tables = new ArrayList<>();
        Object rawTables = p.get("tables");
        if (rawTables instanceof Map) {
            for (Map.Entry<String, Object> e : ((Map<String, Object>) rawTables).entrySet()) {
                if (!(e.getValue() instanceof Map)) {
                    throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Table definition must be a map: " + e.getKey());
                }
                tables.add(TableSchema.fromMap(e.getKey(), (Map<String, Object>) e.getValue()));
            }
        } else if (rawTables instanceof List) {
            for (Object raw : (List<Object>) rawTables) {
                if (!(raw instanceof Map)) {
                    throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Table definition must be a map");
                }
                tables.add(TableSchema.fromMap((Map<String, Object>) raw));
            }
        } else if (rawTables != null) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA, "tables must be a map or a list");
        }
        List<IndexDef> indexes = new ArrayList<>();
        List<Object> rawIndexes = p.getList("indexes");
        if (rawIndexes != null) {
            for (Object raw : rawIndexes) {
                if (!(raw instanceof Map)) {
                    throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Index definition must be a map");
                }
                indexes.add(IndexDef.fromMap((Map<String, Object>) raw));
            }
        }
        return new SchemaDefinition(p.getString("version"), tables, indexes);
    }

    public String getVersion() {
        return version;
    }

    public Map<String, TableSchema> getTables() {
        return tables;
    }

    public List<IndexDef> getIndexes() {
        return indexes;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> tableMap = new LinkedHashMap<>();
        for (TableSchema table : tables.values()) {
            Map<String, Object> t = table.toMap();
            t.remove("name");
            tableMap.put(table.getName(), t);
        }
        List<Object> idx = new ArrayList<>();
        for (IndexDef index : indexes) {
            idx.add(index.toMap());
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", version);
        map.put("tables", tableMap);
        map.put("indexes", idx);
        return map;
    }
}
