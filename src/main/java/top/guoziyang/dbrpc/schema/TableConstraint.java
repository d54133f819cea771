package top.guoziyang.dbrpc.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Params;

/**
 * 表级约束：复合主键或外键
 *
 * map表示：
 * - {type: primary_key, columns}
 * - {type: foreign_key, columns, references_table, references_columns}
 */
public class TableConstraint {

    public enum Type {
        PRIMARY_KEY,
        FOREIGN_KEY
    }

    private final Type type;
    private final List<String> columns;
    private final String referencesTable;
    private final List<String> referencesColumns;

    private TableConstraint(Type type, List<String> columns, String referencesTable, List<String> referencesColumns) {
        if (columns == null || columns.isEmpty()) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA, type + " constraint without columns");
        }
        this.type = type;
        this.columns = Collections.unmodifiableList(SqlIdentifiers.checkAll(columns, "column"));
        this.referencesTable = referencesTable;
        this.referencesColumns = referencesColumns;
    }

    public static TableConstraint primaryKey(List<String> columns) {
        return new TableConstraint(Type.PRIMARY_KEY, columns, null, null);
    }

    public static TableConstraint foreignKey(List<String> columns, String referencesTable, List<String> referencesColumns) {
        SqlIdentifiers.check(referencesTable, "table");
        if (referencesColumns == null || referencesColumns.size() != columns.size()) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Foreign key column count mismatch");
        }
        return new TableConstraint(Type.FOREIGN_KEY, columns, referencesTable,
            Collections.unmodifiableList(SqlIdentifiers.checkAll(referencesColumns, "column")));
    }

    public static TableConstraint fromMap(Map<String, Object> map) {
        Params p = new Params(map);
        String type = p.requireString("type");
        if ("primary_key".equals(type)) {
            return primaryKey(p.getStringList("columns"));
        }
        if ("foreign_key".equals(type)) {
            return foreignKey(p.getStringList("columns"), p.getString("references_table"),
                p.getStringList("references_columns"));
        }
        throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Unknown constraint type: " + type);
    }

    public Type getType() {
        return type;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String toSql() {
        if (type == Type.PRIMARY_KEY) {
            return "PRIMARY KEY (" + String.join(", ", columns) + ")";
        }
        return "FOREIGN KEY (" + String.join(", ", columns) + ") REFERENCES "
            + referencesTable + " (" + String.join(", ", referencesColumns) + ")";
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type == Type.PRIMARY_KEY ? "primary_key" : "foreign_key");
        map.put("columns", columns);
        if (type == Type.FOREIGN_KEY) {
            map.put("references_table", referencesTable);
            map.put("references_columns", referencesColumns);
        }
        return map;
    }
}
