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
 * 表结构定义 - create_table的参数，也是SchemaDefinition里的一项
 *
 * map表示：{name, columns: [ColumnDef], constraints: [TableConstraint]}
 *
 * 建表语句总是 CREATE TABLE IF NOT EXISTS，重复创建同名表不会报错。
 */
public class TableSchema {

    private final String name;
    private final List<ColumnDef> columns;
    private final List<TableConstraint> constraints;

    public TableSchema(String name, List<ColumnDef> columns, List<TableConstraint> constraints) {
        this.name = SqlIdentifiers.check(name, "table");
        if (columns == null || columns.isEmpty()) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Table " + name + " needs at least one column");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.constraints = constraints == null
            ? Collections.<TableConstraint>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(constraints));
    }

    public static TableSchema fromMap(Map<String, Object> map) {
        return fromMap(null, map);
    }

    /**
     * @param name 表名，为null时从map的name字段读取（SchemaDefinition里表名是外层的key）
     */
    @SuppressWarnings("unchecked")
    public static TableSchema fromMap(String name, Map<String, Object> map) {
        Params p = new Params(map);
        String tableName = name != null ? name : p.getString("name");
        List<ColumnDef> columns = new ArrayList<>();
        List<Object> rawColumns = p.getList("columns");
        if (rawColumns != null) {
            for (Object raw : rawColumns) {
                if (!(raw instanceof Map)) {
                    throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Column definition must be a map");
                }
                columns.add(ColumnDef.fromMap((Map<String, Object>) raw));
            }
        }
        List<TableConstraint> constraints = new ArrayList<>();
        List<Object> rawConstraints = p.getList("constraints");
        if (rawConstraints != null) {
            for (Object raw : rawConstraints) {
                if (!(raw instanceof Map)) {
                    throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Constraint definition must be a map");
                }
                constraints.add(TableConstraint.fromMap((Map<String, Object>) raw));
            }
        }
        return new TableSchema(tableName, columns, constraints);
    }

    public String getName() {
        return name;
    }

    public List<ColumnDef> getColumns() {
        return columns;
    }

    public List<TableConstraint> getConstraints() {
        return constraints;
    }

    public ColumnDef getColumn(String columnName) {
        for (ColumnDef column : columns) {
            if (column.getName().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    public String toCreateSql() {
        List<String> parts = new ArrayList<>();
        for (ColumnDef column : columns) {
            parts.add(column.toSql());
        }
        for (TableConstraint constraint : constraints) {
            parts.add(constraint.toSql());
        }
        return "CREATE TABLE IF NOT EXISTS " + name + " (" + String.join(", ", parts) + ")";
    }

    public Map<String, Object> toMap() {
        List<Object> cols = new ArrayList<>();
        for (ColumnDef column : columns) {
            cols.add(column.toMap());
        }
        List<Object> cons = new ArrayList<>();
        for (TableConstraint constraint : constraints) {
            cons.add(constraint.toMap());
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("columns", cols);
        map.put("constraints", cons);
        return map;
    }
}
