package top.guoziyang.dbrpc.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Params;

/**
 * 列定义
 *
 * map表示：{name, type, not_null | nullable, default, primary_key, autoincrement}，
 * nullable=false与not_null=true等价，两种写法都接受。
 */
public class ColumnDef {

    private final String name;
    private final String type;
    private final boolean notNull;
    private final Object defaultValue;
    private final boolean primaryKey;
    private final boolean autoincrement;

    public ColumnDef(String name, String type, boolean notNull, Object defaultValue,
                     boolean primaryKey, boolean autoincrement) {
        this.name = SqlIdentifiers.check(name, "column");
        this.type = type == null || type.isEmpty() ? "TEXT" : type;
        this.notNull = notNull;
        this.defaultValue = defaultValue;
        this.primaryKey = primaryKey;
        this.autoincrement = autoincrement;
    }

    public static ColumnDef of(String name, String type) {
        return new ColumnDef(name, type, false, null, false, false);
    }

    public static ColumnDef fromMap(Map<String, Object> map) {
        Params p = new Params(map);
        String type = p.getString("type");
        if (type != null && !type.matches("[A-Za-z][A-Za-z0-9_ (),]*")) {
            throw DriverException.of(ErrorCode.INVALID_SCHEMA, "Invalid column type: " + type);
        }
        boolean notNull = p.getBoolean("not_null", false) || !p.getBoolean("nullable", true);
        return new ColumnDef(p.getString("name"), type, notNull, p.get("default"),
            p.getBoolean("primary_key", false), p.getBoolean("autoincrement", false));
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public boolean isAutoincrement() {
        return autoincrement;
    }

    /**
     * 生成列的DDL片段，例如 "path TEXT NOT NULL DEFAULT 'x'"
     */
    public String toSql() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(type);
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
            if (autoincrement) {
                sb.append(" AUTOINCREMENT");
            }
        }
        if (notNull) {
            sb.append(" NOT NULL");
        }
        if (defaultValue != null) {
            sb.append(" DEFAULT ").append(literal(defaultValue));
        }
        return sb.toString();
    }

    static String literal(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("type", type);
        map.put("not_null", notNull);
        map.put("default", defaultValue);
        map.put("primary_key", primaryKey);
        map.put("autoincrement", autoincrement);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ColumnDef)) {
            return false;
        }
        ColumnDef other = (ColumnDef) o;
        return name.equals(other.name) && type.equalsIgnoreCase(other.type)
            && notNull == other.notNull && primaryKey == other.primaryKey
            && autoincrement == other.autoincrement && Objects.equals(defaultValue, other.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type.toUpperCase());
    }

    @Override
    public String toString() {
        return toSql();
    }
}
