package top.guoziyang.dbrpc.backend.driver;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 协议值与SQLite存储值之间的转换
 *
 * 绑定：
 * - null → NULL
 * - Boolean → 1 / 0
 * - Long / Double / String / byte[] → 原样
 * - Instant → ISO-8601文本
 * - List / Map → 不支持，INVALID_PARAMS
 *
 * 读取：INTEGER → Long，REAL → Double，TEXT → String，BLOB → byte[]
 */
final class SqlValues {

    private SqlValues() {
    }

    static void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            bind(ps, i + 1, args.get(i));
        }
    }

    static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NULL);
        } else if (value instanceof Boolean) {
            ps.setLong(index, (Boolean) value ? 1L : 0L);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            ps.setLong(index, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            ps.setDouble(index, ((Number) value).doubleValue());
        } else if (value instanceof String) {
            ps.setString(index, (String) value);
        } else if (value instanceof byte[]) {
            ps.setBytes(index, (byte[]) value);
        } else if (value instanceof Instant) {
            ps.setString(index, value.toString());
        } else {
            throw DriverException.of(ErrorCode.INVALID_PARAMS,
                "Value of type " + value.getClass().getSimpleName() + " can't be stored in a column");
        }
    }

    static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int n = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= n; i++) {
                row.put(meta.getColumnLabel(i), read(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    static Object read(Object raw) {
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Float) {
            return ((Float) raw).doubleValue();
        }
        return raw;
    }
}
