package top.guoziyang.dbrpc.transport;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 请求参数的类型化读取
 *
 * 参数类型不符或必填参数缺失时统一抛出INVALID_PARAMS，
 * 让处理器不必各自做instanceof检查。
 */
public class Params {

    private final Map<String, Object> raw;

    public Params(Map<String, Object> raw) {
        this.raw = raw == null ? Collections.<String, Object>emptyMap() : raw;
    }

    public boolean has(String key) {
        return raw.get(key) != null;
    }

    public Object get(String key) {
        return raw.get(key);
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value == null || value.isEmpty()) {
            throw missing(key);
        }
        return value;
    }

    public String getString(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw wrongType(key, "string");
        }
        return (String) value;
    }

    public Long getLong(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw wrongType(key, "integer");
        }
        return ((Number) value).longValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = raw.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw wrongType(key, "boolean");
        }
        return (Boolean) value;
    }

    public Map<String, Object> requireMap(String key) {
        Map<String, Object> value = getMap(key);
        if (value == null || value.isEmpty()) {
            throw missing(key);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw wrongType(key, "map");
        }
        return (Map<String, Object>) value;
    }

    public List<Object> getList(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw wrongType(key, "list");
        }
        @SuppressWarnings("unchecked")
        List<Object> list = (List<Object>) value;
        return list;
    }

    public List<String> getStringList(String key) {
        List<Object> list = getList(key);
        if (list == null) {
            return null;
        }
        for (Object item : list) {
            if (!(item instanceof String)) {
                throw wrongType(key, "list of strings");
            }
        }
        @SuppressWarnings("unchecked")
        List<String> strings = (List<String>) (List<?>) list;
        return strings;
    }

    private static DriverException missing(String key) {
        return DriverException.of(ErrorCode.INVALID_PARAMS, key + " parameter is required");
    }

    private static DriverException wrongType(String key, String expected) {
        return DriverException.of(ErrorCode.INVALID_PARAMS, key + " must be a " + expected);
    }
}
