package top.guoziyang.dbrpc.client;

import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 把Result拆成包装方法的返回值，Error结果转成DriverException
 */
final class Results {

    private Results() {
    }

    static Map<String, Object> data(Result result) {
        result.orThrow();
        if (!(result instanceof Result.Success)) {
            throw unexpected(result);
        }
        return ((Result.Success) result).getDataMap();
    }

    static List<Map<String, Object>> rows(Result result) {
        result.orThrow();
        if (!(result instanceof Result.Rows)) {
            throw unexpected(result);
        }
        return ((Result.Rows) result).getRecords();
    }

    static long longValue(Result result, String key) {
        Object value = data(result).get(key);
        if (!(value instanceof Number)) {
            throw DriverException.of(ErrorCode.INTERNAL_ERROR, "Result field " + key + " is not a number: " + value);
        }
        return ((Number) value).longValue();
    }

    static boolean booleanValue(Result result, String key) {
        return Boolean.TRUE.equals(data(result).get(key));
    }

    static String stringValue(Result result, String key) {
        Object value = data(result).get(key);
        return value == null ? null : value.toString();
    }

    private static DriverException unexpected(Result result) {
        return DriverException.of(ErrorCode.INTERNAL_ERROR, "Unexpected result: " + result);
    }
}
