package top.guoziyang.dbrpc.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 执行结果 - 三选一的标签联合
 *
 * - Success{data}：普通返回值（map、数字、字符串等）
 * - Error{code, message}：带类型的错误，永远不会和数据同时出现
 * - Rows{records}：查询返回的行集合
 *
 * 查询行集单独作为一种结果，调用方不必再解析data的形状。
 *
 * wire表示：
 * {id, outcome: success|error|rows, data | records | code+message}
 */
public abstract class Result {

    public enum Kind {
        SUCCESS("success"),
        ERROR("error"),
        ROWS("rows");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        static Kind fromWire(Object raw) {
            for (Kind kind : values()) {
                if (kind.wireName.equals(raw)) {
                    return kind;
                }
            }
            throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Unknown result outcome: " + raw);
        }
    }

    static final String KEY_ID = "id";
    static final String KEY_OUTCOME = "outcome";
    static final String KEY_DATA = "data";
    static final String KEY_RECORDS = "records";
    static final String KEY_CODE = "code";
    static final String KEY_MESSAGE = "message";

    private Result() {
    }

    public abstract Kind kind();

    public boolean isError() {
        return kind() == Kind.ERROR;
    }

    public static Success success(Object data) {
        return new Success(data);
    }

    public static Error error(ErrorCode code, String message) {
        return new Error(code, message);
    }

    public static Error error(DriverException e) {
        return new Error(e.getCode(), e.getMessage());
    }

    public static Rows rows(List<Map<String, Object>> records) {
        return new Rows(records);
    }

    /**
     * Error结果转成异常抛出，其它结果原样返回
     */
    public Result orThrow() {
        if (this instanceof Error) {
            Error e = (Error) this;
            throw DriverException.of(e.getCode(), e.getMessage());
        }
        return this;
    }

    public Map<String, Object> toMap(String requestId) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_ID, requestId);
        map.put(KEY_OUTCOME, kind().wireName());
        writePayload(map);
        return map;
    }

    abstract void writePayload(Map<String, Object> map);

    @SuppressWarnings("unchecked")
    public static Result fromMap(Map<String, Object> map) {
        Kind kind = Kind.fromWire(map.get(KEY_OUTCOME));
        switch (kind) {
            case SUCCESS:
                return new Success(map.get(KEY_DATA));
            case ROWS: {
                Object records = map.get(KEY_RECORDS);
                if (records != null && !(records instanceof List)) {
                    throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Rows result without record list");
                }
                List<Map<String, Object>> list = new ArrayList<>();
                if (records != null) {
                    for (Object record : (List<Object>) records) {
                        if (!(record instanceof Map)) {
                            throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Row record must be a map");
                        }
                        list.add((Map<String, Object>) record);
                    }
                }
                return new Rows(list);
            }
            default: {
                Object code = map.get(KEY_CODE);
                Object message = map.get(KEY_MESSAGE);
                return new Error(ErrorCode.fromWire(code instanceof String ? (String) code : null),
                    message == null ? "" : message.toString());
            }
        }
    }

    public static final class Success extends Result {
        private final Object data;

        Success(Object data) {
            this.data = data;
        }

        public Object getData() {
            return data;
        }

        @SuppressWarnings("unchecked")
        public Map<String, Object> getDataMap() {
            if (data instanceof Map) {
                return (Map<String, Object>) data;
            }
            return Collections.emptyMap();
        }

        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }

        @Override
        void writePayload(Map<String, Object> map) {
            map.put(KEY_DATA, data);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Success && ValueCodec.deepEquals(data, ((Success) o).data);
        }

        @Override
        public int hashCode() {
            return Kind.SUCCESS.hashCode();
        }

        @Override
        public String toString() {
            return "Success{" + data + "}";
        }
    }

    public static final class Error extends Result {
        private final ErrorCode code;
        private final String message;

        Error(ErrorCode code, String message) {
            this.code = Objects.requireNonNull(code);
            this.message = message;
        }

        public ErrorCode getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public Kind kind() {
            return Kind.ERROR;
        }

        @Override
        void writePayload(Map<String, Object> map) {
            map.put(KEY_CODE, code.name());
            map.put(KEY_MESSAGE, message);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Error)) {
                return false;
            }
            Error other = (Error) o;
            return code == other.code && Objects.equals(message, other.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(code, message);
        }

        @Override
        public String toString() {
            return "Error{" + code + ", " + message + "}";
        }
    }

    public static final class Rows extends Result {
        private final List<Map<String, Object>> records;

        Rows(List<Map<String, Object>> records) {
            this.records = records == null
                ? Collections.<Map<String, Object>>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(records));
        }

        public List<Map<String, Object>> getRecords() {
            return records;
        }

        @Override
        public Kind kind() {
            return Kind.ROWS;
        }

        @Override
        void writePayload(Map<String, Object> map) {
            map.put(KEY_RECORDS, records);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Rows && ValueCodec.deepEquals(records, ((Rows) o).records);
        }

        @Override
        public int hashCode() {
            return records.size();
        }

        @Override
        public String toString() {
            return "Rows{" + records.size() + " records}";
        }
    }
}
