package top.guoziyang.dbrpc.transport;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * RPC请求 - 客户端创建后只读
 *
 * 字段说明：
 * - id：关联ID，服务器用它把异步执行的结果交还给等待中的调用方
 * - method：方法名，wire上是字符串，服务器接收时再查Method目录
 * - params：结构化参数，只能包含ValueCodec支持的类型
 * - priority：队列优先级
 * - createdAt / timeoutMillis：超时从创建时刻起算
 *
 * wire表示是一个map，解码时忽略不认识的key，便于以后加字段。
 */
public final class Request {

    static final String KEY_ID = "id";
    static final String KEY_METHOD = "method";
    static final String KEY_PARAMS = "params";
    static final String KEY_PRIORITY = "priority";
    static final String KEY_CREATED_AT = "created_at";
    static final String KEY_TIMEOUT = "timeout_ms";

    private final String id;
    private final String method;
    private final Map<String, Object> params;
    private final Priority priority;
    private final Instant createdAt;
    private final long timeoutMillis;

    public Request(String id, String method, Map<String, Object> params,
                   Priority priority, Instant createdAt, long timeoutMillis) {
        this.id = Objects.requireNonNull(id, "id");
        this.method = Objects.requireNonNull(method, "method");
        this.params = params == null
            ? Collections.<String, Object>emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.priority = priority == null ? Priority.NORMAL : priority;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.timeoutMillis = timeoutMillis;
    }

    public static Request create(Method method, Map<String, Object> params, Priority priority, long timeoutMillis) {
        return new Request(UUID.randomUUID().toString(), method.wireName(), params, priority, Instant.now(), timeoutMillis);
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Params params() {
        return new Params(params);
    }

    public Priority getPriority() {
        return priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * 请求的绝对截止时间（毫秒时间戳）
     */
    public long deadlineMillis() {
        long created = createdAt.toEpochMilli();
        // 超大的timeout_ms视为永不过期
        return timeoutMillis > Long.MAX_VALUE - created ? Long.MAX_VALUE : created + timeoutMillis;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_ID, id);
        map.put(KEY_METHOD, method);
        map.put(KEY_PARAMS, params);
        map.put(KEY_PRIORITY, priority.name());
        map.put(KEY_CREATED_AT, createdAt);
        map.put(KEY_TIMEOUT, timeoutMillis);
        return map;
    }

    @SuppressWarnings("unchecked")
    public static Request fromMap(Map<String, Object> map, long defaultTimeoutMillis) {
        Object id = map.get(KEY_ID);
        Object method = map.get(KEY_METHOD);
        if (!(id instanceof String) || !(method instanceof String)) {
            throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Request without id or method");
        }
        Object params = map.get(KEY_PARAMS);
        if (params != null && !(params instanceof Map)) {
            throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Request params must be a map");
        }
        Object createdAt = map.get(KEY_CREATED_AT);
        Object timeout = map.get(KEY_TIMEOUT);
        long timeoutMillis = timeout instanceof Number && ((Number) timeout).longValue() > 0
            ? ((Number) timeout).longValue()
            : defaultTimeoutMillis;
        return new Request((String) id, (String) method, (Map<String, Object>) params,
            Priority.fromWire(map.get(KEY_PRIORITY)),
            createdAt instanceof Instant ? (Instant) createdAt : Instant.now(),
            timeoutMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Request)) {
            return false;
        }
        Request other = (Request) o;
        return timeoutMillis == other.timeoutMillis
            && id.equals(other.id)
            && method.equals(other.method)
            && priority == other.priority
            && createdAt.equals(other.createdAt)
            && ValueCodec.deepEquals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, method, priority, createdAt, timeoutMillis);
    }

    @Override
    public String toString() {
        return "Request{" + method + ", id=" + id + ", priority=" + priority + "}";
    }
}
