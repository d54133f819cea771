package top.guoziyang.dbrpc.transport;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.primitives.Bytes;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.Error;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 数据包编码器 - 负责Package对象与字节数组之间的序列化和反序列化
 *
 * 协议格式：
 * - 字节0：包类型（0=请求，1=结果，2=协议错误）
 * - 字节1+：ValueCodec编码的map
 *
 * 请求体：{id, method, params, priority, created_at, timeout_ms}
 * 结果体：{id, outcome, data | records | code+message}
 * 协议错误体：{id?, code, message}
 *
 * 前向兼容：
 * 解码时只读取认识的key，其余字段一律忽略，
 * 新版本客户端可以附带旧版本驱动不认识的字段。
 *
 * 长度字段由下层Transporter的分隔符处理，这里不再重复。
 *
 * @see Package 数据包封装类
 * @see ValueCodec 值编码
 */
public class Encoder {

    private static final byte TYPE_REQUEST = 0;
    private static final byte TYPE_RESULT = 1;
    private static final byte TYPE_PROTOCOL_ERROR = 2;

    private final long defaultTimeoutMillis;

    public Encoder() {
        this(30_000L);
    }

    /**
     * @param defaultTimeoutMillis 请求未携带超时时间时使用的默认值
     */
    public Encoder(long defaultTimeoutMillis) {
        this.defaultTimeoutMillis = defaultTimeoutMillis;
    }

    /**
     * 将Package对象编码为字节数组，格式为[类型][载荷]
     */
    public byte[] encode(Package pkg) {
        switch (pkg.getType()) {
            case REQUEST:
                return Bytes.concat(new byte[]{TYPE_REQUEST}, ValueCodec.encode(pkg.getRequest().toMap()));
            case RESULT:
                return Bytes.concat(new byte[]{TYPE_RESULT},
                    ValueCodec.encode(pkg.getResult().toMap(pkg.getRequestId())));
            default: {
                DriverException err = pkg.getErr();
                // 准备错误消息
                String msg = "Intern server error!";
                if (err.getMessage() != null) {
                    msg = err.getMessage();
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("id", pkg.getRequestId());
                body.put("code", err.getCode().name());
                body.put("message", msg);
                return Bytes.concat(new byte[]{TYPE_PROTOCOL_ERROR}, ValueCodec.encode(body));
            }
        }
    }

    /**
     * 将字节数组解码为Package对象
     *
     * @throws DriverException MALFORMED_FRAME，数据格式无效
     */
    @SuppressWarnings("unchecked")
    public Package decode(byte[] data) {
        // 验证数据包最小长度（至少包含1字节类型位和1字节值标签）
        if (data.length < 2) {
            throw Error.InvalidPkgDataException;
        }
        Object body = ValueCodec.decode(Arrays.copyOfRange(data, 1, data.length));
        if (!(body instanceof Map)) {
            throw Error.InvalidPkgDataException;
        }
        Map<String, Object> map = (Map<String, Object>) body;
        switch (data[0]) {
            case TYPE_REQUEST:
                return Package.request(Request.fromMap(map, defaultTimeoutMillis));
            case TYPE_RESULT: {
                Object id = map.get(Result.KEY_ID);
                if (!(id instanceof String)) {
                    throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Result without request id");
                }
                return Package.result((String) id, Result.fromMap(map));
            }
            case TYPE_PROTOCOL_ERROR: {
                Object id = map.get("id");
                Object code = map.get("code");
                Object message = map.get("message");
                DriverException err = DriverException.of(
                    ErrorCode.fromWire(code instanceof String ? (String) code : null),
                    message == null ? "Protocol error" : message.toString());
                return Package.protocolError(id instanceof String ? (String) id : null, err);
            }
            default:
                // 非法数据包：未知的类型位
                throw Error.InvalidPkgDataException;
        }
    }
}
