package top.guoziyang.dbrpc.transport;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 值编解码器 - 把结构化参数序列化为带类型标签的二进制
 *
 * 编码格式：
 * [tag:1字节][载荷]
 *
 * 标签与载荷：
 * - NULL(0)：无载荷
 * - BOOLEAN(1)：1字节，0或1
 * - LONG(2)：8字节大端整数，int/short/byte统一提升为long
 * - DOUBLE(3)：8字节IEEE754，float提升为double
 * - STRING(4)：[长度:4][UTF-8字节]
 * - BYTES(5)：[长度:4][原始字节]
 * - TIMESTAMP(6)：[epochSecond:8][nano:4]
 * - LIST(7)：[元素数:4][元素...]
 * - MAP(8)：[条目数:4]([key:STRING载荷][value])...
 *
 * 设计思想：
 * 与JSON相比，二进制标签可以无损往返byte[]和时间戳，
 * 解码端不需要猜测类型。map的key只允许字符串。
 *
 * @see Encoder 在此之上封装数据包
 */
public class ValueCodec {

    static final byte TAG_NULL = 0;
    static final byte TAG_BOOLEAN = 1;
    static final byte TAG_LONG = 2;
    static final byte TAG_DOUBLE = 3;
    static final byte TAG_STRING = 4;
    static final byte TAG_BYTES = 5;
    static final byte TAG_TIMESTAMP = 6;
    static final byte TAG_LIST = 7;
    static final byte TAG_MAP = 8;

    /** 嵌套层数上限，防止恶意帧导致栈溢出 */
    private static final int MAX_DEPTH = 64;

    public static byte[] encode(Object value) {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        write(out, value, 0);
        return out.toByteArray();
    }

    public static Object decode(byte[] raw) {
        ByteArrayDataInput in = ByteStreams.newDataInput(raw);
        Object value;
        try {
            value = read(in, raw.length, 0);
        } catch (IllegalStateException e) {
            // ByteArrayDataInput在数据不足时抛出IllegalStateException(EOFException)
            throw DriverException.wrap(ErrorCode.MALFORMED_FRAME, "Truncated value", e);
        }
        return value;
    }

    private static void write(ByteArrayDataOutput out, Object value, int depth) {
        if (depth > MAX_DEPTH) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "Value nested too deeply");
        }
        if (value == null) {
            out.writeByte(TAG_NULL);
        } else if (value instanceof Boolean) {
            out.writeByte(TAG_BOOLEAN);
            out.writeBoolean((Boolean) value);
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            out.writeByte(TAG_LONG);
            out.writeLong(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            out.writeByte(TAG_DOUBLE);
            out.writeDouble(((Number) value).doubleValue());
        } else if (value instanceof String) {
            out.writeByte(TAG_STRING);
            writeString(out, (String) value);
        } else if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            out.writeByte(TAG_BYTES);
            out.writeInt(bytes.length);
            out.write(bytes);
        } else if (value instanceof Instant) {
            Instant instant = (Instant) value;
            out.writeByte(TAG_TIMESTAMP);
            out.writeLong(instant.getEpochSecond());
            out.writeInt(instant.getNano());
        } else if (value instanceof Collection) {
            Collection<?> list = (Collection<?>) value;
            out.writeByte(TAG_LIST);
            out.writeInt(list.size());
            for (Object item : list) {
                write(out, item, depth + 1);
            }
        } else if (value instanceof Object[]) {
            Object[] array = (Object[]) value;
            out.writeByte(TAG_LIST);
            out.writeInt(array.length);
            for (Object item : array) {
                write(out, item, depth + 1);
            }
        } else if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            out.writeByte(TAG_MAP);
            out.writeInt(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw DriverException.of(ErrorCode.INVALID_PARAMS, "Map keys must be strings: " + entry.getKey());
                }
                writeString(out, (String) entry.getKey());
                write(out, entry.getValue(), depth + 1);
            }
        } else {
            throw DriverException.of(ErrorCode.INVALID_PARAMS,
                "Unsupported value type: " + value.getClass().getName());
        }
    }

    private static Object read(ByteArrayDataInput in, int limit, int depth) {
        if (depth > MAX_DEPTH) {
            throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Value nested too deeply");
        }
        byte tag = in.readByte();
        switch (tag) {
            case TAG_NULL:
                return null;
            case TAG_BOOLEAN:
                return in.readBoolean();
            case TAG_LONG:
                return in.readLong();
            case TAG_DOUBLE:
                return in.readDouble();
            case TAG_STRING:
                return readString(in, limit);
            case TAG_BYTES: {
                byte[] bytes = new byte[readLength(in, limit)];
                in.readFully(bytes);
                return bytes;
            }
            case TAG_TIMESTAMP: {
                long seconds = in.readLong();
                int nanos = in.readInt();
                return Instant.ofEpochSecond(seconds, nanos);
            }
            case TAG_LIST: {
                int size = readLength(in, limit);
                List<Object> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    list.add(read(in, limit, depth + 1));
                }
                return list;
            }
            case TAG_MAP: {
                int size = readLength(in, limit);
                Map<String, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < size; i++) {
                    String key = readString(in, limit);
                    map.put(key, read(in, limit, depth + 1));
                }
                return map;
            }
            default:
                throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Unknown value tag: " + tag);
        }
    }

    /**
     * 结构相等比较，byte[]按内容比较，数字按wire类型比较
     */
    public static boolean deepEquals(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof byte[] && b instanceof byte[]) {
            return Arrays.equals((byte[]) a, (byte[]) b);
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> ma = (Map<?, ?>) a;
            Map<?, ?> mb = (Map<?, ?>) b;
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : ma.entrySet()) {
                if (!mb.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), mb.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List && b instanceof List) {
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if (la.size() != lb.size()) {
                return false;
            }
            for (int i = 0; i < la.size(); i++) {
                if (!deepEquals(la.get(i), lb.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    private static void writeString(ByteArrayDataOutput out, String str) {
        byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readString(ByteArrayDataInput in, int limit) {
        byte[] bytes = new byte[readLength(in, limit)];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 读取长度字段，长度不可能超过整帧大小
     */
    private static int readLength(ByteArrayDataInput in, int limit) {
        int length = in.readInt();
        if (length < 0 || length > limit) {
            throw DriverException.of(ErrorCode.MALFORMED_FRAME, "Invalid length field: " + length);
        }
        return length;
    }
}
