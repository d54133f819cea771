package top.guoziyang.dbrpc.transport;

import top.guoziyang.dbrpc.common.DriverException;

/**
 * 数据包封装类 - 客户端与驱动进程之间传输的统一容器
 *
 * 功能概述：
 * - 请求包：携带Request，由客户端发出
 * - 结果包：携带请求ID和Result，由驱动进程发回
 * - 协议错误包：携带DriverException，表示连接级错误（帧损坏、未知方法）
 *
 * 设计思想：
 * 一个Package只会是三种形态之一，不会出现既有结果又有协议错误的模糊状态。
 * 结果包里的Result本身也可能是Error，但那是某个请求的业务错误；
 * 协议错误包不属于任何一个待处理请求，调用方应当重连。
 *
 * 使用模式：
 * 1. Package.request(req)：客户端发送
 * 2. Package.result(id, result)：服务器响应
 * 3. Package.protocolError(id, err)：服务器拒绝，id可能为null
 *
 * @see Encoder 负责Package的序列化和反序列化
 * @see Packager 负责Package的网络传输
 */
public class Package {

    public enum Type {
        REQUEST,
        RESULT,
        PROTOCOL_ERROR
    }

    private final Type type;

    private final Request request;

    /**
     * 结果包或协议错误包对应的请求ID，协议错误无法解析出ID时为null
     */
    private final String requestId;

    private final Result result;

    private final DriverException err;

    private Package(Type type, Request request, String requestId, Result result, DriverException err) {
        this.type = type;
        this.request = request;
        this.requestId = requestId;
        this.result = result;
        this.err = err;
    }

    public static Package request(Request request) {
        return new Package(Type.REQUEST, request, request.getId(), null, null);
    }

    public static Package result(String requestId, Result result) {
        return new Package(Type.RESULT, null, requestId, result, null);
    }

    public static Package protocolError(String requestId, DriverException err) {
        return new Package(Type.PROTOCOL_ERROR, null, requestId, null, err);
    }

    public Type getType() {
        return type;
    }

    public Request getRequest() {
        return request;
    }

    public String getRequestId() {
        return requestId;
    }

    public Result getResult() {
        return result;
    }

    /**
     * 获取协议错误
     *
     * 错误检查模式：
     * ```java
     * Package pkg = packager.receive();
     * if (pkg.getErr() != null) {
     *     // 连接级错误，丢弃连接
     *     throw pkg.getErr();
     * }
     * Result result = pkg.getResult();
     * ```
     *
     * @return 协议错误，非协议错误包时为null
     */
    public DriverException getErr() {
        return err;
    }
}
