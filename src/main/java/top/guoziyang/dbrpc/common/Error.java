package top.guoziyang.dbrpc.common;

/**
 * Error - 预定义的固定错误
 *
 * 只收录消息固定、不需要携带上下文的错误条件。
 * 需要说明具体表名、列名、请求ID的错误，直接使用DriverException.of构造。
 *
 * 分类说明：
 * - transport: 帧格式错误、连接关闭
 * - queue/server: 队列满、驱动关闭
 * - tree: 树操作未配置
 *
 * 使用建议：
 * - 不要修改这些异常对象
 * - 可以通过getCode()精确判断错误类型
 */
public class Error {

    // ========== 传输层 (transport) ==========

    public static final DriverException InvalidPkgDataException =
        DriverException.of(ErrorCode.MALFORMED_FRAME, "Invalid package data!");

    public static final DriverException FrameTooLargeException =
        DriverException.of(ErrorCode.MALFORMED_FRAME, "Frame too large!");

    public static final DriverException ConnectionClosedException =
        DriverException.of(ErrorCode.CONNECTION_UNAVAILABLE, "Connection closed!");

    // ========== 队列与服务器 (queue / server) ==========

    public static final DriverException QueueFullException =
        DriverException.of(ErrorCode.QUEUE_FULL, "Request queue is full!");

    public static final DriverException ShuttingDownException =
        DriverException.of(ErrorCode.SHUTTING_DOWN, "Driver is shutting down!");

    // ========== 树操作 (tree) ==========

    public static final DriverException TreeNotSupportedException =
        DriverException.of(ErrorCode.NOT_SUPPORTED, "Tree operations are not configured on this driver!");
}
