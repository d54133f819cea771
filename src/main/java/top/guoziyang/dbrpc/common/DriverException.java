package top.guoziyang.dbrpc.common;

/**
 * DriverException - 系统内唯一跨层传播的异常类型
 *
 * 驱动引擎、服务器、客户端和原子保存流程都只抛出DriverException，
 * 异常里带有ErrorCode，服务器端的Executor据此把异常转换成Error结果，
 * 客户端再把Error结果还原成DriverException抛给调用方。
 *
 * 存储层的SQLException、IO层的IOException都要先用wrap包装并补充上下文，
 * 不允许未分类的异常穿过RPC边界。
 */
public class DriverException extends RuntimeException {

    private final ErrorCode code;

    public static DriverException of(ErrorCode code, String message) {
        return new DriverException(code, message, null);
    }

    public static DriverException wrap(ErrorCode code, String message, Throwable cause) {
        if (cause instanceof DriverException) {
            // 已经分类过的异常保持原有错误码
            return (DriverException) cause;
        }
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new DriverException(code, message + detail, cause);
    }

    public DriverException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public DriverException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String getLocalizedMessage() {
        return "[" + code + "] " + getMessage();
    }
}
