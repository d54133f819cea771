package top.guoziyang.dbrpc.common;

import java.util.HashMap;
import java.util.Map;

/**
 * ErrorCode - 跨RPC边界传递的错误码
 *
 * 每个错误码都归属于一个错误类别（ErrorCategory），调用方根据类别决定处理方式：
 * - PROTOCOL：连接级错误，需要重连
 * - VALIDATION：参数或结构错误，重试没有意义
 * - RESOURCE：队列满、超时、锁等待超时，可以退避后重试
 * - STORAGE：底层存储失败，已附带操作和表的上下文
 * - ATOMICITY：原子保存流程某个阶段失败
 *
 * 错误码的wire名称就是枚举名本身，客户端和驱动进程共享同一份定义。
 */
public enum ErrorCode {

    // 协议错误
    MALFORMED_FRAME(ErrorCategory.PROTOCOL),
    UNKNOWN_METHOD(ErrorCategory.PROTOCOL),

    // 校验错误
    INVALID_PARAMS(ErrorCategory.VALIDATION),
    TABLE_NOT_FOUND(ErrorCategory.VALIDATION),
    COLUMN_NOT_FOUND(ErrorCategory.VALIDATION),
    INVALID_SCHEMA(ErrorCategory.VALIDATION),
    TRANSACTION_NOT_FOUND(ErrorCategory.VALIDATION),
    NOT_SUPPORTED(ErrorCategory.VALIDATION),
    DUPLICATE_REQUEST(ErrorCategory.VALIDATION),

    // 资源错误
    QUEUE_FULL(ErrorCategory.RESOURCE),
    TIMEOUT(ErrorCategory.RESOURCE),
    CONNECTION_UNAVAILABLE(ErrorCategory.RESOURCE),
    LOCK_TIMEOUT(ErrorCategory.RESOURCE),
    SHUTTING_DOWN(ErrorCategory.RESOURCE),

    // 存储错误
    STORAGE_ERROR(ErrorCategory.STORAGE),

    // 原子性失败
    ATOMIC_SAVE_FAILED(ErrorCategory.ATOMICITY),

    INTERNAL_ERROR(ErrorCategory.INTERNAL);

    public enum ErrorCategory {
        PROTOCOL,
        VALIDATION,
        RESOURCE,
        STORAGE,
        ATOMICITY,
        INTERNAL
    }

    private static final Map<String, ErrorCode> BY_NAME = new HashMap<>();

    static {
        for (ErrorCode code : values()) {
            BY_NAME.put(code.name(), code);
        }
    }

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * 资源类错误可以退避重试，其它类别重试不会改变结果
     */
    public boolean isRetryable() {
        return category == ErrorCategory.RESOURCE;
    }

    /**
     * 解析wire上的错误码，未知的错误码（来自更新版本的驱动）归为INTERNAL_ERROR
     */
    public static ErrorCode fromWire(String name) {
        if (name == null) {
            return INTERNAL_ERROR;
        }
        ErrorCode code = BY_NAME.get(name);
        return code == null ? INTERNAL_ERROR : code;
    }
}
