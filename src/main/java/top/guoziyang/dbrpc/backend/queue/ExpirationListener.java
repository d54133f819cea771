package top.guoziyang.dbrpc.backend.queue;

/**
 * 队列在清理过期请求时的回调
 *
 * 在队列锁之外调用，实现里可以安全地访问其他加锁结构。
 */
public interface ExpirationListener {
    void expired(QueuedRequest item);
}
