package top.guoziyang.dbrpc.backend.server;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import top.guoziyang.dbrpc.transport.Result;

/**
 * 一个等待中的调用：接收线程在这里阻塞，工作线程在这里交付结果
 *
 * complete和abandon互斥，先到者生效，后到者返回false：
 * - 工作线程先complete：调用方拿到真实结果
 * - 调用方先abandon（超时）：之后到达的结果被丢弃，计为迟到结果
 * 因此每个请求的结果最多交付一次。
 */
public class PendingResponse {

    private final String requestId;
    private final Lock lock = new ReentrantLock();
    private final Condition done = lock.newCondition();

    private Result result;
    private boolean abandoned;

    PendingResponse(String requestId) {
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * 交付结果
     *
     * @return 已交付过或已被放弃时返回false
     */
    public boolean complete(Result result) {
        lock.lock();
        try {
            if (this.result != null || abandoned) {
                return false;
            }
            this.result = result;
            done.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 放弃等待
     *
     * @return 结果已经交付时返回false，此时调用方应当使用getResult
     */
    public boolean abandon() {
        lock.lock();
        try {
            if (result != null) {
                return false;
            }
            abandoned = true;
            done.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 等待结果
     *
     * @return 超时或被放弃时返回null
     */
    public Result await(long timeoutMillis) throws InterruptedException {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMillis));
            while (result == null && !abandoned) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = done.awaitNanos(remaining);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Result getResult() {
        lock.lock();
        try {
            return result;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAbandoned() {
        lock.lock();
        try {
            return abandoned;
        } finally {
            lock.unlock();
        }
    }
}
