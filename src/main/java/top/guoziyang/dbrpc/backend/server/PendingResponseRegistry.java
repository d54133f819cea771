package top.guoziyang.dbrpc.backend.server;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 请求ID → PendingResponse 的关联表
 *
 * 接收线程注册并等待，工作线程交付结果，两边持有同一个实例。
 * 自己的锁只保护这张表，与请求队列和连接通道无关。
 *
 * 迟到结果：
 * 调用方超时之后工作线程才交付的结果不会再发给任何人，
 * 在这里记WARN日志并计数，health_check里可以看到累计值。
 */
public class PendingResponseRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PendingResponseRegistry.class);

    private final Lock lock = new ReentrantLock();
    private final Map<String, PendingResponse> pending = new HashMap<>();
    private long lateResults;

    /**
     * @throws DriverException DUPLICATE_REQUEST，同一ID的请求仍在等待
     */
    public PendingResponse register(String requestId) {
        lock.lock();
        try {
            if (pending.containsKey(requestId)) {
                throw DriverException.of(ErrorCode.DUPLICATE_REQUEST, "Request " + requestId + " is already pending");
            }
            PendingResponse p = new PendingResponse(requestId);
            pending.put(requestId, p);
            return p;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 交付结果
     *
     * @return 没有调用方在等待时返回false，结果被丢弃
     */
    public boolean complete(String requestId, Result result) {
        PendingResponse p;
        lock.lock();
        try {
            p = pending.get(requestId);
        } finally {
            lock.unlock();
        }
        if (p != null && p.complete(result)) {
            return true;
        }
        lock.lock();
        try {
            lateResults++;
        } finally {
            lock.unlock();
        }
        LOG.warn("Dropping late result for request {}: {}", requestId, result);
        return false;
    }

    /**
     * 是否仍有调用方在等待这个请求
     */
    public boolean isWaiting(String requestId) {
        PendingResponse p;
        lock.lock();
        try {
            p = pending.get(requestId);
        } finally {
            lock.unlock();
        }
        return p != null && !p.isAbandoned();
    }

    /**
     * 仅当表中登记的正是p时才移除
     */
    public void remove(String requestId, PendingResponse p) {
        lock.lock();
        try {
            pending.remove(requestId, p);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public long lateResults() {
        lock.lock();
        try {
            return lateResults;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 关闭时用同一个结果完成所有等待中的调用
     */
    public void failAll(Result result) {
        List<PendingResponse> waiting;
        lock.lock();
        try {
            waiting = new ArrayList<>(pending.values());
        } finally {
            lock.unlock();
        }
        for (PendingResponse p : waiting) {
            p.complete(result);
        }
    }
}
