package top.guoziyang.dbrpc.backend.queue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Request;

/**
 * 请求优先级队列
 *
 * 排序规则：
 * 1. 优先级高的先出队（URGENT > HIGH > NORMAL > LOW）
 * 2. 同一优先级按入队序号先进先出
 *
 * 容量：
 * 队列有上限maxSize，满了之后enqueue立即返回false，不阻塞调用方。
 * 调用方据此返回QUEUE_FULL错误。
 *
 * 过期清理：
 * 每次dequeue之前以及调度循环空闲时调用purgeExpired，
 * 超过自身超时时间的请求被移出队列并交给ExpirationListener，
 * 由它完成调用方的等待（TIMEOUT）。回调在锁外执行。
 *
 * 条件出队：
 * dequeue(eligible)跳过不满足条件的请求，被跳过的请求留在原位（序号不变），
 * 条件放开后仍按原来的顺序出队。调度循环用它在事务占用连接通道时暂缓非事务请求。
 *
 * 锁：
 * 所有操作由一把ReentrantLock保护，和TransactionManagerImpl一样使用显式锁，
 * 与连接通道锁、等待表锁互相独立。
 */
public class RequestQueue {

    private static final Logger LOG = LoggerFactory.getLogger(RequestQueue.class);

    private static final Comparator<QueuedRequest> ORDER =
        Comparator.comparing((QueuedRequest q) -> q.getRequest().getPriority()).reversed()
            .thenComparingLong(QueuedRequest::getSeq);

    private final int maxSize;
    private final Lock lock = new ReentrantLock();
    private final PriorityQueue<QueuedRequest> heap = new PriorityQueue<>(ORDER);
    private final EnumMap<Priority, Integer> perPriority = new EnumMap<>(Priority.class);

    private ExpirationListener expirationListener;

    private long nextSeq;
    private long totalEnqueued;
    private long totalDequeued;
    private long totalRejected;
    private long totalExpired;

    public RequestQueue(int maxSize) {
        Preconditions.checkArgument(maxSize > 0, "maxSize must be positive");
        this.maxSize = maxSize;
    }

    public void setExpirationListener(ExpirationListener expirationListener) {
        this.expirationListener = expirationListener;
    }

    /**
     * 请求入队
     *
     * @return 队列已满时返回false，请求没有入队
     */
    public boolean enqueue(Request request) {
        lock.lock();
        try {
            if (heap.size() >= maxSize) {
                totalRejected++;
                LOG.warn("Queue full ({}), rejecting {}", maxSize, request);
                return false;
            }
            heap.add(new QueuedRequest(request, System.currentTimeMillis(), nextSeq++));
            perPriority.merge(request.getPriority(), 1, Integer::sum);
            totalEnqueued++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取出优先级最高、入队最早的请求，先清理过期请求
     *
     * @return 队列为空时返回null
     */
    public QueuedRequest dequeue() {
        return dequeue(request -> true);
    }

    /**
     * 取出满足条件的请求中优先级最高、入队最早的一个，先清理过期请求
     *
     * @return 没有满足条件的请求时返回null
     */
    public QueuedRequest dequeue(Predicate<Request> eligible) {
        List<QueuedRequest> expired;
        QueuedRequest head = null;
        lock.lock();
        try {
            expired = collectExpired(System.currentTimeMillis());
            List<QueuedRequest> skipped = new ArrayList<>();
            QueuedRequest q;
            while ((q = heap.poll()) != null) {
                if (eligible.test(q.getRequest())) {
                    head = q;
                    break;
                }
                skipped.add(q);
            }
            heap.addAll(skipped);
            if (head != null) {
                decrement(head.getRequest().getPriority());
                totalDequeued++;
            }
        } finally {
            lock.unlock();
        }
        notifyExpired(expired);
        return head;
    }

    /**
     * 按请求ID移除，用于调用方超时后撤回仍在排队的请求
     *
     * @return 请求不在队列中（已出队或从未入队）时返回false
     */
    public boolean remove(String requestId) {
        lock.lock();
        try {
            Iterator<QueuedRequest> it = heap.iterator();
            while (it.hasNext()) {
                QueuedRequest q = it.next();
                if (q.getRequest().getId().equals(requestId)) {
                    it.remove();
                    decrement(q.getRequest().getPriority());
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除所有过期请求
     *
     * @return 被移除的数量
     */
    public int purgeExpired() {
        List<QueuedRequest> expired;
        lock.lock();
        try {
            expired = collectExpired(System.currentTimeMillis());
        } finally {
            lock.unlock();
        }
        notifyExpired(expired);
        return expired.size();
    }

    /**
     * 移除所有满足条件的请求，不经过ExpirationListener，由调用方负责完成它们
     */
    public List<QueuedRequest> removeIf(Predicate<QueuedRequest> filter) {
        lock.lock();
        try {
            List<QueuedRequest> removed = new ArrayList<>();
            Iterator<QueuedRequest> it = heap.iterator();
            while (it.hasNext()) {
                QueuedRequest q = it.next();
                if (filter.test(q)) {
                    it.remove();
                    decrement(q.getRequest().getPriority());
                    removed.add(q);
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public QueueStats stats() {
        lock.lock();
        try {
            long now = System.currentTimeMillis();
            long oldest = 0;
            for (QueuedRequest q : heap) {
                oldest = Math.max(oldest, now - q.getEnqueuedAt());
            }
            return new QueueStats(heap.size(), maxSize, new EnumMap<>(perPriority), oldest,
                totalEnqueued, totalDequeued, totalRejected, totalExpired);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清空队列，返回剩余的请求（关闭时使用）
     */
    public List<QueuedRequest> drain() {
        lock.lock();
        try {
            List<QueuedRequest> rest = new ArrayList<>();
            QueuedRequest q;
            while ((q = heap.poll()) != null) {
                rest.add(q);
            }
            perPriority.clear();
            return rest;
        } finally {
            lock.unlock();
        }
    }

    // 调用方必须持有lock
    private List<QueuedRequest> collectExpired(long now) {
        List<QueuedRequest> expired = new ArrayList<>();
        Iterator<QueuedRequest> it = heap.iterator();
        while (it.hasNext()) {
            QueuedRequest q = it.next();
            if (q.isExpired(now)) {
                it.remove();
                decrement(q.getRequest().getPriority());
                expired.add(q);
            }
        }
        totalExpired += expired.size();
        return expired;
    }

    private void decrement(Priority priority) {
        perPriority.computeIfPresent(priority, (p, n) -> n > 1 ? n - 1 : null);
    }

    private void notifyExpired(List<QueuedRequest> expired) {
        if (expired.isEmpty()) {
            return;
        }
        LOG.debug("Purged {} expired requests", expired.size());
        ExpirationListener listener = expirationListener;
        if (listener == null) {
            return;
        }
        for (QueuedRequest q : expired) {
            listener.expired(q);
        }
    }
}
