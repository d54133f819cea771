package top.guoziyang.dbrpc.backend.queue;

import top.guoziyang.dbrpc.transport.Request;

/**
 * 队列中的请求：原始请求 + 入队时间 + 入队序号
 *
 * 序号单调递增，同一优先级内按序号先进先出。
 */
public class QueuedRequest {

    private final Request request;
    private final long enqueuedAt;
    private final long seq;

    QueuedRequest(Request request, long enqueuedAt, long seq) {
        this.request = request;
        this.enqueuedAt = enqueuedAt;
        this.seq = seq;
    }

    public Request getRequest() {
        return request;
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    public long getSeq() {
        return seq;
    }

    /**
     * 请求是否已超过自己的超时时间
     */
    public boolean isExpired(long now) {
        return now >= request.deadlineMillis();
    }

    @Override
    public String toString() {
        return "QueuedRequest{" + request + ", seq=" + seq + "}";
    }
}
