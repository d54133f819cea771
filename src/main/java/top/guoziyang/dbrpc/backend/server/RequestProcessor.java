package top.guoziyang.dbrpc.backend.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.backend.queue.RequestQueue;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.Error;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 接收路径上的请求处理：登记 → 入队 → 等待
 *
 * 1. 在PendingResponseRegistry登记，同一ID重复 → DUPLICATE_REQUEST
 * 2. 入队，队列满 → 立即返回QUEUE_FULL
 * 3. 阻塞等待到请求的截止时间
 * 4. 超时：放弃等待（之后到达的结果成为迟到结果），撤回仍在排队的请求，返回TIMEOUT
 *
 * 放弃和交付互斥，调用方只会拿到一个结果。
 */
public class RequestProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(RequestProcessor.class);

    private final RequestQueue queue;
    private final PendingResponseRegistry registry;
    private volatile boolean shuttingDown;

    public RequestProcessor(RequestQueue queue, PendingResponseRegistry registry) {
        this.queue = queue;
        this.registry = registry;
    }

    public Result process(Request request) {
        if (shuttingDown) {
            return Result.error(Error.ShuttingDownException);
        }
        PendingResponse pending;
        try {
            pending = registry.register(request.getId());
        } catch (DriverException e) {
            return Result.error(e);
        }
        try {
            if (!queue.enqueue(request)) {
                return Result.error(Error.QueueFullException);
            }
            long wait = request.deadlineMillis() - System.currentTimeMillis();
            Result result = pending.await(wait);
            if (result != null) {
                return result;
            }
            if (pending.abandon()) {
                queue.remove(request.getId());
                LOG.warn("{} timed out after {} ms", request, request.getTimeoutMillis());
                return timeout(request);
            }
            // 放弃之前结果刚好到达
            return pending.getResult();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!pending.abandon()) {
                return pending.getResult();
            }
            queue.remove(request.getId());
            return Result.error(Error.ShuttingDownException);
        } finally {
            registry.remove(request.getId(), pending);
        }
    }

    static Result timeout(Request request) {
        return Result.error(ErrorCode.TIMEOUT,
            "Request " + request.getId() + " timed out after " + request.getTimeoutMillis() + " ms");
    }

    public void shutdown() {
        shuttingDown = true;
    }
}
