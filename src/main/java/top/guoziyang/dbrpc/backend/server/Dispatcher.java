package top.guoziyang.dbrpc.backend.server;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import top.guoziyang.dbrpc.backend.queue.QueuedRequest;
import top.guoziyang.dbrpc.backend.queue.RequestQueue;
import top.guoziyang.dbrpc.common.Error;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 调度循环 - 从优先级队列取请求，交给固定大小的工作线程池
 *
 * 顺序保证：
 * 先拿到一个工作许可（Semaphore，许可数 = 工作线程数）再出队，
 * 所以请求只会在优先级队列里等待，不会堆积在线程池自己的FIFO队列里。
 * 出队顺序就是调度顺序：优先级从高到低，同优先级先进先出。
 *
 * 空闲时：
 * 队列为空则归还许可、清理过期请求、休眠idleSleepMillis后重试。
 *
 * 跳过：
 * 调用方已经放弃等待的请求不再执行。
 *
 * 事务占用连接通道时：
 * 只出队携带transaction_id的请求（以及health_check），其余请求留在队列里，
 * 不占用工作许可，否则它们会占满工作线程，让事务自己的语句和提交拿不到线程。
 * 通道被同一事务持续占用超过laneTimeoutMillis后，仍在等待的请求以LOCK_TIMEOUT结束。
 */
public class Dispatcher implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final RequestQueue queue;
    private final PendingResponseRegistry registry;
    private final Executor executor;
    private final long idleSleepMillis;
    private final Semaphore permits;
    private final ThreadPoolExecutor workers;
    private final Supplier<String> activeTransaction;
    private final long laneTimeoutMillis;

    // 只在调度线程内读写
    private String laneTx;
    private long laneHeldSince;

    private volatile boolean running;
    private volatile DispatchListener listener;
    private Thread thread;

    public Dispatcher(RequestQueue queue, PendingResponseRegistry registry, Executor executor,
                      int workerCount, long idleSleepMillis) {
        this(queue, registry, executor, workerCount, idleSleepMillis, () -> null, Long.MAX_VALUE);
    }

    /**
     * @param activeTransaction 当前占用连接通道的事务ID，没有时返回null
     * @param laneTimeoutMillis 非事务请求等待通道的上限
     */
    public Dispatcher(RequestQueue queue, PendingResponseRegistry registry, Executor executor,
                      int workerCount, long idleSleepMillis,
                      Supplier<String> activeTransaction, long laneTimeoutMillis) {
        this.queue = queue;
        this.activeTransaction = activeTransaction;
        this.laneTimeoutMillis = laneTimeoutMillis;
        this.registry = registry;
        this.executor = executor;
        this.idleSleepMillis = Math.max(1L, idleSleepMillis);
        this.permits = new Semaphore(workerCount);
        this.workers = new ThreadPoolExecutor(workerCount, workerCount, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("dbrpc-worker-%d").setDaemon(true).build());
    }

    public void setListener(DispatchListener listener) {
        this.listener = listener;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new ThreadFactoryBuilder().setNameFormat("dbrpc-dispatcher").setDaemon(true).build()
            .newThread(this);
        thread.start();
    }

    @Override
    public void run() {
        LOG.debug("Dispatch loop started");
        while (running) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                break;
            }
            String tx = trackLane();
            if (tx != null) {
                failParked(tx);
            }
            QueuedRequest item = tx == null ? queue.dequeue() : queue.dequeue(Dispatcher::mayUseHeldLane);
            if (item == null) {
                permits.release();
                queue.purgeExpired();
                try {
                    Thread.sleep(idleSleepMillis);
                } catch (InterruptedException e) {
                    break;
                }
                continue;
            }
            dispatch(item);
        }
        LOG.debug("Dispatch loop stopped");
    }

    private String trackLane() {
        String tx = activeTransaction.get();
        if (tx == null) {
            laneTx = null;
        } else if (!tx.equals(laneTx)) {
            laneTx = tx;
            laneHeldSince = System.currentTimeMillis();
        }
        return tx;
    }

    static boolean mayUseHeldLane(Request request) {
        if (Method.of(request.getMethod()) == Method.HEALTH_CHECK) {
            return true;
        }
        Object txId = request.getParams().get("transaction_id");
        return txId instanceof String && !((String) txId).isEmpty();
    }

    private void failParked(String tx) {
        long now = System.currentTimeMillis();
        if (now - laneHeldSince < laneTimeoutMillis) {
            return;
        }
        List<QueuedRequest> parked = queue.removeIf(q -> !mayUseHeldLane(q.getRequest())
            && now - Math.max(q.getEnqueuedAt(), laneHeldSince) >= laneTimeoutMillis);
        for (QueuedRequest q : parked) {
            String id = q.getRequest().getId();
            if (!registry.isWaiting(id)) {
                continue;
            }
            LOG.warn("{} waited more than {} ms for {}", q.getRequest(), laneTimeoutMillis, tx);
            registry.complete(id, Result.error(ErrorCode.LOCK_TIMEOUT,
                "Connection busy (" + tx + ") for more than " + laneTimeoutMillis + " ms"));
        }
    }

    // 调用方已持有一个许可，这里负责在任何情况下归还
    private void dispatch(QueuedRequest item) {
        Request request = item.getRequest();
        if (!registry.isWaiting(request.getId())) {
            LOG.debug("Skipping {}, nobody is waiting", request);
            permits.release();
            return;
        }
        DispatchListener l = listener;
        if (l != null) {
            l.dispatched(item);
        }
        try {
            workers.execute(() -> {
                try {
                    Result result = executor.execute(request);
                    registry.complete(request.getId(), result);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            registry.complete(request.getId(), Result.error(Error.ShuttingDownException));
        }
    }

    /**
     * 停止调度，等待正在执行的请求结束，队列中剩余的请求以SHUTTING_DOWN完成
     */
    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Workers still busy after 10s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (QueuedRequest rest : queue.drain()) {
            registry.complete(rest.getRequest().getId(), Result.error(Error.ShuttingDownException));
        }
    }
}
