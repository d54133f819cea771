package top.guoziyang.dbrpc.client;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Package;
import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 驱动客户端 - 通过Unix域套接字调用驱动进程
 *
 * 调用流程：
 * 1. 从连接池借一个连接
 * 2. 发送请求包，等待同一个ID的结果包
 * 3. 连接无误则归还，否则丢弃
 *
 * 重试策略：
 * - 借不到连接、连接失败、发送失败：请求没有到达驱动，总是可以重试
 * - 发送之后连接断开：请求可能已经执行，只有只读方法才重试
 * - 超时（看门狗）和结果包里的Error：不重试，原样交给调用方
 * 每次重试使用新的请求ID，退避时间指数增长。
 *
 * 协议错误包说明连接本身出了问题（帧损坏、未知方法），
 * 转成对应错误码的Error结果，连接不再复用。
 */
public class Client implements DatabaseApi {

    private static final Logger LOG = LoggerFactory.getLogger(Client.class);

    private final ClientConfig config;
    private final ScheduledExecutorService watchdog;
    private final ConnectionPool pool;

    public Client(ClientConfig config) {
        this.config = config;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("dbrpc-client-watchdog").setDaemon(true).build());
        this.pool = new ConnectionPool(config, watchdog);
    }

    @Override
    public Result call(Method method, Map<String, Object> params, Priority priority) {
        return call(method, params, priority, config.getTimeoutMillis());
    }

    @Override
    public Result call(Method method, Map<String, Object> params, Priority priority, long timeoutMillis) {
        DriverException last = null;
        for (int attempt = 1; attempt <= config.getMaxAttempts(); attempt++) {
            if (attempt > 1 && !backoff(attempt - 1)) {
                return Result.error(ErrorCode.CONNECTION_UNAVAILABLE, "Interrupted during retry backoff");
            }
            Request request = Request.create(method, params, priority, timeoutMillis);
            try {
                return attempt(request, method);
            } catch (RetryableFailure e) {
                last = e.failure;
                LOG.debug("Attempt {} of {} failed: {}", attempt, method.wireName(), e.failure.getMessage());
            }
        }
        return Result.error(last);
    }

    private Result attempt(Request request, Method method) throws RetryableFailure {
        PooledConnection conn;
        try {
            conn = pool.acquire(request.getTimeoutMillis());
        } catch (DriverException e) {
            if (e.getCode() == ErrorCode.CONNECTION_UNAVAILABLE) {
                throw new RetryableFailure(e);
            }
            return Result.error(e);
        }
        RoundTripper rt = conn.roundTripper();
        boolean reusable = false;
        try {
            try {
                rt.send(Package.request(request));
            } catch (DriverException e) {
                // 编码失败时还没有写出任何字节，连接仍可复用
                reusable = true;
                return Result.error(e);
            } catch (IOException e) {
                throw new RetryableFailure(
                    DriverException.wrap(ErrorCode.CONNECTION_UNAVAILABLE, "Send failed", e));
            }
            Package response;
            try {
                response = rt.receive(request.getTimeoutMillis());
            } catch (IOException | DriverException e) {
                DriverException err = e instanceof DriverException
                    ? (DriverException) e
                    : DriverException.wrap(ErrorCode.CONNECTION_UNAVAILABLE, "Response lost", e);
                if (err.getCode() == ErrorCode.TIMEOUT) {
                    return Result.error(err);
                }
                if (method.isReadOnly()) {
                    throw new RetryableFailure(err);
                }
                return Result.error(ErrorCode.CONNECTION_UNAVAILABLE,
                    "Connection lost after sending " + method.wireName() + "; outcome unknown");
            }
            if (response.getType() == Package.Type.PROTOCOL_ERROR) {
                return Result.error(response.getErr());
            }
            if (response.getType() != Package.Type.RESULT || !request.getId().equals(response.getRequestId())) {
                return Result.error(ErrorCode.MALFORMED_FRAME,
                    "Unexpected response for request " + request.getId());
            }
            reusable = true;
            return response.getResult();
        } finally {
            pool.release(conn, reusable);
        }
    }

    /**
     * @return 等待中被中断时返回false
     */
    private boolean backoff(int retry) {
        try {
            Thread.sleep(config.backoffMillis(retry));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted during retry backoff");
            return false;
        }
    }

    @Override
    public void close() {
        pool.close();
        watchdog.shutdownNow();
    }

    /**
     * 可以换一个连接重试的失败
     */
    private static class RetryableFailure extends Exception {
        private final DriverException failure;

        RetryableFailure(DriverException cause) {
            super(cause);
            this.failure = cause;
        }
    }
}
