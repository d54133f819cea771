package top.guoziyang.dbrpc.client;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Encoder;
import top.guoziyang.dbrpc.transport.Packager;
import top.guoziyang.dbrpc.transport.Transporter;

/**
 * 连接池 - 最多poolSize个到驱动进程的连接
 *
 * 借出：
 * 1. 拿一个许可，拿不到则等待，超时返回CONNECTION_UNAVAILABLE
 * 2. 优先复用空闲连接；连接已关闭，或空闲太久且ping不通，则丢弃
 * 3. 没有可用的空闲连接时新建
 *
 * 归还：
 * 正常完成的连接放回空闲队列；出过错（超时、协议错误、读写失败）的连接直接关闭，
 * 连接上的帧边界已经不可信了。
 */
class ConnectionPool {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    private static final long PING_TIMEOUT_MILLIS = 1_000L;

    private final ClientConfig config;
    private final ScheduledExecutorService watchdog;
    private final Semaphore permits;
    private final Deque<PooledConnection> idle = new ArrayDeque<>();
    private boolean closed;

    ConnectionPool(ClientConfig config, ScheduledExecutorService watchdog) {
        this.config = config;
        this.watchdog = watchdog;
        this.permits = new Semaphore(config.getPoolSize(), true);
    }

    PooledConnection acquire(long waitMillis) {
        try {
            if (!permits.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                throw DriverException.of(ErrorCode.CONNECTION_UNAVAILABLE,
                    "No pooled connection free within " + waitMillis + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DriverException.wrap(ErrorCode.CONNECTION_UNAVAILABLE, "Interrupted waiting for a connection", e);
        }
        try {
            PooledConnection conn;
            while ((conn = pollIdle()) != null) {
                if (healthy(conn)) {
                    return conn;
                }
                conn.close();
            }
            return open();
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    void release(PooledConnection conn, boolean reusable) {
        try {
            if (reusable && conn.isOpen()) {
                conn.touch();
                synchronized (this) {
                    if (!closed) {
                        idle.push(conn);
                        return;
                    }
                }
            }
            conn.close();
        } finally {
            permits.release();
        }
    }

    synchronized int idleCount() {
        return idle.size();
    }

    void close() {
        List<PooledConnection> toClose;
        synchronized (this) {
            closed = true;
            toClose = new ArrayList<>(idle);
            idle.clear();
        }
        for (PooledConnection conn : toClose) {
            conn.close();
        }
    }

    private synchronized PooledConnection pollIdle() {
        if (closed) {
            throw DriverException.of(ErrorCode.CONNECTION_UNAVAILABLE, "Client is closed");
        }
        return idle.poll();
    }

    private boolean healthy(PooledConnection conn) {
        if (!conn.isOpen()) {
            return false;
        }
        if (conn.idleMillis(System.currentTimeMillis()) <= config.getHealthCheckIdleMillis()) {
            return true;
        }
        boolean ok = conn.ping(PING_TIMEOUT_MILLIS);
        if (!ok) {
            LOG.info("Discarding idle connection that failed health check");
        }
        return ok;
    }

    private PooledConnection open() {
        try {
            Transporter transporter = Transporter.connect(config.getSocketPath());
            Packager packager = new Packager(transporter, new Encoder(config.getTimeoutMillis()));
            return new PooledConnection(new RoundTripper(packager, watchdog, config.getGraceMillis()));
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.CONNECTION_UNAVAILABLE,
                "Cannot connect to " + config.getSocketPath(), e);
        }
    }
}
