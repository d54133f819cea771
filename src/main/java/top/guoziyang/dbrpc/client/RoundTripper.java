package top.guoziyang.dbrpc.client;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Package;
import top.guoziyang.dbrpc.transport.Packager;

/**
 * 往返通信处理器 - 一个连接上的请求-响应
 *
 * 同一连接上严格一发一收，调用方（连接池）保证同一时刻只有一个线程在用。
 *
 * 看门狗：
 * 发送之后在共享的调度线程上登记一个任务，timeout + grace 之后仍未收到响应
 * 就直接关闭连接。阻塞在receive上的线程因此醒来，得到TIMEOUT。
 * 超时的连接不会再被复用，迟到的响应不会串到下一个请求上。
 *
 * 发送和接收分成两步，客户端据此判断失败发生在"请求已发出"之前还是之后。
 */
class RoundTripper {

    private static final Logger LOG = LoggerFactory.getLogger(RoundTripper.class);

    private final Packager packager;
    private final ScheduledExecutorService watchdog;
    private final long graceMillis;

    RoundTripper(Packager packager, ScheduledExecutorService watchdog, long graceMillis) {
        this.packager = packager;
        this.watchdog = watchdog;
        this.graceMillis = graceMillis;
    }

    void send(Package pkg) throws IOException {
        packager.send(pkg);
    }

    /**
     * 等待下一帧响应
     *
     * @throws DriverException TIMEOUT，看门狗关闭了连接
     * @throws IOException 连接断开
     */
    Package receive(long timeoutMillis) throws IOException {
        AtomicBoolean fired = new AtomicBoolean(false);
        ScheduledFuture<?> task = watchdog.schedule(() -> {
            fired.set(true);
            LOG.warn("No response within {} ms, closing connection", timeoutMillis + graceMillis);
            closeQuietly();
        }, timeoutMillis + graceMillis, TimeUnit.MILLISECONDS);
        try {
            return packager.receive();
        } catch (IOException | DriverException e) {
            if (fired.get()) {
                throw new DriverException(ErrorCode.TIMEOUT, "No response within " + timeoutMillis + " ms", e);
            }
            throw e;
        } finally {
            task.cancel(false);
        }
    }

    boolean isOpen() {
        return packager.isOpen();
    }

    void close() throws IOException {
        packager.close();
    }

    void closeQuietly() {
        try {
            packager.close();
        } catch (IOException e) {
            LOG.debug("Close failed: {}", e.getMessage());
        }
    }
}
