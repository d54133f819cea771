package top.guoziyang.dbrpc.client;

import java.io.IOException;
import java.util.Collections;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Package;
import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Request;

/**
 * 连接池中的一个连接，记录上次归还的时间用于健康检查
 */
class PooledConnection {

    private final RoundTripper rt;
    private volatile long lastUsedAt;

    PooledConnection(RoundTripper rt) {
        this.rt = rt;
        this.lastUsedAt = System.currentTimeMillis();
    }

    RoundTripper roundTripper() {
        return rt;
    }

    long idleMillis(long now) {
        return now - lastUsedAt;
    }

    void touch() {
        lastUsedAt = System.currentTimeMillis();
    }

    boolean isOpen() {
        return rt.isOpen();
    }

    /**
     * 用health_check探测连接是否还能用
     */
    boolean ping(long timeoutMillis) {
        Request request = Request.create(Method.HEALTH_CHECK, Collections.<String, Object>emptyMap(),
            Priority.HIGH, timeoutMillis);
        try {
            rt.send(Package.request(request));
            Package response = rt.receive(timeoutMillis);
            boolean ok = response.getType() == Package.Type.RESULT
                && request.getId().equals(response.getRequestId())
                && !response.getResult().isError();
            if (ok) {
                touch();
            }
            return ok;
        } catch (IOException | DriverException e) {
            return false;
        }
    }

    void close() {
        rt.closeQuietly();
    }
}
