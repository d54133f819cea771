package top.guoziyang.dbrpc.client;

import java.util.Map;

import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.server.Executor;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 进程内客户端 - 不经过套接字和请求队列，直接在调用线程上执行
 *
 * 供工具和测试使用。优先级和超时只记录在请求上，不参与调度；
 * 等待连接通道的时间仍受驱动的锁超时限制。
 * close不会关闭驱动，驱动的生命周期由创建者负责。
 */
public class EmbeddedClient implements DatabaseApi {

    private final Executor executor;
    private final long defaultTimeoutMillis;

    public EmbeddedClient(DatabaseDriver driver) {
        this(driver, ClientConfig.DEFAULT_TIMEOUT_MILLIS);
    }

    public EmbeddedClient(DatabaseDriver driver, long defaultTimeoutMillis) {
        this.executor = new Executor(driver, null);
        this.defaultTimeoutMillis = defaultTimeoutMillis;
    }

    @Override
    public Result call(Method method, Map<String, Object> params, Priority priority, long timeoutMillis) {
        return executor.execute(Request.create(method, params, priority, timeoutMillis));
    }

    @Override
    public Result call(Method method, Map<String, Object> params, Priority priority) {
        return call(method, params, priority, defaultTimeoutMillis);
    }

    @Override
    public void close() {
    }
}
