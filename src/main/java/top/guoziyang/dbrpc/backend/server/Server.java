package top.guoziyang.dbrpc.backend.server;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.queue.RequestQueue;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.Error;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Encoder;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Package;
import top.guoziyang.dbrpc.transport.Packager;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;
import top.guoziyang.dbrpc.transport.Transporter;

/**
 * Server - 驱动进程的RPC服务器
 *
 * 组件关系：
 *
 *   客户端连接 ──→ HandleSocket（连接线程池）
 *                      │ RequestProcessor：登记 + 入队 + 等待
 *                      ↓
 *                 RequestQueue（优先级）
 *                      │ Dispatcher：取许可 + 出队
 *                      ↓
 *                 工作线程池 ──→ Executor ──→ DatabaseDriver
 *                      │
 *                      └──→ PendingResponseRegistry.complete ──→ 唤醒HandleSocket
 *
 * 监听：
 * Unix域套接字，启动前删除残留的套接字文件（上次进程异常退出时留下的）。
 *
 * 连接处理：
 * 每个连接一个处理线程，线程池为 核心线程 + 有界队列 + CallerRunsPolicy。
 */
public class Server {

    private static final Logger LOG = LoggerFactory.getLogger(Server.class);

    static final int MAX_CONNECTIONS = 64;

    private final DriverConfig config;
    private final RequestQueue queue;
    private final PendingResponseRegistry registry;
    private final Dispatcher dispatcher;
    private final RequestProcessor processor;
    private final ThreadPoolExecutor connections;

    private volatile boolean running;
    private ServerSocketChannel serverChannel;

    public Server(DriverConfig config, DatabaseDriver driver) {
        this.config = config;
        this.queue = new RequestQueue(config.getQueueMaxSize());
        this.registry = new PendingResponseRegistry();
        Executor executor = new Executor(driver, this::runtimeStats);
        this.dispatcher = new Dispatcher(queue, registry, executor, config.getWorkers(), config.getIdleSleepMillis(),
            driver::activeTransaction, config.getLockTimeoutMillis());
        this.processor = new RequestProcessor(queue, registry);
        this.connections = new ThreadPoolExecutor(
            MAX_CONNECTIONS, MAX_CONNECTIONS, 60L, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(100),
            new ThreadFactoryBuilder().setNameFormat("dbrpc-conn-%d").setDaemon(true).build(),
            new ThreadPoolExecutor.CallerRunsPolicy()
        );
        this.connections.allowCoreThreadTimeOut(true);
        queue.setExpirationListener(item -> {
            Request request = item.getRequest();
            if (registry.isWaiting(request.getId())) {
                registry.complete(request.getId(), RequestProcessor.timeout(request));
            }
        });
    }

    /**
     * 绑定套接字并启动调度循环，不阻塞
     */
    public synchronized void bind() throws IOException {
        Path socketPath = config.getSocketPath();
        // 删除上次运行残留的套接字文件
        Files.deleteIfExists(socketPath);
        if (socketPath.toAbsolutePath().getParent() != null) {
            Files.createDirectories(socketPath.toAbsolutePath().getParent());
        }
        serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        serverChannel.bind(UnixDomainSocketAddress.of(socketPath));
        running = true;
        dispatcher.start();
        LOG.info("Server listen to socket: {}", socketPath);
    }

    /**
     * 接受连接的主循环，直到stop被调用
     */
    public void serve() {
        try {
            while (running) {
                // 阻塞等待客户端连接
                SocketChannel channel = serverChannel.accept();
                connections.execute(new HandleSocket(channel, processor, config.getRequestTimeoutMillis()));
            }
        } catch (ClosedChannelException e) {
            LOG.debug("Server channel closed");
        } catch (IOException e) {
            if (running) {
                LOG.error("Accept loop failed", e);
            }
        }
    }

    /**
     * 绑定并在当前线程运行主循环
     */
    public void start() throws IOException {
        bind();
        serve();
    }

    /**
     * 停止服务：不再接受连接，等待进行中的请求，剩余请求以SHUTTING_DOWN结束
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        processor.shutdown();
        try {
            serverChannel.close();
        } catch (IOException e) {
            LOG.warn("Failed to close server channel", e);
        }
        dispatcher.stop();
        registry.failAll(Result.error(Error.ShuttingDownException));
        connections.shutdownNow();
        try {
            Files.deleteIfExists(config.getSocketPath());
        } catch (IOException e) {
            LOG.warn("Failed to remove socket file {}", config.getSocketPath(), e);
        }
        LOG.info("Server stopped");
    }

    private Map<String, Object> runtimeStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("queue", queue.stats().toMap());
        stats.put("pending", (long) registry.size());
        stats.put("late_results", registry.lateResults());
        stats.put("workers", (long) config.getWorkers());
        stats.put("connections", (long) connections.getActiveCount());
        return stats;
    }
}

/**
 * 客户端连接处理器 - 一个连接一个实例，在连接线程池中运行
 *
 * 同一连接上的请求是串行的：读一个请求、等它的结果、写回、再读下一个。
 * 并发来自多个连接（客户端连接池）。
 *
 * 错误处理：
 * - 未知方法：回PROTOCOL_ERROR，连接继续使用
 * - 帧格式错误：回PROTOCOL_ERROR（不关联任何请求），然后关闭连接
 * - 对端关闭或IO错误：直接关闭
 */
class HandleSocket implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(HandleSocket.class);

    private final SocketChannel channel;
    private final RequestProcessor processor;
    private final long defaultTimeoutMillis;

    HandleSocket(SocketChannel channel, RequestProcessor processor, long defaultTimeoutMillis) {
        this.channel = channel;
        this.processor = processor;
        this.defaultTimeoutMillis = defaultTimeoutMillis;
    }

    @Override
    public void run() {
        LOG.debug("Establish connection: {}", channel);
        Packager packager = new Packager(new Transporter(channel), new Encoder(defaultTimeoutMillis));
        try {
            serve(packager);
        } finally {
            try {
                packager.close();
            } catch (IOException e) {
                LOG.warn("Failed to close connection", e);
            }
        }
    }

    private void serve(Packager packager) {
        while (true) {
            Package pkg;
            try {
                pkg = packager.receive();
            } catch (DriverException e) {
                if (e.getCode() == ErrorCode.MALFORMED_FRAME) {
                    LOG.warn("Malformed frame, closing connection: {}", e.getMessage());
                    trySend(packager, Package.protocolError(null, e));
                }
                return;
            } catch (IOException e) {
                LOG.debug("Connection dropped: {}", e.getMessage());
                return;
            }

            if (pkg.getType() != Package.Type.REQUEST) {
                trySend(packager, Package.protocolError(pkg.getRequestId(),
                    DriverException.of(ErrorCode.MALFORMED_FRAME, "Expected a request package")));
                return;
            }
            Request request = pkg.getRequest();
            if (Method.of(request.getMethod()) == null) {
                LOG.warn("Unknown method {} in request {}", request.getMethod(), request.getId());
                if (!trySend(packager, Package.protocolError(request.getId(),
                    DriverException.of(ErrorCode.UNKNOWN_METHOD, "Unknown method: " + request.getMethod())))) {
                    return;
                }
                continue;
            }

            Result result = processor.process(request);
            if (!sendResult(packager, request, result)) {
                return;
            }
        }
    }

    private boolean sendResult(Packager packager, Request request, Result result) {
        try {
            packager.send(Package.result(request.getId(), result));
            return true;
        } catch (DriverException e) {
            // 结果本身无法编码（过大或含不支持的类型），改为发送错误结果
            LOG.warn("Cannot encode result of {}: {}", request, e.getMessage());
            return trySend(packager, Package.result(request.getId(),
                Result.error(ErrorCode.INTERNAL_ERROR, "Result cannot be sent: " + e.getMessage())));
        } catch (IOException e) {
            LOG.warn("Failed to send result of {}: {}", request, e.getMessage());
            return false;
        }
    }

    private boolean trySend(Packager packager, Package pkg) {
        try {
            packager.send(pkg);
            return true;
        } catch (IOException | DriverException e) {
            LOG.warn("Failed to send package: {}", e.getMessage());
            return false;
        }
    }
}
