package top.guoziyang.dbrpc.client;

import java.nio.file.Path;

import com.google.common.base.Preconditions;

/**
 * 客户端配置
 *
 * 默认值：
 * - 连接池4个连接
 * - 单次调用超时30秒，看门狗在超时之后再多等2秒
 * - 连接失败最多尝试3次，退避从100ms开始翻倍，上限2秒
 * - 空闲超过30秒的连接在借出前先ping一次
 */
public class ClientConfig {

    public static final int DEFAULT_POOL_SIZE = 4;
    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BACKOFF_INITIAL_MILLIS = 100L;
    public static final long DEFAULT_BACKOFF_MAX_MILLIS = 2_000L;
    public static final long DEFAULT_HEALTH_CHECK_IDLE_MILLIS = 30_000L;
    public static final long DEFAULT_GRACE_MILLIS = 2_000L;

    private final Path socketPath;
    private int poolSize = DEFAULT_POOL_SIZE;
    private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private long backoffInitialMillis = DEFAULT_BACKOFF_INITIAL_MILLIS;
    private long backoffMaxMillis = DEFAULT_BACKOFF_MAX_MILLIS;
    private long healthCheckIdleMillis = DEFAULT_HEALTH_CHECK_IDLE_MILLIS;
    private long graceMillis = DEFAULT_GRACE_MILLIS;

    public ClientConfig(Path socketPath) {
        this.socketPath = Preconditions.checkNotNull(socketPath, "socket path");
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public ClientConfig setPoolSize(int poolSize) {
        Preconditions.checkArgument(poolSize > 0, "pool size must be positive");
        this.poolSize = poolSize;
        return this;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public ClientConfig setTimeoutMillis(long timeoutMillis) {
        Preconditions.checkArgument(timeoutMillis > 0, "timeout must be positive");
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public ClientConfig setMaxAttempts(int maxAttempts) {
        Preconditions.checkArgument(maxAttempts > 0, "attempts must be positive");
        this.maxAttempts = maxAttempts;
        return this;
    }

    public long getBackoffInitialMillis() {
        return backoffInitialMillis;
    }

    public ClientConfig setBackoffInitialMillis(long backoffInitialMillis) {
        this.backoffInitialMillis = backoffInitialMillis;
        return this;
    }

    public long getBackoffMaxMillis() {
        return backoffMaxMillis;
    }

    public ClientConfig setBackoffMaxMillis(long backoffMaxMillis) {
        this.backoffMaxMillis = backoffMaxMillis;
        return this;
    }

    public long getHealthCheckIdleMillis() {
        return healthCheckIdleMillis;
    }

    public ClientConfig setHealthCheckIdleMillis(long healthCheckIdleMillis) {
        this.healthCheckIdleMillis = healthCheckIdleMillis;
        return this;
    }

    public long getGraceMillis() {
        return graceMillis;
    }

    public ClientConfig setGraceMillis(long graceMillis) {
        this.graceMillis = graceMillis;
        return this;
    }

    /**
     * 第attempt次重试前的等待时间（attempt从1开始）
     */
    long backoffMillis(int attempt) {
        long delay = backoffInitialMillis;
        for (int i = 1; i < attempt && delay < backoffMaxMillis; i++) {
            delay *= 2;
        }
        return Math.min(delay, backoffMaxMillis);
    }
}
