package top.guoziyang.dbrpc.backend.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.google.common.base.Preconditions;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 驱动进程配置
 *
 * 取值优先级（后者覆盖前者）：
 * 1. 代码里的默认值
 * 2. properties文件（Launcher的 -config 选项）
 * 3. 命令行选项
 *
 * properties文件的key：
 * - dbrpc.database       数据库文件路径
 * - dbrpc.socket         Unix域套接字路径
 * - dbrpc.workers        工作线程数
 * - dbrpc.queue.max      请求队列上限
 * - dbrpc.timeout.ms     默认请求超时
 * - dbrpc.lock.timeout.ms 等待连接通道的超时
 * - dbrpc.tx.idle.ms     事务空闲多久后被自动回滚
 * - dbrpc.idle.sleep.ms  调度循环空转时的休眠时间
 * - dbrpc.backup.dir     sync_schema的默认备份目录
 * - dbrpc.log.file       日志文件
 */
public class DriverConfig {

    public static final int DEFAULT_WORKERS = 10;
    public static final int DEFAULT_QUEUE_MAX = 1000;
    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000L;
    public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 30_000L;
    public static final long DEFAULT_TX_IDLE_MILLIS = 300_000L;
    public static final long DEFAULT_IDLE_SLEEP_MILLIS = 5L;

    private Path databasePath;
    private Path socketPath;
    private int workers = DEFAULT_WORKERS;
    private int queueMaxSize = DEFAULT_QUEUE_MAX;
    private long requestTimeoutMillis = DEFAULT_TIMEOUT_MILLIS;
    private long lockTimeoutMillis = DEFAULT_LOCK_TIMEOUT_MILLIS;
    private long transactionIdleTimeoutMillis = DEFAULT_TX_IDLE_MILLIS;
    private long idleSleepMillis = DEFAULT_IDLE_SLEEP_MILLIS;
    private Path backupDir;
    private Path logFile;

    /**
     * 从properties文件加载配置，文件里没有的key保持默认值
     */
    public static DriverConfig load(Path propertiesFile) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.INVALID_PARAMS, "Cannot read config " + propertiesFile, e);
        }
        DriverConfig config = new DriverConfig();
        config.apply(props);
        return config;
    }

    public DriverConfig apply(Properties props) {
        String value = props.getProperty("dbrpc.database");
        if (value != null) {
            databasePath = Path.of(value.trim());
        }
        value = props.getProperty("dbrpc.socket");
        if (value != null) {
            socketPath = Path.of(value.trim());
        }
        value = props.getProperty("dbrpc.backup.dir");
        if (value != null) {
            backupDir = Path.of(value.trim());
        }
        value = props.getProperty("dbrpc.log.file");
        if (value != null) {
            logFile = Path.of(value.trim());
        }
        workers = intNumber(props, "dbrpc.workers", workers);
        queueMaxSize = intNumber(props, "dbrpc.queue.max", queueMaxSize);
        requestTimeoutMillis = number(props, "dbrpc.timeout.ms", requestTimeoutMillis);
        lockTimeoutMillis = number(props, "dbrpc.lock.timeout.ms", lockTimeoutMillis);
        transactionIdleTimeoutMillis = number(props, "dbrpc.tx.idle.ms", transactionIdleTimeoutMillis);
        idleSleepMillis = number(props, "dbrpc.idle.sleep.ms", idleSleepMillis);
        return this;
    }

    private static int intNumber(Properties props, String key, int defaultValue) {
        long value = number(props, key, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, key + " is out of range: " + value);
        }
    }

    private static long number(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, key + " must be a number: " + value);
        }
    }

    /**
     * 启动前的完整性检查
     */
    public void validate() {
        Preconditions.checkState(databasePath != null, "database path is required");
        Preconditions.checkState(socketPath != null, "socket path is required");
        Preconditions.checkState(workers > 0, "workers must be positive");
        Preconditions.checkState(queueMaxSize > 0, "queue size must be positive");
        Preconditions.checkState(requestTimeoutMillis > 0, "request timeout must be positive");
        Preconditions.checkState(lockTimeoutMillis > 0, "lock timeout must be positive");
        Preconditions.checkState(transactionIdleTimeoutMillis > 0, "transaction idle timeout must be positive");
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public DriverConfig setDatabasePath(Path databasePath) {
        this.databasePath = databasePath;
        return this;
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public DriverConfig setSocketPath(Path socketPath) {
        this.socketPath = socketPath;
        return this;
    }

    public int getWorkers() {
        return workers;
    }

    public DriverConfig setWorkers(int workers) {
        this.workers = workers;
        return this;
    }

    public int getQueueMaxSize() {
        return queueMaxSize;
    }

    public DriverConfig setQueueMaxSize(int queueMaxSize) {
        this.queueMaxSize = queueMaxSize;
        return this;
    }

    public long getRequestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    public DriverConfig setRequestTimeoutMillis(long requestTimeoutMillis) {
        this.requestTimeoutMillis = requestTimeoutMillis;
        return this;
    }

    public long getLockTimeoutMillis() {
        return lockTimeoutMillis;
    }

    public DriverConfig setLockTimeoutMillis(long lockTimeoutMillis) {
        this.lockTimeoutMillis = lockTimeoutMillis;
        return this;
    }

    public long getTransactionIdleTimeoutMillis() {
        return transactionIdleTimeoutMillis;
    }

    public DriverConfig setTransactionIdleTimeoutMillis(long transactionIdleTimeoutMillis) {
        this.transactionIdleTimeoutMillis = transactionIdleTimeoutMillis;
        return this;
    }

    public long getIdleSleepMillis() {
        return idleSleepMillis;
    }

    public DriverConfig setIdleSleepMillis(long idleSleepMillis) {
        this.idleSleepMillis = idleSleepMillis;
        return this;
    }

    /**
     * 未配置时为数据库文件所在目录下的 backups
     */
    public Path getBackupDir() {
        if (backupDir != null) {
            return backupDir;
        }
        Path parent = databasePath == null ? null : databasePath.toAbsolutePath().getParent();
        return parent == null ? Path.of("backups") : parent.resolve("backups");
    }

    public DriverConfig setBackupDir(Path backupDir) {
        this.backupDir = backupDir;
        return this;
    }

    public Path getLogFile() {
        return logFile;
    }

    public DriverConfig setLogFile(Path logFile) {
        this.logFile = logFile;
        return this;
    }
}
