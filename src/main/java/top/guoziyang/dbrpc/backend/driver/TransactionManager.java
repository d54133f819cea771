package top.guoziyang.dbrpc.backend.driver;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * TransactionManager - 唯一数据库连接的"通道"管理器
 *
 * 驱动进程只有一个JDBC连接，但工作线程有多个。这里保证：
 * 1. 任意时刻只有一个线程在这个连接上执行语句
 * 2. 有活跃事务时，只有携带该事务ID的请求能使用连接，
 *    其他请求排队等待事务结束，最多等待lockTimeout（超时返回LOCK_TIMEOUT）
 * 3. 同一时刻最多一个活跃事务，不同事务的语句绝不交错
 * 4. 空闲超过transactionIdleTimeout的事务被自动回滚，释放通道
 *
 * 与多连接数据库驱动的区别：
 * 这里没有真正的并发事务，begin_transaction本身也要排队等待通道空闲，
 * 换来的是对单连接存储（SQLite）没有任何隐式交错。
 */
public interface TransactionManager {

    /**
     * 在通道上执行一段操作
     *
     * @param txId 事务ID，null表示非事务操作（自动提交）
     * @throws SQLException 操作本身的数据库错误，由调用方补充上下文后包装
     * @throws top.guoziyang.dbrpc.common.DriverException TRANSACTION_NOT_FOUND / LOCK_TIMEOUT
     */
    <T> T withConnection(String txId, ConnectionWork<T> work) throws SQLException;

    /**
     * 开启事务，等待通道空闲后独占
     *
     * @return 新事务ID
     */
    String begin();

    void commit(String txId);

    void rollback(String txId);

    /**
     * @return 当前活跃事务ID，没有时为null
     */
    String activeTransaction();

    /**
     * 回滚空闲超时的事务
     *
     * @return 是否回滚了事务
     */
    boolean reapIdle();

    /**
     * 回滚活跃事务并关闭连接
     */
    void close();

    public static TransactionManager create(Connection conn, long lockTimeoutMillis, long idleTimeoutMillis) {
        return new TransactionManagerImpl(conn, lockTimeoutMillis, idleTimeoutMillis);
    }
}
