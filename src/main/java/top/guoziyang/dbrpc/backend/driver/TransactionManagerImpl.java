package top.guoziyang.dbrpc.backend.driver;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * TransactionManagerImpl - 连接通道的具体实现
 *
 * 同步结构：
 * - connLock：公平的ReentrantLock，执行任何语句时都持有，
 *   等待的工作线程按到达顺序获得连接
 * - released：事务结束时signalAll，唤醒等待通道的非事务请求和begin
 * - activeTx：当前持有通道的事务，只在connLock内写，activeTransaction()无锁读取
 *
 * 等待逻辑（非事务请求）：
 * ┌───────────────┐  activeTx == null   ┌────────┐
 * │ tryLock(剩余) ├────────────────────→│ 执行   │
 * └──────┬────────┘                     └────────┘
 *        │ activeTx != null
 *        ↓
 *   released.awaitNanos(剩余)：剩余时间耗尽 → LOCK_TIMEOUT
 *
 * 事务请求（txId != null）不等待：txId必须正是当前activeTx，
 * 否则立即返回TRANSACTION_NOT_FOUND。
 */
public class TransactionManagerImpl implements TransactionManager {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionManagerImpl.class);

    private final Connection conn;
    private final long lockTimeoutMillis;
    private final long idleTimeoutMillis;

    private final ReentrantLock connLock = new ReentrantLock(true);
    private final Condition released = connLock.newCondition();

    private volatile Transaction activeTx;

    TransactionManagerImpl(Connection conn, long lockTimeoutMillis, long idleTimeoutMillis) {
        this.conn = conn;
        this.lockTimeoutMillis = lockTimeoutMillis;
        this.idleTimeoutMillis = idleTimeoutMillis;
    }

    @Override
    public <T> T withConnection(String txId, ConnectionWork<T> work) throws SQLException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockTimeoutMillis);
        acquire(deadline);
        try {
            if (txId != null) {
                Transaction tx = owned(txId);
                try {
                    return work.run(conn);
                } finally {
                    tx.touch();
                }
            }
            awaitFreeLane(deadline);
            return work.run(conn);
        } finally {
            connLock.unlock();
        }
    }

    @Override
    public String begin() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockTimeoutMillis);
        acquire(deadline);
        try {
            awaitFreeLane(deadline);
            try {
                conn.setAutoCommit(false);
            } catch (SQLException e) {
                throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Failed to begin transaction", e);
            }
            activeTx = new Transaction();
            LOG.debug("Transaction {} started", activeTx.getId());
            return activeTx.getId();
        } finally {
            connLock.unlock();
        }
    }

    @Override
    public void commit(String txId) {
        finish(txId, true);
    }

    @Override
    public void rollback(String txId) {
        finish(txId, false);
    }

    private void finish(String txId, boolean commit) {
        if (txId == null) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "transaction_id parameter is required");
        }
        acquire(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockTimeoutMillis));
        try {
            Transaction tx = owned(txId);
            end(tx, commit);
        } finally {
            connLock.unlock();
        }
    }

    // 调用方必须持有connLock
    private void end(Transaction tx, boolean commit) {
        try {
            if (commit) {
                conn.commit();
            } else {
                conn.rollback();
            }
            tx.finish(commit ? Transaction.State.COMMITTED : Transaction.State.ROLLED_BACK);
        } catch (SQLException e) {
            if (commit) {
                // 提交失败时撤销，通道不能停留在半完成的事务里
                rollbackQuietly(tx);
            }
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR,
                (commit ? "Commit" : "Rollback") + " failed for " + tx.getId(), e);
        } finally {
            release(tx);
        }
        LOG.debug("Transaction {} {}", tx.getId(), tx.getState());
    }

    private void rollbackQuietly(Transaction tx) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.error("Rollback after failed commit of {} failed", tx.getId(), e);
        }
        tx.finish(Transaction.State.ROLLED_BACK);
    }

    private void release(Transaction tx) {
        activeTx = null;
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.error("Failed to restore autocommit after {}", tx.getId(), e);
        }
        released.signalAll();
    }

    @Override
    public String activeTransaction() {
        // 调度线程会频繁调用，不能等正在执行的语句释放connLock
        Transaction tx = activeTx;
        return tx == null ? null : tx.getId();
    }

    @Override
    public boolean reapIdle() {
        // 正在执行语句说明事务并不空闲，本轮跳过
        if (!connLock.tryLock()) {
            return false;
        }
        try {
            Transaction tx = activeTx;
            if (tx == null || System.currentTimeMillis() - tx.getLastUsedAt() < idleTimeoutMillis) {
                return false;
            }
            LOG.warn("Rolling back {} after {} ms idle", tx.getId(), idleTimeoutMillis);
            end(tx, false);
            return true;
        } finally {
            connLock.unlock();
        }
    }

    @Override
    public void close() {
        connLock.lock();
        try {
            if (activeTx != null) {
                LOG.warn("Closing with active {}, rolling back", activeTx.getId());
                end(activeTx, false);
            }
        } catch (DriverException e) {
            LOG.error("Rollback on close failed", e);
        } finally {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.error("Failed to close database connection", e);
            }
            connLock.unlock();
        }
    }

    private void acquire(long deadline) {
        try {
            if (!connLock.tryLock(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
                throw lockTimeout();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DriverException.of(ErrorCode.SHUTTING_DOWN, "Interrupted while waiting for the connection");
        }
    }

    // 调用方必须持有connLock
    private void awaitFreeLane(long deadline) {
        try {
            while (activeTx != null) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw lockTimeout();
                }
                released.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DriverException.of(ErrorCode.SHUTTING_DOWN, "Interrupted while waiting for the connection");
        }
    }

    // 调用方必须持有connLock
    private Transaction owned(String txId) {
        Transaction tx = activeTx;
        if (tx == null || !tx.getId().equals(txId)) {
            throw DriverException.of(ErrorCode.TRANSACTION_NOT_FOUND, "Transaction not found: " + txId);
        }
        return tx;
    }

    private DriverException lockTimeout() {
        String holder = activeTx == null ? "another statement" : activeTx.getId();
        return DriverException.of(ErrorCode.LOCK_TIMEOUT,
            "Connection busy (" + holder + ") for more than " + lockTimeoutMillis + " ms");
    }
}
