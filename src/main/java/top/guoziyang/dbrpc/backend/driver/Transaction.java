package top.guoziyang.dbrpc.backend.driver;

import java.util.UUID;

/**
 * 事务 - 连接通道的一次独占
 *
 * 状态转换：
 *     begin()
 *        ↓
 *   ┌─────────┐    commit()     ┌───────────┐
 *   │ ACTIVE  ├─────────────────→ COMMITTED │
 *   └────┬────┘                 └───────────┘
 *        │       rollback()     ┌─────────────┐
 *        └──────────────────────→ ROLLED_BACK │
 *                               └─────────────┘
 *
 * ID形如 tx-&lt;uuid&gt;，不会复用。状态由TransactionManagerImpl在通道锁内修改。
 */
public class Transaction {

    public enum State {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }

    private final String id;
    private final long createdAt;
    private volatile long lastUsedAt;
    private volatile State state;

    Transaction() {
        this.id = "tx-" + UUID.randomUUID();
        this.createdAt = System.currentTimeMillis();
        this.lastUsedAt = createdAt;
        this.state = State.ACTIVE;
    }

    public String getId() {
        return id;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastUsedAt() {
        return lastUsedAt;
    }

    public State getState() {
        return state;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    void touch() {
        lastUsedAt = System.currentTimeMillis();
    }

    void finish(State state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "Transaction{" + id + ", " + state + "}";
    }
}
