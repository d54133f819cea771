package top.guoziyang.dbrpc.backend.queue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import top.guoziyang.dbrpc.transport.Priority;

/**
 * 队列统计快照
 */
public class QueueStats {

    private final int size;
    private final int maxSize;
    private final Map<Priority, Integer> perPriority;
    private final long oldestAgeMillis;
    private final long totalEnqueued;
    private final long totalDequeued;
    private final long totalRejected;
    private final long totalExpired;

    QueueStats(int size, int maxSize, EnumMap<Priority, Integer> perPriority, long oldestAgeMillis,
               long totalEnqueued, long totalDequeued, long totalRejected, long totalExpired) {
        this.size = size;
        this.maxSize = maxSize;
        this.perPriority = Collections.unmodifiableMap(perPriority);
        this.oldestAgeMillis = oldestAgeMillis;
        this.totalEnqueued = totalEnqueued;
        this.totalDequeued = totalDequeued;
        this.totalRejected = totalRejected;
        this.totalExpired = totalExpired;
    }

    public int getSize() {
        return size;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int count(Priority priority) {
        Integer n = perPriority.get(priority);
        return n == null ? 0 : n;
    }

    public long getOldestAgeMillis() {
        return oldestAgeMillis;
    }

    public long getTotalEnqueued() {
        return totalEnqueued;
    }

    public long getTotalDequeued() {
        return totalDequeued;
    }

    public long getTotalRejected() {
        return totalRejected;
    }

    public long getTotalExpired() {
        return totalExpired;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> byPriority = new LinkedHashMap<>();
        for (Priority p : Priority.values()) {
            byPriority.put(p.name(), (long) count(p));
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("size", (long) size);
        map.put("max_size", (long) maxSize);
        map.put("per_priority", byPriority);
        map.put("oldest_age_ms", oldestAgeMillis);
        map.put("total_enqueued", totalEnqueued);
        map.put("total_dequeued", totalDequeued);
        map.put("total_rejected", totalRejected);
        map.put("total_expired", totalExpired);
        return map;
    }
}
