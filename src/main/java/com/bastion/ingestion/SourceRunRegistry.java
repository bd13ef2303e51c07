package com.bastion.ingestion;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source run lock. At most one ingestion run per data source holds the
 * lock at any time; timer ticks and manual triggers both go through it.
 */
@Component
public class SourceRunRegistry {

    private final Map<Long, Instant> running = new ConcurrentHashMap<>();

    /**
     * @return true if the caller now owns the lock for {@code sourceId}
     */
    public boolean tryAcquire(Long sourceId, Instant startedAt) {
        return running.putIfAbsent(sourceId, startedAt) == null;
    }

    public void release(Long sourceId) {
        running.remove(sourceId);
    }

    public boolean isRunning(Long sourceId) {
        return running.containsKey(sourceId);
    }

    public Set<Long> runningSourceIds() {
        return Set.copyOf(running.keySet());
    }
}
