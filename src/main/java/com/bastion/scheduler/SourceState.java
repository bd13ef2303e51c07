package com.bastion.scheduler;

import com.bastion.domain.DataSource;

import java.time.Duration;
import java.time.Instant;

/**
 * Scheduling state of a data source at a point in time.
 *
 * <pre>
 * IDLE --(interval elapsed)--> DUE --(dispatched)--> RUNNING --(run ends)--> IDLE
 *   any --(pause)--> PAUSED --(resume, anchor = now)--> IDLE
 * </pre>
 */
public enum SourceState {

    IDLE,

    DUE,

    RUNNING,

    PAUSED;

    /**
     * Derive the state of {@code source} at {@code now}.
     *
     * A run already in flight wins over pause, since pausing never interrupts
     * it. A source that has never run and never been resumed is due at once.
     *
     * @param running whether the per-source run lock is currently held
     */
    public static SourceState evaluate(DataSource source, Instant now, boolean running) {
        if (running) {
            return RUNNING;
        }
        if (source.isPaused()) {
            return PAUSED;
        }
        Instant anchor = source.schedulingAnchor();
        if (anchor == null) {
            return DUE;
        }
        Duration elapsed = Duration.between(anchor, now);
        return elapsed.getSeconds() >= source.getFetchInterval() ? DUE : IDLE;
    }
}
