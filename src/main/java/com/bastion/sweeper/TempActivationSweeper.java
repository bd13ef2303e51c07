package com.bastion.sweeper;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditSink;
import com.bastion.storage.IndicatorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Removes indicators whose temporary activation has expired.
 *
 * Rows are deleted one at a time, re-checking the expiry in the delete
 * itself, and a cleanup audit entry is written only for a row this sweep
 * actually removed. A failure on one row is logged and the sweep moves on.
 */
@Component
public class TempActivationSweeper {

    private static final Logger log = LoggerFactory.getLogger(TempActivationSweeper.class);

    private final IndicatorRepository indicatorRepository;
    private final AuditSink auditSink;
    private final SweeperMetrics metrics;
    private final Clock clock;

    public TempActivationSweeper(IndicatorRepository indicatorRepository,
                                 AuditSink auditSink,
                                 SweeperMetrics metrics,
                                 Clock clock) {
        this.indicatorRepository = indicatorRepository;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${bastion.sweeper.interval-ms:60000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Temporary activation sweep failed", e);
        }
    }

    /**
     * @return number of indicators removed
     */
    public int sweep() {
        long start = System.nanoTime();
        Instant now = clock.instant();
        List<Long> expired = indicatorRepository.findExpiredTempActivationIds(now);

        int removed = 0;
        int failed = 0;
        for (Long id : expired) {
            try {
                if (indicatorRepository.deleteExpired(id, now) == 1) {
                    removed++;
                    auditSink.record(AuditEvent.builder(AuditAction.CLEANUP, AuditEvent.RESOURCE_INDICATOR)
                        .resourceId(id)
                        .details("Removed indicator after temporary activation expired")
                        .build());
                }
            } catch (DataAccessException e) {
                failed++;
                log.warn("Failed to remove expired indicator {}: {}", id, e.getMessage());
            }
        }

        metrics.recordSweep(removed, failed, Duration.ofNanos(System.nanoTime() - start));
        if (removed > 0 || failed > 0) {
            log.info("Temporary activation sweep: removed={}, failed={}", removed, failed);
        }
        return removed;
    }
}
