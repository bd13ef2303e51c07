package com.bastion.scheduler;

import com.bastion.domain.DataSource;
import com.bastion.ingestion.FetchInProgressException;
import com.bastion.ingestion.IngestionTrigger;
import com.bastion.ingestion.IngestionWorker;
import com.bastion.ingestion.SourceInactiveException;
import com.bastion.ingestion.SourcePausedException;
import com.bastion.ingestion.SourceRunRegistry;
import com.bastion.storage.DataSourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

/**
 * Driver loop for feed ingestion.
 *
 * On every tick the active sources are loaded and evaluated with
 * {@link SourceState#evaluate}; the ones that come out DUE are handed to the
 * {@link IngestionWorker}. The scheduler holds no timers per source: the next
 * due time is always derived from the source row (last fetch or resume time
 * plus the fetch interval), so edits and pause/resume take effect on the next
 * tick without any re-registration.
 *
 * Key Responsibilities:
 * - Evaluate IDLE / DUE / RUNNING / PAUSED for every active source
 * - Dispatch due sources, skipping those whose run is already in flight
 * - Leave a source DUE when the worker pool is saturated so a later tick
 *   picks it up
 *
 * A tick never throws. A failure to load sources or to dispatch one source
 * is logged and the next tick tries again.
 *
 * @see SourceState
 * @see IngestionWorker#submit
 */
@Component
public class FeedScheduler {

    private static final Logger log = LoggerFactory.getLogger(FeedScheduler.class);

    private final DataSourceRepository dataSourceRepository;
    private final IngestionWorker worker;
    private final SourceRunRegistry runRegistry;
    private final Clock clock;

    public FeedScheduler(DataSourceRepository dataSourceRepository,
                         IngestionWorker worker,
                         SourceRunRegistry runRegistry,
                         Clock clock) {
        this.dataSourceRepository = dataSourceRepository;
        this.worker = worker;
        this.runRegistry = runRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${bastion.scheduler.tick-interval-ms:5000}")
    public void tick() {
        try {
            int dispatched = dispatchDueSources();
            if (dispatched > 0) {
                log.debug("Scheduler tick dispatched {} source(s)", dispatched);
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    /**
     * @return number of runs started on this tick
     */
    int dispatchDueSources() {
        List<DataSource> sources = dataSourceRepository.findActive();
        Instant now = clock.instant();
        int dispatched = 0;

        for (DataSource source : sources) {
            SourceState state = SourceState.evaluate(source, now, runRegistry.isRunning(source.getId()));
            if (state != SourceState.DUE) {
                continue;
            }
            try {
                worker.submit(source, IngestionTrigger.SCHEDULED);
                dispatched++;
            } catch (FetchInProgressException e) {
                log.debug("Skipping {}: run already in progress", source.getName());
            } catch (SourcePausedException | SourceInactiveException e) {
                log.debug("Skipping {}: {}", source.getName(), e.getMessage());
            } catch (RejectedExecutionException e) {
                log.warn("Ingestion pool saturated; {} will be retried on a later tick", source.getName());
            } catch (RuntimeException e) {
                log.error("Failed to dispatch ingestion run for {}", source.getName(), e);
            }
        }
        return dispatched;
    }
}
