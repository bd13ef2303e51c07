package com.bastion.ingestion;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditLevel;
import com.bastion.audit.AuditSink;
import com.bastion.classification.Classification;
import com.bastion.classification.IndicatorClassifier;
import com.bastion.domain.DataSource;
import com.bastion.domain.ResourceNotFoundException;
import com.bastion.domain.WhitelistBlock;
import com.bastion.domain.WhitelistEntry;
import com.bastion.export.BlacklistExportService;
import com.bastion.fetch.FeedFetcher;
import com.bastion.fetch.FetchFailure;
import com.bastion.fetch.FetchResult;
import com.bastion.settings.PipelineSettings;
import com.bastion.settings.SettingsService;
import com.bastion.storage.DataSourceRepository;
import com.bastion.storage.IndicatorRepository;
import com.bastion.storage.UpsertOutcome;
import com.bastion.whitelist.WhitelistMatcher;
import com.bastion.whitelist.WhitelistService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs one ingestion pass for a data source: fetch, classify, whitelist,
 * upsert.
 *
 * Scheduled ticks and manual "fetch now" requests both enter through
 * {@link #submit}. Admission is decided on the caller's thread so callers get
 * an immediate answer; the run itself executes on the ingestion pool.
 *
 * Key Responsibilities:
 * - Admission: refuse inactive, paused or already running sources. The row is
 *   re-read after the per-source lock is taken, so a pause that lands between
 *   the scheduler's read and dispatch still stops the run
 * - Fetch through {@link FeedFetcher} with a settings snapshot taken once per run
 * - Classify each line against the source's declared indicator types and
 *   collapse duplicates within the body
 * - Check candidates against the whitelist snapshot, recording a block for
 *   each match, and upsert the rest
 * - Record the outcome on the data source row, in the audit log and in
 *   {@link IngestionMetrics}
 * - Ask {@link BlacklistExportService} for regeneration when something new
 *   was stored
 *
 * A run never completes exceptionally: any failure is logged, audited and
 * written to the source's last fetch status, and the per-source lock is always
 * released when the run ends.
 *
 * @see com.bastion.scheduler.FeedScheduler
 * @see SourceRunRegistry
 */
@Service
public class IngestionWorker {

    private static final Logger log = LoggerFactory.getLogger(IngestionWorker.class);

    private final DataSourceRepository dataSourceRepository;
    private final IndicatorRepository indicatorRepository;
    private final WhitelistService whitelistService;
    private final FeedFetcher fetcher;
    private final IndicatorClassifier classifier;
    private final SettingsService settingsService;
    private final BlacklistExportService exportService;
    private final AuditSink auditSink;
    private final SourceRunRegistry runRegistry;
    private final IngestionMetrics metrics;
    private final TaskExecutor executor;
    private final Clock clock;

    public IngestionWorker(DataSourceRepository dataSourceRepository,
                           IndicatorRepository indicatorRepository,
                           WhitelistService whitelistService,
                           FeedFetcher fetcher,
                           IndicatorClassifier classifier,
                           SettingsService settingsService,
                           BlacklistExportService exportService,
                           AuditSink auditSink,
                           SourceRunRegistry runRegistry,
                           IngestionMetrics metrics,
                           @Qualifier("ingestionExecutor") TaskExecutor executor,
                           Clock clock) {
        this.dataSourceRepository = dataSourceRepository;
        this.indicatorRepository = indicatorRepository;
        this.whitelistService = whitelistService;
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.settingsService = settingsService;
        this.exportService = exportService;
        this.auditSink = auditSink;
        this.runRegistry = runRegistry;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Admit and start a run for {@code source}.
     *
     * @return a future completing with the run summary
     * @throws SourceInactiveException    if the source is inactive
     * @throws SourcePausedException      if the source is paused
     * @throws FetchInProgressException   if a run for the source is already in flight
     * @throws ResourceNotFoundException  if the source was deleted meanwhile
     * @throws RejectedExecutionException if the ingestion pool is saturated
     */
    public CompletableFuture<IngestionSummary> submit(DataSource source, IngestionTrigger trigger) {
        checkRunnable(source);
        if (!runRegistry.tryAcquire(source.getId(), clock.instant())) {
            metrics.recordRunRejected();
            throw new FetchInProgressException(source.getId(), source.getName());
        }

        final DataSource current;
        try {
            current = reload(source);
        } catch (RuntimeException e) {
            runRegistry.release(source.getId());
            throw e;
        }

        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return run(current, trigger);
                } finally {
                    runRegistry.release(current.getId());
                }
            }, executor).whenComplete((summary, error) -> {
                if (error != null) {
                    log.error("Ingestion run for {} (id={}) ended abnormally", current.getName(), current.getId(),
                        error);
                }
            });
        } catch (RejectedExecutionException e) {
            runRegistry.release(current.getId());
            metrics.recordRunRejected();
            log.warn("Ingestion pool saturated, run for {} rejected", current.getName());
            throw e;
        }
    }

    private DataSource reload(DataSource source) {
        DataSource current = dataSourceRepository.findById(source.getId())
            .orElseThrow(() -> new ResourceNotFoundException("Data source", source.getId()));
        checkRunnable(current);
        return current;
    }

    private void checkRunnable(DataSource source) {
        if (!source.isActive()) {
            metrics.recordRunRejected();
            throw new SourceInactiveException(source.getId(), source.getName());
        }
        if (source.isPaused()) {
            metrics.recordRunRejected();
            throw new SourcePausedException(source.getId(), source.getName());
        }
    }

    /**
     * Execute a run on the calling thread. The caller must hold the run lock.
     */
    IngestionSummary run(DataSource source, IngestionTrigger trigger) {
        long start = System.nanoTime();
        IngestionSummary summary = new IngestionSummary(source.getId(), source.getName(), trigger, clock.instant());
        metrics.recordRunStarted();
        log.info("Starting {} ingestion run for {} (id={})", trigger, source.getName(), source.getId());

        try {
            PipelineSettings settings = settingsService.snapshot();
            FetchResult result = fetcher.fetch(source, settings);
            metrics.recordFetch(result.getElapsed());

            if (!result.isSuccess()) {
                recordFetchFailure(source, result.getFailure(), summary);
            } else {
                try {
                    process(source, result.getBody(), settings, summary);
                } catch (RuntimeException e) {
                    log.error("Processing failed for {}", source.getName(), e);
                    recordRunFailure(source, summary, "Processing failed: " + e.getMessage(),
                        "Failed to process indicators from " + source.getName() + ": " + e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.error("Ingestion run failed for {} (id={})", source.getName(), source.getId(), e);
            recordRunFailure(source, summary, "Ingestion run failed: " + e.getMessage(),
                "Ingestion run failed for " + source.getName() + ": " + e.getMessage());
        }

        summary.finish(clock.instant());
        metrics.recordSummary(summary);
        metrics.recordRunDuration(Duration.ofNanos(System.nanoTime() - start));
        log.info("Finished ingestion run: {}", summary);
        return summary;
    }

    /**
     * Mark the run and the source as failed. Storage errors here are logged
     * only; the run still completes with the failure in its summary.
     */
    private void recordRunFailure(DataSource source, IngestionSummary summary, String error, String details) {
        summary.failed(error);
        try {
            dataSourceRepository.recordFetchFailure(source.getId(), clock.instant(), error);
        } catch (DataAccessException e) {
            log.error("Could not record failure on data source {}: {}", source.getId(), e.getMessage());
        }
        auditSink.record(AuditEvent.builder(AuditAction.FETCH, AuditEvent.RESOURCE_DATA_SOURCE)
            .level(AuditLevel.ERROR)
            .resourceId(source.getId())
            .details(details)
            .metadata("error", error)
            .metadata("url", source.getUrl())
            .build());
    }

    private void recordFetchFailure(DataSource source, FetchFailure failure, IngestionSummary summary) {
        summary.failed(failure.getMessage());
        metrics.recordFetchFailure(failure.getKind());
        dataSourceRepository.recordFetchFailure(source.getId(), clock.instant(), failure.getMessage());
        auditSink.record(AuditEvent.builder(AuditAction.FETCH, AuditEvent.RESOURCE_DATA_SOURCE)
            .level(AuditLevel.ERROR)
            .resourceId(source.getId())
            .details("Failed to fetch from " + source.getName() + ": " + failure.getMessage())
            .metadata("error", failure.getMessage())
            .metadata("url", source.getUrl())
            .metadata("kind", failure.getKind().name())
            .build());
    }

    private void process(DataSource source, String body, PipelineSettings settings, IngestionSummary summary) {
        List<String> lines = body.lines().collect(Collectors.toList());
        int bytes = body.getBytes(StandardCharsets.UTF_8).length;
        summary.fetchSucceeded(lines.size());

        dataSourceRepository.recordFetchSuccess(source.getId(), clock.instant());
        auditSink.record(AuditEvent.builder(AuditAction.FETCH, AuditEvent.RESOURCE_DATA_SOURCE)
            .resourceId(source.getId())
            .details("Fetched " + lines.size() + " lines from " + source.getName())
            .metadata("lines", lines.size())
            .metadata("bytes", bytes)
            .metadata("url", source.getUrl())
            .build());

        Set<Classification> candidates = new LinkedHashSet<>();
        for (String line : lines) {
            Optional<Classification> classified =
                classifier.classifyLine(line, source.getIndicatorTypes(), settings.isSoarUrlEnabled());
            if (classified.isPresent()) {
                candidates.add(classified.get());
            } else {
                summary.incrementDiscarded();
            }
        }
        summary.candidates(candidates.size());

        WhitelistMatcher whitelist = whitelistService.matcher();
        for (Classification candidate : candidates) {
            try {
                Optional<WhitelistEntry> match = whitelist.match(candidate.getValue(), candidate.getType());
                if (match.isPresent()) {
                    block(source, candidate, match.get());
                    summary.incrementBlocked();
                    continue;
                }

                UpsertOutcome outcome = indicatorRepository.upsert(candidate.getValue(), candidate.getType(),
                    candidate.getHashType(), source.getName(), source.getId(), clock.instant());
                if (outcome == UpsertOutcome.INSERTED) {
                    summary.incrementInserted();
                } else {
                    summary.incrementDuplicates();
                }
            } catch (DataAccessException e) {
                summary.incrementFailed();
                log.warn("Failed to store {} {} from {}: {}", candidate.getType(), candidate.getValue(),
                    source.getName(), e.getMessage());
            }
        }

        auditSink.record(AuditEvent.builder(AuditAction.FETCH, AuditEvent.RESOURCE_DATA_SOURCE)
            .resourceId(source.getId())
            .details("Successfully processed " + (summary.getInserted() + summary.getDuplicates())
                + " indicators from " + source.getName())
            .metadata(summary.toAuditMetadata())
            .build());

        if (summary.getInserted() > 0) {
            exportService.requestRegeneration();
        }
    }

    private void block(DataSource source, Classification candidate, WhitelistEntry entry) {
        Instant now = clock.instant();
        whitelistService.recordBlock(
            WhitelistBlock.forFeedCandidate(candidate.getValue(), candidate.getType(), source, entry, now));
        auditSink.record(AuditEvent.builder(AuditAction.BLOCKED, AuditEvent.RESOURCE_INDICATOR)
            .level(AuditLevel.WARNING)
            .details("Blocked whitelisted " + candidate.getType().getValue() + " " + candidate.getValue()
                + " from " + source.getName())
            .metadata("value", candidate.getValue())
            .metadata("type", candidate.getType().getValue())
            .metadata("sourceId", source.getId())
            .metadata("whitelistEntryId", entry.getId())
            .metadata("whitelistValue", entry.getValue())
            .build());
        log.debug("Blocked {} {} by whitelist entry {}", candidate.getType(), candidate.getValue(), entry.getValue());
    }
}
