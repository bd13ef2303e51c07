package com.bastion.ingestion;

import com.bastion.fetch.FetchFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Metrics for feed ingestion runs.
 *
 * Tracks:
 * - Runs started, rejected (paused, inactive, already running) and failed
 * - Fetch latency and fetch failures by kind
 * - Candidate outcomes: inserted, duplicate, blocked, discarded, failed
 */
@Component
public class IngestionMetrics {

    private final MeterRegistry registry;
    private final Counter runsStarted;
    private final Counter runsRejected;
    private final Counter inserted;
    private final Counter duplicates;
    private final Counter blocked;
    private final Counter discarded;
    private final Counter storeFailures;
    private final Timer fetchLatency;
    private final Timer runLatency;

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runsStarted = Counter.builder("bastion.ingestion.runs")
            .description("Number of ingestion runs started")
            .tag("component", "ingestion")
            .register(registry);

        this.runsRejected = Counter.builder("bastion.ingestion.runs.rejected")
            .description("Run requests rejected because the source was paused, inactive or busy")
            .tag("component", "ingestion")
            .register(registry);

        this.inserted = Counter.builder("bastion.ingestion.indicators.inserted")
            .description("New indicators created by ingestion")
            .tag("component", "ingestion")
            .register(registry);

        this.duplicates = Counter.builder("bastion.ingestion.indicators.duplicate")
            .description("Candidates that already existed and were refreshed")
            .tag("component", "ingestion")
            .register(registry);

        this.blocked = Counter.builder("bastion.ingestion.indicators.blocked")
            .description("Candidates rejected by the whitelist")
            .tag("component", "ingestion")
            .register(registry);

        this.discarded = Counter.builder("bastion.ingestion.lines.discarded")
            .description("Feed lines that were blank, comments or unrecognised")
            .tag("component", "ingestion")
            .register(registry);

        this.storeFailures = Counter.builder("bastion.ingestion.indicators.failed")
            .description("Candidates that could not be written to the store")
            .tag("component", "ingestion")
            .register(registry);

        this.fetchLatency = Timer.builder("bastion.ingestion.fetch.latency")
            .description("Feed retrieval latency")
            .tag("component", "ingestion")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);

        this.runLatency = Timer.builder("bastion.ingestion.run.latency")
            .description("End-to-end ingestion run latency")
            .tag("component", "ingestion")
            .register(registry);
    }

    public void recordRunStarted() {
        runsStarted.increment();
    }

    public void recordRunRejected() {
        runsRejected.increment();
    }

    public void recordFetch(Duration elapsed) {
        fetchLatency.record(elapsed);
    }

    public void recordFetchFailure(FetchFailure.Kind kind) {
        Counter.builder("bastion.ingestion.fetch.failures")
            .description("Failed feed retrievals by failure kind")
            .tag("component", "ingestion")
            .tag("kind", kind.name().toLowerCase(Locale.ROOT))
            .register(registry)
            .increment();
    }

    public void recordSummary(IngestionSummary summary) {
        inserted.increment(summary.getInserted());
        duplicates.increment(summary.getDuplicates());
        blocked.increment(summary.getBlocked());
        discarded.increment(summary.getDiscarded());
        storeFailures.increment(summary.getFailed());
    }

    public void recordRunDuration(Duration elapsed) {
        runLatency.record(elapsed);
    }
}
