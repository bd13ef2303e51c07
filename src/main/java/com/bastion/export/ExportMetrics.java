package com.bastion.export;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for blacklist export generation.
 */
@Component
public class ExportMetrics {

    private final Counter generations;
    private final Counter failures;
    private final Counter filesWritten;
    private final Timer generationLatency;

    public ExportMetrics(MeterRegistry registry) {
        this.generations = Counter.builder("bastion.export.generations")
            .description("Number of export generations run")
            .tag("component", "export")
            .register(registry);

        this.failures = Counter.builder("bastion.export.failures")
            .description("File families that failed to publish")
            .tag("component", "export")
            .register(registry);

        this.filesWritten = Counter.builder("bastion.export.files.written")
            .description("Blacklist files published")
            .tag("component", "export")
            .register(registry);

        this.generationLatency = Timer.builder("bastion.export.latency")
            .description("Time to regenerate every blacklist file")
            .tag("component", "export")
            .register(registry);
    }

    public void recordGeneration(ExportReport report, Duration elapsed) {
        generations.increment();
        failures.increment(report.getErrors().size());
        filesWritten.increment(report.getFiles().values().stream().mapToInt(Integer::intValue).sum());
        generationLatency.record(elapsed);
    }
}
