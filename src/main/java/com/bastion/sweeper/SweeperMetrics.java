package com.bastion.sweeper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for the temporary-activation sweeper.
 */
@Component
public class SweeperMetrics {

    private final Counter sweeps;
    private final Counter removed;
    private final Counter failures;
    private final Timer sweepLatency;

    public SweeperMetrics(MeterRegistry registry) {
        this.sweeps = Counter.builder("bastion.sweeper.runs")
            .description("Number of sweeps run")
            .tag("component", "sweeper")
            .register(registry);

        this.removed = Counter.builder("bastion.sweeper.indicators.removed")
            .description("Indicators deleted after their temporary activation expired")
            .tag("component", "sweeper")
            .register(registry);

        this.failures = Counter.builder("bastion.sweeper.failures")
            .description("Expired indicators that could not be deleted")
            .tag("component", "sweeper")
            .register(registry);

        this.sweepLatency = Timer.builder("bastion.sweeper.latency")
            .tag("component", "sweeper")
            .register(registry);
    }

    public void recordSweep(int removedCount, int failedCount, Duration elapsed) {
        sweeps.increment();
        removed.increment(removedCount);
        failures.increment(failedCount);
        sweepLatency.record(elapsed);
    }
}
