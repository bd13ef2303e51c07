package com.bastion.export;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditLevel;
import com.bastion.audit.AuditSink;
import com.bastion.security.IdentityContext;
import com.bastion.security.RequestIdentity;
import com.bastion.settings.PipelineSettings;
import com.bastion.settings.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides when the blacklist files are regenerated.
 *
 * Triggers:
 * - after an ingestion run inserted something ({@link #requestRegeneration()},
 *   coalesced so a burst of runs causes one generation)
 * - periodically, every {@code system.blacklistUpdateInterval} minutes
 * - on demand from the API ({@link #regenerate()})
 */
@Service
public class BlacklistExportService {

    private static final Logger log = LoggerFactory.getLogger(BlacklistExportService.class);

    private final BlacklistExporter exporter;
    private final SettingsService settingsService;
    private final AuditSink auditSink;
    private final TaskExecutor exportExecutor;
    private final Clock clock;

    private final AtomicBoolean regenerationPending = new AtomicBoolean(false);
    private volatile Instant lastGeneration;

    public BlacklistExportService(BlacklistExporter exporter,
                                  SettingsService settingsService,
                                  AuditSink auditSink,
                                  @Qualifier("exportExecutor") TaskExecutor exportExecutor,
                                  Clock clock) {
        this.exporter = exporter;
        this.settingsService = settingsService;
        this.auditSink = auditSink;
        this.exportExecutor = exportExecutor;
        this.clock = clock;
    }

    /**
     * Regenerate now on the calling thread and audit who asked for it.
     */
    public ExportReport regenerate() {
        RequestIdentity who = IdentityContext.current();
        ExportReport report = generate();

        auditSink.record(AuditEvent.builder(AuditAction.REFRESH, AuditEvent.RESOURCE_BLACKLIST)
            .level(report.hasErrors() ? AuditLevel.ERROR : AuditLevel.INFO)
            .details(report.hasErrors()
                ? "Blacklist refresh finished with errors: " + String.join("; ", report.getErrors())
                : "Blacklist files regenerated")
            .userId(who.getUserId())
            .ipAddress(who.getIpAddress())
            .metadata("files", report.getFiles())
            .metadata("entries", report.getEntries())
            .build());
        return report;
    }

    /**
     * Ask for a background regeneration. Requests made while one is already
     * queued are folded into it.
     */
    public void requestRegeneration() {
        if (!regenerationPending.compareAndSet(false, true)) {
            log.debug("Export regeneration already pending");
            return;
        }
        try {
            exportExecutor.execute(() -> {
                regenerationPending.set(false);
                try {
                    generate();
                } catch (RuntimeException e) {
                    log.error("Background blacklist export failed", e);
                }
            });
        } catch (TaskRejectedException e) {
            regenerationPending.set(false);
            log.warn("Export regeneration request rejected: {}", e.getMessage());
        }
    }

    /**
     * Periodic check; regenerates once the configured interval has passed
     * since the last generation.
     */
    @Scheduled(fixedDelayString = "${bastion.export.check-interval-ms:60000}",
               initialDelayString = "${bastion.export.check-interval-ms:60000}")
    public void periodicRegeneration() {
        try {
            PipelineSettings settings = settingsService.snapshot();
            Instant now = clock.instant();
            Duration interval = Duration.ofMinutes(Math.max(1, settings.getBlacklistUpdateIntervalMinutes()));
            Instant last = lastGeneration;
            if (last == null || !now.isBefore(last.plus(interval))) {
                log.debug("Periodic blacklist regeneration (interval {} min)", interval.toMinutes());
                exporter.generate(settings);
                lastGeneration = now;
            }
        } catch (RuntimeException e) {
            log.error("Periodic blacklist export failed", e);
        }
    }

    /**
     * Active indicator counts per type and the number of files published in
     * each directory.
     */
    public Map<String, Object> stats() {
        Map<String, Long> active = new LinkedHashMap<>();
        exporter.getIndicatorCounts().forEach((type, count) -> active.put(type.getValue(), count));

        Map<String, Integer> files = new LinkedHashMap<>();
        for (Map.Entry<String, List<PublishedFile>> entry : exporter.listPublishedFiles().entrySet()) {
            files.put(entry.getKey(), entry.getValue().size());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("activeIndicators", active);
        stats.put("files", files);
        stats.put("lastGeneration", lastGeneration);
        return stats;
    }

    public Map<String, List<PublishedFile>> listPublishedFiles() {
        return exporter.listPublishedFiles();
    }

    public Instant getLastGeneration() {
        return lastGeneration;
    }

    private ExportReport generate() {
        ExportReport report = exporter.generate(settingsService.snapshot());
        lastGeneration = report.getGeneratedAt();
        return report;
    }
}
