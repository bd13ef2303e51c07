package com.bastion.datasource;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditSink;
import com.bastion.domain.DataSource;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.ResourceNotFoundException;
import com.bastion.ingestion.IngestionTrigger;
import com.bastion.ingestion.IngestionWorker;
import com.bastion.security.IdentityContext;
import com.bastion.security.RequestIdentity;
import com.bastion.settings.SettingsService;
import com.bastion.storage.DataSourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Administration of feed definitions: CRUD, pause/resume and manual fetch.
 */
@Service
public class DataSourceService {

    private static final Logger log = LoggerFactory.getLogger(DataSourceService.class);

    private final DataSourceRepository dataSourceRepository;
    private final IngestionWorker ingestionWorker;
    private final SettingsService settingsService;
    private final AuditSink auditSink;
    private final Clock clock;

    public DataSourceService(DataSourceRepository dataSourceRepository,
                             IngestionWorker ingestionWorker,
                             SettingsService settingsService,
                             AuditSink auditSink,
                             Clock clock) {
        this.dataSourceRepository = dataSourceRepository;
        this.ingestionWorker = ingestionWorker;
        this.settingsService = settingsService;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public List<DataSource> findAll() {
        return dataSourceRepository.findAll();
    }

    public DataSource get(Long id) {
        return dataSourceRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Data source", id));
    }

    public DataSource create(DataSourceRequest request) {
        requireText(request.getName(), "name");
        requireText(request.getUrl(), "url");

        int fetchInterval = request.getFetchInterval() != null
            ? request.getFetchInterval()
            : settingsService.snapshot().getDefaultFetchInterval();

        DataSource source = DataSource.builder()
            .name(request.getName().trim())
            .url(validateUrl(request.getUrl()))
            .indicatorTypes(parseTypes(request.getIndicatorTypes()))
            .fetchInterval(validateInterval(fetchInterval))
            .active(request.getIsActive() == null || request.getIsActive())
            .paused(false)
            .ignoreCertificateErrors(Boolean.TRUE.equals(request.getIgnoreCertificateErrors()))
            .createdAt(clock.instant())
            .createdBy(IdentityContext.current().getUserId())
            .build();

        DataSource saved = dataSourceRepository.insert(source);
        audit(AuditAction.CREATE, saved, "Created data source: " + saved.getName());
        return saved;
    }

    public DataSource update(Long id, DataSourceRequest request) {
        DataSource source = get(id);

        if (request.getName() != null) {
            requireText(request.getName(), "name");
            source.setName(request.getName().trim());
        }
        if (request.getUrl() != null) {
            source.setUrl(validateUrl(request.getUrl()));
        }
        if (request.getIndicatorTypes() != null) {
            source.setIndicatorTypes(parseTypes(request.getIndicatorTypes()));
        }
        if (request.getFetchInterval() != null) {
            source.setFetchInterval(validateInterval(request.getFetchInterval()));
        }
        if (request.getIsActive() != null) {
            source.setActive(request.getIsActive());
        }
        if (request.getIgnoreCertificateErrors() != null) {
            source.setIgnoreCertificateErrors(request.getIgnoreCertificateErrors());
        }

        if (!dataSourceRepository.update(source)) {
            throw new ResourceNotFoundException("Data source", id);
        }
        audit(AuditAction.UPDATE, source, "Updated data source: " + source.getName());
        return source;
    }

    /**
     * Indicators from the source are kept; their sourceId is cleared by the
     * foreign key.
     */
    public void delete(Long id) {
        DataSource source = get(id);
        if (!dataSourceRepository.deleteById(id)) {
            throw new ResourceNotFoundException("Data source", id);
        }
        audit(AuditAction.DELETE, source, "Deleted data source: " + source.getName());
    }

    /**
     * Stop scheduling the source. A run already in flight is allowed to finish.
     */
    public DataSource pause(Long id) {
        DataSource source = get(id);
        dataSourceRepository.pause(id);
        source.setPaused(true);
        log.info("Paused data source {} (id={})", source.getName(), id);
        audit(AuditAction.PAUSE, source, "Paused data source: " + source.getName());
        return source;
    }

    /**
     * Resume scheduling from now. Missed intervals are not caught up.
     */
    public DataSource resume(Long id) {
        DataSource source = get(id);
        Instant now = clock.instant();
        dataSourceRepository.resume(id, now);
        source.setPaused(false);
        source.setResumedAt(now);
        log.info("Resumed data source {} (id={})", source.getName(), id);
        audit(AuditAction.RESUME, source, "Resumed data source: " + source.getName());
        return source;
    }

    /**
     * Start a manual run. Returns once the run has been admitted; it continues
     * in the background.
     */
    public DataSource fetchNow(Long id) {
        DataSource source = get(id);
        ingestionWorker.submit(source, IngestionTrigger.MANUAL);
        audit(AuditAction.MANUAL_FETCH, source, "Manual fetch started for " + source.getName());
        return source;
    }

    private void audit(AuditAction action, DataSource source, String details) {
        RequestIdentity who = IdentityContext.current();
        auditSink.record(AuditEvent.builder(action, AuditEvent.RESOURCE_DATA_SOURCE)
            .resourceId(source.getId())
            .details(details)
            .userId(who.getUserId())
            .ipAddress(who.getIpAddress())
            .build());
    }

    static Set<IndicatorType> parseTypes(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("At least one indicator type is required");
        }
        Set<IndicatorType> types = new LinkedHashSet<>();
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Indicator type must not be empty");
            }
            types.add(IndicatorType.fromValue(value.trim()));
        }
        return types;
    }

    static int validateInterval(int seconds) {
        if (seconds < DataSource.MIN_FETCH_INTERVAL_SECONDS) {
            throw new IllegalArgumentException(
                "Fetch interval must be at least " + DataSource.MIN_FETCH_INTERVAL_SECONDS + " seconds");
        }
        return seconds;
    }

    static String validateUrl(String url) {
        String trimmed = url == null ? "" : url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
                throw new IllegalArgumentException("Data source URL must be an http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid data source URL: " + url);
        }
        return trimmed;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Data source " + field + " is required");
        }
    }
}
