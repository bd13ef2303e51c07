package com.bastion.ingestion;

import com.bastion.audit.AuditAction;
import com.bastion.audit.AuditEvent;
import com.bastion.audit.AuditLevel;
import com.bastion.audit.RecordingAuditSink;
import com.bastion.classification.IndicatorClassifier;
import com.bastion.domain.DataSource;
import com.bastion.domain.FetchStatus;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.ResourceNotFoundException;
import com.bastion.domain.WhitelistEntry;
import com.bastion.export.BlacklistExportService;
import com.bastion.fetch.FeedFetcher;
import com.bastion.fetch.FetchFailure;
import com.bastion.fetch.FetchResult;
import com.bastion.settings.PipelineSettings;
import com.bastion.settings.SettingsService;
import com.bastion.storage.DataSourceRepository;
import com.bastion.storage.IndicatorQuery;
import com.bastion.storage.IndicatorRepository;
import com.bastion.storage.TestDatabase;
import com.bastion.storage.WhitelistBlockRepository;
import com.bastion.storage.WhitelistRepository;
import com.bastion.whitelist.WhitelistService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionWorker Tests")
class IngestionWorkerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private FeedFetcher fetcher;

    @Mock
    private SettingsService settingsService;

    @Mock
    private BlacklistExportService exportService;

    private DataSourceRepository dataSourceRepository;
    private IndicatorRepository indicatorRepository;
    private WhitelistRepository whitelistRepository;
    private WhitelistService whitelistService;
    private SourceRunRegistry runRegistry;
    private RecordingAuditSink auditSink;
    private IngestionWorker worker;
    private DataSource source;

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbc = TestDatabase.create();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        IndicatorClassifier classifier = new IndicatorClassifier();

        dataSourceRepository = new DataSourceRepository(jdbc);
        indicatorRepository = new IndicatorRepository(jdbc);
        whitelistRepository = new WhitelistRepository(jdbc);
        auditSink = new RecordingAuditSink();
        whitelistService = new WhitelistService(whitelistRepository, new WhitelistBlockRepository(jdbc),
            classifier, auditSink, clock, Duration.ofSeconds(30));
        runRegistry = new SourceRunRegistry();

        worker = new IngestionWorker(dataSourceRepository, indicatorRepository, whitelistService, fetcher,
            classifier, settingsService, exportService, auditSink, runRegistry,
            new IngestionMetrics(new SimpleMeterRegistry()), new SyncTaskExecutor(), clock);

        source = dataSourceRepository.insert(DataSource.builder()
            .name("abuse-feed")
            .url("https://feeds.example.com/ips.txt")
            .indicatorTypes(IndicatorType.IP, IndicatorType.DOMAIN)
            .fetchInterval(3600)
            .active(true)
            .createdAt(NOW.minusSeconds(86_400))
            .build());
    }

    @Test
    @DisplayName("Should store each distinct indicator once and discard unrecognised lines")
    void shouldIngestDistinctIndicators() {
        // Given
        givenBody("1.2.3.4\nbadline\n1.2.3.4\n# comment\nevil.example.com\n");

        // When
        IngestionSummary summary = worker.submit(source, IngestionTrigger.SCHEDULED).join();

        // Then
        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.getLines()).isEqualTo(5);
        assertThat(summary.getInserted()).isEqualTo(2);
        assertThat(summary.getDiscarded()).isEqualTo(2);
        assertThat(indicatorRepository.findByValueAndType("1.2.3.4", IndicatorType.IP)).isPresent();
        assertThat(indicatorRepository.find(new IndicatorQuery()).getTotal()).isEqualTo(2);

        DataSource stored = dataSourceRepository.findById(source.getId()).orElseThrow();
        assertThat(stored.getLastFetchStatus()).isEqualTo(FetchStatus.SUCCESS);
        assertThat(stored.getLastFetch()).isEqualTo(NOW);
        assertThat(stored.getLastFetchError()).isNull();

        assertThat(auditSink.withAction(AuditAction.FETCH))
            .extracting(AuditEvent::getDetails)
            .containsExactly("Fetched 5 lines from abuse-feed",
                "Successfully processed 2 indicators from abuse-feed");
        verify(exportService).requestRegeneration();
        assertThat(runRegistry.isRunning(source.getId())).isFalse();
    }

    @Test
    @DisplayName("Should count repeated runs as duplicates and skip regeneration")
    void shouldCountDuplicatesOnRepeatRun() {
        // Given
        givenBody("1.2.3.4\n");
        worker.submit(source, IngestionTrigger.SCHEDULED).join();
        clearInvocations(exportService);

        // When
        IngestionSummary summary = worker.submit(source, IngestionTrigger.MANUAL).join();

        // Then
        assertThat(summary.getInserted()).isZero();
        assertThat(summary.getDuplicates()).isEqualTo(1);
        verify(exportService, never()).requestRegeneration();
    }

    @Test
    @DisplayName("Should block whitelisted candidates and record the block")
    void shouldBlockWhitelistedCandidates() {
        // Given
        whitelistRepository.insert(new WhitelistEntry(null, "10.0.0.0/8", IndicatorType.IP, "internal"), NOW);
        givenBody("10.1.2.3\n10.200.0.0/16\n");

        // When
        IngestionSummary summary = worker.submit(source, IngestionTrigger.SCHEDULED).join();

        // Then
        assertThat(summary.getBlocked()).isEqualTo(2);
        assertThat(summary.getInserted()).isZero();
        assertThat(indicatorRepository.find(new IndicatorQuery()).getTotal()).isZero();
        assertThat(whitelistService.findBlocks(1, 25).getTotal()).isEqualTo(2);
        assertThat(auditSink.withAction(AuditAction.BLOCKED))
            .hasSize(2)
            .allSatisfy(event -> assertThat(event.getLevel()).isEqualTo(AuditLevel.WARNING));
    }

    @Test
    @DisplayName("Should record a fetch failure on the data source")
    void shouldRecordFetchFailure() {
        // Given
        when(settingsService.snapshot()).thenReturn(PipelineSettings.defaults());
        when(fetcher.fetch(any(DataSource.class), any(PipelineSettings.class))).thenReturn(FetchResult.failure(
            new FetchFailure(FetchFailure.Kind.HTTP_STATUS, "HTTP 404: Not Found", 404), Duration.ofMillis(40)));

        // When
        IngestionSummary summary = worker.submit(source, IngestionTrigger.SCHEDULED).join();

        // Then
        assertThat(summary.isSuccess()).isFalse();
        assertThat(summary.getError()).isEqualTo("HTTP 404: Not Found");

        DataSource stored = dataSourceRepository.findById(source.getId()).orElseThrow();
        assertThat(stored.getLastFetchStatus()).isEqualTo(FetchStatus.ERROR);
        assertThat(stored.getLastFetchError()).isEqualTo("HTTP 404: Not Found");

        assertThat(auditSink.withAction(AuditAction.FETCH)).singleElement()
            .satisfies(event -> {
                assertThat(event.getLevel()).isEqualTo(AuditLevel.ERROR);
                assertThat(event.getDetails()).isEqualTo("Failed to fetch from abuse-feed: HTTP 404: Not Found");
            });
        verifyNoInteractions(exportService);
        assertThat(runRegistry.isRunning(source.getId())).isFalse();
    }

    @Test
    @DisplayName("Should treat an empty body as a successful fetch with nothing to store")
    void shouldAcceptEmptyBody() {
        givenBody("");

        IngestionSummary summary = worker.submit(source, IngestionTrigger.SCHEDULED).join();

        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.getLines()).isZero();
        assertThat(dataSourceRepository.findById(source.getId()).orElseThrow().getLastFetchStatus())
            .isEqualTo(FetchStatus.SUCCESS);
    }

    @Test
    @DisplayName("Should reject runs for paused and inactive sources")
    void shouldRejectPausedAndInactiveSources() {
        // Given
        source.setPaused(true);

        // Then
        assertThatThrownBy(() -> worker.submit(source, IngestionTrigger.MANUAL))
            .isInstanceOf(SourcePausedException.class);

        source.setPaused(false);
        source.setActive(false);
        assertThatThrownBy(() -> worker.submit(source, IngestionTrigger.MANUAL))
            .isInstanceOf(SourceInactiveException.class);
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("Should reject a second run while one is in flight")
    void shouldRejectConcurrentRun() {
        // Given
        runRegistry.tryAcquire(source.getId(), NOW);

        // Then
        assertThatThrownBy(() -> worker.submit(source, IngestionTrigger.MANUAL))
            .isInstanceOf(FetchInProgressException.class);
        assertThat(runRegistry.isRunning(source.getId())).isTrue();
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("Should refuse a run when the source was paused after it was read")
    void shouldRefuseRunPausedAfterRead() {
        // Given
        dataSourceRepository.pause(source.getId());

        // Then
        assertThatThrownBy(() -> worker.submit(source, IngestionTrigger.SCHEDULED))
            .isInstanceOf(SourcePausedException.class);
        assertThat(runRegistry.isRunning(source.getId())).isFalse();
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("Should refuse a run for a source deleted after it was read")
    void shouldRefuseRunForDeletedSource() {
        // Given
        dataSourceRepository.deleteById(source.getId());

        // Then
        assertThatThrownBy(() -> worker.submit(source, IngestionTrigger.MANUAL))
            .isInstanceOf(ResourceNotFoundException.class);
        assertThat(runRegistry.isRunning(source.getId())).isFalse();
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("Should record an unexpected failure outside processing on the source")
    void shouldRecordUnexpectedRunFailure() {
        // Given
        when(settingsService.snapshot()).thenThrow(new DataAccessResourceFailureException("settings unavailable"));

        // When
        IngestionSummary summary = worker.submit(source, IngestionTrigger.SCHEDULED).join();

        // Then
        assertThat(summary.isSuccess()).isFalse();
        assertThat(summary.getError()).isEqualTo("Ingestion run failed: settings unavailable");

        DataSource stored = dataSourceRepository.findById(source.getId()).orElseThrow();
        assertThat(stored.getLastFetchStatus()).isEqualTo(FetchStatus.ERROR);
        assertThat(stored.getLastFetch()).isEqualTo(NOW);
        assertThat(stored.getLastFetchError()).isEqualTo("Ingestion run failed: settings unavailable");

        assertThat(auditSink.withAction(AuditAction.FETCH)).singleElement()
            .satisfies(event -> assertThat(event.getLevel()).isEqualTo(AuditLevel.ERROR));
        verifyNoInteractions(fetcher, exportService);
        assertThat(runRegistry.isRunning(source.getId())).isFalse();
    }

    private void givenBody(String body) {
        when(settingsService.snapshot()).thenReturn(PipelineSettings.defaults());
        when(fetcher.fetch(any(DataSource.class), any(PipelineSettings.class)))
            .thenReturn(FetchResult.success(body, Duration.ofMillis(25)));
    }
}
