package com.bastion.storage;

import com.bastion.domain.DataSource;
import com.bastion.domain.FetchStatus;
import com.bastion.domain.IndicatorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DataSourceRepository Tests")
class DataSourceRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private DataSourceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DataSourceRepository(TestDatabase.create());
    }

    @Test
    @DisplayName("Should round-trip a data source with its declared types")
    void shouldRoundTripSource() {
        // Given
        DataSource source = repository.insert(source("urlhaus", true));

        // When
        DataSource loaded = repository.findById(source.getId()).orElseThrow();

        // Then
        assertThat(loaded.getName()).isEqualTo("urlhaus");
        assertThat(loaded.getIndicatorTypes()).containsExactly(IndicatorType.URL, IndicatorType.SOAR_URL);
        assertThat(loaded.getFetchInterval()).isEqualTo(600);
        assertThat(loaded.isPaused()).isFalse();
        assertThat(loaded.getLastFetch()).isNull();
        assertThat(loaded.getLastFetchStatus()).isNull();
    }

    @Test
    @DisplayName("Should return only active sources for scheduling")
    void shouldFindActiveSources() {
        // Given
        repository.insert(source("active", true));
        repository.insert(source("inactive", false));

        // When / Then
        assertThat(repository.findActive()).extracting(DataSource::getName).containsExactly("active");
        assertThat(repository.findAll()).hasSize(2);
    }

    @Test
    @DisplayName("Should record fetch outcome without touching admin fields")
    void shouldRecordFetchOutcome() {
        // Given
        DataSource source = repository.insert(source("feed", true));

        // When
        repository.recordFetchFailure(source.getId(), NOW, "HTTP 404: Not Found");
        DataSource failed = repository.findById(source.getId()).orElseThrow();
        repository.recordFetchSuccess(source.getId(), NOW.plusSeconds(60));
        DataSource succeeded = repository.findById(source.getId()).orElseThrow();

        // Then
        assertThat(failed.getLastFetchStatus()).isEqualTo(FetchStatus.ERROR);
        assertThat(failed.getLastFetchError()).isEqualTo("HTTP 404: Not Found");
        assertThat(failed.getLastFetch()).isEqualTo(NOW);
        assertThat(succeeded.getLastFetchStatus()).isEqualTo(FetchStatus.SUCCESS);
        assertThat(succeeded.getLastFetchError()).isNull();
        assertThat(succeeded.getName()).isEqualTo("feed");
    }

    @Test
    @DisplayName("Should set resumedAt on resume and keep lastFetch on pause")
    void shouldPauseAndResume() {
        // Given
        DataSource source = repository.insert(source("feed", true));
        repository.recordFetchSuccess(source.getId(), NOW);

        // When
        repository.pause(source.getId());
        DataSource paused = repository.findById(source.getId()).orElseThrow();
        repository.resume(source.getId(), NOW.plusSeconds(3600));
        DataSource resumed = repository.findById(source.getId()).orElseThrow();

        // Then
        assertThat(paused.isPaused()).isTrue();
        assertThat(paused.getLastFetch()).isEqualTo(NOW);
        assertThat(resumed.isPaused()).isFalse();
        assertThat(resumed.getResumedAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(resumed.schedulingAnchor()).isEqualTo(NOW.plusSeconds(3600));
    }

    @Test
    @DisplayName("Should report missing rows on update, pause and delete")
    void shouldReportMissingRows() {
        DataSource ghost = source("ghost", true);
        ghost.setId(999L);

        assertThat(repository.update(ghost)).isFalse();
        assertThat(repository.pause(999L)).isFalse();
        assertThat(repository.deleteById(999L)).isFalse();
    }

    @Test
    @DisplayName("Should split comma separated type lists")
    void shouldSplitTypes() {
        assertThat(DataSourceRepository.splitTypes("ip, domain,,hash"))
            .containsExactly(IndicatorType.IP, IndicatorType.DOMAIN, IndicatorType.HASH);
        assertThat(DataSourceRepository.splitTypes(null)).isEmpty();
        assertThat(DataSourceRepository.joinTypes(EnumSet.of(IndicatorType.IP, IndicatorType.SOAR_URL)))
            .isEqualTo("ip,soar-url");
    }

    private static DataSource source(String name, boolean active) {
        return DataSource.builder()
            .name(name)
            .url("https://feeds.example.org/" + name + ".txt")
            .indicatorTypes(IndicatorType.URL, IndicatorType.SOAR_URL)
            .fetchInterval(600)
            .active(active)
            .createdAt(NOW)
            .build();
    }
}
