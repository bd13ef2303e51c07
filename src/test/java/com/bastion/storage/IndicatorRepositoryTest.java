package com.bastion.storage;

import com.bastion.domain.DataSource;
import com.bastion.domain.HashType;
import com.bastion.domain.Indicator;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IndicatorRepository Tests")
class IndicatorRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private JdbcTemplate jdbcTemplate;
    private IndicatorRepository repository;
    private Long sourceId;

    @BeforeEach
    void setUp() {
        jdbcTemplate = TestDatabase.create();
        repository = new IndicatorRepository(jdbcTemplate);
        sourceId = new DataSourceRepository(jdbcTemplate).insert(DataSource.builder()
            .name("abuse-feed")
            .url("https://feeds.example.org/ips.txt")
            .indicatorTypes(IndicatorType.IP)
            .fetchInterval(3600)
            .active(true)
            .build()).getId();
    }

    @Test
    @DisplayName("Should insert a new indicator on first upsert")
    void shouldInsertOnFirstUpsert() {
        // When
        UpsertOutcome outcome = repository.upsert("1.2.3.4", IndicatorType.IP, null, "abuse-feed", sourceId, NOW);

        // Then
        assertThat(outcome).isEqualTo(UpsertOutcome.INSERTED);
        Indicator stored = repository.findByValueAndType("1.2.3.4", IndicatorType.IP).orElseThrow();
        assertThat(stored.isActive()).isTrue();
        assertThat(stored.getSource()).isEqualTo("abuse-feed");
        assertThat(stored.getSourceId()).isEqualTo(sourceId);
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should refresh attribution but keep activation state on repeated upsert")
    void shouldRefreshAttributionOnRepeatedUpsert() {
        // Given
        repository.upsert("1.2.3.4", IndicatorType.IP, null, "abuse-feed", sourceId, NOW);
        Indicator stored = repository.findByValueAndType("1.2.3.4", IndicatorType.IP).orElseThrow();
        stored.setActive(false);
        repository.update(stored, NOW);

        // When
        Instant later = NOW.plus(1, ChronoUnit.HOURS);
        UpsertOutcome outcome = repository.upsert("1.2.3.4", IndicatorType.IP, null, "other-feed", null, later);

        // Then
        assertThat(outcome).isEqualTo(UpsertOutcome.UPDATED);
        Indicator refreshed = repository.findById(stored.getId()).orElseThrow();
        assertThat(refreshed.isActive()).isFalse();
        assertThat(refreshed.getSource()).isEqualTo("other-feed");
        assertThat(refreshed.getSourceId()).isNull();
        assertThat(refreshed.getUpdatedAt()).isEqualTo(later);
        assertThat(countRows()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the same value under different types as separate rows")
    void shouldTreatValueAndTypeAsKey() {
        // When
        repository.upsert("example.com", IndicatorType.DOMAIN, null, "feed", sourceId, NOW);
        repository.upsert("example.com", IndicatorType.URL, null, "feed", sourceId, NOW);

        // Then
        assertThat(countRows()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should produce exactly one row when writers race on the same value")
    void shouldProduceOneRowUnderConcurrentUpserts() throws Exception {
        // Given
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<UpsertOutcome>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < writers; i++) {
                Callable<UpsertOutcome> task = () -> {
                    start.await();
                    return repository.upsert("5.6.7.8", IndicatorType.IP, null, "abuse-feed", sourceId, NOW);
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int inserted = 0;
            for (Future<UpsertOutcome> result : results) {
                if (result.get(10, TimeUnit.SECONDS) == UpsertOutcome.INSERTED) {
                    inserted++;
                }
            }

            // Then
            assertThat(inserted).isEqualTo(1);
            assertThat(countRows()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should reject manual insert of an existing value and type")
    void shouldRejectDuplicateInsert() {
        // Given
        repository.insert(manual("evil.example.com", IndicatorType.DOMAIN));

        // When / Then
        assertThatThrownBy(() -> repository.insert(manual("evil.example.com", IndicatorType.DOMAIN)))
            .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("Should store hash type for hash indicators")
    void shouldStoreHashType() {
        // When
        repository.upsert("d41d8cd98f00b204e9800998ecf8427e", IndicatorType.HASH, HashType.MD5,
            "feed", sourceId, NOW);

        // Then
        Indicator stored = repository.findByValueAndType("d41d8cd98f00b204e9800998ecf8427e", IndicatorType.HASH)
            .orElseThrow();
        assertThat(stored.getHashType()).isEqualTo(HashType.MD5);
    }

    @Test
    @DisplayName("Should clear temporary activation when an indicator is deactivated")
    void shouldClearTempActivationOnDeactivate() {
        // Given
        Indicator indicator = repository.insert(manual("9.9.9.9", IndicatorType.IP));
        repository.activateUntil(indicator.getId(), NOW.plus(1, ChronoUnit.HOURS), NOW);

        // When
        Indicator stored = repository.findById(indicator.getId()).orElseThrow();
        stored.setActive(false);
        repository.update(stored, NOW);

        // Then
        Indicator updated = repository.findById(indicator.getId()).orElseThrow();
        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getTempActiveUntil()).isNull();
    }

    @Test
    @DisplayName("Should find only indicators whose temporary activation has expired")
    void shouldFindExpiredTempActivations() {
        // Given
        Indicator expired = repository.insert(manual("10.1.1.1", IndicatorType.IP));
        Indicator pending = repository.insert(manual("10.1.1.2", IndicatorType.IP));
        repository.insert(manual("10.1.1.3", IndicatorType.IP));
        repository.activateUntil(expired.getId(), NOW.minus(1, ChronoUnit.MINUTES), NOW);
        repository.activateUntil(pending.getId(), NOW.plus(1, ChronoUnit.HOURS), NOW);

        // When
        List<Long> ids = repository.findExpiredTempActivationIds(NOW);

        // Then
        assertThat(ids).containsExactly(expired.getId());
    }

    @Test
    @DisplayName("Should delete only rows still expired at the given instant")
    void shouldDeleteOnlyStillExpiredRows() {
        // Given
        Indicator expired = repository.insert(manual("10.2.2.1", IndicatorType.IP));
        Indicator extended = repository.insert(manual("10.2.2.2", IndicatorType.IP));
        Indicator permanent = repository.insert(manual("10.2.2.3", IndicatorType.IP));
        repository.activateUntil(expired.getId(), NOW.minus(1, ChronoUnit.MINUTES), NOW);
        repository.activateUntil(extended.getId(), NOW.plus(24, ChronoUnit.HOURS), NOW);

        // When / Then
        assertThat(repository.deleteExpired(expired.getId(), NOW)).isEqualTo(1);
        assertThat(repository.deleteExpired(expired.getId(), NOW)).isZero();
        assertThat(repository.deleteExpired(extended.getId(), NOW)).isZero();
        assertThat(repository.deleteExpired(permanent.getId(), NOW)).isZero();
        assertThat(repository.findById(extended.getId())).isPresent();
        assertThat(repository.findById(permanent.getId())).isPresent();
    }

    @Test
    @DisplayName("Should filter, search and page indicators")
    void shouldFilterAndPage() {
        // Given
        for (int i = 1; i <= 5; i++) {
            repository.upsert("host" + i + ".bad.example", IndicatorType.DOMAIN, null, "feed", sourceId,
                NOW.plusSeconds(i));
        }
        repository.upsert("1.1.1.1", IndicatorType.IP, null, "feed", sourceId, NOW);

        // When
        PageResult<Indicator> page = repository.find(new IndicatorQuery()
            .type(IndicatorType.DOMAIN)
            .search("BAD.example")
            .page(2)
            .limit(2));

        // Then
        assertThat(page.getTotal()).isEqualTo(5);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getItems()).extracting(Indicator::getValue)
            .containsExactly("host3.bad.example", "host2.bad.example");
    }

    @Test
    @DisplayName("Should return active values and per-type counts")
    void shouldReturnActiveValuesAndCounts() {
        // Given
        repository.upsert("1.1.1.1", IndicatorType.IP, null, "feed", sourceId, NOW);
        repository.upsert("2.2.2.2", IndicatorType.IP, null, "feed", sourceId, NOW);
        Indicator inactive = repository.insert(manual("3.3.3.3", IndicatorType.IP));
        inactive.setActive(false);
        repository.update(inactive, NOW);

        // When
        List<String> values = repository.findActiveValues(IndicatorType.IP);
        Map<IndicatorType, Long> counts = repository.countActiveByType();

        // Then
        assertThat(values).containsExactly("1.1.1.1", "2.2.2.2");
        assertThat(counts).containsEntry(IndicatorType.IP, 2L).containsEntry(IndicatorType.DOMAIN, 0L);
    }

    @Test
    @DisplayName("Should keep indicators but clear sourceId when their data source is deleted")
    void shouldNullSourceIdWhenSourceDeleted() {
        // Given
        repository.upsert("1.2.3.4", IndicatorType.IP, null, "abuse-feed", sourceId, NOW);

        // When
        new DataSourceRepository(jdbcTemplate).deleteById(sourceId);

        // Then
        Indicator stored = repository.findByValueAndType("1.2.3.4", IndicatorType.IP).orElseThrow();
        assertThat(stored.getSourceId()).isNull();
        assertThat(stored.getSource()).isEqualTo("abuse-feed");
    }

    private static Indicator manual(String value, IndicatorType type) {
        return Indicator.builder()
            .value(value)
            .type(type)
            .source(Indicator.MANUAL_SOURCE)
            .active(true)
            .createdAt(NOW)
            .build();
    }

    private int countRows() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM indicators", Integer.class);
        return count == null ? 0 : count;
    }
}
