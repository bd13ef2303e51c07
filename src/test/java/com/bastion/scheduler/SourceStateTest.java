package com.bastion.scheduler;

import com.bastion.domain.DataSource;
import com.bastion.domain.IndicatorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SourceState Tests")
class SourceStateTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("Should be due immediately when the source has never run")
    void shouldBeDueWhenNeverFetched() {
        assertThat(SourceState.evaluate(source(120).build(), T0, false)).isEqualTo(SourceState.DUE);
    }

    @Test
    @DisplayName("Should become due once the interval has elapsed since the last fetch")
    void shouldBecomeDueAfterInterval() {
        DataSource source = source(120).lastFetch(T0).build();

        assertThat(SourceState.evaluate(source, T0.plusSeconds(119), false)).isEqualTo(SourceState.IDLE);
        assertThat(SourceState.evaluate(source, T0.plusSeconds(120), false)).isEqualTo(SourceState.DUE);
    }

    @Test
    @DisplayName("Should anchor on the resume time when it is later than the last fetch")
    void shouldAnchorOnResume() {
        // Given
        DataSource source = source(120)
            .lastFetch(T0)
            .resumedAt(T0.plusSeconds(600))
            .build();

        // Then
        assertThat(SourceState.evaluate(source, T0.plusSeconds(660), false)).isEqualTo(SourceState.IDLE);
        assertThat(SourceState.evaluate(source, T0.plusSeconds(720), false)).isEqualTo(SourceState.DUE);
    }

    @Test
    @DisplayName("Should report paused and running ahead of the interval check")
    void shouldReportPausedAndRunning() {
        DataSource paused = source(120).paused(true).build();

        assertThat(SourceState.evaluate(paused, T0, false)).isEqualTo(SourceState.PAUSED);
        assertThat(SourceState.evaluate(paused, T0, true)).isEqualTo(SourceState.RUNNING);
        assertThat(SourceState.evaluate(source(120).build(), T0, true)).isEqualTo(SourceState.RUNNING);
    }

    private static DataSource.Builder source(int interval) {
        return DataSource.builder()
            .id(1L)
            .name("feed")
            .url("https://feeds.example.com/list.txt")
            .indicatorTypes(IndicatorType.IP)
            .fetchInterval(interval)
            .active(true);
    }
}
