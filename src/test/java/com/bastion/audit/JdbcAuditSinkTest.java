package com.bastion.audit;

import com.bastion.storage.TestDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JdbcAuditSink Tests")
class JdbcAuditSinkTest {

    private JdbcTemplate jdbc;
    private JdbcAuditSink sink;

    @BeforeEach
    void setUp() {
        jdbc = TestDatabase.create();
        sink = new JdbcAuditSink(jdbc, new ObjectMapper(),
            Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should persist an event with JSON metadata")
    void shouldPersistEvent() {
        // When
        sink.record(AuditEvent.builder(AuditAction.PAUSE, AuditEvent.RESOURCE_DATA_SOURCE)
            .resourceId(12L)
            .details("Paused data source: abuse-feed")
            .userId(42L)
            .ipAddress("203.0.113.9")
            .metadata("reason", "maintenance")
            .build());

        // Then
        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM audit_logs");
        assertThat(row.get("level")).isEqualTo("info");
        assertThat(row.get("action")).isEqualTo("pause");
        assertThat(row.get("resource")).isEqualTo("data_source");
        assertThat(row.get("resource_id")).isEqualTo("12");
        assertThat(row.get("user_id")).isEqualTo(42L);
        assertThat(row.get("metadata")).isEqualTo("{\"reason\":\"maintenance\"}");
    }

    @Test
    @DisplayName("Should store system events without user or metadata")
    void shouldPersistSystemEvent() {
        // When
        sink.record(AuditEvent.builder(AuditAction.CLEANUP, AuditEvent.RESOURCE_INDICATOR)
            .resourceId(7L)
            .build());

        // Then
        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM audit_logs");
        assertThat(row.get("user_id")).isNull();
        assertThat(row.get("metadata")).isNull();
    }

    @Test
    @DisplayName("Should not propagate a failed write")
    void shouldSwallowWriteFailure() {
        // Given
        jdbc.execute("DROP TABLE audit_logs");

        // Then
        assertThatCode(() -> sink.record(AuditEvent.builder(AuditAction.REFRESH, AuditEvent.RESOURCE_BLACKLIST)
            .build())).doesNotThrowAnyException();
    }
}
