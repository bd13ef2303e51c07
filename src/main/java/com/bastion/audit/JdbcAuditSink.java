package com.bastion.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;

/**
 * Audit sink backed by the audit_logs table.
 *
 * Metadata is stored as a JSON document. A failed write is logged at ERROR
 * and swallowed so that auditing never breaks the pipeline step that
 * produced the event.
 */
@Component
public class JdbcAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcAuditSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void record(AuditEvent event) {
        Instant createdAt = event.getCreatedAt() != null ? event.getCreatedAt() : clock.instant();
        try {
            jdbcTemplate.update("""
                INSERT INTO audit_logs (level, action, resource, resource_id, details, user_id,
                                        ip_address, metadata, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, event.getLevel().getValue(), event.getAction().getValue(), event.getResource(),
                event.getResourceId(), event.getDetails(), event.getUserId(), event.getIpAddress(),
                serializeMetadata(event), Timestamp.from(createdAt));
            log.debug("Audit recorded: {}", event);
        } catch (Exception e) {
            log.error("Failed to record audit event: {}", event, e);
        }
    }

    private String serializeMetadata(AuditEvent event) {
        if (event.getMetadata() == null || event.getMetadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.getMetadata());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit metadata for {}: {}", event.getAction(), e.getMessage());
            return null;
        }
    }
}
