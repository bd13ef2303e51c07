package com.bastion.audit;

/**
 * Append-only destination for audit events.
 *
 * Implementations must not throw: a failed audit write is logged and the
 * calling operation carries on.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
