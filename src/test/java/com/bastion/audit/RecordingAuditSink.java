package com.bastion.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory sink for assertions on recorded audit events.
 */
public class RecordingAuditSink implements AuditSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return events;
    }

    public List<AuditEvent> withAction(AuditAction action) {
        return events.stream().filter(e -> e.getAction() == action).collect(Collectors.toList());
    }
}
