package com.bastion.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-local holder for the identity of the current request.
 *
 * Set by {@link IdentityInterceptor} when a request enters and cleared when
 * it completes. Code running outside a request (scheduled jobs, ingestion
 * workers) sees {@link RequestIdentity#SYSTEM}.
 *
 * Usage:
 * <pre>
 * RequestIdentity who = IdentityContext.current();
 * auditSink.record(AuditEvent.builder(AuditAction.PAUSE, AuditEvent.RESOURCE_DATA_SOURCE)
 *     .userId(who.getUserId())
 *     .ipAddress(who.getIpAddress())
 *     .build());
 * </pre>
 */
public final class IdentityContext {

    private static final Logger log = LoggerFactory.getLogger(IdentityContext.class);

    private static final ThreadLocal<RequestIdentity> IDENTITY = new ThreadLocal<>();

    private IdentityContext() {
        throw new UnsupportedOperationException("IdentityContext is a utility class and cannot be instantiated");
    }

    public static void set(RequestIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("Identity must not be null");
        }
        log.trace("Setting request identity: {}", identity);
        IDENTITY.set(identity);
    }

    /**
     * @return the identity bound to this thread, or {@link RequestIdentity#SYSTEM} if none
     */
    public static RequestIdentity current() {
        RequestIdentity identity = IDENTITY.get();
        return identity != null ? identity : RequestIdentity.SYSTEM;
    }

    public static void clear() {
        IDENTITY.remove();
    }
}
