package com.bastion.fetch;

/**
 * Why a feed could not be retrieved. The message is what operators see as
 * the data source's lastFetchError.
 */
public final class FetchFailure {

    public enum Kind {
        TIMEOUT,
        HTTP_STATUS,
        TLS,
        DNS,
        CONNECTION,
        CIRCUIT_OPEN,
        BODY_TOO_LARGE,
        OTHER
    }

    private final Kind kind;
    private final String message;
    private final Integer statusCode;

    public FetchFailure(Kind kind, String message) {
        this(kind, message, null);
    }

    public FetchFailure(Kind kind, String message, Integer statusCode) {
        this.kind = kind;
        this.message = message;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * HTTP status for {@link Kind#HTTP_STATUS} failures, otherwise null
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
