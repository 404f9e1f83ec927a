package com.hotskills.domain.exception;

import com.hotskills.domain.model.AggregateKind;

/**
 * The snapshot store could not be queried while deriving an aggregate.
 *
 * Nothing is cached when this is thrown.
 */
public class StoreUnavailableException extends RuntimeException {

    private final AggregateKind kind;
    private final String cacheKey;

    public StoreUnavailableException(AggregateKind kind, String cacheKey, Throwable cause) {
        super("Snapshot store unavailable while resolving " + kind + " [" + cacheKey + "]: "
                + cause.getMessage(), cause);
        this.kind = kind;
        this.cacheKey = cacheKey;
    }

    public AggregateKind getKind() {
        return kind;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
