package com.hotskills.domain.exception;

import com.hotskills.domain.model.AggregateKind;

/**
 * An aggregate could not be converted to or from JSON.
 */
public class EncodingException extends RuntimeException {

    private final AggregateKind kind;
    private final String cacheKey;

    public EncodingException(AggregateKind kind, String cacheKey, Throwable cause) {
        super("Failed to encode " + kind + " [" + cacheKey + "]: " + cause.getMessage(), cause);
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
