package com.hotskills.domain.exception;

/**
 * Cache read or write failed, or the cache circuit breaker is open.
 *
 * Callers recover by treating the operation as a miss (read) or a no-op
 * (write).
 */
public class CacheUnavailableException extends RuntimeException {

    private final String cacheKey;

    public CacheUnavailableException(String cacheKey, String operation, Throwable cause) {
        super("Cache " + operation + " failed for key " + cacheKey + ": " + cause.getMessage(), cause);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
