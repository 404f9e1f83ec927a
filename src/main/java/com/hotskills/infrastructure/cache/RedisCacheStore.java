package com.hotskills.infrastructure.cache;

import com.hotskills.domain.exception.CacheUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cache store.
 *
 * One shared Lettuce connection serves every request; it never waits on the
 * database pool.
 *
 * Failure Handling:
 * - Redis errors are rethrown as CacheUnavailableException
 * - When the "redis" circuit breaker is open, calls fail fast with the same
 *   exception instead of waiting on a dead connection
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public Optional<String> get(String key) {
        try {
            String cached = redisTemplate.opsForValue().get(key);

            if (cached == null) {
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            log.debug("Cache hit for key: {}", key);
            return Optional.of(cached);

        } catch (DataAccessException e) {
            throw new CacheUnavailableException(key, "read", e);
        }
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, String payload, Duration ttl) {
        try {
            if (ttl == null) {
                redisTemplate.opsForValue().set(key, payload);
            } else {
                redisTemplate.opsForValue().set(key, payload, ttl);
            }
            log.debug("Cached payload for key: {} (TTL: {})", key, ttl == null ? "none" : ttl);

        } catch (DataAccessException e) {
            throw new CacheUnavailableException(key, "write", e);
        }
    }

    // Fallback methods (circuit breaker)

    private Optional<String> getFallback(String key, Throwable e) {
        throw unavailable(key, "read", e);
    }

    private void setFallback(String key, String payload, Duration ttl, Throwable e) {
        throw unavailable(key, "write", e);
    }

    private static CacheUnavailableException unavailable(String key, String operation, Throwable e) {
        if (e instanceof CacheUnavailableException) {
            return (CacheUnavailableException) e;
        }
        log.warn("Redis circuit breaker open, skipping cache {} for key: {}", operation, key);
        return new CacheUnavailableException(key, operation, e);
    }
}
