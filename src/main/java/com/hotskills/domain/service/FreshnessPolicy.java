package com.hotskills.domain.service;

import com.hotskills.domain.model.AggregateKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache key and TTL for every aggregate kind.
 *
 * Caching Strategy:
 * - Vacancy and resume series: 1 hour (collectors run hourly)
 * - Salary table: 1 hour
 * - Skill lists: 24 hours (collected once a day)
 * - Language list: no expiry, a new language needs a restart anyway
 *
 * Values are read once at startup. There is no per-filter override.
 */
@Component
public class FreshnessPolicy {

    private static final String ALL = "all";

    private final Duration salaryTableTtl;
    private final Duration vacancySeriesTtl;
    private final Duration resumeSeriesTtl;
    private final Duration skillListTtl;

    public FreshnessPolicy(
            @Value("${app.cache.ttl.salary-table:1h}") Duration salaryTableTtl,
            @Value("${app.cache.ttl.vacancy-series:1h}") Duration vacancySeriesTtl,
            @Value("${app.cache.ttl.resume-series:1h}") Duration resumeSeriesTtl,
            @Value("${app.cache.ttl.skill-list:24h}") Duration skillListTtl) {
        this.salaryTableTtl = requirePositive("salary-table", salaryTableTtl);
        this.vacancySeriesTtl = requirePositive("vacancy-series", vacancySeriesTtl);
        this.resumeSeriesTtl = requirePositive("resume-series", resumeSeriesTtl);
        this.skillListTtl = requirePositive("skill-list", skillListTtl);
    }

    /**
     * @return the expiry to attach, or empty for entries that never expire
     */
    public Optional<Duration> ttlFor(AggregateKind kind) {
        Duration ttl = switch (kind) {
            case LANGUAGE_LIST -> null;
            case SALARY_TABLE -> salaryTableTtl;
            case VACANCY_SERIES -> vacancySeriesTtl;
            case RESUME_SERIES -> resumeSeriesTtl;
            case SKILL_LIST -> skillListTtl;
        };
        return Optional.ofNullable(ttl);
    }

    /**
     * Generate cache key from aggregate kind and optional filter,
     * e.g. {@code vacancy-statistics:python} or {@code salaries:all}.
     */
    public String cacheKey(AggregateKind kind, String filter) {
        String suffix = filter == null || filter.isBlank() ? ALL : filter;
        return kind.getKeyPrefix() + ":" + suffix;
    }

    private static Duration requirePositive(String name, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("app.cache.ttl." + name + " must be positive, got " + ttl);
        }
        return ttl;
    }
}
