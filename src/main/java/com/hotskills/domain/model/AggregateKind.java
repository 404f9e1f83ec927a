package com.hotskills.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Logical aggregates served from the cache.
 *
 * The key prefix is part of the cache key, so renaming one orphans every
 * entry already written under the old name.
 */
@Getter
@RequiredArgsConstructor
public enum AggregateKind {

    SALARY_TABLE("salaries"),
    LANGUAGE_LIST("languages"),
    SKILL_LIST("skills"),
    VACANCY_SERIES("vacancy-statistics"),
    RESUME_SERIES("resume-statistics");

    private final String keyPrefix;
}
