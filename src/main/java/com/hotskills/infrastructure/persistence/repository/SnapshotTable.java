package com.hotskills.infrastructure.persistence.repository;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Append-only snapshot tables. One row per collection run, one column per
 * metric, plus the {@code date} timestamp of the run.
 *
 * These names are the only table identifiers that ever reach SQL.
 */
@Getter
@RequiredArgsConstructor
public enum SnapshotTable {

    LANGUAGE_VACANCIES("vacancies_statistics.languages", ValueType.INTEGER_ARRAY),
    PROFESSION_VACANCIES("vacancies_statistics.professions", ValueType.INTEGER),
    RESUMES("resumes", ValueType.INTEGER),
    SALARIES("salaries", ValueType.INTEGER_ARRAY),
    HOT_SKILLS("hot_skills", ValueType.JSON);

    public static final String TIME_COLUMN = "date";

    private final String qualifiedName;
    private final ValueType valueType;

    public enum ValueType {
        INTEGER,
        INTEGER_ARRAY,
        JSON
    }
}
