package com.hotskills.infrastructure.persistence.repository;

import com.hotskills.domain.model.Language;
import com.hotskills.domain.model.LanguageCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotQueryBuilderTest {

    private SnapshotQueryBuilder queryBuilder;

    @BeforeEach
    void setUp() {
        queryBuilder = new SnapshotQueryBuilder(LanguageCatalog.of(List.of(
                new Language("python", "Python", null),
                new Language("one_c", "1C", "#E31E24"))));
    }

    @Test
    void testSince() {
        String sql = queryBuilder.since(SnapshotTable.LANGUAGE_VACANCIES, List.of("python", "one_c"));

        assertEquals("SELECT date, \"python\", \"one_c\" FROM vacancies_statistics.languages"
                + " WHERE date >= :from ORDER BY date ASC", sql);
    }

    @Test
    void testLatestPerDay() {
        String sql = queryBuilder.latestPerDay(SnapshotTable.PROFESSION_VACANCIES, List.of("software_developer"));

        assertTrue(sql.startsWith("SELECT date, \"software_developer\" FROM ("));
        assertTrue(sql.contains("ROW_NUMBER() OVER (PARTITION BY CAST(date AS date) ORDER BY date DESC, ctid DESC)"));
        assertTrue(sql.contains("FROM vacancies_statistics.professions WHERE date >= :from"));
        assertTrue(sql.endsWith("WHERE rn = 1 ORDER BY date ASC"));
    }

    @Test
    void testLatest() {
        String sql = queryBuilder.latest(SnapshotTable.HOT_SKILLS, List.of("python"));

        assertEquals("SELECT date, \"python\" FROM hot_skills ORDER BY date DESC LIMIT 1", sql);
    }

    @Test
    void testRejectsUnknownMetric() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> queryBuilder.since(SnapshotTable.SALARIES, List.of("python", "rust")));
        assertEquals("Column is not a known metric: rust", e.getMessage());
    }

    @Test
    void testRejectsInjectedIdentifier() {
        assertThrows(IllegalArgumentException.class,
                () -> queryBuilder.latest(SnapshotTable.SALARIES, List.of("python\"; DROP TABLE salaries; --")));
        assertThrows(IllegalArgumentException.class,
                () -> queryBuilder.latest(SnapshotTable.SALARIES, List.of("Python")));
    }

    @Test
    void testRejectsEmptyColumnList() {
        assertThrows(IllegalArgumentException.class, () -> queryBuilder.columnList(List.of()));
    }
}
