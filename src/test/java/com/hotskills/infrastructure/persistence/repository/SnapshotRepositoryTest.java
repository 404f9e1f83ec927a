package com.hotskills.infrastructure.persistence.repository;

import com.hotskills.domain.model.Language;
import com.hotskills.domain.model.LanguageCatalog;
import com.hotskills.domain.model.MetricValue;
import com.hotskills.domain.model.SnapshotRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotRepositoryTest {

    private static final Instant SNAPSHOT_TIME = Instant.parse("2025-05-23T17:00:00Z");

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Mock
    private ResultSet resultSet;

    private SnapshotRepository repository;

    @BeforeEach
    void setUp() {
        LanguageCatalog catalog = LanguageCatalog.of(List.of(
                new Language("python", "Python", null),
                new Language("go", "Go", null)));
        repository = new SnapshotRepository(jdbcTemplate, new SnapshotQueryBuilder(catalog));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindSince_DecodesArrayColumns() throws Exception {
        // Given
        Array pythonArray = mock(Array.class);
        when(pythonArray.getArray()).thenReturn(new Integer[]{1200, 1600});
        when(resultSet.getTimestamp("date")).thenReturn(Timestamp.from(SNAPSHOT_TIME));
        when(resultSet.getArray("python")).thenReturn(pythonArray);
        when(resultSet.getArray("go")).thenReturn(null);
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenAnswer(invocation -> {
                    RowMapper<SnapshotRow> mapper = invocation.getArgument(2);
                    return List.of(mapper.mapRow(resultSet, 0));
                });
        Instant from = Instant.parse("2025-05-22T17:00:00Z");

        // When
        List<SnapshotRow> rows = repository.findSince(SnapshotTable.LANGUAGE_VACANCIES, List.of("python", "go"), from);

        // Then
        assertEquals(1, rows.size());
        assertEquals(SNAPSHOT_TIME, rows.get(0).getTimestamp());
        assertEquals(MetricValue.ofVector(List.of(1200L, 1600L)), rows.get(0).valueOf("python"));
        assertNull(rows.get(0).valueOf("go"));
        verify(pythonArray).free();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).query(sql.capture(), params.capture(), any(RowMapper.class));
        assertTrue(sql.getValue().contains("FROM vacancies_statistics.languages WHERE date >= :from"));
        assertEquals(Timestamp.from(from), params.getValue().getValue("from"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindLatestPerDay_DecodesScalarColumns() throws Exception {
        // Given
        when(resultSet.getTimestamp("date")).thenReturn(Timestamp.from(SNAPSHOT_TIME));
        when(resultSet.getObject("software_developer")).thenReturn(14500);
        when(jdbcTemplate.query(contains("ROW_NUMBER()"), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenAnswer(invocation -> {
                    RowMapper<SnapshotRow> mapper = invocation.getArgument(2);
                    return List.of(mapper.mapRow(resultSet, 0));
                });

        // When
        List<SnapshotRow> rows = repository.findLatestPerDay(SnapshotTable.PROFESSION_VACANCIES,
                List.of("software_developer"), Instant.parse("2025-04-23T17:00:00Z"));

        // Then
        assertEquals(MetricValue.of(14500), rows.get(0).valueOf("software_developer"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindLatest_NoRows() {
        // Given
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        // When
        Optional<SnapshotRow> latest = repository.findLatest(SnapshotTable.SALARIES, List.of("python", "go"));

        // Then
        assertTrue(latest.isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindLatestDocument_ReturnsRawJson() throws Exception {
        // Given
        when(resultSet.getString("go")).thenReturn("[[\"gin\", 40]]");
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenAnswer(invocation -> {
                    RowMapper<String> mapper = invocation.getArgument(2);
                    return List.of(mapper.mapRow(resultSet, 0));
                });

        // When
        Optional<String> document = repository.findLatestDocument(SnapshotTable.HOT_SKILLS, "go");

        // Then
        assertEquals(Optional.of("[[\"gin\", 40]]"), document);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindLatestDocument_NullColumn() throws Exception {
        // Given
        when(resultSet.getString("go")).thenReturn(null);
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenAnswer(invocation -> {
                    RowMapper<String> mapper = invocation.getArgument(2);
                    return Collections.singletonList(mapper.mapRow(resultSet, 0));
                });

        // When
        Optional<String> document = repository.findLatestDocument(SnapshotTable.HOT_SKILLS, "go");

        // Then
        assertTrue(document.isEmpty());
    }

    @Test
    void testFindLatestDocument_RejectsNonDocumentTable() {
        assertThrows(IllegalArgumentException.class,
                () -> repository.findLatestDocument(SnapshotTable.SALARIES, "go"));
        verifyNoInteractions(jdbcTemplate);
    }
}
