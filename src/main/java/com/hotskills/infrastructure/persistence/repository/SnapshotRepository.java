package com.hotskills.infrastructure.persistence.repository;

import com.hotskills.domain.model.MetricValue;
import com.hotskills.domain.model.SnapshotRow;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only access to the snapshot tables.
 *
 * Rows are decoded into {@link SnapshotRow} here, so nothing past this class
 * sees JDBC types or column names it did not ask for.
 *
 * Failures surface as Spring's DataAccessException; callers decide what
 * they mean.
 */
@Repository
@RequiredArgsConstructor
public class SnapshotRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SnapshotQueryBuilder queryBuilder;

    /**
     * Hourly window: every row with {@code date >= from}, ascending.
     */
    public List<SnapshotRow> findSince(SnapshotTable table, List<String> columns, Instant from) {
        String sql = queryBuilder.since(table, columns);
        return jdbcTemplate.query(sql, fromParameter(from), rowMapper(table, columns));
    }

    /**
     * Daily window: latest row per calendar day with {@code date >= from}, ascending.
     */
    public List<SnapshotRow> findLatestPerDay(SnapshotTable table, List<String> columns, Instant from) {
        String sql = queryBuilder.latestPerDay(table, columns);
        return jdbcTemplate.query(sql, fromParameter(from), rowMapper(table, columns));
    }

    public Optional<SnapshotRow> findLatest(SnapshotTable table, List<String> columns) {
        String sql = queryBuilder.latest(table, columns);
        List<SnapshotRow> rows = jdbcTemplate.query(sql, new MapSqlParameterSource(), rowMapper(table, columns));
        return rows.stream().findFirst();
    }

    /**
     * Raw JSON text of one column in the most recent row of a document table.
     *
     * @return empty when the table has no rows or the column is NULL
     */
    public Optional<String> findLatestDocument(SnapshotTable table, String column) {
        if (table.getValueType() != SnapshotTable.ValueType.JSON) {
            throw new IllegalArgumentException(table + " does not hold JSON documents");
        }
        String sql = queryBuilder.latest(table, List.of(column));
        List<String> documents = jdbcTemplate.query(sql, new MapSqlParameterSource(),
                (rs, rowNum) -> rs.getString(column));
        return documents.stream().filter(Objects::nonNull).findFirst();
    }

    private static MapSqlParameterSource fromParameter(Instant from) {
        return new MapSqlParameterSource("from", Timestamp.from(from));
    }

    private static RowMapper<SnapshotRow> rowMapper(SnapshotTable table, List<String> columns) {
        return (rs, rowNum) -> {
            Instant timestamp = rs.getTimestamp(SnapshotTable.TIME_COLUMN).toInstant();
            Map<String, MetricValue> values = new LinkedHashMap<>();
            for (String column : columns) {
                values.put(column, decode(rs, column, table.getValueType()));
            }
            return new SnapshotRow(timestamp, values);
        };
    }

    private static MetricValue decode(ResultSet rs, String column, SnapshotTable.ValueType type) throws SQLException {
        return switch (type) {
            case INTEGER -> {
                Object raw = rs.getObject(column);
                yield raw == null ? null : MetricValue.of(((Number) raw).longValue());
            }
            case INTEGER_ARRAY -> decodeArray(rs.getArray(column));
            case JSON -> throw new IllegalArgumentException("JSON column " + column + " is not a metric value");
        };
    }

    private static MetricValue decodeArray(Array array) throws SQLException {
        if (array == null) {
            return null;
        }
        try {
            Object[] items = (Object[]) array.getArray();
            List<Long> components = new ArrayList<>(items.length);
            for (Object item : items) {
                components.add(item == null ? null : ((Number) item).longValue());
            }
            return MetricValue.ofVector(components);
        } finally {
            array.free();
        }
    }
}
