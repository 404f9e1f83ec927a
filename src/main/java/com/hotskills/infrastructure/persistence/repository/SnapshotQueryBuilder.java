package com.hotskills.infrastructure.persistence.repository;

import com.hotskills.domain.model.LanguageCatalog;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds snapshot queries from whitelisted identifiers.
 *
 * Column names must be known metrics from the catalog and plain lowercase
 * identifiers; they are double-quoted in the output. Table names come from
 * {@link SnapshotTable} only. Time bounds are bound as the {@code :from}
 * parameter, never inlined.
 */
@RequiredArgsConstructor
public class SnapshotQueryBuilder {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final LanguageCatalog catalog;

    /**
     * Every row since {@code :from}, oldest first.
     */
    public String since(SnapshotTable table, List<String> columns) {
        return "SELECT " + SnapshotTable.TIME_COLUMN + ", " + columnList(columns) +
               " FROM " + table.getQualifiedName() +
               " WHERE " + SnapshotTable.TIME_COLUMN + " >= :from" +
               " ORDER BY " + SnapshotTable.TIME_COLUMN + " ASC";
    }

    /**
     * Latest row of each calendar day since {@code :from}, oldest day first.
     *
     * Days follow the session time zone. Rows sharing a timestamp are ranked
     * by physical position so the pick is stable for an append-only table.
     */
    public String latestPerDay(SnapshotTable table, List<String> columns) {
        return "SELECT " + SnapshotTable.TIME_COLUMN + ", " + columnList(columns) +
               " FROM (" +
               "SELECT *, ROW_NUMBER() OVER (" +
               "PARTITION BY CAST(" + SnapshotTable.TIME_COLUMN + " AS date) " +
               "ORDER BY " + SnapshotTable.TIME_COLUMN + " DESC, ctid DESC) AS rn" +
               " FROM " + table.getQualifiedName() +
               " WHERE " + SnapshotTable.TIME_COLUMN + " >= :from" +
               ") sub" +
               " WHERE rn = 1" +
               " ORDER BY " + SnapshotTable.TIME_COLUMN + " ASC";
    }

    /**
     * The single most recent row.
     */
    public String latest(SnapshotTable table, List<String> columns) {
        return "SELECT " + SnapshotTable.TIME_COLUMN + ", " + columnList(columns) +
               " FROM " + table.getQualifiedName() +
               " ORDER BY " + SnapshotTable.TIME_COLUMN + " DESC" +
               " LIMIT 1";
    }

    String columnList(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("At least one metric column is required");
        }
        return columns.stream()
                .map(this::quote)
                .collect(Collectors.joining(", "));
    }

    private String quote(String column) {
        if (column == null || !IDENTIFIER.matcher(column).matches() || !catalog.isKnownMetric(column)) {
            throw new IllegalArgumentException("Column is not a known metric: " + column);
        }
        return "\"" + column + "\"";
    }
}
