package com.hotskills.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One collection run read from a snapshot table, restricted to the columns
 * the query asked for.
 *
 * Values may be null; a missing metric and a NULL column look the same.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SnapshotRow {

    private final Instant timestamp;
    private final Map<String, MetricValue> values;

    public SnapshotRow(Instant timestamp, Map<String, MetricValue> values) {
        if (timestamp == null) {
            throw new IllegalArgumentException("Snapshot timestamp must not be null");
        }
        this.timestamp = timestamp;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public MetricValue valueOf(String metric) {
        return values.get(metric);
    }
}
