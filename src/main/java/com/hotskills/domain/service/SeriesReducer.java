package com.hotskills.domain.service;

import com.hotskills.domain.model.MetricSeries;
import com.hotskills.domain.model.SeriesPoint;
import com.hotskills.domain.model.SnapshotRow;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns snapshot rows into a daily and an hourly series per metric.
 *
 * Hourly: every row inside the hourly window, ascending, no deduplication.
 * Daily: the latest row of each calendar day inside the daily window,
 * ascending by date. When two rows of a day share the latest timestamp the
 * one that comes later in the input wins.
 *
 * Pure: output depends only on the rows, the metrics and {@code now}. Rows
 * that were already windowed or deduplicated by the database pass through
 * unchanged.
 */
@Component
public class SeriesReducer {

    private final Duration hourlyWindow;
    private final Duration dailyWindow;
    private final ZoneId zone;

    public SeriesReducer(
            @Value("${app.series.hourly-window:24h}") Duration hourlyWindow,
            @Value("${app.series.daily-window:30d}") Duration dailyWindow,
            @Value("${app.series.zone:Europe/Moscow}") String zone) {
        this.hourlyWindow = hourlyWindow;
        this.dailyWindow = dailyWindow;
        this.zone = ZoneId.of(zone);
    }

    public Instant hourlyWindowStart(Instant now) {
        return now.minus(hourlyWindow);
    }

    public Instant dailyWindowStart(Instant now) {
        return now.minus(dailyWindow);
    }

    /**
     * Build series for each metric, keyed in the order the metrics are given.
     *
     * @param dailyRows  rows for the daily series (may be pre-deduplicated)
     * @param hourlyRows rows for the hourly series
     */
    public Map<String, MetricSeries> reduce(List<String> metrics,
                                            List<SnapshotRow> dailyRows,
                                            List<SnapshotRow> hourlyRows,
                                            Instant now) {
        SortedMap<LocalDate, SnapshotRow> days = latestPerDay(dailyRows, now);
        List<SnapshotRow> hours = hourlyWindow(hourlyRows, now);

        Map<String, MetricSeries> result = new LinkedHashMap<>();
        for (String metric : metrics) {
            List<SeriesPoint> daily = new ArrayList<>(days.size());
            days.forEach((date, row) -> daily.add(new SeriesPoint(dailyLabel(date), row.valueOf(metric))));

            List<SeriesPoint> hourly = new ArrayList<>(hours.size());
            for (SnapshotRow row : hours) {
                hourly.add(new SeriesPoint(hourlyLabel(row.getTimestamp()), row.valueOf(metric)));
            }

            result.put(metric, MetricSeries.builder()
                    .daily(daily)
                    .hourly(hourly)
                    .build());
        }
        return result;
    }

    /**
     * Rows with {@code timestamp >= now - hourlyWindow}, ascending. Equal
     * timestamps keep their input order.
     */
    public List<SnapshotRow> hourlyWindow(List<SnapshotRow> rows, Instant now) {
        Instant from = hourlyWindowStart(now);
        return rows.stream()
                .filter(row -> !row.getTimestamp().isBefore(from))
                .sorted(Comparator.comparing(SnapshotRow::getTimestamp))
                .collect(Collectors.toList());
    }

    /**
     * Latest row per calendar day for rows with {@code timestamp >= now - dailyWindow}.
     */
    public SortedMap<LocalDate, SnapshotRow> latestPerDay(List<SnapshotRow> rows, Instant now) {
        Instant from = dailyWindowStart(now);
        SortedMap<LocalDate, SnapshotRow> days = new TreeMap<>();
        for (SnapshotRow row : rows) {
            if (row.getTimestamp().isBefore(from)) {
                continue;
            }
            LocalDate date = row.getTimestamp().atZone(zone).toLocalDate();
            days.merge(date, row, (kept, candidate) ->
                    candidate.getTimestamp().isBefore(kept.getTimestamp()) ? kept : candidate);
        }
        return days;
    }

    String dailyLabel(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    String hourlyLabel(Instant timestamp) {
        return DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.SECONDS));
    }
}
