package com.hotskills.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One point of a series, written as a two-element JSON array
 * {@code [label, value]}.
 *
 * Label is an ISO date for daily points and an ISO instant (UTC) for hourly
 * points. A null value means the snapshot had no data for the metric.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"label", "value"})
public class SeriesPoint {

    private String label;
    private MetricValue value;
}
