package com.hotskills.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Daily and hourly series for a single metric.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSeries {

    private List<SeriesPoint> daily;
    private List<SeriesPoint> hourly;
}
