package com.hotskills.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Numeric value of one metric in one snapshot.
 *
 * Either a single count (professions, resumes) or a fixed-length vector:
 * a (moscow, russia) pair for language vacancies, 16 salary bounds for the
 * salary table. Vector elements may be null when the collector wrote NULL.
 *
 * JSON form is a bare number for scalars and an array for vectors, which is
 * what the front end reads.
 */
@ToString
@EqualsAndHashCode
public final class MetricValue {

    private final List<Long> components;
    private final boolean scalar;

    private MetricValue(List<Long> components, boolean scalar) {
        this.components = components;
        this.scalar = scalar;
    }

    public static MetricValue of(long value) {
        return new MetricValue(List.of(value), true);
    }

    public static MetricValue ofVector(List<Long> components) {
        if (components == null) {
            throw new IllegalArgumentException("Vector components must not be null");
        }
        return new MetricValue(Collections.unmodifiableList(new ArrayList<>(components)), false);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MetricValue fromJson(Object raw) {
        if (raw instanceof Number) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof List) {
            List<Long> components = new ArrayList<>();
            for (Object item : (List<?>) raw) {
                components.add(item == null ? null : ((Number) item).longValue());
            }
            return ofVector(components);
        }
        throw new IllegalArgumentException("Unsupported metric value: " + raw);
    }

    @JsonValue
    public Object toJson() {
        return scalar ? components.get(0) : components;
    }

    public boolean isScalar() {
        return scalar;
    }

    public List<Long> getComponents() {
        return components;
    }

    public int size() {
        return components.size();
    }

    /**
     * Component at the given position, or null if the vector is shorter or
     * the element itself is NULL.
     */
    public Long component(int index) {
        return index < components.size() ? components.get(index) : null;
    }
}
