package com.vectororm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row returned by a vector search together with its distance to the query vector.
 */
public record SearchHit(
    @NotNull
    @JsonProperty("entity")
    Map<String, Object> entity,

    @JsonProperty("distance")
    double distance
) {
    @JsonCreator
    public SearchHit {
        if (entity == null) {
            throw new IllegalArgumentException("Entity cannot be null");
        }
        if (Double.isNaN(distance)) {
            throw new IllegalArgumentException("Distance cannot be NaN");
        }
        // rows may carry null values
        entity = Collections.unmodifiableMap(new LinkedHashMap<>(entity));
    }
}
