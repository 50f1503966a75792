package com.vectororm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.List;

/**
 * Nearest-neighbour search over one vector field, with the compiled scalar
 * expression applied as a pre-filter.
 */
@Builder
public record SearchRequest(
    @NotBlank
    @JsonProperty("collectionName")
    String collectionName,

    @NotBlank
    @JsonProperty("annsField")
    String annsField,

    @NotNull
    @Size(min = 1)
    @JsonProperty("vector")
    List<Float> vector,

    @NotBlank
    @JsonProperty("metricType")
    String metricType,

    @Min(1)
    @JsonProperty("limit")
    int limit,

    @Min(0)
    @JsonProperty("offset")
    Integer offset,

    @JsonProperty("filter")
    String filter,

    @JsonProperty("outputFields")
    List<String> outputFields,

    @JsonProperty("consistencyLevel")
    ConsistencyLevel consistencyLevel
) {
    @JsonCreator
    public SearchRequest {
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("Collection name cannot be null or blank");
        }
        if (annsField == null || annsField.isBlank()) {
            throw new IllegalArgumentException("Vector field cannot be null or blank");
        }
        if (vector == null || vector.isEmpty()) {
            throw new IllegalArgumentException("Query vector cannot be null or empty");
        }
        if (metricType == null || metricType.isBlank()) {
            throw new IllegalArgumentException("Metric type cannot be null or blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        vector = List.copyOf(vector);
        filter = filter == null ? "" : filter;
        outputFields = outputFields == null ? List.of() : List.copyOf(outputFields);
    }

    /**
     * Gets the dimension of the query vector
     */
    public int dimension() {
        return vector.size();
    }
}
