package com.vectororm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.util.List;

/**
 * Scalar query against a collection.
 * An empty filter means "match all"; null limit/offset leave pagination to the store
 * and a null consistency level uses the collection's default.
 */
@Builder(toBuilder = true)
public record QueryRequest(
    @NotBlank
    @JsonProperty("collectionName")
    String collectionName,

    @JsonProperty("filter")
    String filter,

    @JsonProperty("outputFields")
    List<String> outputFields,

    @Min(1)
    @JsonProperty("limit")
    Integer limit,

    @Min(0)
    @JsonProperty("offset")
    Integer offset,

    @JsonProperty("orderBy")
    SortKey orderBy,

    @JsonProperty("consistencyLevel")
    ConsistencyLevel consistencyLevel
) {
    @JsonCreator
    public QueryRequest {
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("Collection name cannot be null or blank");
        }
        filter = filter == null ? "" : filter;
        outputFields = outputFields == null ? List.of() : List.copyOf(outputFields);
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
    }

    /**
     * Creates a match-all query over every field of a collection
     */
    public static QueryRequest all(String collectionName) {
        return new QueryRequest(collectionName, "", List.of(), null, null, null, null);
    }
}
