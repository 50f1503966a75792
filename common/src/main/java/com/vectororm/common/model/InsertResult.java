package com.vectororm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Outcome of an insert: how many rows the store accepted and the primary keys it
 * reports for them, in insertion order.
 */
public record InsertResult(
    @Min(0)
    @JsonProperty("insertCount")
    long insertCount,

    @JsonProperty("primaryKeys")
    List<Object> primaryKeys
) {
    @JsonCreator
    public InsertResult {
        if (insertCount < 0) {
            throw new IllegalArgumentException("Insert count cannot be negative");
        }
        primaryKeys = primaryKeys == null ? List.of() : List.copyOf(primaryKeys);
    }

    /**
     * Creates a result for stores that do not report generated keys
     */
    public static InsertResult ofCount(long insertCount) {
        return new InsertResult(insertCount, List.of());
    }
}
