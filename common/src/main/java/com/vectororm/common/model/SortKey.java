package com.vectororm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Ordering directive for a scalar query: a single field and a direction.
 */
public record SortKey(
    @NotBlank
    @JsonProperty("field")
    String field,

    @JsonProperty("descending")
    boolean descending
) {
    @JsonCreator
    public SortKey {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Sort field cannot be null or blank");
        }
    }

    /**
     * Parses {@code "field"} (ascending) or {@code "-field"} (descending)
     */
    public static SortKey parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Sort key cannot be null or blank");
        }
        return key.startsWith("-")
                ? new SortKey(key.substring(1), true)
                : new SortKey(key, false);
    }

    @Override
    public String toString() {
        return descending ? "-" + field : field;
    }
}
