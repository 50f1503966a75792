package com.vectororm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Read consistency requested from the store. {@link #STRONG} reads observe every
 * write acknowledged before the read was issued.
 */
public enum ConsistencyLevel {
    STRONG("Strong"),
    BOUNDED("Bounded"),
    SESSION("Session"),
    EVENTUALLY("Eventually");

    private final String wireName;

    ConsistencyLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a level by name, ignoring case ({@code "strong"}, {@code "Bounded"}, ...)
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static ConsistencyLevel of(String name) {
        if (name != null) {
            for (ConsistencyLevel level : values()) {
                if (level.wireName.equalsIgnoreCase(name.trim())) {
                    return level;
                }
            }
        }
        throw new IllegalArgumentException("Unknown consistency level '" + name + "'");
    }
}
