package com.example.mongoprofile.aggregate;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete type tag assigned to a single observed value.
 */
public enum Kind {
    NULL("null"),
    BOOLEAN("boolean"),
    NUMBER("number"),
    STRING("string"),
    TIMESTAMP("timestamp"),
    GEOPOINT("geopoint"),
    REFERENCE("reference"),
    BYTES("bytes"),
    ARRAY("array"),
    OBJECT("object"),
    UNKNOWN("unknown");

    private final String wireName;

    Kind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Lower-case name used in reports
     */
    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isScalar() {
        return this == BOOLEAN || this == STRING || this == NUMBER;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
