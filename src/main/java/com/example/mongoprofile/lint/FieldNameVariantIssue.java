package com.example.mongoprofile.lint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;

/**
 * Field paths that collapse to the same normalized name, e.g. {@code firstName} and {@code first_name}.
 * The most common spelling is the canonical one; the others are listed as variants.
 */
@JsonPropertyOrder({"normalized", "canonical", "canonical_count", "variants"})
public class FieldNameVariantIssue {
    @JsonProperty("normalized")
    private final String normalized;

    @JsonProperty("canonical")
    private final String canonical;

    @JsonProperty("canonical_count")
    private final long canonicalCount;

    @JsonProperty("variants")
    private final List<Variant> variants;

    public FieldNameVariantIssue(String normalized, String canonical, long canonicalCount, List<Variant> variants) {
        this.normalized = normalized;
        this.canonical = canonical;
        this.canonicalCount = canonicalCount;
        this.variants = Collections.unmodifiableList(variants);
    }

    public String getNormalized() { return normalized; }
    public String getCanonical() { return canonical; }
    public long getCanonicalCount() { return canonicalCount; }
    public List<Variant> getVariants() { return variants; }

    @JsonPropertyOrder({"field", "present_count"})
    public static class Variant {
        @JsonProperty("field")
        private final String field;

        @JsonProperty("present_count")
        private final long presentCount;

        public Variant(String field, long presentCount) {
            this.field = field;
            this.presentCount = presentCount;
        }

        public String getField() { return field; }
        public long getPresentCount() { return presentCount; }
    }
}
