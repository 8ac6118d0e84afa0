package com.example.mongoprofile.lint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;

/**
 * A field present in so few documents that it is likely a typo or a stray one-off.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"field", "present_count", "present_pct", "example_doc_ids"})
public class RareFieldIssue {
    @JsonProperty("field")
    private final String field;

    @JsonProperty("present_count")
    private final long presentCount;

    @JsonProperty("present_pct")
    private final double presentPct;

    @JsonProperty("example_doc_ids")
    private final List<String> exampleDocIds;

    public RareFieldIssue(String field, long presentCount, double presentPct, List<String> exampleDocIds) {
        this.field = field;
        this.presentCount = presentCount;
        this.presentPct = presentPct;
        this.exampleDocIds = Collections.unmodifiableList(exampleDocIds);
    }

    public String getField() { return field; }
    public long getPresentCount() { return presentCount; }
    public double getPresentPct() { return presentPct; }
    public List<String> getExampleDocIds() { return exampleDocIds; }
}
