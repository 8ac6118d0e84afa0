package com.example.mongoprofile.lint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;

/**
 * An expected field (present in at least the required fraction of documents) that some documents lack.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"field", "missing_count", "missing_pct", "example_doc_ids"})
public class MissingFieldIssue {
    @JsonProperty("field")
    private final String field;

    @JsonProperty("missing_count")
    private final long missingCount;

    @JsonProperty("missing_pct")
    private final double missingPct;

    @JsonProperty("example_doc_ids")
    private final List<String> exampleDocIds;

    public MissingFieldIssue(String field, long missingCount, double missingPct, List<String> exampleDocIds) {
        this.field = field;
        this.missingCount = missingCount;
        this.missingPct = missingPct;
        this.exampleDocIds = Collections.unmodifiableList(exampleDocIds);
    }

    public String getField() { return field; }
    public long getMissingCount() { return missingCount; }
    public double getMissingPct() { return missingPct; }
    public List<String> getExampleDocIds() { return exampleDocIds; }
}
