package com.example.mongoprofile.lint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A field observed with two or more distinct non-null kinds.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"field", "kinds", "example_doc_ids_by_kind"})
public class TypeMismatchIssue {
    @JsonProperty("field")
    private final String field;

    // kind name -> observations, null included
    @JsonProperty("kinds")
    private final Map<String, Long> kinds;

    @JsonProperty("example_doc_ids_by_kind")
    private final Map<String, List<String>> exampleDocIdsByKind;

    public TypeMismatchIssue(String field, Map<String, Long> kinds, Map<String, List<String>> exampleDocIdsByKind) {
        this.field = field;
        this.kinds = Collections.unmodifiableMap(kinds);
        this.exampleDocIdsByKind = Collections.unmodifiableMap(exampleDocIdsByKind);
    }

    public String getField() { return field; }
    public Map<String, Long> getKinds() { return kinds; }
    public Map<String, List<String>> getExampleDocIdsByKind() { return exampleDocIdsByKind; }
}
