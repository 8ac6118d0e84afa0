package com.example.mongoprofile.lint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * String values of a field that failed its configured pattern.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"field", "regex", "note", "violation_count", "examples"})
public class RegexViolationIssue {
    @JsonProperty("field")
    private final String field;

    @JsonProperty("regex")
    private final String regex;

    @JsonProperty("note")
    private final String note;

    @JsonProperty("violation_count")
    private final long violationCount;

    @JsonProperty("examples")
    private final List<Example> examples;

    public RegexViolationIssue(String field, String regex, String note, long violationCount, List<Example> examples) {
        this.field = field;
        this.regex = regex;
        this.note = note;
        this.violationCount = violationCount;
        this.examples = Collections.unmodifiableList(examples);
    }

    public String getField() { return field; }
    public String getRegex() { return regex; }
    public String getNote() { return note; }
    public long getViolationCount() { return violationCount; }
    public List<Example> getExamples() { return examples; }

    /**
     * Offending document and its raw value
     */
    @JsonPropertyOrder({"doc", "value"})
    public static class Example {
        @JsonProperty("doc")
        private final String doc;

        @JsonProperty("value")
        private final String value;

        public Example(String doc, String value) {
            this.doc = doc;
            this.value = value;
        }

        public String getDoc() { return doc; }
        public String getValue() { return value; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Example)) return false;
            Example that = (Example) o;
            return doc.equals(that.doc) && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(doc, value);
        }

        @Override
        public String toString() {
            return doc + "=" + value;
        }
    }
}
