package com.example.mongoprofile.lint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;

/**
 * The five issue sections of a lint run. An empty section means no issue of that kind, and is omitted when serialized.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"missing_fields", "type_mismatches", "regex_violations", "rare_fields", "field_name_variants"})
public class IssueReport {
    @JsonProperty("missing_fields")
    private final List<MissingFieldIssue> missingFields;

    @JsonProperty("type_mismatches")
    private final List<TypeMismatchIssue> typeMismatches;

    @JsonProperty("regex_violations")
    private final List<RegexViolationIssue> regexViolations;

    @JsonProperty("rare_fields")
    private final List<RareFieldIssue> rareFields;

    @JsonProperty("field_name_variants")
    private final List<FieldNameVariantIssue> fieldNameVariants;

    @JsonIgnore
    private final int fieldsTotal;

    @JsonIgnore
    private final int expectedFieldsCount;

    IssueReport(List<MissingFieldIssue> missingFields,
                List<TypeMismatchIssue> typeMismatches,
                List<RegexViolationIssue> regexViolations,
                List<RareFieldIssue> rareFields,
                List<FieldNameVariantIssue> fieldNameVariants,
                int fieldsTotal,
                int expectedFieldsCount) {
        this.missingFields = Collections.unmodifiableList(missingFields);
        this.typeMismatches = Collections.unmodifiableList(typeMismatches);
        this.regexViolations = Collections.unmodifiableList(regexViolations);
        this.rareFields = Collections.unmodifiableList(rareFields);
        this.fieldNameVariants = Collections.unmodifiableList(fieldNameVariants);
        this.fieldsTotal = fieldsTotal;
        this.expectedFieldsCount = expectedFieldsCount;
    }

    public List<MissingFieldIssue> getMissingFields() { return missingFields; }
    public List<TypeMismatchIssue> getTypeMismatches() { return typeMismatches; }
    public List<RegexViolationIssue> getRegexViolations() { return regexViolations; }
    public List<RareFieldIssue> getRareFields() { return rareFields; }
    public List<FieldNameVariantIssue> getFieldNameVariants() { return fieldNameVariants; }

    /**
     * Number of distinct flattened field paths observed
     */
    @JsonIgnore
    public int getFieldsTotal() { return fieldsTotal; }

    /**
     * Number of fields whose presence fraction reached the required threshold
     */
    @JsonIgnore
    public int getExpectedFieldsCount() { return expectedFieldsCount; }
}
