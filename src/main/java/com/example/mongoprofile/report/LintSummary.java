package com.example.mongoprofile.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Issue counts per section.
 */
@JsonPropertyOrder({"fields_total", "expected_fields_count", "missing_fields_issues", "type_mismatch_issues",
        "regex_issues", "rare_fields_issues", "field_name_variant_issues", "docs_with_issues_examples_count"})
public class LintSummary {
    @JsonProperty("fields_total")
    private final int fieldsTotal;

    @JsonProperty("expected_fields_count")
    private final int expectedFieldsCount;

    @JsonProperty("missing_fields_issues")
    private final int missingFieldsIssues;

    @JsonProperty("type_mismatch_issues")
    private final int typeMismatchIssues;

    @JsonProperty("regex_issues")
    private final int regexIssues;

    @JsonProperty("rare_fields_issues")
    private final int rareFieldsIssues;

    @JsonProperty("field_name_variant_issues")
    private final int fieldNameVariantIssues;

    // distinct ids among the missing, type and regex examples; a lower bound, since examples are capped
    @JsonProperty("docs_with_issues_examples_count")
    private final int docsWithIssuesExamplesCount;

    LintSummary(int fieldsTotal, int expectedFieldsCount, int missingFieldsIssues, int typeMismatchIssues,
                int regexIssues, int rareFieldsIssues, int fieldNameVariantIssues, int docsWithIssuesExamplesCount) {
        this.fieldsTotal = fieldsTotal;
        this.expectedFieldsCount = expectedFieldsCount;
        this.missingFieldsIssues = missingFieldsIssues;
        this.typeMismatchIssues = typeMismatchIssues;
        this.regexIssues = regexIssues;
        this.rareFieldsIssues = rareFieldsIssues;
        this.fieldNameVariantIssues = fieldNameVariantIssues;
        this.docsWithIssuesExamplesCount = docsWithIssuesExamplesCount;
    }

    public int getFieldsTotal() { return fieldsTotal; }
    public int getExpectedFieldsCount() { return expectedFieldsCount; }
    public int getMissingFieldsIssues() { return missingFieldsIssues; }
    public int getTypeMismatchIssues() { return typeMismatchIssues; }
    public int getRegexIssues() { return regexIssues; }
    public int getRareFieldsIssues() { return rareFieldsIssues; }
    public int getFieldNameVariantIssues() { return fieldNameVariantIssues; }
    public int getDocsWithIssuesExamplesCount() { return docsWithIssuesExamplesCount; }
}
