package com.example.mongoprofile.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Run parameters and counts, so a report can be read without the configuration that produced it.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"generated_at", "sample_limit", "docs_scanned", "required_threshold", "rare_field_max_pct",
        "examples_per_issue", "check_field_name_variants", "regex_rules"})
public class RunMetadata {
    @JsonProperty("generated_at")
    private final String generatedAt;

    // null means the whole collection was scanned
    @JsonProperty("sample_limit")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final Integer sampleLimit;

    @JsonProperty("docs_scanned")
    private final long docsScanned;

    @JsonProperty("required_threshold")
    private final double requiredThreshold;

    @JsonProperty("rare_field_max_pct")
    private final double rareFieldMaxPct;

    @JsonProperty("examples_per_issue")
    private final int examplesPerIssue;

    @JsonProperty("check_field_name_variants")
    private final boolean checkFieldNameVariants;

    @JsonProperty("regex_rules")
    private final Map<String, String> regexRules;

    RunMetadata(String generatedAt, Integer sampleLimit, long docsScanned, double requiredThreshold,
                double rareFieldMaxPct, int examplesPerIssue, boolean checkFieldNameVariants,
                Map<String, String> regexRules) {
        this.generatedAt = generatedAt;
        this.sampleLimit = sampleLimit;
        this.docsScanned = docsScanned;
        this.requiredThreshold = requiredThreshold;
        this.rareFieldMaxPct = rareFieldMaxPct;
        this.examplesPerIssue = examplesPerIssue;
        this.checkFieldNameVariants = checkFieldNameVariants;
        this.regexRules = regexRules;
    }

    public String getGeneratedAt() { return generatedAt; }
    public Integer getSampleLimit() { return sampleLimit; }
    public long getDocsScanned() { return docsScanned; }
    public double getRequiredThreshold() { return requiredThreshold; }
    public double getRareFieldMaxPct() { return rareFieldMaxPct; }
    public int getExamplesPerIssue() { return examplesPerIssue; }
    public boolean isCheckFieldNameVariants() { return checkFieldNameVariants; }
    public Map<String, String> getRegexRules() { return regexRules; }
}
