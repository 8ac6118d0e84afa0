package com.example.mongoprofile.report;

import com.example.mongoprofile.config.ProfileMode;
import com.example.mongoprofile.lint.IssueReport;
import com.example.mongoprofile.schema.ExampleDocumentSelector.ExampleDocument;
import com.example.mongoprofile.schema.SchemaSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Final result of a profiling run, ready to be rendered.
 * The schema block is absent in lint-only runs, the summary and issues blocks in schema-only runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"collection", "mode", "meta", "schema", "summary", "issues"})
public class ProfileReport {
    @JsonProperty("collection")
    private final String collection;

    @JsonProperty("mode")
    private final ProfileMode mode;

    @JsonProperty("meta")
    private final RunMetadata meta;

    @JsonProperty("schema")
    private final SchemaBlock schema;

    @JsonProperty("summary")
    private final LintSummary summary;

    @JsonProperty("issues")
    private final IssueReport issues;

    ProfileReport(String collection, ProfileMode mode, RunMetadata meta, SchemaBlock schema,
                  LintSummary summary, IssueReport issues) {
        this.collection = collection;
        this.mode = mode;
        this.meta = meta;
        this.schema = schema;
        this.summary = summary;
        this.issues = issues;
    }

    public String getCollection() { return collection; }
    public ProfileMode getMode() { return mode; }
    public RunMetadata getMeta() { return meta; }
    public SchemaBlock getSchema() { return schema; }
    public LintSummary getSummary() { return summary; }
    public IssueReport getIssues() { return issues; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"document", "example"})
    public static class SchemaBlock {
        @JsonProperty("document")
        private final SchemaSummary document;

        @JsonProperty("example")
        private final ExampleDocument example;

        SchemaBlock(SchemaSummary document, ExampleDocument example) {
            this.document = document;
            this.example = example;
        }

        public SchemaSummary getDocument() { return document; }
        public ExampleDocument getExample() { return example; }
    }
}
