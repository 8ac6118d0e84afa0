package com.example.mongoprofile.report;

import com.example.mongoprofile.config.ProfileOptions;
import com.example.mongoprofile.config.RegexRule;
import com.example.mongoprofile.lint.IssueReport;
import com.example.mongoprofile.lint.MissingFieldIssue;
import com.example.mongoprofile.lint.RegexViolationIssue;
import com.example.mongoprofile.lint.TypeMismatchIssue;
import com.example.mongoprofile.schema.ExampleDocumentSelector.ExampleDocument;
import com.example.mongoprofile.schema.SchemaSummary;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shapes schema and issue results plus run metadata into a {@link ProfileReport}. No business logic.
 */
public final class ReportAssembler {

    private ReportAssembler() {
    }

    /**
     * @param schema  document schema, {@code null} for lint-only runs
     * @param example example document, may be {@code null}
     * @param issues  lint results, {@code null} for schema-only runs
     */
    public static ProfileReport assemble(String collection,
                                         ProfileOptions options,
                                         long docsScanned,
                                         SchemaSummary schema,
                                         ExampleDocument example,
                                         IssueReport issues,
                                         Instant generatedAt) {
        Map<String, String> rules = new LinkedHashMap<>();
        for (RegexRule rule : options.getRegexRules().values()) {
            rules.put(rule.getFieldPath(), rule.getPattern().pattern());
        }
        RunMetadata meta = new RunMetadata(generatedAt.toString(), options.getSampleLimit(), docsScanned,
                options.getRequiredThreshold(), options.getRareFieldMaxFraction(), options.getExamplesPerIssue(),
                options.isCheckFieldNameVariants(), rules);

        ProfileReport.SchemaBlock schemaBlock = schema == null ? null : new ProfileReport.SchemaBlock(schema, example);
        LintSummary summary = issues == null ? null : summarize(issues);

        return new ProfileReport(collection, options.getMode(), meta, schemaBlock, summary, issues);
    }

    static LintSummary summarize(IssueReport issues) {
        return new LintSummary(
                issues.getFieldsTotal(),
                issues.getExpectedFieldsCount(),
                issues.getMissingFields().size(),
                issues.getTypeMismatches().size(),
                issues.getRegexViolations().size(),
                issues.getRareFields().size(),
                issues.getFieldNameVariants().size(),
                docsWithIssueExamples(issues));
    }

    private static int docsWithIssueExamples(IssueReport issues) {
        Set<String> docs = new HashSet<>();
        for (MissingFieldIssue issue : issues.getMissingFields()) {
            docs.addAll(issue.getExampleDocIds());
        }
        for (TypeMismatchIssue issue : issues.getTypeMismatches()) {
            for (List<String> ids : issue.getExampleDocIdsByKind().values()) {
                docs.addAll(ids);
            }
        }
        for (RegexViolationIssue issue : issues.getRegexViolations()) {
            for (RegexViolationIssue.Example example : issue.getExamples()) {
                docs.add(example.getDoc());
            }
        }
        return docs.size();
    }
}
