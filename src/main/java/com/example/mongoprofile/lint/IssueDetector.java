package com.example.mongoprofile.lint;

import com.example.mongoprofile.aggregate.FieldAggregate;
import com.example.mongoprofile.aggregate.FoldListener;
import com.example.mongoprofile.aggregate.Kind;
import com.example.mongoprofile.aggregate.ObjectAggregate;
import com.example.mongoprofile.aggregate.VariantAggregate;
import com.example.mongoprofile.config.ProfileOptions;
import com.example.mongoprofile.config.RegexRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives data-quality issues from a finished aggregate tree.
 *
 * <p>Works in two passes over the same document sequence. During the first pass it is fed every field observation
 * through {@link #evidenceListener(String)} and keeps only bounded example lists (per-kind document ids, regex
 * violations). Which fields are "expected" is only known once that pass is over, so a second pass with a
 * {@link MissingFieldCollector} gathers the ids of documents lacking them.
 *
 * <p>Never fails on odd data: values of unknown type take part as {@link Kind#UNKNOWN}.
 */
public class IssueDetector {
    private static final Logger logger = LoggerFactory.getLogger(IssueDetector.class);

    private final ProfileOptions options;
    private final Map<String, FieldEvidence> evidence = new HashMap<>();

    public IssueDetector(ProfileOptions options) {
        this.options = options;
    }

    /**
     * Listener that records first-pass evidence for the document with the given id.
     */
    public FoldListener evidenceListener(String docId) {
        return (path, kind, value) -> recordObservation(docId, path, kind, value);
    }

    void recordObservation(String docId, String path, Kind kind, Object value) {
        FieldEvidence fieldEvidence = evidence.computeIfAbsent(path, k -> new FieldEvidence(options.getExamplesPerIssue()));
        fieldEvidence.recordPresence(docId, kind);

        RegexRule rule = options.getRegexRules().get(path);
        if (rule != null && kind == Kind.STRING && !rule.matches((String) value)) {
            fieldEvidence.recordRegexViolation(docId, (String) value);
        }
    }

    /**
     * Expected fields that some documents lack. A second pass is only needed when this is non-empty.
     */
    public Set<String> fieldsMissingEvidence(ObjectAggregate root, long totalDocs) {
        Set<String> fields = new LinkedHashSet<>();
        for (Map.Entry<String, FieldAggregate> entry : FieldPathFlattener.flatten(root).entrySet()) {
            long present = entry.getValue().getPresentCount();
            if (isExpected(present, totalDocs) && present < totalDocs) {
                fields.add(entry.getKey());
            }
        }
        return fields;
    }

    public MissingFieldCollector missingFieldCollector(Set<String> fields) {
        return new MissingFieldCollector(fields, options.getExamplesPerIssue());
    }

    /**
     * Run all checks.
     *
     * @param root      aggregate folded during the first pass
     * @param totalDocs documents folded into {@code root}
     * @param missing   second-pass evidence, or {@code null} when no second pass was made
     */
    public IssueReport detect(ObjectAggregate root, long totalDocs, MissingFieldCollector missing) {
        SortedMap<String, FieldAggregate> fields = FieldPathFlattener.flatten(root);
        logger.debug("Checking {} field paths over {} documents", fields.size(), totalDocs);

        int expectedCount = 0;
        List<MissingFieldIssue> missingIssues = new ArrayList<>();
        List<TypeMismatchIssue> mismatchIssues = new ArrayList<>();
        List<RareFieldIssue> rareIssues = new ArrayList<>();

        for (Map.Entry<String, FieldAggregate> entry : fields.entrySet()) {
            String path = entry.getKey();
            FieldAggregate field = entry.getValue();
            long present = field.getPresentCount();
            double fraction = fraction(present, totalDocs);

            if (isExpected(present, totalDocs)) {
                expectedCount++;
                long missingCount = totalDocs - present;
                if (missingCount > 0) {
                    List<String> examples = missing == null ? List.of() : missing.getExamples(path);
                    missingIssues.add(new MissingFieldIssue(path, missingCount, round(fraction(missingCount, totalDocs)), examples));
                }
            }

            if (field.getNonNullKinds().size() >= 2) {
                mismatchIssues.add(typeMismatch(path, field));
            }

            if (totalDocs > 0 && fraction <= options.getRareFieldMaxFraction()) {
                rareIssues.add(new RareFieldIssue(path, present, round(fraction), evidenceFor(path).getPresenceExamples()));
            }
        }

        missingIssues.sort(Comparator.comparingLong(MissingFieldIssue::getMissingCount).reversed()
                .thenComparing(MissingFieldIssue::getField));
        mismatchIssues.sort(Comparator.comparingInt((TypeMismatchIssue issue) -> issue.getKinds().size()).reversed()
                .thenComparing(TypeMismatchIssue::getField));
        rareIssues.sort(Comparator.comparingDouble(RareFieldIssue::getPresentPct)
                .thenComparing(RareFieldIssue::getField));

        List<FieldNameVariantIssue> variantIssues = options.isCheckFieldNameVariants()
                ? fieldNameVariants(fields)
                : List.of();

        IssueReport report = new IssueReport(missingIssues, mismatchIssues, regexViolations(fields), rareIssues,
                variantIssues, fields.size(), expectedCount);

        logger.info("Lint found {} missing, {} type mismatch, {} regex, {} rare and {} name variant issues",
                missingIssues.size(), mismatchIssues.size(), report.getRegexViolations().size(),
                rareIssues.size(), variantIssues.size());
        return report;
    }

    private TypeMismatchIssue typeMismatch(String path, FieldAggregate field) {
        Map<String, Long> kinds = new LinkedHashMap<>();
        Map<String, List<String>> examples = new LinkedHashMap<>();
        FieldEvidence fieldEvidence = evidenceFor(path);
        for (VariantAggregate variant : field.getVariants().values()) {
            kinds.put(variant.getKind().getWireName(), variant.getCount());
            List<String> ids = fieldEvidence.getKindExamples(variant.getKind());
            if (!ids.isEmpty()) {
                examples.put(variant.getKind().getWireName(), ids);
            }
        }
        return new TypeMismatchIssue(path, kinds, examples);
    }

    private List<RegexViolationIssue> regexViolations(Map<String, FieldAggregate> fields) {
        List<RegexViolationIssue> issues = new ArrayList<>();
        for (RegexRule rule : options.getRegexRules().values()) {
            if (!fields.containsKey(rule.getFieldPath())) {
                logger.warn("Regex rule for '{}' did not match any observed field", rule.getFieldPath());
                continue;
            }
            FieldEvidence fieldEvidence = evidenceFor(rule.getFieldPath());
            if (fieldEvidence.getRegexViolationCount() == 0) {
                continue;
            }
            issues.add(new RegexViolationIssue(rule.getFieldPath(), rule.getPattern().pattern(), rule.getNote(),
                    fieldEvidence.getRegexViolationCount(), fieldEvidence.getRegexViolations()));
        }
        return issues;
    }

    private List<FieldNameVariantIssue> fieldNameVariants(SortedMap<String, FieldAggregate> fields) {
        Map<String, List<String>> groups = new TreeMap<>();
        for (String path : fields.keySet()) {
            groups.computeIfAbsent(normalizeFieldName(path), k -> new ArrayList<>()).add(path);
        }

        List<FieldNameVariantIssue> issues = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            List<String> paths = group.getValue();
            if (paths.size() <= 1) {
                continue;
            }
            // most common spelling first, ties broken by name
            paths.sort(Comparator.comparingLong((String p) -> fields.get(p).getPresentCount()).reversed()
                    .thenComparing(Comparator.<String>naturalOrder()));
            String canonical = paths.get(0);
            List<FieldNameVariantIssue.Variant> variants = new ArrayList<>();
            for (String path : paths.subList(1, paths.size())) {
                variants.add(new FieldNameVariantIssue.Variant(path, fields.get(path).getPresentCount()));
            }
            issues.add(new FieldNameVariantIssue(group.getKey(), canonical, fields.get(canonical).getPresentCount(), variants));
        }
        return issues;
    }

    private FieldEvidence evidenceFor(String path) {
        FieldEvidence fieldEvidence = evidence.get(path);
        return fieldEvidence != null ? fieldEvidence : new FieldEvidence(options.getExamplesPerIssue());
    }

    private boolean isExpected(long present, long totalDocs) {
        return totalDocs > 0 && fraction(present, totalDocs) >= options.getRequiredThreshold();
    }

    /**
     * Lower-cased, with path separators and underscores removed: {@code first_name} and {@code firstName} collide.
     */
    static String normalizeFieldName(String path) {
        return path.replace(".", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    static double fraction(long count, long total) {
        return total == 0 ? 0 : (double) count / total;
    }

    static double round(double fraction) {
        return Math.round(fraction * 10_000) / 10_000.0;
    }
}
