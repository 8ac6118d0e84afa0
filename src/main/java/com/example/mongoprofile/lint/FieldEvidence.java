package com.example.mongoprofile.lint;

import com.example.mongoprofile.aggregate.Kind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded example evidence for one field path, collected during the first pass.
 * Every list keeps the first {@code limit} entries it is offered.
 */
class FieldEvidence {
    private final int limit;
    private final Map<Kind, List<String>> kindExamples = new EnumMap<>(Kind.class);
    private final List<String> presenceExamples = new ArrayList<>();
    private final List<RegexViolationIssue.Example> regexViolations = new ArrayList<>();
    private long regexViolationCount = 0;

    FieldEvidence(int limit) {
        this.limit = limit;
    }

    void recordPresence(String docId, Kind kind) {
        push(presenceExamples, docId);
        push(kindExamples.computeIfAbsent(kind, k -> new ArrayList<>()), docId);
    }

    void recordRegexViolation(String docId, String value) {
        regexViolationCount++;
        push(regexViolations, new RegexViolationIssue.Example(docId, value));
    }

    private <T> void push(List<T> list, T value) {
        if (list.size() < limit) {
            list.add(value);
        }
    }

    List<String> getKindExamples(Kind kind) {
        return kindExamples.getOrDefault(kind, Collections.emptyList());
    }

    List<String> getPresenceExamples() {
        return presenceExamples;
    }

    List<RegexViolationIssue.Example> getRegexViolations() {
        return regexViolations;
    }

    long getRegexViolationCount() {
        return regexViolationCount;
    }
}
