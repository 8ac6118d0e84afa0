package com.example.mongoprofile.lint;

import com.example.mongoprofile.source.SourceDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Second-pass consumer: records the ids of documents lacking each of a fixed set of expected fields.
 * Selection is first-seen-wins in source order, capped per field.
 */
public class MissingFieldCollector implements Consumer<SourceDocument> {
    private final Map<String, List<String>> missingExamples = new LinkedHashMap<>();
    private final int limit;
    private int openFields;

    MissingFieldCollector(Set<String> fields, int limit) {
        this.limit = limit;
        for (String field : fields) {
            missingExamples.put(field, new ArrayList<>());
        }
        this.openFields = fields.size();
    }

    @Override
    public void accept(SourceDocument document) {
        if (openFields == 0) {
            return;
        }
        Set<String> present = FieldPathFlattener.presentPaths(document.getPayload());
        for (Map.Entry<String, List<String>> entry : missingExamples.entrySet()) {
            List<String> examples = entry.getValue();
            if (examples.size() >= limit || present.contains(entry.getKey())) {
                continue;
            }
            examples.add(document.getId());
            if (examples.size() == limit) {
                openFields--;
            }
        }
    }

    /**
     * Collected document ids for a field, empty if the field was not tracked or never missing
     */
    public List<String> getExamples(String field) {
        return Collections.unmodifiableList(missingExamples.getOrDefault(field, Collections.emptyList()));
    }

    public Set<String> getTrackedFields() {
        return Collections.unmodifiableSet(missingExamples.keySet());
    }
}
