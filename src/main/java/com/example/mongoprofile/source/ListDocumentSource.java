package com.example.mongoprofile.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * In-memory document source for callers that already hold the documents.
 */
public class ListDocumentSource implements DocumentSource {
    private final String name;
    private final List<SourceDocument> documents;
    private final Integer sampleLimit;

    public ListDocumentSource(String name, List<SourceDocument> documents) {
        this(name, documents, null);
    }

    /**
     * @param sampleLimit maximum number of documents to deliver, {@code null} for all
     */
    public ListDocumentSource(String name, List<SourceDocument> documents, Integer sampleLimit) {
        this.name = name;
        this.documents = Collections.unmodifiableList(new ArrayList<>(documents));
        this.sampleLimit = sampleLimit;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long forEach(Consumer<SourceDocument> consumer, Integer limit) {
        Integer bound = limit == null ? sampleLimit : sampleLimit == null ? limit : Integer.valueOf(Math.min(limit, sampleLimit));
        long delivered = 0;
        for (SourceDocument document : documents) {
            if (bound != null && delivered >= bound) {
                break;
            }
            consumer.accept(document);
            delivered++;
        }
        return delivered;
    }
}
