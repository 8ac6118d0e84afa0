package com.example.mongoprofile.source;

import java.util.function.Consumer;

/**
 * Ordered, re-iterable sequence of documents of one collection.
 * Every call to {@link #forEach} re-issues the same sequence from the start, which is what lets
 * the profiler make a second pass for evidence collection.
 */
public interface DocumentSource {

    /**
     * Name of the collection, used in logs and reports
     */
    String getName();

    /**
     * Feed every document to the consumer in order.
     *
     * @return number of documents delivered
     * @throws DocumentSourceException if the underlying store fails; the run must be abandoned
     */
    default long forEach(Consumer<SourceDocument> consumer) {
        return forEach(consumer, null);
    }

    /**
     * Feed at most {@code limit} documents to the consumer in order, then stop reading.
     *
     * @param limit maximum number of documents for this pass, {@code null} for no limit beyond the source's own
     * @return number of documents delivered
     * @throws DocumentSourceException if the underlying store fails; the run must be abandoned
     */
    long forEach(Consumer<SourceDocument> consumer, Integer limit);
}
