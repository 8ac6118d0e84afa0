package com.example.mongoprofile.schema;

import com.example.mongoprofile.source.SourceDocument;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Keeps the single most complete document seen so far (most top-level fields, first one wins on ties),
 * so the report can show a representative example without holding the whole collection.
 */
public class ExampleDocumentSelector
{
    private SourceDocument best;
    private int bestFieldCount = -1;

    public void offer(SourceDocument document)
    {
        int fieldCount = document.getPayload().size();
        if (fieldCount > bestFieldCount)
        {
            best = document;
            bestFieldCount = fieldCount;
        }
    }

    /**
     * Sanitized example, or {@code null} if no document was offered
     */
    public ExampleDocument getExample()
    {
        if (best == null)
        {
            return null;
        }
        return new ExampleDocument(best.getId(), ValueSanitizer.sanitizeDocument(best.getPayload()));
    }

    @JsonPropertyOrder({"id", "document"})
    public static class ExampleDocument
    {
        @JsonProperty("id")
        private final String id;

        @JsonProperty("document")
        private final Map<String, Object> document;

        public ExampleDocument(String id, Map<String, Object> document)
        {
            this.id = id;
            this.document = document;
        }

        public String getId()
        {
            return id;
        }

        public Map<String, Object> getDocument()
        {
            return document;
        }
    }
}
