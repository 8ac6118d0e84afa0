package com.example.mongoprofile.source;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * One document of a collection: a stable identifier plus its nested key/value payload.
 */
public final class SourceDocument {
    private final String id;
    private final Map<String, Object> payload;

    public SourceDocument(String id, Map<String, Object> payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = payload == null ? Collections.emptyMap() : payload;
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "SourceDocument{id=" + id + ", fields=" + payload.keySet() + "}";
    }
}
