package com.example.mongoprofile.aggregate;

/**
 * Callback for field observations reachable from a document root through object values.
 */
@FunctionalInterface
public interface FoldListener {

    FoldListener NONE = (path, kind, value) -> { };

    /**
     * @param path  dot separated field path, e.g. {@code status.code}
     * @param kind  classified kind of the value
     * @param value the raw value
     */
    void onField(String path, Kind kind, Object value);
}
