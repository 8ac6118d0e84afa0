package com.example.mongoprofile.aggregate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * All object-valued occurrences at one position (or the document root).
 * {@code totalSeen} counts object values, so a property with {@code presentCount < totalSeen}
 * was absent from some of them.
 */
public class ObjectAggregate {
    private long totalSeen = 0;
    private final Map<String, FieldAggregate> properties = new HashMap<>();

    public long getTotalSeen() {
        return totalSeen;
    }

    public Map<String, FieldAggregate> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public FieldAggregate getProperty(String name) {
        return properties.get(name);
    }

    void incrementTotalSeen() {
        totalSeen++;
    }

    FieldAggregate property(String name) {
        return properties.computeIfAbsent(name, k -> new FieldAggregate());
    }

    /**
     * Add another object aggregate into this one; properties only present in {@code other} are copied.
     */
    public ObjectAggregate merge(ObjectAggregate other) {
        totalSeen += other.totalSeen;
        for (Map.Entry<String, FieldAggregate> entry : other.properties.entrySet()) {
            property(entry.getKey()).merge(entry.getValue());
        }
        return this;
    }

    public ObjectAggregate copy() {
        return new ObjectAggregate().merge(this);
    }

    @Override
    public String toString() {
        return "ObjectAggregate{totalSeen=" + totalSeen + ", properties=" + properties.keySet() + "}";
    }
}
