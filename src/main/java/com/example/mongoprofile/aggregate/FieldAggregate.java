package com.example.mongoprofile.aggregate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Everything observed for one field at one nesting position, across all parent occurrences.
 * Invariant: {@code presentCount} equals the sum of the variant counts.
 */
public class FieldAggregate {
    private long presentCount = 0;
    private final Map<Kind, VariantAggregate> variants = new EnumMap<>(Kind.class);

    public long getPresentCount() {
        return presentCount;
    }

    public Map<Kind, VariantAggregate> getVariants() {
        return Collections.unmodifiableMap(variants);
    }

    public VariantAggregate getVariant(Kind kind) {
        return variants.get(kind);
    }

    public Set<Kind> getKinds() {
        return variants.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(variants.keySet());
    }

    /**
     * Observed kinds other than {@link Kind#NULL}, in enum order
     */
    public Set<Kind> getNonNullKinds() {
        Set<Kind> kinds = getKinds();
        kinds.remove(Kind.NULL);
        return kinds;
    }

    public boolean isNullable() {
        return variants.containsKey(Kind.NULL);
    }

    /**
     * Record one more observation of the given kind and return its variant.
     */
    VariantAggregate observe(Kind kind) {
        presentCount++;
        VariantAggregate variant = variants.computeIfAbsent(kind, VariantAggregate::new);
        variant.increment();
        return variant;
    }

    /**
     * Add the observations of another aggregate into this one. The other aggregate is left untouched
     * and no child aggregate is shared between the two afterwards.
     */
    public FieldAggregate merge(FieldAggregate other) {
        presentCount += other.presentCount;
        for (Map.Entry<Kind, VariantAggregate> entry : other.variants.entrySet()) {
            variants.computeIfAbsent(entry.getKey(), VariantAggregate::new).merge(entry.getValue());
        }
        return this;
    }

    public FieldAggregate copy() {
        return new FieldAggregate().merge(this);
    }

    @Override
    public String toString() {
        return "FieldAggregate{presentCount=" + presentCount + ", kinds=" + variants.keySet() + "}";
    }
}
