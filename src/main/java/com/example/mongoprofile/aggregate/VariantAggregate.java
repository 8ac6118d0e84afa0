package com.example.mongoprofile.aggregate;

/**
 * Per-kind counter for a field. Object and array variants own a nested aggregate,
 * number variants track whether every value seen so far was integral.
 */
public class VariantAggregate {
    private final Kind kind;
    private long count = 0;
    private final ObjectAggregate object;
    private final ArrayAggregate array;
    private boolean integerOnly = true;

    VariantAggregate(Kind kind) {
        this.kind = kind;
        this.object = kind == Kind.OBJECT ? new ObjectAggregate() : null;
        this.array = kind == Kind.ARRAY ? new ArrayAggregate() : null;
    }

    void increment() {
        count++;
    }

    // only ever flips to false
    void markNonInteger() {
        integerOnly = false;
    }

    void merge(VariantAggregate other) {
        if (other.kind != kind) {
            throw new IllegalArgumentException("Cannot merge variant " + other.kind + " into " + kind);
        }
        count += other.count;
        integerOnly = integerOnly && other.integerOnly;
        if (object != null) {
            object.merge(other.object);
        }
        if (array != null) {
            array.merge(other.array);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public long getCount() {
        return count;
    }

    /**
     * Nested aggregate for object values, {@code null} for any other kind
     */
    public ObjectAggregate getObject() {
        return object;
    }

    /**
     * Nested aggregate for array values, {@code null} for any other kind
     */
    public ArrayAggregate getArray() {
        return array;
    }

    /**
     * Only meaningful for {@link Kind#NUMBER}.
     */
    public boolean isIntegerOnly() {
        return integerOnly;
    }
}
