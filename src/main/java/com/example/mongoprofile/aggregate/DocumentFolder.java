package com.example.mongoprofile.aggregate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Walks documents and nested values and folds them into an aggregate tree.
 * The model has no dedup: folding the same document twice counts it twice.
 */
public final class DocumentFolder {

    private DocumentFolder() {
    }

    /**
     * Record one more observation of {@code value} in {@code aggregate}.
     */
    public static void foldValue(FieldAggregate aggregate, Object value) {
        foldValue(aggregate, value, null, FoldListener.NONE);
    }

    /**
     * Fold a whole document: its own fields are treated like the properties of an object value.
     */
    public static void foldObjectSample(ObjectAggregate aggregate, Map<String, ?> document) {
        foldDocument(aggregate, document, FoldListener.NONE);
    }

    /**
     * Same as {@link #foldObjectSample} but also reports every object-reachable field to the listener.
     */
    public static void foldDocument(ObjectAggregate aggregate, Map<String, ?> document, FoldListener listener) {
        foldProperties(aggregate, document, "", listener);
    }

    private static void foldProperties(ObjectAggregate aggregate, Map<?, ?> object, String prefix, FoldListener listener) {
        aggregate.incrementTotalSeen();
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String name = String.valueOf(entry.getKey());
            String path = prefix.isEmpty() ? name : prefix + "." + name;
            foldValue(aggregate.property(name), entry.getValue(), path, listener);
        }
    }

    private static void foldValue(FieldAggregate aggregate, Object value, String path, FoldListener listener) {
        Kind kind = KindClassifier.classify(value);
        VariantAggregate variant = aggregate.observe(kind);
        if (path != null) {
            listener.onField(path, kind, value);
        }

        switch (kind) {
            case OBJECT:
                // element values of arrays are folded without a path
                foldProperties(variant.getObject(), (Map<?, ?>) value, path == null ? "" : path,
                        path == null ? FoldListener.NONE : listener);
                break;
            case ARRAY:
                ArrayAggregate array = variant.getArray();
                array.incrementTotalSeen();
                List<?> elements = value instanceof Object[] ? Arrays.asList((Object[]) value) : (List<?>) value;
                if (elements.isEmpty()) {
                    array.incrementEmptyCount();
                } else {
                    FieldAggregate items = array.items();
                    for (Object element : elements) {
                        foldValue(items, element, null, FoldListener.NONE);
                    }
                }
                break;
            case NUMBER:
                if (!KindClassifier.isIntegral((Number) value)) {
                    variant.markNonInteger();
                }
                break;
            default:
                break;
        }
    }
}
