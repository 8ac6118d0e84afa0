package com.example.mongoprofile.lint;

import com.example.mongoprofile.aggregate.FieldAggregate;
import com.example.mongoprofile.aggregate.Kind;
import com.example.mongoprofile.aggregate.KindClassifier;
import com.example.mongoprofile.aggregate.ObjectAggregate;
import com.example.mongoprofile.aggregate.VariantAggregate;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Dot-separated field paths reachable from a document root through object values.
 * Array contents are not flattened.
 */
public final class FieldPathFlattener {

    private FieldPathFlattener() {
    }

    /**
     * Every path of the aggregate tree with its aggregate, sorted by path.
     * An object-valued field is listed itself and then again through each of its properties.
     * A key containing a dot and a nested path with the same spelling share one merged aggregate.
     */
    public static SortedMap<String, FieldAggregate> flatten(ObjectAggregate root) {
        SortedMap<String, FieldAggregate> out = new TreeMap<>();
        flatten(root, "", out);
        return out;
    }

    private static void flatten(ObjectAggregate object, String prefix, Map<String, FieldAggregate> out) {
        for (Map.Entry<String, FieldAggregate> entry : object.getProperties().entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            FieldAggregate field = entry.getValue();
            out.merge(path, field, (seen, other) -> seen.copy().merge(other));
            VariantAggregate objectVariant = field.getVariant(Kind.OBJECT);
            if (objectVariant != null) {
                flatten(objectVariant.getObject(), path, out);
            }
        }
    }

    /**
     * Paths present in one document, following the same rules as the fold.
     */
    static Set<String> presentPaths(Map<String, ?> document) {
        Set<String> out = new HashSet<>();
        collect(document, "", out);
        return out;
    }

    private static void collect(Map<?, ?> object, String prefix, Set<String> out) {
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String name = String.valueOf(entry.getKey());
            String path = prefix.isEmpty() ? name : prefix + "." + name;
            out.add(path);
            Object value = entry.getValue();
            if (KindClassifier.classify(value) == Kind.OBJECT) {
                collect((Map<?, ?>) value, path, out);
            }
        }
    }
}
