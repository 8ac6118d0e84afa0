package com.example.mongoprofile.schema;

import com.example.mongoprofile.aggregate.ArrayAggregate;
import com.example.mongoprofile.aggregate.FieldAggregate;
import com.example.mongoprofile.aggregate.Kind;
import com.example.mongoprofile.aggregate.ObjectAggregate;
import com.example.mongoprofile.aggregate.VariantAggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a finished aggregate tree into a {@link SchemaSummary}.
 * Pure and deterministic: output depends only on aggregate state, never on the order fields were discovered in.
 */
public final class SchemaSummarizer
{
    static final String MAP_TYPE_PREFIX = "map<string,";

    private SchemaSummarizer()
    {
    }

    /**
     * Summarize a document root. The root is always described as a fixed-shape object.
     */
    public static SchemaSummary summarize(ObjectAggregate root)
    {
        return describeFields(new SchemaSummary("object"), root);
    }

    /**
     * Summarize one field observed under a parent that was seen {@code parentTotalSeen} times.
     */
    public static SchemaSummary summarizeField(FieldAggregate field, long parentTotalSeen)
    {
        boolean required = parentTotalSeen > 0 && field.getPresentCount() == parentTotalSeen;
        boolean nullable = field.isNullable();
        Set<Kind> nonNull = field.getNonNullKinds();

        if (nonNull.isEmpty())
        {
            return new SchemaSummary("unknown").withPresence(required, true);
        }
        if (nonNull.size() > 1)
        {
            List<String> union = new ArrayList<>();
            for (Kind kind : nonNull)
            {
                union.add(typeName(field.getVariant(kind)));
            }
            Collections.sort(union);
            return new SchemaSummary("union").withPresence(required, nullable).withUnion(union);
        }

        VariantAggregate variant = field.getVariant(nonNull.iterator().next());
        switch (variant.getKind())
        {
            case TIMESTAMP:
                return new SchemaSummary(typeName(variant)).withFormat("RFC3339").withPresence(required, nullable);
            case ARRAY:
                return new SchemaSummary("array").withPresence(required, nullable).withItems(summarizeItems(variant.getArray()));
            case OBJECT:
            {
                ObjectAggregate object = variant.getObject();
                Kind mapValueKind = mapValueKind(object);
                if (mapValueKind != null)
                {
                    return new SchemaSummary(MAP_TYPE_PREFIX + mapValueKind.getWireName() + ">").withPresence(required, nullable);
                }
                return describeFields(new SchemaSummary("object").withPresence(required, nullable), object);
            }
            default:
                return new SchemaSummary(typeName(variant)).withPresence(required, nullable);
        }
    }

    /**
     * Value kind when the object behaves as a homogeneous string-keyed dictionary, {@code null} for a fixed-shape record.
     * A dictionary has no property present in every instance and a single shared scalar kind across all properties.
     */
    static Kind mapValueKind(ObjectAggregate object)
    {
        Map<String, FieldAggregate> properties = object.getProperties();
        if (properties.isEmpty())
        {
            return null;
        }
        Kind shared = null;
        for (FieldAggregate property : properties.values())
        {
            if (property.getPresentCount() == object.getTotalSeen())
            {
                return null;
            }
            Set<Kind> kinds = property.getKinds();
            if (kinds.size() != 1)
            {
                return null;
            }
            Kind kind = kinds.iterator().next();
            if (!kind.isScalar() || (shared != null && shared != kind))
            {
                return null;
            }
            shared = kind;
        }
        return shared;
    }

    static String typeName(VariantAggregate variant)
    {
        switch (variant.getKind())
        {
            case NUMBER:
                return variant.isIntegerOnly() ? "integer" : "number";
            case REFERENCE:
                return "documentReference";
            case BYTES:
                return "bytes(base64)";
            case GEOPOINT:
                return "geopoint{latitude:number, longitude:number}";
            default:
                return variant.getKind().getWireName();
        }
    }

    private static SchemaSummary summarizeItems(ArrayAggregate array)
    {
        FieldAggregate items = array.getItems();
        if (items == null)
        {
            return new SchemaSummary("any");
        }
        // elements are measured against themselves, so item nodes always read as required
        return summarizeField(items, items.getPresentCount());
    }

    private static SchemaSummary describeFields(SchemaSummary node, ObjectAggregate object)
    {
        Map<String, SchemaSummary> fields = new TreeMap<>();
        List<String> requiredFields = new ArrayList<>();
        for (Map.Entry<String, FieldAggregate> entry : object.getProperties().entrySet())
        {
            SchemaSummary child = summarizeField(entry.getValue(), object.getTotalSeen());
            fields.put(entry.getKey(), child);
            if (Boolean.TRUE.equals(child.getRequired()))
            {
                requiredFields.add(entry.getKey());
            }
        }
        Collections.sort(requiredFields);
        return node.withFields(fields, requiredFields);
    }
}
