package com.example.mongoprofile.schema;

import com.example.mongoprofile.aggregate.KindClassifier;
import com.mongodb.DBRef;
import com.mongodb.client.model.geojson.Point;
import org.bson.BsonTimestamp;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw document values into plain, serializable values for reports.
 */
public final class ValueSanitizer
{
    private ValueSanitizer()
    {
    }

    public static Object sanitize(Object value)
    {
        switch (KindClassifier.classify(value))
        {
            case NUMBER:
                if (value instanceof Decimal128)
                {
                    return decimal((Decimal128) value);
                }
                return value;
            case NULL:
            case STRING:
            case BOOLEAN:
                return value;
            case TIMESTAMP:
                return toInstant(value).toString();
            case GEOPOINT:
                return geoPoint(value);
            case REFERENCE:
                if (value instanceof ObjectId)
                {
                    return ((ObjectId) value).toHexString();
                }
                DBRef ref = (DBRef) value;
                return ref.getCollectionName() + "/" + sanitize(ref.getId());
            case BYTES:
                byte[] data = value instanceof Binary ? ((Binary) value).getData() : (byte[]) value;
                return Base64.getEncoder().encodeToString(data);
            case ARRAY:
            {
                List<?> elements = value instanceof Object[] ? Arrays.asList((Object[]) value) : (List<?>) value;
                List<Object> out = new ArrayList<>(elements.size());
                for (Object element : elements)
                {
                    out.add(sanitize(element));
                }
                return out;
            }
            case OBJECT:
                return sanitizeMap((Map<?, ?>) value);
            default:
                return String.valueOf(value);
        }
    }

    /**
     * Sanitize every value of a document, keeping key order.
     */
    public static Map<String, Object> sanitizeDocument(Map<String, ?> document)
    {
        return sanitizeMap(document);
    }

    private static Map<String, Object> sanitizeMap(Map<?, ?> map)
    {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet())
        {
            out.put(String.valueOf(entry.getKey()), sanitize(entry.getValue()));
        }
        return out;
    }

    // NaN and infinities have no JSON number form; negative zero becomes plain zero
    private static Object decimal(Decimal128 value)
    {
        if (value.isNaN() || value.isInfinite())
        {
            return value.toString();
        }
        return new BigDecimal(value.toString());
    }

    private static Instant toInstant(Object value)
    {
        if (value instanceof Date)
        {
            return ((Date) value).toInstant();
        }
        if (value instanceof BsonTimestamp)
        {
            return Instant.ofEpochSecond(((BsonTimestamp) value).getTime());
        }
        return (Instant) value;
    }

    // GeoJSON stores [longitude, latitude]
    private static Map<String, Object> geoPoint(Object value)
    {
        List<?> coordinates;
        if (value instanceof Point)
        {
            coordinates = ((Point) value).getCoordinates().getValues();
        } else
        {
            coordinates = (List<?>) ((Map<?, ?>) value).get("coordinates");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("latitude", coordinates.get(1));
        out.put("longitude", coordinates.get(0));
        return out;
    }
}
