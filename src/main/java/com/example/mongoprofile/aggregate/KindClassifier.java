package com.example.mongoprofile.aggregate;

import com.mongodb.DBRef;
import com.mongodb.client.model.geojson.Point;
import org.bson.BsonTimestamp;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Maps arbitrary document values to a single {@link Kind}.
 * The order of checks matters: structured/opaque types are recognised before generic maps,
 * so a geo point or timestamp never ends up classified as an object.
 */
public final class KindClassifier {

    private KindClassifier() {
    }

    public static Kind classify(Object value) {
        if (value == null) {
            return Kind.NULL;
        }
        if (value instanceof Date || value instanceof BsonTimestamp || value instanceof Instant) {
            return Kind.TIMESTAMP;
        }
        if (value instanceof Point || isGeoJsonPoint(value)) {
            return Kind.GEOPOINT;
        }
        if (value instanceof DBRef || value instanceof ObjectId) {
            return Kind.REFERENCE;
        }
        if (value instanceof byte[] || value instanceof Binary) {
            return Kind.BYTES;
        }
        if (value instanceof List || value instanceof Object[]) {
            return Kind.ARRAY;
        }
        if (value instanceof String) {
            return Kind.STRING;
        }
        if (value instanceof Boolean) {
            return Kind.BOOLEAN;
        }
        if (value instanceof Number) {
            return Kind.NUMBER;
        }
        if (value instanceof Map && hasStringKeys((Map<?, ?>) value)) {
            return Kind.OBJECT;
        }
        return Kind.UNKNOWN;
    }

    /**
     * Whether a number has no fractional part. Non-finite values are never integral.
     */
    public static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return true;
        }
        if (number instanceof Decimal128) {
            Decimal128 decimal = (Decimal128) number;
            if (decimal.isNaN() || decimal.isInfinite()) {
                return false;
            }
            // bigDecimalValue() rejects negative zero
            return isIntegral(new BigDecimal(decimal.toString()));
        }
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        double d = number.doubleValue();
        return !Double.isNaN(d) && !Double.isInfinite(d) && Math.floor(d) == d;
    }

    /**
     * Raw GeoJSON point as stored by MongoDB: {type: "Point", coordinates: [lon, lat]}
     */
    static boolean isGeoJsonPoint(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        if (map.size() != 2 || !"Point".equals(map.get("type"))) {
            return false;
        }
        Object coordinates = map.get("coordinates");
        if (!(coordinates instanceof List)) {
            return false;
        }
        List<?> list = (List<?>) coordinates;
        return list.size() == 2 && list.get(0) instanceof Number && list.get(1) instanceof Number;
    }

    private static boolean hasStringKeys(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return false;
            }
        }
        return true;
    }
}
