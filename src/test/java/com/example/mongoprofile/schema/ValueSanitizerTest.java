package com.example.mongoprofile.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.DBRef;
import com.mongodb.client.model.geojson.Point;
import com.mongodb.client.model.geojson.Position;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ValueSanitizerTest {

    @Test
    public void testScalarsPassThrough() {
        assertThat(ValueSanitizer.sanitize(null)).isNull();
        assertThat(ValueSanitizer.sanitize("x")).isEqualTo("x");
        assertThat(ValueSanitizer.sanitize(5)).isEqualTo(5);
        assertThat(ValueSanitizer.sanitize(false)).isEqualTo(false);
    }

    @Test
    public void testTimestampsBecomeIsoStrings() {
        assertThat(ValueSanitizer.sanitize(new Date(0))).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(ValueSanitizer.sanitize(Instant.parse("2024-03-01T12:00:00Z"))).isEqualTo("2024-03-01T12:00:00Z");
    }

    @Test
    public void testReferencesAndBytes() {
        ObjectId id = new ObjectId("65f0c0ffee0000000000abcd");
        assertThat(ValueSanitizer.sanitize(id)).isEqualTo("65f0c0ffee0000000000abcd");
        assertThat(ValueSanitizer.sanitize(new DBRef("people", id))).isEqualTo("people/65f0c0ffee0000000000abcd");
        assertThat(ValueSanitizer.sanitize(new byte[]{'h', 'i'})).isEqualTo("aGk=");
        assertThat(ValueSanitizer.sanitize(new Binary(new byte[]{'h', 'i'}))).isEqualTo("aGk=");
    }

    @Test
    public void testGeoPointsSwapToLatitudeLongitude() {
        assertThat(ValueSanitizer.sanitize(new Document("type", "Point").append("coordinates", Arrays.asList(10.75, 59.91))))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("latitude", 59.91)
                .containsEntry("longitude", 10.75);

        assertThat(ValueSanitizer.sanitize(new Point(new Position(10.75, 59.91))))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("latitude", 59.91)
                .containsEntry("longitude", 10.75);
    }

    @Test
    public void testDecimalsBecomePlainNumbersOrStrings() {
        assertThat(ValueSanitizer.sanitize(Decimal128.parse("12.50"))).isEqualTo(new BigDecimal("12.50"));
        assertThat(ValueSanitizer.sanitize(Decimal128.NEGATIVE_ZERO)).isInstanceOf(BigDecimal.class)
                .isEqualTo(BigDecimal.ZERO);
        assertThat(ValueSanitizer.sanitize(Decimal128.parse("-0.00"))).isEqualTo(new BigDecimal("0.00"));
        assertThat(ValueSanitizer.sanitize(Decimal128.NaN)).isEqualTo("NaN");
        assertThat(ValueSanitizer.sanitize(Decimal128.POSITIVE_INFINITY)).isEqualTo("Infinity");
        assertThat(ValueSanitizer.sanitize(Decimal128.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
    }

    @Test
    public void testNonFiniteDecimalsStillWriteValidJson() throws Exception {
        Map<String, Object> out = ValueSanitizer.sanitizeDocument(new Document("price", Decimal128.NaN)
                .append("limit", Decimal128.POSITIVE_INFINITY)
                .append("balance", Decimal128.parse("-0.00")));

        ObjectMapper mapper = new ObjectMapper();
        JsonNode parsed = mapper.readTree(mapper.writeValueAsString(out));
        assertThat(parsed.get("price").asText()).isEqualTo("NaN");
        assertThat(parsed.get("limit").asText()).isEqualTo("Infinity");
        assertThat(parsed.get("balance").isNumber()).isTrue();
        assertThat(parsed.get("balance").decimalValue().signum()).isZero();
    }

    @Test
    public void testNestedStructuresAreSanitizedRecursively() {
        Document doc = new Document("when", new Date(0))
                .append("refs", Arrays.asList(new ObjectId("65f0c0ffee0000000000abcd"), null))
                .append("other", new Object() {
                    @Override
                    public String toString() {
                        return "opaque";
                    }
                });

        Map<String, Object> out = ValueSanitizer.sanitizeDocument(doc);
        assertThat(out.keySet()).containsExactly("when", "refs", "other");
        assertThat(out.get("when")).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(out.get("refs")).isEqualTo(Arrays.asList("65f0c0ffee0000000000abcd", null));
        assertThat(out.get("other")).isEqualTo("opaque");
    }
}
