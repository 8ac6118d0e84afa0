package com.example.mongoprofile.aggregate;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AggregateMergeTest {

    private static final List<Document> FIRST = Arrays.asList(
            new Document("name", "Ann").append("age", 31).append("tags", Arrays.asList("a")),
            new Document("name", "Bob").append("address", new Document("city", "Oslo")));

    private static final List<Document> SECOND = Arrays.asList(
            new Document("name", null).append("age", 2.5).append("tags", Collections.emptyList()),
            new Document("address", new Document("city", "Rome").append("zip", "00100")));

    private static ObjectAggregate fold(List<Document> documents) {
        ObjectAggregate root = new ObjectAggregate();
        for (Document document : documents) {
            DocumentFolder.foldObjectSample(root, document);
        }
        return root;
    }

    @Test
    public void testMergeEqualsFoldingConcatenation() {
        ObjectAggregate merged = fold(FIRST).merge(fold(SECOND));
        ObjectAggregate expected = fold(concat(FIRST, SECOND));
        assertSameAggregate(merged, expected);
    }

    @Test
    public void testMergeIsCommutativeOnCounts() {
        ObjectAggregate ab = fold(FIRST).merge(fold(SECOND));
        ObjectAggregate ba = fold(SECOND).merge(fold(FIRST));
        assertSameAggregate(ab, ba);
    }

    @Test
    public void testMergeWithEmptyIsIdentity() {
        ObjectAggregate merged = fold(FIRST).merge(new ObjectAggregate());
        assertSameAggregate(merged, fold(FIRST));
    }

    @Test
    public void testIntegerOnlyIsAndedOnMerge() {
        ObjectAggregate merged = fold(FIRST).merge(fold(SECOND));
        assertThat(merged.getProperty("age").getVariant(Kind.NUMBER).isIntegerOnly()).isFalse();
        assertThat(fold(FIRST).getProperty("age").getVariant(Kind.NUMBER).isIntegerOnly()).isTrue();
    }

    @Test
    public void testMergedTreeSharesNoChildrenWithSource() {
        ObjectAggregate source = fold(SECOND);
        ObjectAggregate target = new ObjectAggregate().merge(source);

        DocumentFolder.foldObjectSample(target, new Document("address", new Document("city", "Paris")));

        ObjectAggregate sourceAddress = source.getProperty("address").getVariant(Kind.OBJECT).getObject();
        assertThat(sourceAddress.getTotalSeen()).isEqualTo(1);
        assertThat(sourceAddress.getProperty("city").getPresentCount()).isEqualTo(1);
        assertThat(target.getProperty("address").getVariant(Kind.OBJECT).getObject().getTotalSeen()).isEqualTo(2);
    }

    @Test
    public void testCopyIsIndependent() {
        FieldAggregate original = new FieldAggregate();
        DocumentFolder.foldValue(original, "x");
        FieldAggregate copy = original.copy();
        DocumentFolder.foldValue(copy, "y");
        assertThat(original.getPresentCount()).isEqualTo(1);
        assertThat(copy.getPresentCount()).isEqualTo(2);
    }

    @Test
    public void testVariantKindMismatchIsRejected() {
        VariantAggregate strings = new VariantAggregate(Kind.STRING);
        assertThatThrownBy(() -> strings.merge(new VariantAggregate(Kind.NUMBER)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Document> concat(List<Document> a, List<Document> b) {
        List<Document> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }

    private static void assertSameAggregate(ObjectAggregate actual, ObjectAggregate expected) {
        assertThat(actual.getTotalSeen()).isEqualTo(expected.getTotalSeen());
        assertThat(actual.getProperties().keySet()).isEqualTo(expected.getProperties().keySet());
        for (String name : expected.getProperties().keySet()) {
            assertSameField(actual.getProperty(name), expected.getProperty(name));
        }
    }

    private static void assertSameField(FieldAggregate actual, FieldAggregate expected) {
        assertThat(actual.getPresentCount()).isEqualTo(expected.getPresentCount());
        assertThat(actual.getKinds()).isEqualTo(expected.getKinds());
        for (Kind kind : expected.getKinds()) {
            VariantAggregate a = actual.getVariant(kind);
            VariantAggregate e = expected.getVariant(kind);
            assertThat(a.getCount()).isEqualTo(e.getCount());
            assertThat(a.isIntegerOnly()).isEqualTo(e.isIntegerOnly());
            if (e.getObject() != null) {
                assertSameAggregate(a.getObject(), e.getObject());
            }
            if (e.getArray() != null) {
                assertThat(a.getArray().getTotalSeen()).isEqualTo(e.getArray().getTotalSeen());
                assertThat(a.getArray().getEmptyCount()).isEqualTo(e.getArray().getEmptyCount());
                if (e.getArray().getItems() == null) {
                    assertThat(a.getArray().getItems()).isNull();
                } else {
                    assertSameField(a.getArray().getItems(), e.getArray().getItems());
                }
            }
        }
    }
}
