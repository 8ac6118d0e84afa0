package com.example.mongoprofile.lint;

import com.example.mongoprofile.source.SourceDocument;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;

import static org.assertj.core.api.Assertions.assertThat;

public class MissingFieldCollectorTest {

    @Test
    public void testCollectsFirstMissingUpToLimit() {
        MissingFieldCollector collector = new MissingFieldCollector(
                new LinkedHashSet<>(Arrays.asList("email", "address.city")), 2);

        collector.accept(new SourceDocument("a", new Document("email", "x")));
        collector.accept(new SourceDocument("b", new Document("address", new Document("city", "Oslo"))));
        collector.accept(new SourceDocument("c", new Document("address", "n/a")));
        collector.accept(new SourceDocument("d", new Document()));

        assertThat(collector.getExamples("email")).containsExactly("b", "c");
        assertThat(collector.getExamples("address.city")).containsExactly("a", "c");
        assertThat(collector.getExamples("phone")).isEmpty();
        assertThat(collector.getTrackedFields()).containsExactly("email", "address.city");
    }

    @Test
    public void testPresentPathsFollowObjectsOnly() {
        Document doc = new Document("a", new Document("b", 1))
                .append("list", Arrays.asList(new Document("inner", 1)));
        assertThat(FieldPathFlattener.presentPaths(doc)).containsExactlyInAnyOrder("a", "a.b", "list");
    }
}
