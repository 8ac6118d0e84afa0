package com.example.mongoprofile.lint;

import com.example.mongoprofile.aggregate.DocumentFolder;
import com.example.mongoprofile.aggregate.FieldAggregate;
import com.example.mongoprofile.aggregate.Kind;
import com.example.mongoprofile.aggregate.ObjectAggregate;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

public class FieldPathFlattenerTest {

    @Test
    public void testIncludesIntermediateObjectPaths() {
        ObjectAggregate root = new ObjectAggregate();
        DocumentFolder.foldObjectSample(root, new Document("profile", new Document("name", new Document("first", "A")))
                .append("tags", Arrays.asList(new Document("k", "v"))));
        DocumentFolder.foldObjectSample(root, new Document("profile", "legacy"));

        assertThat(FieldPathFlattener.flatten(root).keySet())
                .containsExactly("profile", "profile.name", "profile.name.first", "tags");
        assertThat(FieldPathFlattener.flatten(root).get("profile").getPresentCount()).isEqualTo(2);
    }

    @Test
    public void testDottedKeyMergesWithNestedPath() {
        ObjectAggregate root = new ObjectAggregate();
        DocumentFolder.foldObjectSample(root, new Document("a.b", 1));
        DocumentFolder.foldObjectSample(root, new Document("a", new Document("b", "x")));
        DocumentFolder.foldObjectSample(root, new Document("a", new Document("b", "y")));

        SortedMap<String, FieldAggregate> paths = FieldPathFlattener.flatten(root);
        assertThat(paths.keySet()).containsExactly("a", "a.b");
        FieldAggregate ab = paths.get("a.b");
        assertThat(ab.getPresentCount()).isEqualTo(3);
        assertThat(ab.getNonNullKinds()).containsExactly(Kind.NUMBER, Kind.STRING);

        // the folded tree itself is left as it was
        assertThat(root.getProperty("a.b").getPresentCount()).isEqualTo(1);
        assertThat(root.getProperty("a").getVariant(Kind.OBJECT).getObject().getProperty("b").getPresentCount())
                .isEqualTo(2);
    }
}
