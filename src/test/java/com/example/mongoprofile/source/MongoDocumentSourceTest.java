package com.example.mongoprofile.source;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class MongoDocumentSourceTest {

    private MongoCollection<Document> collection;
    private FindIterable<Document> iterable;
    private final List<Bson> filters = new ArrayList<>();
    private final List<Integer> limits = new ArrayList<>();
    private final Deque<Object> pages = new ArrayDeque<>();

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        collection = mock(MongoCollection.class);
        iterable = mock(FindIterable.class);
        when(collection.getNamespace()).thenReturn(new MongoNamespace("realm", "people"));
        when(collection.find(any(Bson.class))).thenAnswer(invocation -> {
            filters.add(invocation.getArgument(0));
            return iterable;
        });
        when(iterable.sort(any())).thenReturn(iterable);
        when(iterable.limit(anyInt())).thenAnswer(invocation -> {
            limits.add(invocation.getArgument(0));
            return iterable;
        });
        when(iterable.into(any())).thenAnswer(invocation -> {
            Collection<Document> target = invocation.getArgument(0);
            Object page = pages.isEmpty() ? new ArrayList<Document>() : pages.poll();
            if (page instanceof RuntimeException) {
                throw (RuntimeException) page;
            }
            target.addAll((List<Document>) page);
            return target;
        });
    }

    private static List<Document> page(int... ids) {
        List<Document> docs = new ArrayList<>();
        for (int id : ids) {
            docs.add(new Document("_id", id).append("n", id * 10));
        }
        return docs;
    }

    private List<String> readAll(MongoDocumentSource source) {
        List<String> ids = new ArrayList<>();
        source.forEach(doc -> ids.add(doc.getId()));
        return ids;
    }

    @Test
    public void testPagesByIdUntilShortPage() {
        pages.add(page(1, 2));
        pages.add(page(3, 4));
        pages.add(page(5));

        MongoDocumentSource source = new MongoDocumentSource(collection, 2, null);
        assertThat(readAll(source)).containsExactly("1", "2", "3", "4", "5");
        assertThat(filters).hasSize(3);
        assertThat(render(filters.get(0))).isEqualTo(new BsonDocument());
        assertThat(render(filters.get(1))).isEqualTo(new BsonDocument("_id", new BsonDocument("$gt", new BsonInt32(2))));
        assertThat(render(filters.get(2))).isEqualTo(new BsonDocument("_id", new BsonDocument("$gt", new BsonInt32(4))));
    }

    @Test
    public void testStopsOnEmptyPage() {
        pages.add(page(1, 2));

        long delivered = new MongoDocumentSource(collection, 2, null).forEach(doc -> { });
        assertThat(delivered).isEqualTo(2);
        assertThat(filters).hasSize(2);
    }

    @Test
    public void testSampleLimitShrinksLastPage() {
        pages.add(page(1, 2));
        pages.add(page(3));

        MongoDocumentSource source = new MongoDocumentSource(collection, 2, 3);
        assertThat(readAll(source)).containsExactly("1", "2", "3");
        assertThat(limits).containsExactly(2, 1);
    }

    @Test
    public void testPassLimitStopsPaging() {
        pages.add(page(1, 2));
        pages.add(page(3, 4));
        pages.add(page(5, 6));

        List<String> ids = new ArrayList<>();
        long delivered = new MongoDocumentSource(collection, 2, null).forEach(doc -> ids.add(doc.getId()), 3);
        assertThat(delivered).isEqualTo(3);
        assertThat(ids).containsExactly("1", "2", "3");
        assertThat(limits).containsExactly(2, 1);
        assertThat(filters).hasSize(2);
    }

    @Test
    public void testTighterOfSourceAndPassLimitWins() {
        pages.add(page(1, 2));

        long delivered = new MongoDocumentSource(collection, 10, 2).forEach(doc -> { }, 5);
        assertThat(delivered).isEqualTo(2);
        assertThat(limits).containsExactly(2);
    }

    @Test
    public void testIdIsStrippedFromPayload() {
        List<SourceDocument> seen = new ArrayList<>();
        pages.add(page(7));

        new MongoDocumentSource(collection, 10, null).forEach(seen::add);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).getId()).isEqualTo("7");
        assertThat(seen.get(0).getPayload()).containsOnlyKeys("n");
    }

    @Test
    public void testDriverFailureIsWrapped() {
        pages.add(page(1, 2));
        pages.add(new MongoException("connection reset"));

        MongoDocumentSource source = new MongoDocumentSource(collection, 2, null);
        assertThatThrownBy(() -> source.forEach(doc -> { }))
                .isInstanceOf(DocumentSourceException.class)
                .hasMessageContaining("people")
                .hasMessageContaining("after 2 documents")
                .hasCauseInstanceOf(MongoException.class);
    }

    @Test
    public void testRenderId() {
        ObjectId id = new ObjectId("65f0c0ffee0000000000abcd");
        assertThat(MongoDocumentSource.renderId(id)).isEqualTo("65f0c0ffee0000000000abcd");
        assertThat(MongoDocumentSource.renderId("slug")).isEqualTo("slug");
        assertThat(MongoDocumentSource.renderId(42L)).isEqualTo("42");
    }

    @Test
    public void testNameAndBatchSizeValidation() {
        assertThat(new MongoDocumentSource(collection, 1, null).getName()).isEqualTo("people");
        assertThatThrownBy(() -> new MongoDocumentSource(collection, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSecondPassSeesSameSequence() {
        pages.addAll(Arrays.asList(page(1, 2), page(3)));
        MongoDocumentSource source = new MongoDocumentSource(collection, 2, null);
        List<String> first = readAll(source);
        pages.addAll(Arrays.asList(page(1, 2), page(3)));
        assertThat(readAll(source)).isEqualTo(first);
    }

    private static BsonDocument render(Bson filter) {
        return filter.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    }
}
