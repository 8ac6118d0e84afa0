package com.example.mongoprofile.source;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Reads a MongoDB collection in {@code _id} order, one page of {@code batchSize} documents at a time.
 * Each page restarts after the last {@code _id} of the previous one, so a second pass sees the same sequence
 * as long as the collection is not modified in between.
 */
public class MongoDocumentSource implements DocumentSource {
    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentSource.class);
    private static final String ID_FIELD = "_id";

    private final MongoCollection<Document> collection;
    private final int batchSize;
    private final Integer sampleLimit;

    /**
     * @param sampleLimit maximum number of documents per pass, {@code null} to scan the whole collection
     */
    public MongoDocumentSource(MongoCollection<Document> collection, int batchSize, Integer sampleLimit) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.collection = collection;
        this.batchSize = batchSize;
        this.sampleLimit = sampleLimit;
    }

    @Override
    public String getName() {
        return collection.getNamespace().getCollectionName();
    }

    @Override
    public long forEach(Consumer<SourceDocument> consumer, Integer limit) {
        Integer bound = limit == null ? sampleLimit : sampleLimit == null ? limit : Integer.valueOf(Math.min(limit, sampleLimit));
        long delivered = 0;
        Object lastId = null;

        try {
            while (bound == null || delivered < bound) {
                int pageSize = bound == null ? batchSize : (int) Math.min(batchSize, bound - delivered);
                Bson filter = lastId == null ? new Document() : Filters.gt(ID_FIELD, lastId);
                List<Document> page = collection.find(filter)
                        .sort(Sorts.ascending(ID_FIELD))
                        .limit(pageSize)
                        .into(new ArrayList<>());

                if (page.isEmpty()) {
                    break;
                }

                for (Document doc : page) {
                    consumer.accept(toSourceDocument(doc));
                    delivered++;
                    if (delivered % 1000 == 0) {
                        logger.info("  Read {} documents from {}", delivered, getName());
                    }
                }

                lastId = page.get(page.size() - 1).get(ID_FIELD);
                if (page.size() < pageSize) {
                    break;
                }
            }
        } catch (MongoException e) {
            throw new DocumentSourceException("Failed to read collection " + getName() + " after " + delivered + " documents", e);
        }

        return delivered;
    }

    static SourceDocument toSourceDocument(Document doc) {
        Object id = doc.get(ID_FIELD);
        Document payload = new Document(doc);
        payload.remove(ID_FIELD);
        return new SourceDocument(renderId(id), payload);
    }

    static String renderId(Object id) {
        if (id instanceof ObjectId) {
            return ((ObjectId) id).toHexString();
        }
        return String.valueOf(id);
    }
}
