package io.sentinel.work.internal.mongo;

import io.sentinel.work.spi.CompletionStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence of completion records in {@code work_completions}.
 */
public class MongoCompletionStore implements CompletionStore {

    private final MongoTemplate mongoTemplate;

    public MongoCompletionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Upsert with {@code $max}, so a concurrent or out-of-order write never moves a record back.
     */
    @Override
    public void saveIfLater(String itemId, Instant completedAt) {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");

        Query q = new Query(Criteria.where("_id").is(itemId));
        Update u = new Update().max("completedAt", completedAt);
        mongoTemplate.upsert(q, u, CompletionDocument.class);
    }

    @Override
    public Map<String, Instant> loadAll() {
        Map<String, Instant> out = new LinkedHashMap<>();
        for (CompletionDocument doc : mongoTemplate.findAll(CompletionDocument.class)) {
            if (doc.getId() != null && doc.getCompletedAt() != null) {
                out.put(doc.getId(), doc.getCompletedAt());
            }
        }
        return out;
    }
}
