package io.sentinel.work.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last successful completion of one work item. The document id is the item id.
 */
@Document(collection = "work_completions")
public class CompletionDocument {

    @Id
    private String id;

    private Instant completedAt;

    public CompletionDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
