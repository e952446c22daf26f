package io.sentinel.work.core;

import java.util.Objects;

/**
 * One schedulable unit: a work type applied to a subject.
 * Single-subject work types use the empty subject, in which case the identity is the type id alone.
 */
public record WorkItem(String workTypeId, String subject) {

    public static final String NO_SUBJECT = "";

    public WorkItem {
        Objects.requireNonNull(workTypeId, "workTypeId must not be null");
        subject = subject == null ? NO_SUBJECT : subject;
    }

    public static WorkItem of(String workTypeId, String subject) {
        return new WorkItem(workTypeId, subject);
    }

    public static WorkItem global(String workTypeId) {
        return new WorkItem(workTypeId, NO_SUBJECT);
    }

    /**
     * Completion and in-flight key: {@code id} or {@code id:subject}.
     */
    public String id() {
        return idOf(workTypeId, subject);
    }

    public boolean hasSubject() {
        return !subject.isEmpty();
    }

    public static String idOf(String workTypeId, String subject) {
        if (subject == null || subject.isEmpty()) {
            return workTypeId;
        }
        return workTypeId + ":" + subject;
    }

    @Override
    public String toString() {
        return id();
    }
}
