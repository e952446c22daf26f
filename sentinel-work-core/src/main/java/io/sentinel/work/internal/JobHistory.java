package io.sentinel.work.internal;

import io.sentinel.work.core.JobHistoryEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded log of queue dispatch outcomes, newest first. The oldest entry is evicted when full.
 */
class JobHistory {

    private final int capacity;
    private final Deque<JobHistoryEntry> entries = new ArrayDeque<>();

    JobHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("sentinel.work.historySize must be a positive number");
        }
        this.capacity = capacity;
    }

    synchronized void add(JobHistoryEntry entry) {
        entries.addFirst(entry);
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    synchronized List<JobHistoryEntry> recent(int limit) {
        int n = Math.min(Math.max(limit, 0), entries.size());
        List<JobHistoryEntry> out = new ArrayList<>(n);
        Iterator<JobHistoryEntry> it = entries.iterator();
        while (out.size() < n && it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }

    synchronized int size() {
        return entries.size();
    }
}
