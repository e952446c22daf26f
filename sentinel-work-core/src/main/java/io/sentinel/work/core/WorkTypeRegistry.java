package io.sentinel.work.core;

import io.sentinel.work.WorkType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog of work types.
 *
 * <p>Registration validates the dependency graph eagerly: duplicate ids, unknown dependencies and
 * cycles throw {@link WorkConfigurationException}. After {@link #freeze()} the registry is
 * read-only; readers always see an immutable snapshot and never lock.
 */
public class WorkTypeRegistry {

    private static final Comparator<Entry> SCHEDULING_ORDER = Comparator
            .comparing((Entry e) -> e.workType().priority())
            .thenComparingLong(Entry::sequence);

    private record Entry(WorkType workType, long sequence) {
    }

    private final Object writeLock = new Object();

    private volatile Map<String, Entry> byId = Map.of();
    private volatile List<WorkType> ordered = List.of();
    private volatile boolean frozen = false;
    private long nextSequence = 0;

    public WorkTypeRegistry() {
    }

    public WorkTypeRegistry(Collection<WorkType> workTypes) {
        registerAll(workTypes);
    }

    /**
     * Register a single work type. Every dependency must already be registered.
     */
    public void register(WorkType workType) {
        Objects.requireNonNull(workType, "workType must not be null");
        registerAll(List.of(workType));
    }

    /**
     * Register a batch atomically. Dependencies may point at types registered earlier or at other
     * members of the batch; the combined graph must be acyclic.
     */
    public void registerAll(Collection<WorkType> workTypes) {
        Objects.requireNonNull(workTypes, "workTypes must not be null");

        synchronized (writeLock) {
            if (frozen) {
                throw new IllegalStateException("Work type registry is frozen; register work types before the engine starts");
            }

            Map<String, Entry> next = new LinkedHashMap<>(byId);
            long seq = nextSequence;
            for (WorkType wt : workTypes) {
                Objects.requireNonNull(wt, "workType must not be null");
                if (next.containsKey(wt.id())) {
                    throw new WorkConfigurationException("Duplicate work type id: " + wt.id());
                }
                next.put(wt.id(), new Entry(wt, seq++));
            }

            for (WorkType wt : workTypes) {
                for (String dep : wt.dependsOn()) {
                    if (!next.containsKey(dep)) {
                        throw new WorkConfigurationException(
                                "Work type " + wt.id() + " depends on unknown work type: " + dep);
                    }
                }
            }

            assertAcyclic(next);

            List<WorkType> sorted = next.values().stream()
                    .sorted(SCHEDULING_ORDER)
                    .map(Entry::workType)
                    .toList();

            nextSequence = seq;
            byId = Map.copyOf(next);
            ordered = sorted;
        }
    }

    /**
     * Work types by priority (critical first), ties in registration order.
     */
    public List<WorkType> all() {
        return ordered;
    }

    public Optional<WorkType> get(String id) {
        Entry e = byId.get(id);
        return e == null ? Optional.empty() : Optional.of(e.workType());
    }

    public WorkType getRequired(String id) {
        return get(id).orElseThrow(() -> new IllegalStateException("No work type registered for id: " + id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return ordered.size();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    // Three-color DFS; reports the first cycle found as a path.
    private static void assertAcyclic(Map<String, Entry> graph) {
        Map<String, Integer> state = new HashMap<>();
        for (String id : graph.keySet()) {
            if (!state.containsKey(id)) {
                visit(id, graph, state, new ArrayList<>());
            }
        }
    }

    private static void visit(String id, Map<String, Entry> graph, Map<String, Integer> state, List<String> path) {
        state.put(id, 1);
        path.add(id);
        for (String dep : graph.get(id).workType().dependsOn()) {
            Integer s = state.get(dep);
            if (s == null) {
                visit(dep, graph, state, path);
            } else if (s == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                throw new WorkConfigurationException("Circular work type dependency: " + String.join(" -> ", cycle));
            }
        }
        path.remove(path.size() - 1);
        state.put(id, 2);
    }
}
