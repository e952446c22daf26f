package io.sentinel.work.core;

import java.util.List;

/**
 * A manually dispatched work item whose dependencies have never completed.
 */
public class DependencyNotMetException extends Exception {

    private final List<String> missing;

    public DependencyNotMetException(String itemId, List<String> missing) {
        super("dependencies not met for " + itemId + ": " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
