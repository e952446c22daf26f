package io.sentinel.work;

/**
 * Narrow progress capability handed to a running work item.
 */
public interface ProgressReporter {

    void report(int current, int total, String message);

    /**
     * Reporter that discards every report. Valid wherever a reporter is expected.
     */
    static ProgressReporter noop() {
        return (current, total, message) -> {
        };
    }
}
