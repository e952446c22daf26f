package io.sentinel.work.core;

/**
 * Raised at registration time for an invalid work type graph: duplicate ids,
 * unknown dependencies or dependency cycles. Startup must not continue past it.
 */
public class WorkConfigurationException extends IllegalStateException {

    public WorkConfigurationException(String message) {
        super(message);
    }
}
