package io.sentinel.work;

/**
 * Task body of a work type. Returning normally means success; any exception is a failure.
 */
@FunctionalInterface
public interface WorkExecution {

    void execute(WorkContext context, String subject, ProgressReporter progress) throws Exception;
}
