package io.herald4j;

/**
 * Fatal: stored schedules could not be loaded.
 */
public class SchedulerStartupException extends RuntimeException {

    public SchedulerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
