package io.herald4j;

/**
 * The job store could not be reached. Retried at startup; surfaced to the caller otherwise.
 */
public class JobStoreUnavailableException extends RuntimeException {

    public JobStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
