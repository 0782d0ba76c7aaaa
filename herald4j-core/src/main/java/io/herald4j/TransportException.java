package io.herald4j;

/**
 * The chat platform rejected a call or could not be reached.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
