package io.herald4j.core;

/**
 * Result of cancelling a schedule.
 *
 * matched : number of pending records matched by id and destination
 * deleted : number of records deleted
 */
public record CancelResult(
        long matched,
        long deleted
) {

    public static CancelResult notFound() {
        return new CancelResult(0, 0);
    }

    public boolean hasEffect() {
        return deleted > 0;
    }
}
