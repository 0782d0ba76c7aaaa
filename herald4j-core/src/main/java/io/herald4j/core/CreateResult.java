package io.herald4j.core;

/**
 * Result of creating a schedule.
 *
 * @param id               id assigned to the new record
 * @param replacedId       id of the same-named record that was removed, or null
 * @param triggerInstalled false when a fire-at time was already in the past
 */
public record CreateResult(
        String id,
        String replacedId,
        boolean triggerInstalled
) {

    public boolean replaced() {
        return replacedId != null;
    }
}
