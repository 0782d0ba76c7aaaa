package io.herald4j.core;

/**
 * Outcome of rebuilding triggers from stored records.
 *
 * loaded  : records whose trigger was installed
 * skipped : records left untouched because they were invalid or their destination was unreachable
 * expired : one-shot records whose time had passed; they are marked completed without delivery
 */
public record RecoveryReport(
        int loaded,
        int skipped,
        int expired
) {
}
