package io.herald4j;

import io.herald4j.core.CancelResult;
import io.herald4j.core.CreateResult;
import io.herald4j.core.JobRecord;
import io.herald4j.core.RecoveryReport;
import io.herald4j.core.ScheduleRequest;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Supports two scheduling styles:
 * <ul>
 *   <li>Absolute time scheduling (single delivery at a local date-time)</li>
 *   <li>Interval-based scheduling (repeat every N seconds until cancelled)</li>
 * </ul>
 *
 * <p>Within a destination the schedule name is unique: creating a schedule replaces any existing
 * record with the same {@code (destination, scheduleName)}, whether or not it was already sent.
 * Callers are responsible for authorization.
 */
public interface MessageScheduler {

    /**
     * Rebuild triggers from storage and start delivering. Idempotent.
     *
     * @throws SchedulerStartupException if the store stays unreachable after the configured retries
     */
    void start();

    /**
     * Stop delivering. Idempotent. Stored records are not touched.
     */
    void stop();

    CreateResult create(ScheduleRequest request);

    /**
     * Delete a pending schedule of the given destination and stop its trigger.
     * Returns an empty result when no pending record matches (unknown id or already sent).
     */
    CancelResult cancel(String jobId, String destination);

    /**
     * Pending (not completed) schedules of a destination.
     */
    List<JobRecord> list(String destination);

    /**
     * Load every pending record and install triggers for the valid ones.
     * One-shot records whose time has passed are marked completed and never delivered.
     */
    RecoveryReport recover();

    boolean isScheduled(String jobId);
}
