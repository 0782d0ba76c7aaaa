package io.herald4j;

import io.herald4j.core.JobQuery;
import io.herald4j.core.JobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for {@link JobRecord}s.
 *
 * <p>Each call is expected to be atomic on its own; no guarantee spans several calls.
 * Implementations report connectivity problems with {@link JobStoreUnavailableException}.
 */
public interface JobStore {

    /**
     * @return the id assigned to the inserted record
     */
    String insert(JobRecord record);

    Optional<JobRecord> findById(String id);

    Optional<JobRecord> findOne(JobQuery query);

    List<JobRecord> findMany(JobQuery query);

    /**
     * @return number of records modified (0 or 1)
     */
    long markCompleted(String id);

    /**
     * Delete at most one record matching the query.
     *
     * @return deleted count
     */
    long deleteOne(JobQuery query);
}
