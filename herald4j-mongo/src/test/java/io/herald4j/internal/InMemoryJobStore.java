package io.herald4j.internal;

import io.herald4j.JobStore;
import io.herald4j.JobStoreUnavailableException;
import io.herald4j.core.JobQuery;
import io.herald4j.core.JobRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JobStore backed by a map, with injectable read failures.
 */
class InMemoryJobStore implements JobStore {

    private final Map<String, JobRecord> records = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger failingScans = new AtomicInteger();
    private final AtomicInteger scans = new AtomicInteger();

    /**
     * The next {@code n} calls to findMany throw {@link JobStoreUnavailableException}.
     */
    void failNextScans(int n) {
        failingScans.set(n);
    }

    int scanCount() {
        return scans.get();
    }

    /**
     * Store a record as-is, keeping its id.
     */
    synchronized void put(JobRecord record) {
        records.put(record.id(), record);
    }

    synchronized int size() {
        return records.size();
    }

    @Override
    public synchronized String insert(JobRecord record) {
        String id = String.valueOf(sequence.incrementAndGet());
        records.put(id, record.withId(id));
        return id;
    }

    @Override
    public synchronized Optional<JobRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized Optional<JobRecord> findOne(JobQuery query) {
        return records.values().stream().filter(r -> matches(r, query)).findFirst();
    }

    @Override
    public synchronized List<JobRecord> findMany(JobQuery query) {
        scans.incrementAndGet();
        if (failingScans.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new JobStoreUnavailableException("connection refused", null);
        }
        List<JobRecord> out = new ArrayList<>();
        for (JobRecord r : records.values()) {
            if (matches(r, query)) {
                out.add(r);
            }
        }
        return out;
    }

    @Override
    public synchronized long markCompleted(String id) {
        JobRecord r = records.get(id);
        if (r == null || r.completed()) {
            return 0;
        }
        records.put(id, r.withCompleted(true));
        return 1;
    }

    @Override
    public synchronized long deleteOne(JobQuery query) {
        Optional<JobRecord> hit = findOne(query);
        hit.ifPresent(r -> records.remove(r.id()));
        return hit.isPresent() ? 1 : 0;
    }

    private static boolean matches(JobRecord r, JobQuery q) {
        return (q.id() == null || q.id().equals(r.id()))
                && (q.destination() == null || q.destination().equals(r.destination()))
                && (q.scheduleName() == null || q.scheduleName().equals(r.scheduleName()))
                && (q.completed() == null || q.completed() == r.completed());
    }
}
