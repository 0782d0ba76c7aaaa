package io.herald4j.internal;

import io.herald4j.core.TriggerSpec;
import io.herald4j.utils.TriggerParser;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of live timers, one per job id.
 *
 * <p>Timers do not run by themselves: {@link #tick()} reports the jobs whose firing time has been
 * reached and moves each of them to its next firing. The tick period therefore bounds delivery
 * latency, while the trigger decides the cadence.
 */
public class TriggerSet {

    /**
     * A due job reported by {@link #tick()}.
     */
    public record Firing(String jobId, String destination, boolean recurring) {
    }

    private static final class LiveTrigger {
        private final String destination;
        private final TriggerSpec spec;
        private final Instant nextFireAt;
        private final int failedAttempts;

        private LiveTrigger(String destination, TriggerSpec spec, Instant nextFireAt, int failedAttempts) {
            this.destination = destination;
            this.spec = spec;
            this.nextFireAt = nextFireAt;
            this.failedAttempts = failedAttempts;
        }

        private LiveTrigger firingAt(Instant at) {
            return new LiveTrigger(destination, spec, at, failedAttempts);
        }

        private LiveTrigger failedOnce() {
            return new LiveTrigger(destination, spec, nextFireAt, failedAttempts + 1);
        }
    }

    private final ConcurrentHashMap<String, LiveTrigger> triggers = new ConcurrentHashMap<>();
    private final Clock clock;

    public TriggerSet(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static String tagFor(String jobId) {
        return "job_" + jobId;
    }

    /**
     * Install (or replace) the timer of a job.
     *
     * @return the cancellation tag
     */
    public String install(String jobId, String destination, TriggerSpec spec) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        Instant first = TriggerParser.initialFireAt(spec, clock.instant(), clock.getZone());
        triggers.put(jobId, new LiveTrigger(destination, spec, first, 0));
        return tagFor(jobId);
    }

    /**
     * @return true if a timer was removed
     */
    public boolean cancel(String jobId) {
        return jobId != null && triggers.remove(jobId) != null;
    }

    /**
     * Jobs due now, in no particular order. Each reported job has already been moved to its next firing.
     */
    public List<Firing> tick() {
        Instant now = clock.instant();
        List<Firing> due = new ArrayList<>();

        for (String jobId : triggers.keySet()) {
            triggers.computeIfPresent(jobId, (id, t) -> {
                if (t.nextFireAt.isAfter(now)) {
                    return t;
                }
                due.add(new Firing(id, t.destination, t.spec.isRecurring()));
                return t.firingAt(TriggerParser.computeNextFireAt(t.spec, now, clock.getZone()));
            });
        }
        return due;
    }

    /**
     * Count a failed delivery for the job's live timer.
     *
     * @return failed attempts so far, or 0 if the job has no timer
     */
    public int recordFailure(String jobId) {
        LiveTrigger updated = triggers.computeIfPresent(jobId, (id, t) -> t.failedOnce());
        return updated == null ? 0 : updated.failedAttempts;
    }

    /**
     * Move the next firing of a live timer. No-op if the job has no timer.
     */
    public boolean reschedule(String jobId, Instant at) {
        Objects.requireNonNull(at, "at must not be null");
        return triggers.computeIfPresent(jobId, (id, t) -> t.firingAt(at)) != null;
    }

    public boolean contains(String jobId) {
        return jobId != null && triggers.containsKey(jobId);
    }

    public Optional<Instant> nextFireAt(String jobId) {
        LiveTrigger t = triggers.get(jobId);
        return t == null ? Optional.empty() : Optional.of(t.nextFireAt);
    }

    public int size() {
        return triggers.size();
    }

    public void clear() {
        triggers.clear();
    }
}
