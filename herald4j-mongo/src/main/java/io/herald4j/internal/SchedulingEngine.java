package io.herald4j.internal;

import io.herald4j.ChatTransport;
import io.herald4j.JobStore;
import io.herald4j.JobStoreUnavailableException;
import io.herald4j.MessageScheduler;
import io.herald4j.SchedulerStartupException;
import io.herald4j.TransportException;
import io.herald4j.config.SchedulerProperties;
import io.herald4j.core.CancelResult;
import io.herald4j.core.CreateResult;
import io.herald4j.core.JobQuery;
import io.herald4j.core.JobRecord;
import io.herald4j.core.RecoveryReport;
import io.herald4j.core.ScheduleRequest;
import io.herald4j.core.TriggerSpec;
import io.herald4j.utils.TriggerParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store-backed message scheduler.
 *
 * <p>The trigger table mirrors the pending records of the {@link JobStore}:
 * <ul>
 *   <li>{@link #start()} rebuilds it from storage (recovery) and starts the ticker</li>
 *   <li>the ticker asks the trigger table for due jobs once per tick and hands each to a delivery worker</li>
 *   <li>{@link #create} and {@link #cancel} update storage first, then the trigger table</li>
 * </ul>
 *
 * <p>Replacing a same-named schedule is a delete followed by an insert. The store offers no
 * transaction across the two calls, so a crash between them leaves the name without any schedule.
 * Concurrent callers never observe the gap: create, cancel and delivery serialize on per-name and
 * per-job locks.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.create(new ScheduleRequest("-100123", "Weekly Update", "Standup at 10",
 *         null, List.of(), TriggerSpec.everySeconds(604800)));
 *
 * scheduler.cancel(jobId, "-100123");
 * scheduler.stop();
 * }</pre>
 */
public class SchedulingEngine implements MessageScheduler {
    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);
    private static final int LOCK_STRIPES = 64;

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final ChatTransport transport;
    private final Clock clock;

    private final TriggerSet triggers;
    private final MessageDelivery delivery;
    private final JobLocks locks = new JobLocks(LOCK_STRIPES);

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService deliveryPool;
    private Thread tickerThread;
    private int systemErrorCount = 0;

    public SchedulingEngine(SchedulerProperties props, JobStore jobStore, ChatTransport transport, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.triggers = new TriggerSet(clock);
        this.delivery = new MessageDelivery(jobStore, transport, triggers, clock,
                props.getMaxDeliveryRetries(), props.getDeliveryRetryDelay());
    }

    /**
     * Recover stored schedules, then start ticking. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getTickInterval(), "herald.tickInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("herald.tickInterval must be a positive duration");
        }
        if (props.getDeliveryConcurrency() <= 0) {
            started.set(false);
            throw new IllegalArgumentException("herald.deliveryConcurrency must be a positive number");
        }

        log.info("Scheduler starting with tickInterval={}, deliveryConcurrency={}, recoveryRetries={}, maxDeliveryRetries={}",
                props.getTickInterval(),
                props.getDeliveryConcurrency(),
                props.getRecoveryRetries(),
                props.getMaxDeliveryRetries());

        try {
            recoverWithRetries();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        if (deliveryPool == null) {
            deliveryPool = Executors.newFixedThreadPool(props.getDeliveryConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("herald.delivery");
                t.setDaemon(true);
                return t;
            });
        }

        if (tickerThread == null) {
            tickerThread = new Thread(this::tickerLoop);
            tickerThread.setName("herald.ticker");
            tickerThread.setDaemon(true);
            tickerThread.start();
        }
        log.info("Scheduler started successfully with {} live triggers.", triggers.size());
    }

    /**
     * Stop ticking and delivering. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");

        if (tickerThread != null) {
            tickerThread.interrupt();
            tickerThread = null;
        }

        if (deliveryPool != null) {
            deliveryPool.shutdown();
            try {
                if (!deliveryPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    deliveryPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                deliveryPool.shutdownNow();
            } finally {
                deliveryPool = null;
            }
        }

        triggers.clear();
        log.info("Scheduler stopped successfully.");
    }

    /**
     * Create a schedule, replacing any record with the same destination and name.
     *
     * <p>A fire-at time in the past is stored but gets no trigger; the record is left pending and is
     * marked completed by the next recovery.
     */
    @Override
    public CreateResult create(ScheduleRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        // the first firing must be computable before the old record is removed
        TriggerParser.initialFireAt(request.trigger(), clock.instant(), clock.getZone());

        return locks.withNameLock(request.destination(), request.scheduleName(), () -> {
            String replacedId = jobStore.findOne(JobQuery.named(request.destination(), request.scheduleName()))
                    .map(this::removeReplaced)
                    .orElse(null);

            String id = jobStore.insert(JobRecord.from(request));

            return locks.withJobLock(id, () -> {
                TriggerSpec trigger = request.trigger();
                boolean installed = false;
                if (trigger.isRecurring()) {
                    triggers.install(id, request.destination(), trigger);
                    installed = true;
                    log.info("Scheduled repeating message job={} destination={} name='{}' every={}s",
                            id, request.destination(), request.scheduleName(), trigger.interval().toSeconds());
                } else if (trigger.fireAt().isAfter(LocalDateTime.now(clock))) {
                    triggers.install(id, request.destination(), trigger);
                    installed = true;
                    log.info("Scheduled one-time message job={} destination={} name='{}' at={}",
                            id, request.destination(), request.scheduleName(), TriggerParser.formatFireAt(trigger.fireAt()));
                } else {
                    log.warn("Stored one-time message job={} destination={} name='{}' without a trigger: {} is in the past",
                            id, request.destination(), request.scheduleName(), TriggerParser.formatFireAt(trigger.fireAt()));
                }
                return new CreateResult(id, replacedId, installed);
            });
        });
    }

    private String removeReplaced(JobRecord existing) {
        String oldId = existing.id();
        return locks.withJobLock(oldId, () -> {
            jobStore.deleteOne(JobQuery.byId(oldId));
            if (!existing.completed()) {
                triggers.cancel(oldId);
            }
            log.info("Auto-deleted existing message job={} (completed: {}) with name '{}' for destination={}",
                    oldId, existing.completed(), existing.scheduleName(), existing.destination());
            return oldId;
        });
    }

    @Override
    public CancelResult cancel(String jobId, String destination) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(destination, "destination must not be null");

        return locks.withJobLock(jobId, () -> {
            JobQuery query = JobQuery.builder()
                    .id(jobId)
                    .destination(destination)
                    .completed(false)
                    .build();

            long deleted = jobStore.deleteOne(query);
            if (deleted == 0) {
                log.debug("Cancel found no pending job={} destination={}", jobId, destination);
                return CancelResult.notFound();
            }

            triggers.cancel(jobId);
            log.info("Deleted scheduled message job={} destination={}", jobId, destination);
            return new CancelResult(deleted, deleted);
        });
    }

    @Override
    public List<JobRecord> list(String destination) {
        Objects.requireNonNull(destination, "destination must not be null");
        return jobStore.findMany(JobQuery.pendingIn(destination));
    }

    @Override
    public boolean isScheduled(String jobId) {
        return triggers.contains(jobId);
    }

    /**
     * Rebuild triggers from every pending record.
     *
     * <p>Per record: required fields must be present, the destination must resolve, and the trigger
     * must parse. Invalid records are skipped with a warning and left as they are. A one-shot record
     * whose time is not in the future is marked completed without delivery.
     *
     * @throws JobStoreUnavailableException if the pending records cannot be read
     */
    @Override
    public RecoveryReport recover() {
        List<JobRecord> pending = jobStore.findMany(JobQuery.pending());

        int loaded = 0;
        int skipped = 0;
        int expired = 0;
        for (JobRecord record : pending) {
            try {
                switch (recoverOne(record)) {
                    case LOADED -> loaded++;
                    case EXPIRED -> expired++;
                    case SKIPPED -> skipped++;
                }
            } catch (RuntimeException e) {
                log.error("Error processing schedule job={} msg={}", record.id(), e.getMessage(), e);
                skipped++;
            }
        }

        log.info("Schedule loading complete: {} loaded, {} skipped, {} expired", loaded, skipped, expired);
        return new RecoveryReport(loaded, skipped, expired);
    }

    private enum Recovered { LOADED, SKIPPED, EXPIRED }

    private Recovered recoverOne(JobRecord record) {
        String id = record.id();
        if (isBlank(id) || isBlank(record.destination()) || isBlank(record.scheduleName()) || isBlank(record.body())) {
            log.warn("Skipping invalid schedule job={}: missing required fields", id);
            return Recovered.SKIPPED;
        }

        try {
            transport.resolve(record.destination());
        } catch (TransportException | RuntimeException e) {
            log.warn("Skipping schedule job={} for inaccessible destination={}: {}", id, record.destination(), e.getMessage());
            return Recovered.SKIPPED;
        }

        TriggerSpec trigger;
        try {
            trigger = TriggerParser.fromRecord(record);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping schedule job={}: {}", id, e.getMessage());
            return Recovered.SKIPPED;
        }

        return locks.withJobLock(id, () -> {
            if (!trigger.isRecurring() && !trigger.fireAt().isAfter(LocalDateTime.now(clock))) {
                jobStore.markCompleted(id);
                log.info("Skipped past schedule job={} for destination={}, name '{}'", id, record.destination(), record.scheduleName());
                return Recovered.EXPIRED;
            }
            triggers.install(id, record.destination(), trigger);
            log.info("Loaded {} schedule job={} for destination={}, name '{}'",
                    trigger.isRecurring() ? "repeating" : "one-time", id, record.destination(), record.scheduleName());
            return Recovered.LOADED;
        });
    }

    private void recoverWithRetries() {
        int attempts = Math.max(1, props.getRecoveryRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                recover();
                return;
            } catch (JobStoreUnavailableException e) {
                log.error("Job store query failed (attempt {}/{}) msg={}", attempt, attempts, e.getMessage());
                if (attempt >= attempts) {
                    log.error("Max retries reached. Schedule loading failed.");
                    throw new SchedulerStartupException("Failed to load schedules from the job store", e);
                }
                try {
                    Thread.sleep(props.getRecoveryRetryDelay().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SchedulerStartupException("Interrupted while loading schedules", ie);
                }
            }
        }
    }

    private void tickerLoop() {
        try {
            while (started.get()) {
                try {
                    tickOnce();
                    systemErrorCount = 0;
                } catch (RuntimeException e) {
                    systemErrorCount++;
                    log.error("scheduler tick failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                }

                try {
                    Thread.sleep(props.getTickInterval().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } catch (Throwable t) {
            log.error("Scheduler ticker terminated unexpectedly; no further messages will be delivered", t);
            throw t;
        }
    }

    /**
     * One tick: hand every due job to a delivery worker, or deliver inline when no pool is running.
     *
     * @return number of due jobs
     */
    int tickOnce() {
        List<TriggerSet.Firing> due = triggers.tick();
        for (TriggerSet.Firing firing : due) {
            ExecutorService pool = deliveryPool;
            if (pool == null) {
                deliverGuarded(firing);
                continue;
            }
            try {
                pool.submit(() -> deliverGuarded(firing));
            } catch (RejectedExecutionException e) {
                log.warn("Delivery rejected for job={}: scheduler is stopping", firing.jobId());
            }
        }
        return due.size();
    }

    /**
     * Deliver one firing under its job lock, never throwing.
     */
    Optional<DeliveryOutcome> deliverGuarded(TriggerSet.Firing firing) {
        try {
            return Optional.of(locks.withJobLock(firing.jobId(),
                    () -> delivery.deliver(firing.destination(), firing.jobId())));
        } catch (RuntimeException e) {
            log.error("Delivery failed job={} destination={} msg={}", firing.jobId(), firing.destination(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    TriggerSet triggers() {
        return triggers;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
