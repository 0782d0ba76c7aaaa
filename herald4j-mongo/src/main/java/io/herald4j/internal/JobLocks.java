package io.herald4j.internal;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped mutexes serializing work on the same schedule name or job id.
 *
 * <p>Name locks and job locks are separate stripes. A caller holding a job lock must never take a
 * name lock; name then job is the only nesting allowed.
 */
final class JobLocks {

    private final ReentrantLock[] nameStripes;
    private final ReentrantLock[] jobStripes;

    JobLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive");
        }
        this.nameStripes = newStripes(stripes);
        this.jobStripes = newStripes(stripes);
    }

    <T> T withNameLock(String destination, String scheduleName, Supplier<T> action) {
        return withLock(nameStripes, destination + '\u0000' + scheduleName, action);
    }

    <T> T withJobLock(String jobId, Supplier<T> action) {
        return withLock(jobStripes, jobId, action);
    }

    private static <T> T withLock(ReentrantLock[] stripes, String key, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(key.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static ReentrantLock[] newStripes(int n) {
        ReentrantLock[] locks = new ReentrantLock[n];
        for (int i = 0; i < n; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }
}
