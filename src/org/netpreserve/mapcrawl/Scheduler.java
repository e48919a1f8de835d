package org.netpreserve.mapcrawl;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shares the run's document budget between workers and sources.
 * <p>
 * Each fetch holds a slot of the budget from {@link #acquire()} until it is settled by {@link #recordSuccess},
 * {@link #recordFailure()} or {@link #release()}, so the number of successes can never exceed the budget however
 * many workers run. Until every source has reached its minimum share ({@code maxDocuments / sources}),
 * {@link #preferredSource()} steers workers round-robin towards the sources still below it.
 * <p>
 * All counters and the round-robin cursor are guarded by one lock which is never held across I/O.
 */
public class Scheduler {
    private final Lock lock = new ReentrantLock();
    private final Condition budgetChanged = lock.newCondition();
    private final List<String> sources;
    private final long maxDocuments;
    private final long minPerSource;
    private final Map<String, Long> successesBySource = new LinkedHashMap<>();
    private int cursor;
    private long inFlight;
    private long downloaded;
    private long updated;
    private long notModified;
    private long failed;

    public Scheduler(List<String> sources, long maxDocuments) {
        this.sources = List.copyOf(sources);
        this.maxDocuments = maxDocuments;
        this.minPerSource = sources.isEmpty() ? 0 : maxDocuments / sources.size();
        for (String source : sources) {
            successesBySource.put(source, 0L);
        }
    }

    /**
     * Reserves a slot of the budget for one fetch. Waits while the remaining budget is held by fetches still
     * in flight, as one of them may yet fail and hand its slot back.
     *
     * @throws CrawlLimitException if the budget has been reached
     */
    public void acquire() throws CrawlLimitException, InterruptedException {
        lock.lock();
        try {
            while (downloaded + inFlight >= maxDocuments) {
                if (downloaded >= maxDocuments) {
                    throw new CrawlLimitException("document limit of " + maxDocuments + " reached");
                }
                budgetChanged.await();
            }
            inFlight++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands back a slot that wasn't used for a fetch.
     */
    public void release() {
        lock.lock();
        try {
            settle();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The first source, scanning round-robin from the cursor, that is still below its minimum share, or null if
     * every source has reached it (or there are no sources).
     */
    public @Nullable String preferredSource() {
        lock.lock();
        try {
            for (int tries = 0; tries < sources.size(); tries++) {
                String candidate = sources.get(cursor % sources.size());
                cursor = (cursor + 1) % sources.size();
                if (successesBySource.get(candidate) < minPerSource) {
                    return candidate;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles a fetch that succeeded (200 or 304).
     *
     * @param changed whether the content was new or different from what was stored
     * @return the number of successful fetches this run, including this one
     */
    public long recordSuccess(String source, boolean changed) {
        lock.lock();
        try {
            settle();
            downloaded++;
            if (changed) {
                updated++;
            } else {
                notModified++;
            }
            successesBySource.computeIfPresent(source, (k, v) -> v + 1);
            return downloaded;
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            settle();
            failed++;
        } finally {
            lock.unlock();
        }
    }

    private void settle() {
        if (inFlight <= 0) throw new IllegalStateException("no fetch in flight");
        inFlight--;
        budgetChanged.signalAll();
    }

    public long downloaded() {
        lock.lock();
        try {
            return downloaded;
        } finally {
            lock.unlock();
        }
    }

    public Report report(long queuedRemaining, long documentsInDb) {
        lock.lock();
        try {
            return new Report(downloaded, updated, notModified, failed, queuedRemaining,
                    new LinkedHashMap<>(successesBySource), documentsInDb);
        } finally {
            lock.unlock();
        }
    }
}
