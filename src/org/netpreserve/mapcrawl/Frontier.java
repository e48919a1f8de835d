package org.netpreserve.mapcrawl;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.mapcrawl.db.QueueDAO;
import org.netpreserve.mapcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Owns the lifecycle of queue entries.
 * <pre>
 *   QUEUED --claim--> IN_PROGRESS --> DONE | FAILED
 *   DONE --recrawl expiry--> QUEUED
 *   IN_PROGRESS --startup recovery--> QUEUED
 *   FAILED --operator requeue--> QUEUED
 *   IN_PROGRESS --interrupted fetch--> QUEUED
 * </pre>
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final QueueDAO dao;
    private final Clock clock;

    public Frontier(QueueDAO dao, Clock clock) {
        this.dao = dao;
        this.clock = clock;
    }

    /**
     * Adds a URL as QUEUED unless it is already known, in which case only its update time changes.
     *
     * @return true if the URL was new
     */
    public boolean enqueue(Url url, String source) {
        Instant now = clock.instant();
        if (dao.insertIfAbsent(url, source, now)) {
            log.debug("Queued {} from {}", url, source);
            return true;
        }
        dao.touch(url, now);
        return false;
    }

    /**
     * Claims the next queued entry, preferring the given source but falling back to any source when it has
     * nothing queued.
     *
     * @return the claimed entry, now IN_PROGRESS, or null if nothing is queued at all
     */
    public @Nullable QueueEntry claim(@Nullable String preferredSource) {
        Instant now = clock.instant();
        if (preferredSource != null) {
            QueueEntry entry = dao.claim(preferredSource, now);
            if (entry != null) return entry;
        }
        return dao.claim(null, now);
    }

    public void markNotModified(QueueEntry entry) {
        dao.markNotModified(entry.id(), clock.instant());
    }

    public void markFetched(QueueEntry entry) {
        dao.markFetched(entry.id(), clock.instant());
    }

    public void markFailed(QueueEntry entry, String error) {
        dao.markFailed(entry.id(), error, clock.instant());
    }

    /**
     * Hands a claimed entry back to the queue without counting an attempt, e.g. when its fetch was interrupted.
     */
    public void requeue(QueueEntry entry) {
        dao.unclaim(entry.id(), clock.instant());
    }

    /**
     * Requeues entries left IN_PROGRESS by a previous run that didn't shut down cleanly.
     */
    public int recoverInProgress() {
        int count = dao.resetInProgress(clock.instant());
        if (count > 0) log.info("Recovered {} entries left in progress", count);
        return count;
    }

    /**
     * Requeues DONE entries last crawled longer than {@code ttl} ago.
     */
    public int requeueExpired(Duration ttl) {
        Instant now = clock.instant();
        int count = dao.requeueExpired(now.minus(ttl), now);
        log.info("Moved {} due recrawls back to the queue", count);
        return count;
    }

    /**
     * Requeues every FAILED entry. Only done on operator request; failures are never retried automatically.
     */
    public int requeueFailed() {
        int count = dao.requeueFailed(clock.instant());
        log.info("Moved {} failed entries back to the queue", count);
        return count;
    }

    public long queuedRemaining() {
        return dao.countByStatus(QueueEntry.Status.QUEUED);
    }
}
