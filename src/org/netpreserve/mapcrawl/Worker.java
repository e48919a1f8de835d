package org.netpreserve.mapcrawl;

import org.netpreserve.mapcrawl.db.DocumentDAO;
import org.netpreserve.mapcrawl.util.ContentHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;

/**
 * One fetch loop of the pool: reserve budget, claim an entry, fetch it conditionally, record the outcome, repeat
 * until the budget is reached or nothing is left to claim.
 */
public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    static final int PROGRESS_INTERVAL = 100;
    final String id;
    private final Scheduler scheduler;
    private final Frontier frontier;
    private final DocumentDAO documents;
    private final Fetcher fetcher;
    private final Duration delay;
    private final Clock clock;

    public Worker(String id, Scheduler scheduler, Frontier frontier, DocumentDAO documents, Fetcher fetcher,
                  Duration delay, Clock clock) {
        this.id = id;
        this.scheduler = scheduler;
        this.frontier = frontier;
        this.documents = documents;
        this.fetcher = fetcher;
        this.delay = delay;
        this.clock = clock;
    }

    enum Outcome {
        UPDATED, NOT_MODIFIED, FAILED,
        /**
         * The entry's outcome was never written to the queue, so it counts neither as a success nor a failure.
         */
        ABANDONED
    }

    @Override
    public void run() {
        try {
            while (true) {
                try {
                    scheduler.acquire();
                } catch (CrawlLimitException e) {
                    log.info("Worker {} stopping: {}", id, e.getMessage());
                    return;
                }

                QueueEntry entry;
                try {
                    entry = frontier.claim(scheduler.preferredSource());
                } catch (RuntimeException e) {
                    scheduler.release();
                    throw e;
                }
                if (entry == null) {
                    scheduler.release();
                    log.info("No work available for worker {}", id);
                    return;
                }

                Outcome outcome = Outcome.ABANDONED;
                try {
                    outcome = process(entry);
                } catch (InterruptedException e) {
                    requeue(entry);
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Unable to record the outcome for {}", entry.url(), e);
                } finally {
                    settle(entry, outcome);
                }

                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
            }
        } catch (InterruptedException e) {
            log.warn("Worker {} interrupted", id);
            Thread.currentThread().interrupt();
        }
    }

    private void settle(QueueEntry entry, Outcome outcome) {
        if (outcome == Outcome.ABANDONED) {
            scheduler.release();
            return;
        }
        if (outcome == Outcome.FAILED) {
            scheduler.recordFailure();
            return;
        }
        long count = scheduler.recordSuccess(entry.source(), outcome == Outcome.UPDATED);
        if (count % PROGRESS_INTERVAL == 0) {
            log.info("Downloaded {} documents", count);
        }
    }

    private void requeue(QueueEntry entry) {
        try {
            frontier.requeue(entry);
            log.info("Worker {} interrupted, requeued {}", id, entry.url());
        } catch (RuntimeException e) {
            log.warn("Unable to requeue {}, it will be recovered on the next start", entry.url(), e);
        }
    }

    /**
     * Fetches a claimed entry and writes the result to the documents and the queue. Never throws for a
     * per-URL problem: anything that goes wrong marks the entry FAILED.
     */
    Outcome process(QueueEntry entry) throws InterruptedException {
        log.atDebug().addKeyValue("url", entry.url()).addKeyValue("source", entry.source()).log("Fetching");
        try {
            return fetch(entry);
        } catch (IOException e) {
            return fail(entry, errorText(e));
        } catch (RuntimeException e) {
            log.error("Error processing {}", entry.url(), e);
            return fail(entry, errorText(e));
        }
    }

    private Outcome fetch(QueueEntry entry) throws IOException, InterruptedException {
        var validators = documents.findValidators(entry.url());
        var headers = new LinkedHashMap<String, String>();
        if (validators != null) {
            if (!validators.etag().isEmpty()) headers.put("If-None-Match", validators.etag());
            if (!validators.lastModified().isEmpty()) headers.put("If-Modified-Since", validators.lastModified());
        }

        var response = fetcher.get(entry.url(), headers);
        var now = clock.instant();
        switch (response.status()) {
            case 304 -> {
                documents.touch(entry.url(), entry.source(), now);
                frontier.markNotModified(entry);
                log.debug("Not modified (304) {}", entry.url());
                return Outcome.NOT_MODIFIED;
            }
            case 200 -> {
                String hash = ContentHash.sha256(response.body());
                boolean changed = validators == null || !hash.equals(validators.contentHash());
                if (changed) {
                    documents.save(new DocumentRecord(entry.url(), entry.source(), response.body(), now,
                            response.header("ETag"), response.header("Last-Modified"), hash));
                } else {
                    documents.touch(entry.url(), entry.source(), now);
                }
                frontier.markFetched(entry);
                log.debug("{} {}", changed ? "Updated" : "Unchanged", entry.url());
                return changed ? Outcome.UPDATED : Outcome.NOT_MODIFIED;
            }
            default -> {
                return fail(entry, "HTTP " + response.status());
            }
        }
    }

    private Outcome fail(QueueEntry entry, String error) {
        log.warn("Failed {}: {}", entry.url(), error);
        frontier.markFailed(entry, error);
        return Outcome.FAILED;
    }

    private static String errorText(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getName() : message;
    }
}
