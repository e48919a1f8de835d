package org.netpreserve.mapcrawl;

import org.netpreserve.mapcrawl.config.JobConfig;
import org.netpreserve.mapcrawl.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * A crawl run: startup recovery, recrawl sweep, discovery, the fetch pool and the final report.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    private final JobConfig config;
    private final Database db;
    private final boolean ownsDatabase;
    private final Clock clock;
    private final Frontier frontier;
    private final Fetcher fetcher;

    public Job(JobConfig config) {
        this(config, Database.open(config.store()), true,
                new Fetcher(Fetcher.newHttpClient(config.crawl()), config.crawl()), Clock.systemUTC());
    }

    public Job(JobConfig config, Database db, Fetcher fetcher, Clock clock) {
        this(config, db, false, fetcher, clock);
    }

    private Job(JobConfig config, Database db, boolean ownsDatabase, Fetcher fetcher, Clock clock) {
        this.config = config;
        this.db = db;
        this.ownsDatabase = ownsDatabase;
        this.clock = clock;
        this.frontier = new Frontier(db.queue(), clock);
        this.fetcher = fetcher;
    }

    public Frontier frontier() {
        return frontier;
    }

    /**
     * Runs the whole crawl. Per-URL failures are recorded in the queue and never end the run.
     *
     * @param crawlOnly     skip sitemap discovery and only work through what is already queued
     * @param requeueFailed move FAILED entries back to the queue before crawling
     */
    public Report run(boolean crawlOnly, boolean requeueFailed) throws InterruptedException {
        frontier.recoverInProgress();
        if (requeueFailed) {
            frontier.requeueFailed();
        }
        frontier.requeueExpired(config.crawl().recrawlAfter());

        if (crawlOnly) {
            log.info("Skipping sitemap discovery (crawl only)");
        } else {
            new Discovery(frontier, fetcher, new SitemapParser(), config.sources(), config.crawl().maxDocuments())
                    .seed();
        }

        Scheduler scheduler = crawl();
        return scheduler.report(frontier.queuedRemaining(), db.documents().count());
    }

    /**
     * Runs the fetch pool until every worker has stopped.
     */
    Scheduler crawl() throws InterruptedException {
        var crawl = config.crawl();
        var scheduler = new Scheduler(config.sourceNames(), crawl.maxDocuments());
        log.info("Starting {} workers (delay={}ms, retries={}, budget={})", crawl.workers(),
                crawl.delay().toMillis(), crawl.retries(), crawl.maxDocuments());

        ExecutorService pool = Executors.newFixedThreadPool(crawl.workers(), new NamedThreadFactory("worker"));
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < crawl.workers(); i++) {
                var worker = new Worker(String.valueOf(i), scheduler, frontier, db.documents(), fetcher,
                        crawl.delay(), clock);
                futures.add(pool.submit(worker));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("Worker crashed", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        log.info("All workers finished after {} documents", scheduler.downloaded());
        return scheduler;
    }

    @Override
    public void close() {
        if (ownsDatabase) {
            try {
                db.close();
            } catch (Exception e) {
                log.error("Failed to close database", e);
            }
        }
    }
}
