package org.netpreserve.mapcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.mapcrawl.util.DurationDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent    User-Agent string to identify as to servers
 * @param timeout      per-request timeout (a bare number is seconds)
 * @param maxDocuments global budget of successful fetches per run
 * @param recrawlAfter age after which a completed entry is queued again (a bare number is hours)
 * @param delay        politeness delay each worker waits between requests (a bare number is seconds)
 * @param workers      number of concurrent fetch workers
 * @param retries      retries after a transport error, per fetch attempt
 */
public record CrawlConfig(
        String userAgent,
        @JsonDeserialize(using = DurationDeserializer.Seconds.class)
        Duration timeout,
        long maxDocuments,
        @JsonDeserialize(using = DurationDeserializer.Hours.class)
        Duration recrawlAfter,
        @JsonDeserialize(using = DurationDeserializer.Seconds.class)
        Duration delay,
        int workers,
        int retries
) {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);
    public static final String DELAY_ENV = "CRAWL_DELAY_SECONDS";
    public static final String WORKERS_ENV = "CRAWL_WORKERS";

    public CrawlConfig withDelay(Duration delay) {
        return new CrawlConfig(userAgent, timeout, maxDocuments, recrawlAfter, delay, workers, retries);
    }

    public CrawlConfig withWorkers(int workers) {
        return new CrawlConfig(userAgent, timeout, maxDocuments, recrawlAfter, delay, workers, retries);
    }

    public CrawlConfig withRetries(int retries) {
        return new CrawlConfig(userAgent, timeout, maxDocuments, recrawlAfter, delay, workers, retries);
    }

    /**
     * Applies {@value DELAY_ENV} and {@value WORKERS_ENV}. Values that don't parse are logged and ignored.
     */
    public CrawlConfig withEnvironment(Map<String, String> env) {
        CrawlConfig config = this;
        String delayValue = env.getOrDefault(DELAY_ENV, "").strip();
        if (!delayValue.isEmpty()) {
            try {
                config = config.withDelay(seconds(Math.max(0.0, Double.parseDouble(delayValue))));
            } catch (NumberFormatException e) {
                log.warn("Ignoring {}={}: not a number", DELAY_ENV, delayValue);
            }
        }
        String workersValue = env.getOrDefault(WORKERS_ENV, "").strip();
        if (!workersValue.isEmpty()) {
            try {
                config = config.withWorkers(Math.max(1, Integer.parseInt(workersValue)));
            } catch (NumberFormatException e) {
                log.warn("Ignoring {}={}: not an integer", WORKERS_ENV, workersValue);
            }
        }
        return config;
    }

    public static Duration seconds(double seconds) {
        return DurationDeserializer.ofUnits(seconds, ChronoUnit.SECONDS);
    }

    void validate() throws ConfigException {
        if (userAgent == null || userAgent.isBlank()) throw new ConfigException("crawl.userAgent is required");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ConfigException("crawl.timeout must be positive");
        }
        if (maxDocuments <= 0) throw new ConfigException("crawl.maxDocuments must be positive");
        if (recrawlAfter == null || recrawlAfter.isNegative()) {
            throw new ConfigException("crawl.recrawlAfter must not be negative");
        }
        if (delay == null || delay.isNegative()) throw new ConfigException("crawl.delay must not be negative");
        if (workers < 1) throw new ConfigException("crawl.workers must be at least 1");
        if (retries < 0) throw new ConfigException("crawl.retries must not be negative");
    }
}
