package org.netpreserve.mapcrawl;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.netpreserve.mapcrawl.config.ConfigException;
import org.netpreserve.mapcrawl.config.CrawlConfig;
import org.netpreserve.mapcrawl.config.JobConfig;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public class Mapcrawl {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Mapcrawl.class);

    public static void main(String[] args) throws Exception {
        Path configFile = null;
        boolean crawlOnly = false;
        boolean requeueFailed = false;
        boolean dumpConfig = false;
        Integer workers = null;
        Double delaySeconds = null;
        Integer retries = null;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--crawl-only" -> crawlOnly = true;
                    case "--requeue-failed" -> requeueFailed = true;
                    case "--dump-config" -> dumpConfig = true;
                    case "--workers", "-w" -> workers = Integer.parseInt(args[++i]);
                    case "--delay" -> delaySeconds = Double.parseDouble(args[++i]);
                    case "--retries" -> retries = Integer.parseInt(args[++i]);
                    case "--log-file" -> startLogFile(args[++i]);
                    case "--help", "-h" -> {
                        System.out.println("Usage: mapcrawl [options] CONFIG.yaml");
                        System.out.println("Options:");
                        System.out.println("      --crawl-only         Skip sitemap discovery, only fetch queued URLs");
                        System.out.println("      --delay SECONDS      Delay between requests per worker");
                        System.out.println("      --dump-config        Print the effective configuration and exit");
                        System.out.println("  -h, --help");
                        System.out.println("      --log-file FILE      Also write the log to FILE");
                        System.out.println("      --requeue-failed     Move failed URLs back to the queue first");
                        System.out.println("      --retries N          Retries after a network error");
                        System.out.println("  -w, --workers N          Number of concurrent fetch workers");
                        System.exit(0);
                    }
                    default -> {
                        if (args[i].startsWith("-")) {
                            System.err.println("Unknown option: " + args[i]);
                            System.exit(1);
                        }
                        configFile = Path.of(args[i]);
                    }
                }
            }
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            System.exit(1);
        }

        JobConfig config;
        try {
            config = JobConfig.load(configFile);
            CrawlConfig crawl = config.crawl().withEnvironment(System.getenv());
            if (workers != null) crawl = crawl.withWorkers(workers);
            if (delaySeconds != null) crawl = crawl.withDelay(CrawlConfig.seconds(Math.max(0.0, delaySeconds)));
            if (retries != null) crawl = crawl.withRetries(retries);
            config = config.withCrawl(crawl);
            config.validate();
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(1);
            return;
        }

        if (dumpConfig) {
            System.out.println(JobConfig.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        log.info("Crawling {} sources into {}", config.sources().size(), config.store().url());
        Report report;
        try (Job job = new Job(config)) {
            report = job.run(crawlOnly, requeueFailed);
        }
        for (String line : report.lines()) {
            System.out.println(line);
        }
    }

    private static void startLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{0} %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("log-file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }
}
