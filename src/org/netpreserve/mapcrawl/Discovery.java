package org.netpreserve.mapcrawl;

import org.netpreserve.mapcrawl.config.SourceConfig;
import org.netpreserve.mapcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Seeds the queue from each source's two-level sitemap: root index, then child sitemaps, then article URLs.
 * <p>
 * Discovery deliberately over-supplies the queue: each source may queue up to
 * {@code ceil(maxDocuments / sources) + maxDocuments / 2} URLs, and at most {@code maxDocuments / 200 + 200}
 * child sitemaps are read per source.
 */
public class Discovery {
    private static final Logger log = LoggerFactory.getLogger(Discovery.class);
    private final Frontier frontier;
    private final Fetcher fetcher;
    private final SitemapParser parser;
    private final List<SourceConfig> sources;
    private final long maxDocuments;

    public Discovery(Frontier frontier, Fetcher fetcher, SitemapParser parser, List<SourceConfig> sources,
                     long maxDocuments) {
        this.frontier = frontier;
        this.fetcher = fetcher;
        this.parser = parser;
        this.sources = sources;
        this.maxDocuments = maxDocuments;
    }

    /**
     * @param discovered article URLs that passed the prefix filter
     * @param added      of those, URLs that weren't already in the queue
     */
    public record Result(long discovered, long added) {
        Result plus(Result other) {
            return new Result(discovered + other.discovered, added + other.added);
        }
    }

    public long targetPerSource() {
        if (sources.isEmpty()) return 0;
        long count = sources.size();
        return (maxDocuments + count - 1) / count + maxDocuments / 2;
    }

    public long childSitemapLimit() {
        return maxDocuments / 200 + 200;
    }

    public Result seed() throws InterruptedException {
        var total = new Result(0, 0);
        for (SourceConfig source : sources) {
            Result result = seed(source);
            log.info("Discovered {} article URLs for {}, {} new", result.discovered(), source.name(), result.added());
            total = total.plus(result);
        }
        log.info("Discovered {} article URLs in total, {} new", total.discovered(), total.added());
        return total;
    }

    Result seed(SourceConfig source) throws InterruptedException {
        List<String> children = fetchLocations(source.sitemapIndex());
        var childSitemaps = new ArrayList<String>();
        for (String child : children) {
            if (allowedChild(child, source.sitemapAllowPatterns())) {
                childSitemaps.add(child);
            }
        }
        log.info("{}: {} child sitemap candidates", source.name(), childSitemaps.size());

        long target = targetPerSource();
        long limit = Math.min(childSitemaps.size(), childSitemapLimit());
        long discovered = 0;
        long added = 0;
        for (int i = 0; i < limit && discovered < target; i++) {
            for (String location : fetchLocations(childSitemaps.get(i))) {
                Url url = Url.normalize(location);
                if (!url.startsWithAny(source.allowedPrefixes())) continue;
                discovered++;
                if (frontier.enqueue(url, source.name())) added++;
                if (discovered >= target) break;
            }
        }
        return new Result(discovered, added);
    }

    static boolean allowedChild(String url, List<String> allowPatterns) {
        if (allowPatterns.isEmpty()) return true;
        String lowered = url.toLowerCase(Locale.ROOT);
        for (String pattern : allowPatterns) {
            if (lowered.contains(pattern.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private List<String> fetchLocations(String sitemapUrl) throws InterruptedException {
        Fetcher.Response response;
        try {
            response = fetcher.get(new Url(sitemapUrl.strip()));
        } catch (IOException e) {
            log.warn("Failed to fetch sitemap {}: {}", sitemapUrl, e.getMessage());
            return List.of();
        }
        if (response.status() != 200) {
            log.warn("Failed to fetch sitemap {}: HTTP {}", sitemapUrl, response.status());
            return List.of();
        }
        return parser.locations(response.body(), sitemapUrl);
    }
}
