package org.netpreserve.mapcrawl;

import org.netpreserve.mapcrawl.config.CrawlConfig;
import org.netpreserve.mapcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Map;

/**
 * GETs URLs with the crawl's User-Agent and timeout, retrying transport errors with capped exponential backoff.
 * Status codes are returned as-is and never retried.
 */
public class Fetcher {
    private static final Logger log = LoggerFactory.getLogger(Fetcher.class);
    static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(3);
    private final HttpClient httpClient;
    private final String userAgent;
    private final Duration timeout;
    private final int retries;
    private final Duration maxBackoff;

    public Fetcher(HttpClient httpClient, CrawlConfig config) {
        this(httpClient, config, DEFAULT_MAX_BACKOFF);
    }

    public Fetcher(HttpClient httpClient, CrawlConfig config, Duration maxBackoff) {
        this.httpClient = httpClient;
        this.userAgent = config.userAgent();
        this.timeout = config.timeout();
        this.retries = config.retries();
        this.maxBackoff = maxBackoff;
    }

    public static HttpClient newHttpClient(CrawlConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public Response get(Url url) throws IOException, InterruptedException {
        return get(url, Map.of());
    }

    /**
     * @param extraHeaders additional request headers, e.g. conditional GET validators
     * @throws IOException if the URL is unusable or the last retry failed with a transport error
     */
    public Response get(Url url, Map<String, String> extraHeaders) throws IOException, InterruptedException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "*/*");
            extraHeaders.forEach(builder::header);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unable to request " + url + ": " + e.getMessage(), e);
        }
        HttpRequest request = builder.GET().build();

        for (int attempt = 0; ; attempt++) {
            try {
                var response = httpClient.send(request, BodyHandlers.ofByteArray());
                return new Response(response.statusCode(), response.body(), response.headers());
            } catch (IOException e) {
                if (attempt >= retries) throw e;
                Duration backoff = backoff(attempt);
                log.debug("Retrying {} in {}ms after {}", url, backoff.toMillis(), e.toString());
                Thread.sleep(backoff.toMillis());
            }
        }
    }

    Duration backoff(int attempt) {
        Duration exponential = Duration.ofSeconds(1L << Math.min(attempt, 16));
        return exponential.compareTo(maxBackoff) > 0 ? maxBackoff : exponential;
    }

    public record Response(int status, byte[] body, HttpHeaders headers) {
        public String header(String name) {
            return headers.firstValue(name).orElse("");
        }
    }
}
