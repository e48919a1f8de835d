package org.netpreserve.mapcrawl;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A local web server serving canned pages. Answers 304 when a request's If-None-Match matches the page's ETag.
 */
class TestServer implements AutoCloseable {
    private final HttpServer httpServer;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
    private final Map<String, Headers> lastRequestHeaders = new ConcurrentHashMap<>();
    private final Set<String> blockedPaths = ConcurrentHashMap.newKeySet();
    private final CountDownLatch blockedRequestArrived = new CountDownLatch(1);
    private final CountDownLatch unblock = new CountDownLatch(1);

    record Page(int status, byte[] body, String etag, String lastModified) {
    }

    TestServer() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", this::handle);
        httpServer.setExecutor(executor);
        httpServer.start();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        hits.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
        lastRequestHeaders.put(path, exchange.getRequestHeaders());
        try {
            if (blockedPaths.contains(path)) {
                blockedRequestArrived.countDown();
                try {
                    unblock.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            Page page = pages.get(path);
            if (page == null) {
                exchange.sendResponseHeaders(404, -1);
                return;
            }
            if (page.etag() != null) exchange.getResponseHeaders().add("ETag", page.etag());
            if (page.lastModified() != null) exchange.getResponseHeaders().add("Last-Modified", page.lastModified());
            if (page.status() == 200 && page.etag() != null
                && page.etag().equals(exchange.getRequestHeaders().getFirst("If-None-Match"))) {
                exchange.sendResponseHeaders(304, -1);
                return;
            }
            if (page.body().length == 0) {
                exchange.sendResponseHeaders(page.status(), -1);
                return;
            }
            exchange.sendResponseHeaders(page.status(), page.body().length);
            exchange.getResponseBody().write(page.body());
        } finally {
            exchange.close();
        }
    }

    String url(String path) {
        return "http://127.0.0.1:" + httpServer.getAddress().getPort() + path;
    }

    void page(String path, String body) {
        pages.put(path, new Page(200, body.getBytes(UTF_8), null, null));
    }

    void page(String path, Page page) {
        pages.put(path, page);
    }

    void status(String path, int status) {
        pages.put(path, new Page(status, new byte[0], null, null));
    }

    /**
     * Holds requests for the path until the server is closed.
     */
    void block(String path) {
        blockedPaths.add(path);
    }

    boolean awaitBlockedRequest() throws InterruptedException {
        return blockedRequestArrived.await(10, TimeUnit.SECONDS);
    }

    int hits(String path) {
        var count = hits.get(path);
        return count == null ? 0 : count.get();
    }

    Headers lastRequestHeaders(String path) {
        return lastRequestHeaders.get(path);
    }

    static String sitemapIndex(String... sitemaps) {
        var xml = new StringBuilder("""
                <?xml version="1.0" encoding="UTF-8"?>
                <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                """);
        for (String sitemap : sitemaps) {
            xml.append("  <sitemap><loc>").append(sitemap).append("</loc></sitemap>\n");
        }
        return xml.append("</sitemapindex>\n").toString();
    }

    static String urlset(String... urls) {
        var xml = new StringBuilder("""
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                """);
        for (String url : urls) {
            xml.append("  <url><loc>").append(url).append("</loc></url>\n");
        }
        return xml.append("</urlset>\n").toString();
    }

    @Override
    public void close() {
        unblock.countDown();
        httpServer.stop(0);
        executor.shutdownNow();
    }
}
