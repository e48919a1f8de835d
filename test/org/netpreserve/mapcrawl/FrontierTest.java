package org.netpreserve.mapcrawl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.mapcrawl.util.MustUpdate;
import org.netpreserve.mapcrawl.util.Url;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.mapcrawl.QueueEntry.Status.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class FrontierTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private final Database database;
    private final Frontier frontier;

    FrontierTest(Database database) {
        this.database = database;
        this.frontier = frontierAt(NOW);
    }

    @BeforeEach
    void clear() {
        InMemoryDatabaseTestExtension.clear(database);
    }

    private Frontier frontierAt(Instant instant) {
        return new Frontier(database.queue(), Clock.fixed(instant, ZoneOffset.UTC));
    }

    private QueueEntry entry(String url) {
        return database.queue().findByUrl(new Url(url));
    }

    @Test
    void testEnqueueIsInsertOnly() {
        assertTrue(frontier.enqueue(new Url("https://a.example/one"), "a"));
        var claimed = frontier.claim(null);
        assertNotNull(claimed);
        assertEquals(IN_PROGRESS, claimed.status());

        // rediscovery neither duplicates nor resets the entry
        assertFalse(frontierAt(NOW.plusSeconds(60)).enqueue(new Url("https://a.example/one"), "b"));
        var entry = entry("https://a.example/one");
        assertEquals(IN_PROGRESS, entry.status());
        assertEquals("a", entry.source());
        assertEquals(NOW, entry.addedAt());
        assertEquals(NOW.plusSeconds(60), entry.updatedAt());
        assertEquals(1, database.queue().count());
    }

    @Test
    void testClaimOrderAndFallback() {
        frontier.enqueue(new Url("https://a.example/1"), "a");
        frontier.enqueue(new Url("https://b.example/1"), "b");
        frontier.enqueue(new Url("https://a.example/2"), "a");

        assertEquals("https://b.example/1", frontier.claim("b").url().toString());
        // b has nothing left so any source will do
        assertEquals("https://a.example/1", frontier.claim("b").url().toString());
        assertEquals("https://a.example/2", frontier.claim(null).url().toString());
        assertNull(frontier.claim("a"));
        assertNull(frontier.claim(null));
    }

    @Test
    void testSingleEntryClaimedOnce() throws Exception {
        frontier.enqueue(new Url("https://a.example/only"), "a");
        var executor = Executors.newFixedThreadPool(2);
        var start = new CountDownLatch(1);
        try {
            Callable<QueueEntry> claim = () -> {
                start.await();
                return frontier.claim(null);
            };
            var first = executor.submit(claim);
            var second = executor.submit(claim);
            start.countDown();

            var results = new ArrayList<QueueEntry>();
            for (var future : List.of(first, second)) {
                var entry = future.get(30, TimeUnit.SECONDS);
                if (entry != null) results.add(entry);
            }
            assertEquals(1, results.size());
            assertEquals("https://a.example/only", results.get(0).url().toString());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testConcurrentClaimsAreExclusive() throws Exception {
        int entries = 60;
        for (int i = 0; i < entries; i++) {
            frontier.enqueue(new Url("https://a.example/" + i), i % 2 == 0 ? "a" : "b");
        }

        int threads = 6;
        var executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<List<Long>>>();
            for (int t = 0; t < threads; t++) {
                String preferred = t % 2 == 0 ? "a" : null;
                futures.add(executor.submit(() -> {
                    start.await();
                    var ids = new ArrayList<Long>();
                    QueueEntry entry;
                    while ((entry = frontier.claim(preferred)) != null) {
                        ids.add(entry.id());
                    }
                    return ids;
                }));
            }
            start.countDown();

            Set<Long> seen = new HashSet<>();
            int total = 0;
            for (var future : futures) {
                for (long id : future.get(30, TimeUnit.SECONDS)) {
                    assertTrue(seen.add(id), "entry " + id + " claimed twice");
                    total++;
                }
            }
            assertEquals(entries, total);
            assertEquals(entries, database.queue().countByStatus(IN_PROGRESS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testRecoverInProgress() {
        frontier.enqueue(new Url("https://a.example/1"), "a");
        frontier.enqueue(new Url("https://a.example/2"), "a");
        frontier.claim(null);
        frontier.claim(null);

        assertEquals(2, frontier.recoverInProgress());
        assertEquals(2, frontier.queuedRemaining());
        assertEquals(0, database.queue().countByStatus(IN_PROGRESS));
        assertEquals(0, frontier.recoverInProgress());
    }

    @Test
    void testRequeueExpired() {
        var old = frontierAt(NOW.minus(Duration.ofHours(25)));
        old.enqueue(new Url("https://a.example/old"), "a");
        old.markFetched(old.claim(null));

        var recent = frontierAt(NOW.minus(Duration.ofHours(1)));
        recent.enqueue(new Url("https://a.example/recent"), "a");
        recent.markNotModified(recent.claim(null));

        assertEquals(1, frontier.requeueExpired(Duration.ofHours(24)));
        assertEquals(QUEUED, entry("https://a.example/old").status());
        assertEquals(DONE, entry("https://a.example/recent").status());
        assertEquals(NOW.minus(Duration.ofHours(25)), entry("https://a.example/old").lastCrawledAt());
    }

    @Test
    void testFailedEntriesOnlyRequeuedOnRequest() {
        var old = frontierAt(NOW.minus(Duration.ofDays(3)));
        old.enqueue(new Url("https://a.example/broken"), "a");
        old.markFailed(old.claim(null), "HTTP 500");

        var failed = entry("https://a.example/broken");
        assertEquals(FAILED, failed.status());
        assertEquals(1, failed.attempts());
        assertEquals("HTTP 500", failed.lastError());
        assertNull(failed.lastCrawledAt());

        assertEquals(0, frontier.recoverInProgress());
        assertEquals(0, frontier.requeueExpired(Duration.ofHours(24)));
        assertEquals(FAILED, entry("https://a.example/broken").status());

        assertEquals(1, frontier.requeueFailed());
        var requeued = entry("https://a.example/broken");
        assertEquals(QUEUED, requeued.status());
        assertEquals(1, requeued.attempts());
    }

    @Test
    void testAttemptsAndErrors() {
        frontier.enqueue(new Url("https://a.example/1"), "a");
        frontier.markFailed(frontier.claim(null), "timeout");
        frontier.requeueFailed();
        frontier.markFetched(frontier.claim(null));

        var entry = entry("https://a.example/1");
        assertEquals(DONE, entry.status());
        assertEquals(2, entry.attempts());
        assertEquals("", entry.lastError());
        assertEquals(NOW, entry.lastCrawledAt());

        // a 304 completes the entry without counting as an attempt
        var later = frontierAt(NOW.plus(Duration.ofDays(2)));
        assertEquals(1, later.requeueExpired(Duration.ofHours(24)));
        later.markNotModified(later.claim(null));
        assertEquals(2, entry("https://a.example/1").attempts());
        assertEquals(NOW.plus(Duration.ofDays(2)), entry("https://a.example/1").lastCrawledAt());
    }

    @Test
    void testRequeueClaimedEntry() {
        frontier.enqueue(new Url("https://a.example/1"), "a");
        var claimed = frontier.claim(null);
        frontier.requeue(claimed);

        var entry = entry("https://a.example/1");
        assertEquals(QUEUED, entry.status());
        assertEquals(0, entry.attempts());
        assertThrows(MustUpdate.Exception.class, () -> frontier.requeue(claimed));
        assertEquals(claimed.id(), frontier.claim(null).id());
    }

    @Test
    void testCompletingAnUnclaimedEntryFails() {
        frontier.enqueue(new Url("https://a.example/1"), "a");
        var claimed = frontier.claim(null);
        frontier.markFetched(claimed);
        assertThrows(MustUpdate.Exception.class, () -> frontier.markFailed(claimed, "late"));
        assertEquals(DONE, entry("https://a.example/1").status());
    }
}
