package org.netpreserve.mapcrawl.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlTest {
    @Test
    void testNormalize() {
        assertEquals("https://example.com/2024/05/story",
                Url.normalize("  HTTPS://Example.COM/2024/05/story/  ").toString());
        assertEquals("https://example.com/story", Url.normalize("https://example.com/story?utm_source=x#top").toString());
        assertEquals("https://example.com/", Url.normalize("https://example.com").toString());
        assertEquals("https://example.com/", Url.normalize("https://example.com/").toString());
        assertEquals("https://example.com/", Url.normalize("https://example.com?page=2").toString());
        assertEquals("http://example.com:8080/A/B", Url.normalize("http://EXAMPLE.com:8080/A/B/").toString());
        assertEquals("https://example.com/a", Url.normalize("//example.com/a").toString());
    }

    @Test
    void testNormalizeStripsOnlyOneSlash() {
        assertEquals("https://example.com/a/", Url.normalize("https://example.com/a//").toString());
    }

    @Test
    void testNormalizedUrlsAreEqual() {
        assertEquals(Url.normalize("https://Example.com/a/"), Url.normalize("https://example.com/a#x"));
    }

    @Test
    void testStartsWithAny() {
        var url = new Url("https://example.com/news/story");
        assertTrue(url.startsWithAny(List.of("https://other.com/", "https://example.com/news/")));
        assertFalse(url.startsWithAny(List.of("https://example.com/sport/")));
        assertFalse(url.startsWithAny(List.of()));
    }
}
