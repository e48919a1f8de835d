package org.netpreserve.mapcrawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;

/**
 * A normalized URL as stored in the queue and document tables.
 */
public final class Url {
    private final String url;
    private URI uri;

    public Url(String url) {
        this.url = url;
    }

    /**
     * Normalizes a URL found in a sitemap: lower-cases the scheme and host, strips a single trailing slash
     * from the path and drops the query and fragment. A missing scheme defaults to https.
     */
    public static Url normalize(String raw) {
        String s = raw.strip();
        String scheme = "";
        String rest = s;
        int colon = s.indexOf(':');
        if (colon > 0 && isScheme(s, colon)) {
            scheme = s.substring(0, colon).toLowerCase(Locale.ROOT);
            rest = s.substring(colon + 1);
        }
        if (scheme.isEmpty()) scheme = "https";

        String authority = "";
        if (rest.startsWith("//")) {
            int end = indexOfAny(rest, 2, "/?#");
            authority = rest.substring(2, end).toLowerCase(Locale.ROOT);
            rest = rest.substring(end);
        }

        String path = rest.substring(0, indexOfAny(rest, 0, "?#"));
        if (path.isEmpty()) path = "/";
        if (!path.equals("/") && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return new Url(scheme + "://" + authority + path);
    }

    private static boolean isScheme(String s, int end) {
        if (!Character.isLetter(s.charAt(0))) return false;
        for (int i = 1; i < end; i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') return false;
        }
        return true;
    }

    private static int indexOfAny(String s, int from, String chars) {
        for (int i = from; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) return i;
        }
        return s.length();
    }

    public boolean startsWithAny(Collection<String> prefixes) {
        for (String prefix : prefixes) {
            if (url.startsWith(prefix)) return true;
        }
        return false;
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    @Override
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
