package org.netpreserve.mapcrawl.config;

import java.util.List;

/**
 * A content source reached through a sitemap index.
 *
 * @param name                 identifies the source in the queue, the documents and the report
 * @param sitemapIndex         URL of the root sitemap index
 * @param sitemapAllowPatterns case-insensitive substrings a child sitemap URL must contain (empty allows all)
 * @param allowedPrefixes      prefixes an article URL must start with after normalization
 */
public record SourceConfig(
        String name,
        String sitemapIndex,
        List<String> sitemapAllowPatterns,
        List<String> allowedPrefixes
) {
    public SourceConfig {
        sitemapAllowPatterns = sitemapAllowPatterns == null ? List.of() : List.copyOf(sitemapAllowPatterns);
        allowedPrefixes = allowedPrefixes == null ? List.of() : List.copyOf(allowedPrefixes);
    }
}
