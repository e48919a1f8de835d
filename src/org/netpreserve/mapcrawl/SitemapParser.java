package org.netpreserve.mapcrawl;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.List;

/**
 * Extracts the {@code <loc>} values of a sitemap or sitemap index using crawler-commons.
 */
public class SitemapParser {
    private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);

    /**
     * @return the child sitemap URLs of an index, or the page URLs of a sitemap; empty if the content can't be
     * parsed
     */
    public List<String> locations(byte[] content, String sitemapUrl) {
        if (content == null || content.length == 0) return List.of();
        try {
            var parser = new crawlercommons.sitemaps.SiteMapParser(false);
            AbstractSiteMap result = parser.parseSiteMap(content, URI.create(sitemapUrl).toURL());
            if (result instanceof SiteMapIndex index) {
                return index.getSitemaps().stream()
                        .map(AbstractSiteMap::getUrl)
                        .map(URL::toString)
                        .toList();
            } else if (result instanceof SiteMap siteMap) {
                return siteMap.getSiteMapUrls().stream()
                        .map(SiteMapURL::getUrl)
                        .map(URL::toString)
                        .toList();
            }
        } catch (UnknownFormatException | IOException | IllegalArgumentException e) {
            log.warn("Unparseable sitemap {}: {}", sitemapUrl, e.getMessage());
        }
        return List.of();
    }
}
