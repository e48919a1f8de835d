package org.netpreserve.mapcrawl;

/**
 * The document budget for this run has been used up.
 */
public class CrawlLimitException extends Exception {
    public CrawlLimitException(String message) {
        super(message);
    }
}
