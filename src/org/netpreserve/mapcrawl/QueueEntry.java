package org.netpreserve.mapcrawl;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.mapcrawl.util.Url;

import java.time.Instant;

/**
 * A URL waiting to be fetched, or the history of one that has been.
 *
 * @param url           The normalized URL. Unique across the queue.
 * @param source        The name of the source whose sitemap listed this URL.
 * @param status        The current state of the entry.
 * @param attempts      The number of completed fetch attempts (304 responses are not counted).
 * @param addedAt       When discovery first inserted the entry.
 * @param updatedAt     When the entry last changed.
 * @param lastCrawledAt When the entry last reached {@link Status#DONE}, or null if it never has.
 * @param lastError     The error text of the last failed attempt, empty when none.
 */
public record QueueEntry(
        long id,
        @NotNull Url url,
        @NotNull String source,
        @NotNull Status status,
        int attempts,
        Instant addedAt,
        Instant updatedAt,
        @Nullable Instant lastCrawledAt,
        @NotNull String lastError
) {
    public enum Status {
        QUEUED, IN_PROGRESS, DONE, FAILED
    }
}
