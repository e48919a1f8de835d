package org.netpreserve.mapcrawl;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.mapcrawl.util.Url;

import java.time.Instant;

/**
 * The stored result of the last successful fetch of a URL.
 * <p>
 * A record that was only ever answered with 304 Not Modified has no payload and no content hash.
 */
public record DocumentRecord(
        @NotNull Url url,
        @NotNull String source,
        byte @Nullable [] rawPayload,
        @NotNull Instant crawledAt,
        @NotNull String etag,
        @NotNull String lastModified,
        @Nullable String contentHash
) {
    public boolean hasPayload() {
        return rawPayload != null && rawPayload.length > 0;
    }
}
