package org.netpreserve.mapcrawl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a run.
 *
 * @param downloaded         successful fetches (200 or 304)
 * @param updated            fetches that stored new or changed content
 * @param notModified        fetches answered with 304 or with content identical to what was stored
 * @param failed             fetches that ended in an error or a status other than 200/304
 * @param queuedRemaining    entries still queued when the run ended
 * @param downloadedBySource successful fetches per configured source
 * @param documentsInDb      documents stored in total
 */
public record Report(long downloaded, long updated, long notModified, long failed, long queuedRemaining,
                     Map<String, Long> downloadedBySource, long documentsInDb) {
    public Report {
        downloadedBySource = Collections.unmodifiableMap(new LinkedHashMap<>(downloadedBySource));
    }

    /**
     * One {@code key: value} line per metric.
     */
    public List<String> lines() {
        var lines = new ArrayList<String>();
        lines.add("downloaded: " + downloaded);
        lines.add("updated: " + updated);
        lines.add("not_modified: " + notModified);
        lines.add("failed: " + failed);
        lines.add("queued_remaining: " + queuedRemaining);
        downloadedBySource.forEach((source, count) -> lines.add("downloaded_source_" + source + ": " + count));
        lines.add("documents_in_db: " + documentsInDb);
        return lines;
    }

    @Override
    public String toString() {
        return String.join("\n", lines());
    }
}
