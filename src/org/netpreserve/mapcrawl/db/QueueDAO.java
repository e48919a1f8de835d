package org.netpreserve.mapcrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.mapcrawl.QueueEntry;
import org.netpreserve.mapcrawl.util.MustUpdate;
import org.netpreserve.mapcrawl.util.Url;

import java.time.Instant;

/**
 * Queue table access. The table name is the {@code queue} attribute defined on the {@link org.jdbi.v3.core.Jdbi}.
 */
@RegisterConstructorMapper(QueueEntry.class)
public interface QueueDAO {
    @SqlUpdate("""
            INSERT INTO <queue> (url, source, status, attempts, added_at, updated_at, last_error)
            VALUES (:url, :source, 'QUEUED', 0, :now, :now, '')
            ON CONFLICT(url) DO NOTHING""")
    boolean insertIfAbsent(Url url, String source, Instant now);

    @SqlUpdate("UPDATE <queue> SET updated_at = :now WHERE url = :url")
    void touch(Url url, Instant now);

    /**
     * Flips the oldest queued entry (of the given source, if not null) to IN_PROGRESS and returns it, all in
     * one statement, so two callers can never receive the same entry.
     */
    @SqlQuery("""
            UPDATE <queue> SET status = 'IN_PROGRESS', updated_at = :now
            WHERE id = (
                SELECT id FROM <queue>
                WHERE status = 'QUEUED'
                AND (:source IS NULL OR source = :source)
                ORDER BY id
                LIMIT 1)
            RETURNING *""")
    @Nullable
    QueueEntry claim(@Nullable String source, Instant now);

    @SqlUpdate("""
            UPDATE <queue> SET status = 'DONE', last_crawled_at = :now, updated_at = :now
            WHERE id = :id AND status = 'IN_PROGRESS'""")
    @MustUpdate(1)
    void markNotModified(long id, Instant now);

    @SqlUpdate("""
            UPDATE <queue> SET status = 'DONE', last_crawled_at = :now, updated_at = :now, last_error = '',
                attempts = attempts + 1
            WHERE id = :id AND status = 'IN_PROGRESS'""")
    @MustUpdate(1)
    void markFetched(long id, Instant now);

    @SqlUpdate("""
            UPDATE <queue> SET status = 'FAILED', last_error = :error, updated_at = :now, attempts = attempts + 1
            WHERE id = :id AND status = 'IN_PROGRESS'""")
    @MustUpdate(1)
    void markFailed(long id, String error, Instant now);

    @SqlUpdate("UPDATE <queue> SET status = 'QUEUED', updated_at = :now WHERE id = :id AND status = 'IN_PROGRESS'")
    @MustUpdate(1)
    void unclaim(long id, Instant now);

    @SqlUpdate("UPDATE <queue> SET status = 'QUEUED', updated_at = :now WHERE status = 'IN_PROGRESS'")
    int resetInProgress(Instant now);

    @SqlUpdate("""
            UPDATE <queue> SET status = 'QUEUED', updated_at = :now
            WHERE status = 'DONE' AND last_crawled_at < :cutoff""")
    int requeueExpired(Instant cutoff, Instant now);

    @SqlUpdate("UPDATE <queue> SET status = 'QUEUED', updated_at = :now WHERE status = 'FAILED'")
    int requeueFailed(Instant now);

    @SqlQuery("SELECT COUNT(*) FROM <queue> WHERE status = ?")
    long countByStatus(QueueEntry.Status status);

    @SqlQuery("SELECT COUNT(*) FROM <queue>")
    long count();

    @SqlQuery("SELECT * FROM <queue> WHERE url = ?")
    QueueEntry findByUrl(Url url);
}
