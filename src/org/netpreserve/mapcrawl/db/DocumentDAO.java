package org.netpreserve.mapcrawl.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.mapcrawl.DocumentRecord;
import org.netpreserve.mapcrawl.util.Url;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(DocumentRecord.class)
public interface DocumentDAO {
    String COLUMNS = "url, source, raw_payload, crawled_at, etag, last_modified, content_hash";

    @SqlQuery("SELECT etag, last_modified, content_hash FROM <documents> WHERE url = ?")
    @RegisterConstructorMapper(Validators.class)
    @Nullable
    Validators findValidators(Url url);

    @SqlQuery("SELECT " + COLUMNS + " FROM <documents> WHERE url = ?")
    @Nullable
    DocumentRecord findByUrl(Url url);

    /**
     * Pages through the documents that have a payload, for text extraction.
     */
    @SqlQuery("SELECT " + COLUMNS + " FROM <documents> WHERE length(raw_payload) > 0 ORDER BY id LIMIT :limit OFFSET :offset")
    List<DocumentRecord> findWithPayload(int limit, long offset);

    @SqlUpdate("INSERT INTO <documents> (" + COLUMNS + """
            ) VALUES (:url, :source, :rawPayload, :crawledAt, :etag, :lastModified, :contentHash)
            ON CONFLICT(url) DO UPDATE SET source = excluded.source, raw_payload = excluded.raw_payload,
                crawled_at = excluded.crawled_at, etag = excluded.etag, last_modified = excluded.last_modified,
                content_hash = excluded.content_hash""")
    void save(@BindMethods DocumentRecord document);

    /**
     * Records a successful fetch that didn't change the content. Creates a payload-less record if the URL
     * had none.
     */
    @SqlUpdate("""
            INSERT INTO <documents> (url, source, crawled_at) VALUES (:url, :source, :crawledAt)
            ON CONFLICT(url) DO UPDATE SET source = excluded.source, crawled_at = excluded.crawled_at""")
    void touch(Url url, String source, Instant crawledAt);

    @SqlQuery("SELECT COUNT(*) FROM <documents>")
    long count();

    /**
     * The cache validators and content hash of a stored document.
     */
    record Validators(String etag, String lastModified, @Nullable String contentHash) {
    }
}
