package org.netpreserve.mapcrawl.config;

import java.util.regex.Pattern;

/**
 * Where crawl state is persisted.
 *
 * @param url            JDBC URL of the SQLite database (e.g. {@code jdbc:sqlite:data/crawl.sqlite3})
 * @param queueTable     name of the table holding queue entries
 * @param documentsTable name of the table holding fetched documents
 */
public record StoreConfig(
        String url,
        String queueTable,
        String documentsTable
) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    void validate() throws ConfigException {
        if (url == null || url.isBlank()) throw new ConfigException("store.url is required");
        checkIdentifier("store.queueTable", queueTable);
        checkIdentifier("store.documentsTable", documentsTable);
        if (queueTable.equals(documentsTable)) {
            throw new ConfigException("store.queueTable and store.documentsTable must differ");
        }
    }

    private static void checkIdentifier(String key, String value) throws ConfigException {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new ConfigException(key + " must be a plain SQL identifier but was: " + value);
        }
    }
}
