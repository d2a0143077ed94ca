package io.github.yok.flexrecords.config;

/**
 * Enumerates supported database dialects.
 *
 * <ul>
 * <li>MYSQL: for MySQL / MariaDB</li>
 * <li>POSTGRESQL: for PostgreSQL</li>
 * <li>H2: for H2</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DialectMode {
    // Backtick quoting, REPLACE INTO
    MYSQL,
    // Double-quote quoting, INSERT ... ON CONFLICT DO UPDATE
    POSTGRESQL,
    // Double-quote quoting, MERGE INTO ... KEY
    H2
}
