package io.github.yok.flexrecords.db;

import java.util.List;

/**
 * Database-specific parts of the statements issued by the engine.
 *
 * <p>
 * Everything else (SELECT, INSERT, UPDATE, DELETE with equality predicates) is plain SQL built by
 * {@code StatementBuilder} on top of {@link #quoteIdentifier(String)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SqlDialect {

    /**
     * Quotes a table or column name.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Builds an idempotent "insert or overwrite" statement keyed by {@code keyColumns}.
     *
     * <p>
     * Placeholders appear in the order of {@code columns}; {@code columns} already contains every
     * key column.
     * </p>
     *
     * @param table table name (unquoted)
     * @param columns all written columns (unquoted), key columns included
     * @param keyColumns identifier column(s) (unquoted)
     * @return statement text
     */
    String buildReplaceSql(String table, List<String> columns, List<String> keyColumns);

    /**
     * Builds an INSERT statement that writes a row without explicit column values.
     *
     * @param table table name (unquoted)
     * @return statement text
     */
    default String buildEmptyInsertSql(String table) {
        return "INSERT INTO " + quoteIdentifier(table) + " DEFAULT VALUES";
    }
}
