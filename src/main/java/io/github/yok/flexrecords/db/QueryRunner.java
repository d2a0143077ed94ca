package io.github.yok.flexrecords.db;

import java.sql.SQLException;
import java.util.List;

/**
 * Executes a parameterized statement against the store.
 *
 * <p>
 * This is the only storage capability the insertion engine depends on. Any backend that honors the
 * following contract can be plugged in:
 * </p>
 *
 * <ul>
 * <li>{@code sql} uses positional {@code ?} placeholders.</li>
 * <li>{@code parameters} holds one scalar bind value per placeholder, in left-to-right order.</li>
 * <li>A {@code SELECT} returns its rows in order, each row a column → value map.</li>
 * <li>An {@code INSERT} additionally reports the identifier assigned to the written row, if the
 * store produced one. When the store generated several columns, the report is a column → value
 * map of them; the engine picks the identifier column(s) of the table from it.</li>
 * </ul>
 *
 * <p>
 * Implementations may pool connections or retry; timeouts, if wanted, belong here as well.
 * Implementations used with concurrent reference lookups must be thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface QueryRunner {

    /**
     * Runs the statement.
     *
     * @param sql statement text with positional placeholders
     * @param parameters bind values, one per placeholder
     * @return rows and/or write outcome
     * @throws SQLException on any store-level failure (connectivity, malformed statement, constraint
     *         violation); "no rows" is not an error
     */
    QueryResult query(String sql, List<?> parameters) throws SQLException;
}
