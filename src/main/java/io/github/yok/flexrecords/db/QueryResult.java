package io.github.yok.flexrecords.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link QueryRunner#query(String, List)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class QueryResult {

    private static final QueryResult EMPTY = new QueryResult(List.of(), 0, null);

    // Result rows of a SELECT, in order; empty for writes
    private final List<Map<String, Object>> rows;

    // Number of rows affected by a write
    private final int affectedRows;

    // Identifier assigned by the store to an inserted row (a column → value map when the store
    // returned several generated columns), or null
    private final Object insertId;

    private QueryResult(List<Map<String, Object>> rows, int affectedRows, Object insertId) {
        this.rows = rows;
        this.affectedRows = affectedRows;
        this.insertId = insertId;
    }

    /**
     * Creates a result for a query returning rows.
     *
     * @param rows result rows; {@code null} is treated as no rows
     * @return result
     */
    public static QueryResult ofRows(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY;
        }
        return new QueryResult(Collections.unmodifiableList(new ArrayList<>(rows)), 0, null);
    }

    /**
     * Creates a result for a write statement.
     *
     * @param affectedRows number of affected rows
     * @param insertId generated identifier, column → value map of generated columns, or
     *        {@code null}
     * @return result
     */
    public static QueryResult ofWrite(int affectedRows, Object insertId) {
        return new QueryResult(List.of(), affectedRows, insertId);
    }

    /**
     * Returns an empty result.
     *
     * @return result without rows and without a generated identifier
     */
    public static QueryResult empty() {
        return EMPTY;
    }

    /**
     * Returns whether the result has at least one row.
     *
     * @return {@code true} if not empty
     */
    public boolean hasRows() {
        return !rows.isEmpty();
    }
}
