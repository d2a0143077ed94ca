package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.db.QueryResult;
import io.github.yok.flexrecords.db.QueryRunner;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Runs the equality lookup behind database references and existing-record checks.
 *
 * <p>
 * The identifier is taken from the first returned row. With a single identifier column the result
 * is that column's value; with several columns it is a column → value map in the configured column
 * order. Further rows are ignored (first row wins) and reported at WARN level.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
class ReferenceLookup {

    private final QueryRunner queryRunner;
    private final StatementBuilder statements;

    /**
     * Creates a lookup.
     *
     * @param queryRunner query runner
     * @param statements statement builder
     */
    ReferenceLookup(QueryRunner queryRunner, StatementBuilder statements) {
        this.queryRunner = queryRunner;
        this.statements = statements;
    }

    /**
     * Looks up the identifier of the row matching all values.
     *
     * @param table table name
     * @param matchColumns predicate columns
     * @param idColumns identifier column(s)
     * @param values bind values, one per match column
     * @return identifier, or empty if no row matches
     * @throws SQLException if the query fails
     */
    Optional<Object> find(String table, List<String> matchColumns, List<String> idColumns,
            List<Object> values) throws SQLException {
        Validate.isTrue(values.size() == matchColumns.size(),
                "Lookup on '%s' expects %d value(s) for %s but got %d.", table,
                matchColumns.size(), matchColumns, values.size());

        String sql = statements.select(table, idColumns, matchColumns);
        QueryResult result = queryRunner.query(sql, values);
        if (result == null || !result.hasRows()) {
            log.debug("Table[{}] No row matches {} = {}", table, matchColumns, values);
            return Optional.empty();
        }
        List<Map<String, Object>> rows = result.getRows();
        if (rows.size() > 1) {
            log.warn("Table[{}] {} rows match {} = {}; using the first row.", table, rows.size(),
                    matchColumns, values);
        }
        return Optional.ofNullable(extractId(rows.get(0), idColumns));
    }

    /**
     * Extracts the identifier from a result row.
     *
     * @param row result row
     * @param idColumns identifier column(s)
     * @return scalar for a single column, column → value map for several columns
     */
    static Object extractId(Map<String, Object> row, List<String> idColumns) {
        if (idColumns.size() == 1) {
            String column = idColumns.get(0);
            if (!containsColumn(row, column) && row.size() == 1) {
                // Driver renamed the single selected column (e.g. upper-cased)
                return row.values().iterator().next();
            }
            return columnValue(row, column);
        }
        Map<String, Object> composite = new LinkedHashMap<>();
        for (String column : idColumns) {
            composite.put(column, columnValue(row, column));
        }
        return composite;
    }

    /**
     * Reads a column from a row, falling back to a case-insensitive match.
     *
     * @param row result row
     * @param column column name
     * @return value, or {@code null} if absent
     */
    static Object columnValue(Map<String, Object> row, String column) {
        if (row.containsKey(column)) {
            return row.get(column);
        }
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (column.equalsIgnoreCase(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    private static boolean containsColumn(Map<String, Object> row, String column) {
        if (row.containsKey(column)) {
            return true;
        }
        return row.keySet().stream().anyMatch(column::equalsIgnoreCase);
    }
}
