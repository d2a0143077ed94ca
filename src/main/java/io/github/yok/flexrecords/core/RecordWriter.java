package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.db.QueryResult;
import io.github.yok.flexrecords.db.QueryRunner;
import io.github.yok.flexrecords.util.JsonValues;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Issues the INSERT, UPDATE, REPLACE and DELETE statements of the engine.
 *
 * <p>
 * Values are bound in column order; nested containers are bound as JSON text. An identifier is a
 * scalar for a single identifier column and a column → value map for a composite one. Every store
 * failure is reported as {@link ErrorKind#WRITE_FAILED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RecordWriter {

    private final QueryRunner queryRunner;
    private final StatementBuilder statements;

    /**
     * Creates a writer.
     *
     * @param queryRunner query runner
     * @param statements statement builder
     */
    RecordWriter(QueryRunner queryRunner, StatementBuilder statements) {
        this.queryRunner = queryRunner;
        this.statements = statements;
    }

    /**
     * Inserts a row.
     *
     * @param table table name
     * @param params column → resolved value
     * @return key generated by the store (a value, or a column → value map when several columns
     *         were generated), or {@code null} if it produced none
     * @throws RecordInsertException if the statement fails
     */
    public Object databaseInsert(String table, Map<String, Object> params)
            throws RecordInsertException {
        List<String> columns = new ArrayList<>(params.keySet());
        String sql = statements.insert(table, columns);
        QueryResult result = run(table, sql, JsonValues.toBindValues(params.values()));
        return result == null ? null : result.getInsertId();
    }

    /**
     * Updates all supplied columns of the row with the given identifier.
     *
     * <p>
     * Without columns nothing is issued.
     * </p>
     *
     * @param table table name
     * @param idColumns identifier column(s)
     * @param id identifier of the row
     * @param params column → resolved value
     * @throws RecordInsertException if the statement fails
     */
    public void databaseUpdate(String table, List<String> idColumns, Object id,
            Map<String, Object> params) throws RecordInsertException {
        if (params.isEmpty()) {
            log.debug("Table[{}] Nothing to update for id={}", table, id);
            return;
        }
        List<String> columns = new ArrayList<>(params.keySet());
        List<Object> values = JsonValues.toBindValues(params.values());
        values.addAll(idValues(idColumns, id));
        run(table, statements.update(table, columns, idColumns), values);
    }

    /**
     * Overwrites the row with the given identifier with the supplied columns plus the identifier.
     *
     * <p>
     * Identifier columns present in {@code params} are bound with the matched identifier.
     * </p>
     *
     * @param table table name
     * @param idColumns identifier column(s)
     * @param id identifier of the row
     * @param params column → resolved value
     * @throws RecordInsertException if the statement fails
     */
    public void databaseReplace(String table, List<String> idColumns, Object id,
            Map<String, Object> params) throws RecordInsertException {
        List<Object> ids = idValues(idColumns, id);
        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, Object> e : params.entrySet()) {
            int idIndex = idColumns.indexOf(e.getKey());
            columns.add(e.getKey());
            values.add(idIndex >= 0 ? ids.get(idIndex) : JsonValues.toBindValue(e.getValue()));
        }
        for (int i = 0; i < idColumns.size(); i++) {
            if (!params.containsKey(idColumns.get(i))) {
                columns.add(idColumns.get(i));
                values.add(ids.get(i));
            }
        }
        run(table, statements.replace(table, columns, idColumns), values);
    }

    /**
     * Deletes all rows matching the values.
     *
     * @param table table name
     * @param matchColumns predicate columns
     * @param values values, one per match column
     * @return number of deleted rows
     * @throws RecordInsertException if the statement fails
     */
    public int databaseDelete(String table, List<String> matchColumns, List<?> values)
            throws RecordInsertException {
        Validate.isTrue(values.size() == matchColumns.size(),
                "Delete on '%s' expects %d value(s) for %s but got %d.", table,
                matchColumns.size(), matchColumns, values.size());
        QueryResult result = run(table, statements.delete(table, matchColumns),
                JsonValues.toBindValues(values));
        int deleted = result == null ? 0 : result.getAffectedRows();
        log.info("Table[{}] Deleted {} row(s) where {} = {}", table, deleted, matchColumns, values);
        return deleted;
    }

    /**
     * Splits an identifier into bind values for the identifier columns.
     *
     * @param idColumns identifier column(s)
     * @param id scalar identifier, or column → value map for composite identifiers
     * @return one value per identifier column
     * @throws IllegalArgumentException if a composite identifier is not a map
     */
    static List<Object> idValues(List<String> idColumns, Object id) {
        if (idColumns.size() == 1) {
            return Collections.singletonList(id);
        }
        Validate.isInstanceOf(Map.class, id,
                "Composite identifier for %s must be a column map: %s", idColumns, id);
        Map<?, ?> composite = (Map<?, ?>) id;
        List<Object> values = new ArrayList<>(idColumns.size());
        for (String column : idColumns) {
            values.add(composite.get(column));
        }
        return values;
    }

    private QueryResult run(String table, String sql, List<Object> values)
            throws RecordInsertException {
        try {
            return queryRunner.query(sql, values);
        } catch (SQLException e) {
            throw new RecordInsertException(ErrorKind.WRITE_FAILED, table, null,
                    "statement on '" + table + "' failed: " + e.getMessage(), e);
        }
    }
}
