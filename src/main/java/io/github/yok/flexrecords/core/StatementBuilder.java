package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.db.SqlDialect;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.lang3.Validate;

/**
 * Builds the single-table statements issued by the engine.
 *
 * <p>
 * All predicates are equalities joined with {@code AND}; all values are positional placeholders.
 * Identifier quoting and the replace statement come from the {@link SqlDialect}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class StatementBuilder {

    private final SqlDialect dialect;

    /**
     * Creates a builder.
     *
     * @param dialect database dialect
     */
    public StatementBuilder(SqlDialect dialect) {
        Validate.notNull(dialect, "dialect must not be null.");
        this.dialect = dialect;
    }

    /**
     * {@code SELECT <idColumns> FROM <table> WHERE <matchColumns> = ? AND ...}.
     *
     * @param table table name
     * @param idColumns selected columns
     * @param matchColumns predicate columns
     * @return statement text
     */
    public String select(String table, List<String> idColumns, List<String> matchColumns) {
        Validate.notEmpty(idColumns, "idColumns must not be empty.");
        return "SELECT " + columnList(idColumns) + " FROM " + dialect.quoteIdentifier(table)
                + " WHERE " + where(matchColumns);
    }

    /**
     * {@code INSERT INTO <table> (<columns>) VALUES (?, ...)}.
     *
     * @param table table name
     * @param columns written columns; empty uses the dialect's empty insert
     * @return statement text
     */
    public String insert(String table, List<String> columns) {
        if (columns.isEmpty()) {
            return dialect.buildEmptyInsertSql(table);
        }
        return "INSERT INTO " + dialect.quoteIdentifier(table) + " (" + columnList(columns)
                + ") VALUES (" + placeholders(columns.size()) + ")";
    }

    /**
     * {@code UPDATE <table> SET <columns> = ?, ... WHERE <idColumns> = ? AND ...}.
     *
     * @param table table name
     * @param columns updated columns
     * @param idColumns key columns
     * @return statement text
     */
    public String update(String table, List<String> columns, List<String> idColumns) {
        Validate.notEmpty(columns, "columns must not be empty.");
        String set = columns.stream().map(c -> dialect.quoteIdentifier(c) + " = ?")
                .collect(Collectors.joining(", "));
        return "UPDATE " + dialect.quoteIdentifier(table) + " SET " + set + " WHERE "
                + where(idColumns);
    }

    /**
     * Dialect specific replace statement.
     *
     * @param table table name
     * @param columns written columns including the key columns
     * @param idColumns key columns
     * @return statement text
     */
    public String replace(String table, List<String> columns, List<String> idColumns) {
        Validate.notEmpty(columns, "columns must not be empty.");
        return dialect.buildReplaceSql(table, columns, idColumns);
    }

    /**
     * {@code DELETE FROM <table> WHERE <matchColumns> = ? AND ...}.
     *
     * @param table table name
     * @param matchColumns predicate columns
     * @return statement text
     */
    public String delete(String table, List<String> matchColumns) {
        return "DELETE FROM " + dialect.quoteIdentifier(table) + " WHERE " + where(matchColumns);
    }

    private String where(List<String> columns) {
        Validate.notEmpty(columns, "Specify at least one column.");
        return columns.stream().map(c -> dialect.quoteIdentifier(c) + " = ?")
                .collect(Collectors.joining(" AND "));
    }

    private String columnList(List<String> columns) {
        return columns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", "));
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
