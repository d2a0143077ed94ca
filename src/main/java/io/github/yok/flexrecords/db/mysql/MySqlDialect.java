package io.github.yok.flexrecords.db.mysql;

import io.github.yok.flexrecords.db.SqlDialect;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link SqlDialect} for MySQL / MariaDB.
 *
 * <p>
 * Identifiers are quoted with backticks and rows are overwritten with {@code REPLACE INTO}, which
 * deletes the row holding the same key before inserting the new one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialect implements SqlDialect {

    /**
     * {@inheritDoc}
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String buildReplaceSql(String table, List<String> columns, List<String> keyColumns) {
        String cols = columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String marks = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "REPLACE INTO " + quoteIdentifier(table) + " (" + cols + ") VALUES (" + marks + ")";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String buildEmptyInsertSql(String table) {
        return "INSERT INTO " + quoteIdentifier(table) + " () VALUES ()";
    }
}
