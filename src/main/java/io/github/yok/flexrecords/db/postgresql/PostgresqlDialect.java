package io.github.yok.flexrecords.db.postgresql;

import io.github.yok.flexrecords.db.SqlDialect;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link SqlDialect} for PostgreSQL.
 *
 * <p>
 * Rows are overwritten with {@code INSERT ... ON CONFLICT (key) DO UPDATE}, so the key columns must
 * be covered by a unique constraint or the primary key.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialect implements SqlDialect {

    /**
     * {@inheritDoc}
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String buildReplaceSql(String table, List<String> columns, List<String> keyColumns) {
        String cols = columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String marks = String.join(", ", Collections.nCopies(columns.size(), "?"));
        String keys =
                keyColumns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        List<String> nonKey =
                columns.stream().filter(c -> !keyColumns.contains(c)).collect(Collectors.toList());

        StringBuilder sql = new StringBuilder();
        sql.append("INSERT INTO ").append(quoteIdentifier(table)).append(" (").append(cols)
                .append(") VALUES (").append(marks).append(") ON CONFLICT (").append(keys)
                .append(") ");
        if (nonKey.isEmpty()) {
            sql.append("DO NOTHING");
        } else {
            sql.append("DO UPDATE SET ").append(nonKey.stream()
                    .map(c -> quoteIdentifier(c) + " = EXCLUDED." + quoteIdentifier(c))
                    .collect(Collectors.joining(", ")));
        }
        return sql.toString();
    }
}
