package io.github.yok.flexrecords.db.h2;

import io.github.yok.flexrecords.db.SqlDialect;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link SqlDialect} for H2 (mainly used for local runs and tests).
 *
 * <p>
 * Rows are overwritten with {@code MERGE INTO ... KEY (...)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class H2Dialect implements SqlDialect {

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
        String keys =
                keyColumns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String marks = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "MERGE INTO " + quoteIdentifier(table) + " (" + cols + ") KEY (" + keys
                + ") VALUES (" + marks + ")";
    }
}
