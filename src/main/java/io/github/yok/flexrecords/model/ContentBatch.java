package io.github.yok.flexrecords.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * The full set of tables submitted to one insert call.
 *
 * <p>
 * Tables are processed in declaration order. A record may only reference records of tables (and
 * records) declared before it, or records inserted by an earlier call on the same engine.
 * </p>
 *
 * <pre>
 * ContentBatch batch = new ContentBatch()
 *         .table("context", new TableBatch().record("dev", RecordParams.of("name", "x")))
 *         .table("users", new TableBatch().record("u1",
 *                 RecordParams.of("name", "Bob", "contextId", new LocalReference("context", "dev"))));
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public final class ContentBatch {

    private final Map<String, TableBatch> tables = new LinkedHashMap<>();

    /**
     * Appends a table.
     *
     * @param table table name
     * @param batch records of the table
     * @return this batch
     * @throws IllegalArgumentException if {@code table} is blank or already declared
     */
    public ContentBatch table(String table, TableBatch batch) {
        Validate.notBlank(table, "table must not be blank.");
        Validate.notNull(batch, "batch must not be null.");
        Validate.isTrue(!tables.containsKey(table), "Duplicate table: %s", table);
        tables.put(table, batch);
        return this;
    }

    /**
     * Returns the tables in declaration order.
     *
     * @return unmodifiable table → batch map
     */
    public Map<String, TableBatch> tables() {
        return Collections.unmodifiableMap(tables);
    }

    /**
     * Returns the total number of records over all tables.
     *
     * @return record count
     */
    public int recordCount() {
        return tables.values().stream().mapToInt(TableBatch::size).sum();
    }
}
