package io.github.yok.flexrecords.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * The records of one table in a {@link ContentBatch}, keyed by caller-chosen local id, in
 * declaration order.
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public final class TableBatch {

    private final Map<String, RecordParams> records = new LinkedHashMap<>();

    @Getter
    private TableOptions options = TableOptions.defaults();

    /**
     * Sets the table options.
     *
     * @param options options; {@code null} resets to {@link TableOptions#defaults()}
     * @return this batch
     */
    public TableBatch options(TableOptions options) {
        this.options = options == null ? TableOptions.defaults() : options;
        return this;
    }

    /**
     * Appends a record.
     *
     * @param localId local id used by {@link LocalReference}s
     * @param params record fields
     * @return this batch
     * @throws IllegalArgumentException if {@code localId} is blank or already declared
     */
    public TableBatch record(String localId, RecordParams params) {
        Validate.notBlank(localId, "localId must not be blank.");
        Validate.notNull(params, "params must not be null.");
        Validate.isTrue(!records.containsKey(localId), "Duplicate local id: %s", localId);
        records.put(localId, params);
        return this;
    }

    /**
     * Returns the records in declaration order.
     *
     * @return unmodifiable local id → record map
     */
    public Map<String, RecordParams> records() {
        return Collections.unmodifiableMap(records);
    }

    /**
     * Returns the number of records.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }
}
