package io.github.yok.flexrecords.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Column name → {@link RecordValue} mapping of one record, in declaration order.
 *
 * <p>
 * Declaration order is kept because it is the order in which columns appear in the generated
 * statements and in which diagnostics are reported.
 * </p>
 *
 * <pre>
 * RecordParams params = RecordParams.of("name", "Bob", "contextId", new LocalReference("ctx", "dev"));
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class RecordParams {

    private final Map<String, RecordValue> fields = new LinkedHashMap<>();

    /**
     * Creates a record from alternating column names and values.
     *
     * @param keyValues {@code column1, value1, column2, value2, ...}; values are converted with
     *        {@link RecordValue#of(Object)}
     * @return new record
     * @throws IllegalArgumentException if the number of arguments is odd or a key is not a string
     */
    public static RecordParams of(Object... keyValues) {
        Validate.isTrue(keyValues.length % 2 == 0,
                "keyValues must contain column/value pairs (got %d arguments).", keyValues.length);
        RecordParams params = new RecordParams();
        for (int i = 0; i < keyValues.length; i += 2) {
            Validate.isInstanceOf(String.class, keyValues[i], "Column name must be a string: %s",
                    keyValues[i]);
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    /**
     * Creates a record from a plain map, keeping its iteration order.
     *
     * @param map column → value map
     * @return new record
     */
    public static RecordParams from(Map<?, ?> map) {
        RecordParams params = new RecordParams();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            params.put(String.valueOf(e.getKey()), e.getValue());
        }
        return params;
    }

    /**
     * Adds a field.
     *
     * @param column column name
     * @param value value; converted with {@link RecordValue#of(Object)}
     * @return this record
     * @throws IllegalArgumentException if {@code column} is blank or already present
     */
    public RecordParams put(String column, Object value) {
        Validate.notBlank(column, "column must not be blank.");
        Validate.isTrue(!fields.containsKey(column), "Duplicate column: %s", column);
        fields.put(column, RecordValue.of(value));
        return this;
    }

    /**
     * Returns the value of a column.
     *
     * @param column column name
     * @return value, or {@code null} if the column is absent
     */
    public RecordValue get(String column) {
        return fields.get(column);
    }

    /**
     * Returns whether the column is present.
     *
     * @param column column name
     * @return {@code true} if present
     */
    public boolean containsColumn(String column) {
        return fields.containsKey(column);
    }

    /**
     * Returns the column names in declaration order.
     *
     * @return unmodifiable column names
     */
    public Set<String> columns() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    /**
     * Returns the fields in declaration order.
     *
     * @return unmodifiable field map
     */
    public Map<String, RecordValue> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Returns the number of fields.
     *
     * @return field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns whether the record has no fields.
     *
     * @return {@code true} if empty
     */
    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
