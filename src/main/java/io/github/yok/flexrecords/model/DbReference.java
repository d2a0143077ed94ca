package io.github.yok.flexrecords.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * Points at a pre-existing row that is found by an equality lookup.
 *
 * <p>
 * The lookup is {@code SELECT <idColumns> FROM <table> WHERE <matchColumns[0]> = ? AND ...}. Match
 * values are bound positionally and may themselves be references; nested {@link DbReference}s are
 * resolved before the outer lookup runs.
 * </p>
 *
 * <p>
 * If {@code idColumns} names a single column the reference resolves to that column's value;
 * otherwise it resolves to a column → value map (composite identifier).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class DbReference extends RecordValue {

    // Table the row lives in
    private final String table;

    // Columns compared with the match values, in bind order
    private final List<String> matchColumns;

    // Column(s) forming the identifier that is returned
    private final List<String> idColumns;

    // Values compared with matchColumns; scalars or references
    private final List<RecordValue> matchValues;

    /**
     * Creates a database reference.
     *
     * @param table table name
     * @param matchColumns match column names
     * @param idColumns identifier column name(s)
     * @param matchValues match values, one per match column
     * @throws IllegalArgumentException if the column lists are empty or the number of values does
     *         not match the number of match columns
     */
    public DbReference(String table, List<String> matchColumns, List<String> idColumns,
            List<?> matchValues) {
        Validate.notBlank(table, "table must not be blank.");
        Validate.notEmpty(matchColumns, "matchColumns must not be empty.");
        Validate.notEmpty(idColumns, "idColumns must not be empty.");
        Validate.notNull(matchValues, "matchValues must not be null.");
        Validate.isTrue(matchValues.size() == matchColumns.size(),
                "Reference '%s' expects %d match value(s) for %s but got %d.", table,
                matchColumns.size(), matchColumns, matchValues.size());
        this.table = table;
        this.matchColumns = Collections.unmodifiableList(new ArrayList<>(matchColumns));
        this.idColumns = Collections.unmodifiableList(new ArrayList<>(idColumns));
        List<RecordValue> values = new ArrayList<>(matchValues.size());
        for (Object v : matchValues) {
            values.add(RecordValue.of(v));
        }
        this.matchValues = Collections.unmodifiableList(values);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Kind getKind() {
        return Kind.DB_REF;
    }

    /**
     * Returns {@code true} if the identifier spans more than one column.
     *
     * @return whether the resolved identifier is a column → value map
     */
    public boolean isComposite() {
        return idColumns.size() > 1;
    }

    /**
     * Returns {@code table:value1,value2}.
     *
     * @return readable form used in log lines and error messages
     */
    @Override
    public String toString() {
        return table + ":" + matchValues.stream()
                .map(v -> v instanceof Scalar ? String.valueOf(((Scalar) v).getValue())
                        : String.valueOf(v))
                .collect(Collectors.joining(","));
    }
}
