package io.github.yok.flexrecords.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Per-table options of a {@link TableBatch}.
 *
 * <p>
 * When {@link #getRefColumns()} is non-empty, every record of the table is first matched against
 * existing rows using those columns; {@link #getMode()} decides what happens on a match. The
 * identifier of a matched row is read from {@link #getIdColumns()} (a single column, or several
 * columns forming a composite key).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TableOptions {

    /**
     * Identifier column used when none is configured.
     */
    public static final String DEFAULT_ID_COLUMN = "id";

    private static final TableOptions DEFAULTS =
            new TableOptions(List.of(), List.of(DEFAULT_ID_COLUMN), ExistingMode.INSERT_ONLY);

    // Columns used to match existing rows; empty disables matching
    private final List<String> refColumns;

    // Identifier column(s)
    private final List<String> idColumns;

    // Behavior on a match
    private final ExistingMode mode;

    /**
     * Creates options.
     *
     * @param refColumns columns used to match existing rows; {@code null} or empty disables
     *        matching
     * @param idColumns identifier column(s); {@code null} or empty means {@code ["id"]}
     * @param mode behavior on a match; {@code null} means {@link ExistingMode#INSERT_ONLY}
     */
    public TableOptions(List<String> refColumns, List<String> idColumns, ExistingMode mode) {
        List<String> refs = refColumns == null ? List.of() : refColumns;
        List<String> ids =
                (idColumns == null || idColumns.isEmpty()) ? List.of(DEFAULT_ID_COLUMN) : idColumns;
        for (String c : refs) {
            Validate.notBlank(c, "refColumns must not contain null/blank names.");
        }
        for (String c : ids) {
            Validate.notBlank(c, "idColumns must not contain null/blank names.");
        }
        this.refColumns = Collections.unmodifiableList(new ArrayList<>(refs));
        this.idColumns = Collections.unmodifiableList(new ArrayList<>(ids));
        this.mode = mode == null ? ExistingMode.INSERT_ONLY : mode;
    }

    /**
     * Returns options without existing-record matching.
     *
     * @return default options
     */
    public static TableOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns options that match existing rows with a single identifier column.
     *
     * @param mode behavior on a match
     * @param idColumn identifier column
     * @param refColumns match columns
     * @return options
     */
    public static TableOptions matching(ExistingMode mode, String idColumn, String... refColumns) {
        return new TableOptions(List.of(refColumns), List.of(idColumn), mode);
    }

    /**
     * Returns whether existing-record matching is enabled.
     *
     * @return {@code true} if at least one match column is configured
     */
    public boolean isMatchingEnabled() {
        return !refColumns.isEmpty();
    }
}
