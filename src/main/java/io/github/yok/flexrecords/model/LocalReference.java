package io.github.yok.flexrecords.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * Points at another record of the same (or an earlier) content batch by its caller-chosen local
 * id.
 *
 * <p>
 * A local reference is resolved purely from the identifier registry of the engine instance; it
 * never causes a database lookup. It resolves only if the referenced record was processed
 * <em>before</em> the referencing one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class LocalReference extends RecordValue {

    // Table (content type) of the referenced record
    private final String table;

    // Local id of the referenced record within its table batch
    private final String id;

    /**
     * Creates a local reference.
     *
     * @param table table of the referenced record
     * @param id local id of the referenced record
     * @throws IllegalArgumentException if an argument is blank
     */
    public LocalReference(String table, String id) {
        Validate.notBlank(table, "table must not be blank.");
        Validate.notBlank(id, "id must not be blank.");
        this.table = table;
        this.id = id;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Kind getKind() {
        return Kind.LOCAL_REF;
    }

    /**
     * Returns {@code table:id}.
     *
     * @return readable form used in log lines
     */
    @Override
    public String toString() {
        return table + ":" + id;
    }
}
