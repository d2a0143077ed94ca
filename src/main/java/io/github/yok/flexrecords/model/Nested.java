package io.github.yok.flexrecords.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * A nested object value, typically the content of a JSON column.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode(callSuper = false)
@ToString
public final class Nested extends RecordValue {

    private final RecordParams params;

    /**
     * Creates a nested value.
     *
     * @param params nested fields
     */
    public Nested(RecordParams params) {
        Validate.notNull(params, "params must not be null.");
        this.params = params;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Kind getKind() {
        return Kind.NESTED;
    }
}
