package io.github.yok.flexrecords.model;

import java.util.Collection;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * A literal bind value (text, number, boolean, date/time, binary or {@code null}).
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode(callSuper = false)
@ToString
public final class Scalar extends RecordValue {

    // Value written as is
    private final Object value;

    /**
     * Creates a scalar value.
     *
     * @param value literal value; may be {@code null}
     * @throws IllegalArgumentException if {@code value} is a container or a reference
     */
    public Scalar(Object value) {
        Validate.isTrue(
                !(value instanceof Map || value instanceof Collection
                        || value instanceof RecordValue || value instanceof RecordParams),
                "Scalar must not wrap a container or a reference: %s", value);
        this.value = value;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Kind getKind() {
        return Kind.SCALAR;
    }
}
