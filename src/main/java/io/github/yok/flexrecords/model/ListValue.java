package io.github.yok.flexrecords.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * An ordered sequence of values.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode(callSuper = false)
@ToString
public final class ListValue extends RecordValue {

    private final List<RecordValue> items;

    /**
     * Creates a list value.
     *
     * @param items elements in order
     */
    public ListValue(List<RecordValue> items) {
        Validate.notNull(items, "items must not be null.");
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Kind getKind() {
        return Kind.LIST;
    }
}
