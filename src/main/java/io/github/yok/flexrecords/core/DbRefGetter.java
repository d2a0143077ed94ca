package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.model.DbReference;
import java.util.Arrays;
import java.util.List;

/**
 * Builds {@link DbReference}s into one table for arbitrary match values.
 *
 * @author Yasuharu.Okawauchi
 * @see RecordInserter#getDbRefGetter(String, List, List)
 */
@FunctionalInterface
public interface DbRefGetter {

    /**
     * Builds a reference.
     *
     * @param values match values, in the order of the getter's match columns
     * @return reference
     */
    DbReference get(List<?> values);

    /**
     * Builds a reference; a single value is treated as a one-element list.
     *
     * @param values match values, in the order of the getter's match columns
     * @return reference
     */
    default DbReference get(Object... values) {
        return get(Arrays.asList(values));
    }
}
