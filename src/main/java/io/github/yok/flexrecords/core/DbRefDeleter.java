package io.github.yok.flexrecords.core;

import java.util.Arrays;
import java.util.List;

/**
 * Deletes all rows of one table matching the given values.
 *
 * @author Yasuharu.Okawauchi
 * @see RecordInserter#getDbRefDeleter(String, List)
 */
@FunctionalInterface
public interface DbRefDeleter {

    /**
     * Deletes matching rows.
     *
     * @param values values, in the order of the deleter's match columns
     * @return number of deleted rows
     * @throws RecordInsertException if the statement fails
     */
    int delete(List<?> values) throws RecordInsertException;

    /**
     * Deletes matching rows; a single value is treated as a one-element list.
     *
     * @param values values, in the order of the deleter's match columns
     * @return number of deleted rows
     * @throws RecordInsertException if the statement fails
     */
    default int delete(Object... values) throws RecordInsertException {
        return delete(Arrays.asList(values));
    }
}
