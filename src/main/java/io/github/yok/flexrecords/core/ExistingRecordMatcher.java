package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.model.TableOptions;
import io.github.yok.flexrecords.util.JsonValues;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Determines whether a resolved record already exists in its table.
 *
 * <p>
 * The match values are read from the resolved record in the order of
 * {@link TableOptions#getRefColumns()}. A match column the record does not supply is bound as
 * {@code null}, which never satisfies an equality predicate, so such a record is always reported
 * as not found.
 * </p>
 *
 * <p>
 * The returned identifier has the shape described in {@link ReferenceLookup}: a scalar for a
 * single identifier column, a column → value map for a composite identifier. When several rows
 * match, the first one wins.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
class ExistingRecordMatcher {

    private final ReferenceLookup lookup;

    /**
     * Creates a matcher.
     *
     * @param lookup reference lookup
     */
    ExistingRecordMatcher(ReferenceLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * Looks for an existing row matching the record.
     *
     * @param table table name
     * @param localId local id of the record, for messages
     * @param options table options; matching must be enabled
     * @param record resolved record
     * @return identifier of the existing row, or empty if none matches
     * @throws RecordInsertException with {@link ErrorKind#REFERENCE_LOOKUP_FAILED} if the lookup
     *         fails in the store
     */
    Optional<Object> findExisting(String table, String localId, TableOptions options,
            Map<String, Object> record) throws RecordInsertException {
        List<Object> values = new ArrayList<>(options.getRefColumns().size());
        for (String column : options.getRefColumns()) {
            if (!record.containsKey(column)) {
                log.warn("Table[{}] Record[{}] has no value for match column '{}'", table, localId,
                        column);
            }
            values.add(JsonValues.toBindValue(record.get(column)));
        }
        try {
            return lookup.find(table, options.getRefColumns(), options.getIdColumns(), values);
        } catch (SQLException e) {
            throw new RecordInsertException(ErrorKind.REFERENCE_LOOKUP_FAILED, table, localId,
                    "existing-record check of '" + table + ":" + localId + "' failed: "
                            + e.getMessage(),
                    e);
        }
    }
}
