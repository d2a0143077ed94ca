package io.github.yok.flexrecords.core;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Remembers the identifier assigned to every record the engine has written, keyed by table and
 * local id.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>
 * Created empty with its {@link RecordInserter} and kept for the lifetime of that instance, across
 * any number of insert calls. Entries are only added, never removed; an entry is never changed to a
 * different identifier once written.
 * </p>
 *
 * <h2>Thread-safety</h2>
 *
 * <p>
 * All methods are synchronized. Writes come only from the sequential write path; reads may come
 * from lookup threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IdentifierRegistry {

    // table -> (local id -> identifier), in registration order
    private final Map<String, Map<String, Object>> data = new LinkedHashMap<>();

    /**
     * Returns the identifier registered for a record.
     *
     * @param table table name
     * @param localId local id
     * @return identifier, or empty if not registered
     */
    public synchronized Optional<Object> find(String table, String localId) {
        Map<String, Object> ids = data.get(table);
        if (ids == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ids.get(localId));
    }

    /**
     * Returns whether a record is registered.
     *
     * @param table table name
     * @param localId local id
     * @return {@code true} if registered
     */
    public synchronized boolean contains(String table, String localId) {
        Map<String, Object> ids = data.get(table);
        return ids != null && ids.containsKey(localId);
    }

    /**
     * Registers the identifier of a written record.
     *
     * <p>
     * Registering the same identifier again is a no-op.
     * </p>
     *
     * @param table table name
     * @param localId local id
     * @param id identifier (scalar, or column → value map for composite keys)
     * @throws NullPointerException if an argument is {@code null}
     * @throws IllegalStateException if a different identifier is already registered
     */
    public synchronized void register(String table, String localId, Object id) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(localId, "localId");
        Objects.requireNonNull(id, "id");

        Map<String, Object> ids = data.computeIfAbsent(table, k -> new LinkedHashMap<>());
        Object current = ids.get(localId);
        if (current != null && !current.equals(id)) {
            throw new IllegalStateException("Identifier of '" + table + ":" + localId
                    + "' is already registered as " + current + " (got " + id + ")");
        }
        ids.put(localId, id);
        log.debug("Registered {}:{} -> {}", table, localId, id);
    }

    /**
     * Returns whether registering {@code id} for the record would be accepted.
     *
     * @param table table name
     * @param localId local id
     * @param id candidate identifier; {@code null} means "not known yet" and is only accepted if the
     *        record is not registered at all
     * @return {@code true} if {@link #register} would succeed
     */
    public synchronized boolean accepts(String table, String localId, Object id) {
        Map<String, Object> ids = data.get(table);
        if (ids == null || !ids.containsKey(localId)) {
            return true;
        }
        return id != null && id.equals(ids.get(localId));
    }

    /**
     * Returns the identifiers registered for one table.
     *
     * @param table table name
     * @return immutable local id → identifier map (empty if nothing is registered)
     */
    public synchronized Map<String, Object> getTable(String table) {
        Map<String, Object> ids = data.get(table);
        return ids == null ? ImmutableMap.of() : ImmutableMap.copyOf(ids);
    }

    /**
     * Returns an immutable snapshot of all registered identifiers.
     *
     * @return table → (local id → identifier)
     */
    public synchronized Map<String, Map<String, Object>> snapshot() {
        ImmutableMap.Builder<String, Map<String, Object>> builder = ImmutableMap.builder();
        data.forEach((table, ids) -> builder.put(table, ImmutableMap.copyOf(ids)));
        return builder.build();
    }

    /**
     * Returns the number of registered records over all tables.
     *
     * @return record count
     */
    public synchronized int size() {
        return data.values().stream().mapToInt(Map::size).sum();
    }
}
