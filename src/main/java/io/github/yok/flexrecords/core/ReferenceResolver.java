package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.model.DbReference;
import io.github.yok.flexrecords.model.ListValue;
import io.github.yok.flexrecords.model.LocalReference;
import io.github.yok.flexrecords.model.Nested;
import io.github.yok.flexrecords.model.RecordParams;
import io.github.yok.flexrecords.model.RecordValue;
import io.github.yok.flexrecords.model.Scalar;
import io.github.yok.flexrecords.util.JsonValues;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Replaces every reference inside a record with a concrete identifier.
 *
 * <h2>Rules</h2>
 *
 * <ul>
 * <li>Scalars pass through unchanged.</li>
 * <li>A {@link LocalReference} is looked up in the {@link IdentifierRegistry}. If it is not
 * registered the field becomes {@code null}, a {@link ResolutionDiagnostic} is recorded, and
 * resolution continues.</li>
 * <li>A {@link DbReference} first resolves its match values (nested database references run
 * concurrently on the lookup executor), then issues its lookup on the same executor. Only the
 * calling thread waits for results; lookup threads never block on each other. No row is
 * {@link ErrorKind#REFERENCE_NOT_FOUND}; a store failure is
 * {@link ErrorKind#REFERENCE_LOOKUP_FAILED}. Both abort the record.</li>
 * <li>Nested objects and lists are resolved element by element, keeping their structure.</li>
 * </ul>
 *
 * <p>
 * Fields are visited in declaration order. A record without references resolves to a plain map
 * equal to its values and causes no query.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ReferenceResolver {

    private final IdentifierRegistry registry;
    private final ReferenceLookup lookup;
    private final Executor lookupExecutor;

    // Unresolved local references, in the order they were met
    private final List<ResolutionDiagnostic> diagnostics = new CopyOnWriteArrayList<>();

    /**
     * Creates a resolver.
     *
     * @param registry identifier registry
     * @param lookup reference lookup
     * @param lookupExecutor executor for independent database lookups
     */
    ReferenceResolver(IdentifierRegistry registry, ReferenceLookup lookup,
            Executor lookupExecutor) {
        this.registry = registry;
        this.lookup = lookup;
        this.lookupExecutor = lookupExecutor;
    }

    /**
     * Resolves all fields of a record.
     *
     * @param table table of the record ({@code null} outside an insert call)
     * @param localId local id of the record ({@code null} outside an insert call)
     * @param params record fields
     * @return column → resolved value, in declaration order
     * @throws RecordInsertException if a database reference cannot be resolved
     */
    public Map<String, Object> resolve(String table, String localId, RecordParams params)
            throws RecordInsertException {
        return resolveParams(params, "", new Site(table, localId));
    }

    /**
     * Resolves a single database reference.
     *
     * @param ref database reference
     * @return identifier (scalar, or column → value map for composite identifiers)
     * @throws RecordInsertException if no row matches or the lookup fails
     */
    public Object resolveDbReference(DbReference ref) throws RecordInsertException {
        return resolveDbReference(ref, "", new Site(ref.getTable(), null));
    }

    /**
     * Resolves independent database references concurrently.
     *
     * @param <K> key type
     * @param refs key → reference
     * @return key → identifier, in the iteration order of {@code refs}
     * @throws RecordInsertException the first failure in iteration order, after every lookup has
     *         finished
     */
    public <K> Map<K, Object> resolveAll(Map<K, DbReference> refs) throws RecordInsertException {
        List<K> keys = new ArrayList<>(refs.keySet());
        List<CompletableFuture<Object>> futures = new ArrayList<>(keys.size());
        for (K key : keys) {
            DbReference ref = refs.get(key);
            Site site = new Site(ref.getTable(), String.valueOf(key));
            futures.add(resolveDbReferenceAsync(ref, String.valueOf(key), site));
        }
        List<Object> ids = awaitAll(futures);

        Map<K, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            result.put(keys.get(i), ids.get(i));
        }
        return result;
    }

    /**
     * Returns the unresolved local references met so far.
     *
     * @return unmodifiable snapshot
     */
    public List<ResolutionDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    private Map<String, Object> resolveParams(RecordParams params, String path, Site site)
            throws RecordInsertException {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, RecordValue> e : params.fields().entrySet()) {
            String field = path.isEmpty() ? e.getKey() : path + "." + e.getKey();
            resolved.put(e.getKey(), resolveValue(e.getValue(), field, site));
        }
        return resolved;
    }

    private Object resolveValue(RecordValue value, String path, Site site)
            throws RecordInsertException {
        switch (value.getKind()) {
            case SCALAR:
                return ((Scalar) value).getValue();
            case LOCAL_REF:
                return resolveLocalReference((LocalReference) value, path, site);
            case DB_REF:
                return resolveDbReference((DbReference) value, path, site);
            case NESTED:
                return resolveParams(((Nested) value).getParams(), path, site);
            case LIST:
                List<RecordValue> items = ((ListValue) value).getItems();
                List<Object> resolved = new ArrayList<>(items.size());
                for (int i = 0; i < items.size(); i++) {
                    resolved.add(resolveValue(items.get(i), path + "[" + i + "]", site));
                }
                return resolved;
            default:
                throw new IllegalStateException("Unknown value kind: " + value.getKind());
        }
    }

    private Object resolveLocalReference(LocalReference ref, String path, Site site) {
        Optional<Object> id = registry.find(ref.getTable(), ref.getId());
        if (id.isPresent()) {
            return id.get();
        }
        log.warn("Table[{}] Record[{}] reference '{}' could not be found; using null value for {}",
                site.table, site.localId, ref, path);
        diagnostics.add(new ResolutionDiagnostic(site.table, site.localId, path, ref));
        return null;
    }

    private Object resolveDbReference(DbReference ref, String path, Site site)
            throws RecordInsertException {
        return awaitAll(List.of(resolveDbReferenceAsync(ref, path, site))).get(0);
    }

    /**
     * Starts the resolution of a database reference without waiting for it.
     *
     * <p>
     * Nested database references among the match values are started first and are independent of
     * each other. The outer lookup is chained after all of them have finished, so no lookup thread
     * ever waits for another lookup. Other match values are resolved on the calling thread.
     * </p>
     */
    private CompletableFuture<Object> resolveDbReferenceAsync(DbReference ref, String path,
            Site site) {
        List<RecordValue> matchValues = ref.getMatchValues();
        List<CompletableFuture<Object>> values = new ArrayList<>(matchValues.size());
        for (int i = 0; i < matchValues.size(); i++) {
            RecordValue v = matchValues.get(i);
            String valuePath = (path.isEmpty() ? ref.getTable() : path) + ".values[" + i + "]";
            if (v.getKind() == RecordValue.Kind.DB_REF) {
                values.add(resolveDbReferenceAsync((DbReference) v, valuePath, site));
                continue;
            }
            try {
                values.add(CompletableFuture.completedFuture(resolveValue(v, valuePath, site)));
            } catch (RecordInsertException e) {
                values.add(CompletableFuture.failedFuture(e));
            }
        }

        return CompletableFuture.allOf(values.toArray(new CompletableFuture<?>[0]))
                .handle((r, t) -> null).<Object>thenCompose(done -> {
                    List<Object> resolved = new ArrayList<>(values.size());
                    for (CompletableFuture<Object> f : values) {
                        try {
                            resolved.add(f.join());
                        } catch (CompletionException e) {
                            return CompletableFuture.<Object>failedFuture(e.getCause());
                        }
                    }
                    return CompletableFuture.<Object>supplyAsync(() -> {
                        try {
                            return findIdentifier(ref, resolved);
                        } catch (RecordInsertException e) {
                            throw new CompletionException(e);
                        }
                    }, lookupExecutor);
                });
    }

    private Object findIdentifier(DbReference ref, List<Object> values)
            throws RecordInsertException {
        String rendered = render(ref.getTable(), values);
        Optional<Object> id;
        try {
            id = lookup.find(ref.getTable(), ref.getMatchColumns(), ref.getIdColumns(),
                    JsonValues.toBindValues(values));
        } catch (SQLException e) {
            throw new RecordInsertException(ErrorKind.REFERENCE_LOOKUP_FAILED, ref.getTable(),
                    rendered, "lookup of reference '" + rendered + "' failed: " + e.getMessage(),
                    e);
        }
        return id.orElseThrow(() -> new RecordInsertException(ErrorKind.REFERENCE_NOT_FOUND,
                ref.getTable(), rendered, "reference '" + rendered + "' could not be found"));
    }

    /**
     * Waits for every future and returns the results in order.
     *
     * @param futures running lookups
     * @return results in the order of {@code futures}
     * @throws RecordInsertException the first failure in order, rethrown after all lookups are done
     */
    static List<Object> awaitAll(List<CompletableFuture<Object>> futures)
            throws RecordInsertException {
        if (futures.isEmpty()) {
            return List.of();
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((r, t) -> null).join();

        List<Object> results = new ArrayList<>(futures.size());
        for (CompletableFuture<Object> f : futures) {
            try {
                results.add(f.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RecordInsertException) {
                    throw (RecordInsertException) cause;
                }
                throw e;
            }
        }
        return results;
    }

    private static String render(String table, List<Object> values) {
        return table + ":" + values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    /**
     * Where a value is being resolved, for diagnostics.
     */
    private static final class Site {
        private final String table;
        private final String localId;

        private Site(String table, String localId) {
            this.table = table;
            this.localId = localId;
        }
    }
}
