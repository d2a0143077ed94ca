package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.db.QueryRunner;
import io.github.yok.flexrecords.db.SqlDialect;
import io.github.yok.flexrecords.model.ContentBatch;
import io.github.yok.flexrecords.model.DbReference;
import io.github.yok.flexrecords.model.ExistingMode;
import io.github.yok.flexrecords.model.LocalReference;
import io.github.yok.flexrecords.model.RecordParams;
import io.github.yok.flexrecords.model.TableBatch;
import io.github.yok.flexrecords.model.TableOptions;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Insertion engine: writes a {@link ContentBatch} table by table and record by record, resolving
 * every reference first.
 *
 * <p>
 * <strong>Per record:</strong>
 * </p>
 * <ol>
 * <li>Resolve all fields with the {@link ReferenceResolver}.</li>
 * <li>If the table options enable matching, look for an existing row with the
 * {@link ExistingRecordMatcher}. On a match, update it ({@link ExistingMode#UPDATE}), replace it
 * ({@link ExistingMode#REPLACE}) or keep it ({@link ExistingMode#INSERT_ONLY}).</li>
 * <li>Otherwise insert a new row.</li>
 * <li>Register the resulting identifier under (table, local id).</li>
 * </ol>
 *
 * <p>
 * Tables and records are processed in declaration order; there is no topological sort, so a
 * record may only reference records declared before it (in this or an earlier call on the same
 * instance). Writes are strictly sequential. The first failure aborts the call; rows written
 * before it stay written.
 * </p>
 *
 * <p>
 * One instance owns one {@link IdentifierRegistry} for its whole lifetime. Concurrent
 * {@link #insert} calls on the same instance are not supported.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RecordInserter {

    // Default match column of getDbRefGetter / getDbRefDeleter
    static final String DEFAULT_REF_COLUMN = "name";

    @Getter
    private final IdentifierRegistry registry = new IdentifierRegistry();

    private final ReferenceResolver resolver;
    private final ExistingRecordMatcher matcher;

    @Getter
    private final RecordWriter writer;

    /**
     * Creates an engine whose independent lookups run on the common fork-join pool.
     *
     * @param queryRunner query runner
     * @param dialect SQL dialect of the store
     */
    public RecordInserter(QueryRunner queryRunner, SqlDialect dialect) {
        this(queryRunner, dialect, ForkJoinPool.commonPool());
    }

    /**
     * Creates an engine.
     *
     * @param queryRunner query runner
     * @param dialect SQL dialect of the store
     * @param lookupExecutor executor for independent database lookups
     */
    public RecordInserter(QueryRunner queryRunner, SqlDialect dialect, Executor lookupExecutor) {
        Validate.notNull(queryRunner, "queryRunner must not be null.");
        Validate.notNull(dialect, "dialect must not be null.");
        Validate.notNull(lookupExecutor, "lookupExecutor must not be null.");
        StatementBuilder statements = new StatementBuilder(dialect);
        ReferenceLookup lookup = new ReferenceLookup(queryRunner, statements);
        this.resolver = new ReferenceResolver(registry, lookup, lookupExecutor);
        this.matcher = new ExistingRecordMatcher(lookup);
        this.writer = new RecordWriter(queryRunner, statements);
    }

    /**
     * Writes all tables of a batch in declaration order.
     *
     * @param batch content batch
     * @return table → number of records per outcome, in declaration order
     * @throws RecordInsertException on the first failure; later records and tables are skipped
     */
    public Map<String, Map<RecordOutcome, Integer>> insert(ContentBatch batch)
            throws RecordInsertException {
        Validate.notNull(batch, "batch must not be null.");
        log.info("=== Insert started (tables={}, records={}) ===", batch.tables().size(),
                batch.recordCount());

        Map<String, Map<RecordOutcome, Integer>> summary = new LinkedHashMap<>();
        for (Map.Entry<String, TableBatch> e : batch.tables().entrySet()) {
            Map<String, RecordOutcome> outcomes = insertObjects(e.getKey(), e.getValue());
            Map<RecordOutcome, Integer> counts = new EnumMap<>(RecordOutcome.class);
            outcomes.values().forEach(o -> counts.merge(o, 1, Integer::sum));
            summary.put(e.getKey(), counts);
        }

        log.info("=== Insert finished (registered={}) ===", registry.size());
        return summary;
    }

    /**
     * Writes the records of one table in declaration order.
     *
     * @param table table name
     * @param batch records and options of the table
     * @return local id → outcome, in declaration order
     * @throws RecordInsertException on the first failure; later records are skipped
     */
    public Map<String, RecordOutcome> insertObjects(String table, TableBatch batch)
            throws RecordInsertException {
        Validate.notBlank(table, "table must not be blank.");
        TableOptions options = batch.getOptions();
        log.info("Table[{}] records={} mode={} refColumns={}", table, batch.size(),
                options.getMode(), options.getRefColumns());

        Map<String, RecordOutcome> outcomes = new LinkedHashMap<>();
        for (Map.Entry<String, RecordParams> e : batch.records().entrySet()) {
            outcomes.put(e.getKey(), handleRecord(table, e.getKey(), e.getValue(), options));
        }

        Map<RecordOutcome, Long> counts = new EnumMap<>(RecordOutcome.class);
        outcomes.values().forEach(o -> counts.merge(o, 1L, Long::sum));
        log.info("Table[{}] done | {}", table, counts);
        return outcomes;
    }

    /**
     * Resolves, matches, writes and registers one record.
     *
     * @param table table name
     * @param localId local id of the record
     * @param params record fields
     * @param options table options
     * @return what happened to the record
     * @throws RecordInsertException if a reference, the existence check or the write fails
     */
    RecordOutcome handleRecord(String table, String localId, RecordParams params,
            TableOptions options) throws RecordInsertException {
        Map<String, Object> resolved = resolver.resolve(table, localId, params);

        Optional<Object> existing = options.isMatchingEnabled()
                ? matcher.findExisting(table, localId, options, resolved)
                : Optional.empty();

        if (existing.isPresent()) {
            Object id = existing.get();
            checkRegistrable(table, localId, id);
            RecordOutcome outcome;
            try {
                switch (options.getMode()) {
                    case UPDATE:
                        writer.databaseUpdate(table, options.getIdColumns(), id, resolved);
                        outcome = RecordOutcome.UPDATED;
                        break;
                    case REPLACE:
                        writer.databaseReplace(table, options.getIdColumns(), id, resolved);
                        outcome = RecordOutcome.REPLACED;
                        break;
                    default:
                        outcome = RecordOutcome.KEPT;
                        break;
                }
            } catch (RecordInsertException e) {
                throw withRecord(e, table, localId);
            }
            registry.register(table, localId, id);
            log.debug("Table[{}] Record[{}] {} id={}", table, localId, outcome, id);
            return outcome;
        }

        checkRegistrable(table, localId, null);
        Object insertId;
        try {
            insertId = writer.databaseInsert(table, resolved);
        } catch (RecordInsertException e) {
            throw withRecord(e, table, localId);
        }
        Object id = identifierOf(insertId, resolved, options.getIdColumns());
        if (id == null) {
            log.warn("Table[{}] Record[{}] no identifier was returned by the store; "
                    + "local references to it will resolve to null", table, localId);
        } else {
            registry.register(table, localId, id);
        }
        log.debug("Table[{}] Record[{}] INSERTED id={}", table, localId, id);
        return RecordOutcome.INSERTED;
    }

    /**
     * Creates a local reference.
     *
     * @param table table of the referenced record
     * @param localId local id of the referenced record
     * @return local reference
     */
    public LocalReference ref(String table, String localId) {
        return new LocalReference(table, localId);
    }

    /**
     * Returns the identifier registered for a record.
     *
     * @param table table name
     * @param localId local id
     * @return registered identifier
     * @throws RecordInsertException with {@link ErrorKind#UNRESOLVED_LOCAL_REFERENCE} if the record
     *         is not registered
     */
    public Object getReferenced(String table, String localId) throws RecordInsertException {
        return registry.find(table, localId)
                .orElseThrow(() -> new RecordInsertException(
                        ErrorKind.UNRESOLVED_LOCAL_REFERENCE, table, localId,
                        "reference '" + table + ":" + localId + "' could not be found"));
    }

    /**
     * Returns a getter matching on {@code name} and returning {@code id}.
     *
     * @param table table name
     * @return getter
     */
    public DbRefGetter getDbRefGetter(String table) {
        return getDbRefGetter(table, null, null);
    }

    /**
     * Returns a getter that builds database references into {@code table}.
     *
     * @param table table name
     * @param refColumns match columns; {@code null} means {@code ["name"]}
     * @param idColumns identifier column(s); {@code null} means {@code ["id"]}
     * @return getter
     */
    public DbRefGetter getDbRefGetter(String table, List<String> refColumns,
            List<String> idColumns) {
        List<String> refs = refColumns == null ? List.of(DEFAULT_REF_COLUMN) : refColumns;
        List<String> ids = idColumns == null ? List.of(TableOptions.DEFAULT_ID_COLUMN) : idColumns;
        return values -> new DbReference(table, refs, ids, values);
    }

    /**
     * Returns a deleter matching on {@code name}.
     *
     * @param table table name
     * @return deleter
     */
    public DbRefDeleter getDbRefDeleter(String table) {
        return getDbRefDeleter(table, null);
    }

    /**
     * Returns a deleter that removes all rows of {@code table} matching the given values.
     *
     * @param table table name
     * @param refColumns match columns; {@code null} means {@code ["name"]}
     * @return deleter
     * @throws IllegalArgumentException if {@code refColumns} is empty
     */
    public DbRefDeleter getDbRefDeleter(String table, List<String> refColumns) {
        List<String> refs = refColumns == null ? List.of(DEFAULT_REF_COLUMN) : refColumns;
        Validate.isTrue(!refs.isEmpty(), "Specify at least one column.");
        return values -> writer.databaseDelete(table, refs, values);
    }

    /**
     * Resolves independent database references concurrently.
     *
     * @param <K> key type
     * @param refs key → reference
     * @return key → identifier, in the iteration order of {@code refs}
     * @throws RecordInsertException the first failure in iteration order
     */
    public <K> Map<K, Object> getRefs(Map<K, DbReference> refs) throws RecordInsertException {
        return resolver.resolveAll(refs);
    }

    /**
     * Resolves all references of a free-standing record.
     *
     * <p>
     * Unresolved local references become {@code null} and are reported through
     * {@link #getDiagnostics()}.
     * </p>
     *
     * @param params record fields
     * @return column → resolved value
     * @throws RecordInsertException if a database reference cannot be resolved
     */
    public Map<String, Object> convertRefs(RecordParams params) throws RecordInsertException {
        return resolver.resolve(null, null, params);
    }

    /**
     * Returns the unresolved local references met so far.
     *
     * @return diagnostics in the order they were recorded
     */
    public List<ResolutionDiagnostic> getDiagnostics() {
        return resolver.getDiagnostics();
    }

    private void checkRegistrable(String table, String localId, Object id)
            throws RecordInsertException {
        if (!registry.accepts(table, localId, id)) {
            Object current = registry.find(table, localId).orElse(null);
            throw new RecordInsertException(ErrorKind.DUPLICATE_LOCAL_ID, table, localId,
                    "record '" + table + ":" + localId + "' is already registered as " + current);
        }
    }

    /**
     * Picks the identifier of an inserted record.
     *
     * <p>
     * {@code generated} is what the store returned for the insert: a single value, or a column →
     * value map when the driver returned several columns of the row. Each identifier column is
     * taken from the generated map (matched case-insensitively), then from the record itself. A
     * single generated value fills the one identifier column still missing. Columns of the
     * generated map that are not identifier columns are ignored.
     * </p>
     *
     * @param generated generated key, column → value map, or {@code null}
     * @param record resolved record
     * @param idColumns identifier column(s)
     * @return scalar or column → value map, or {@code null} if an identifier column stays unknown
     */
    static Object identifierOf(Object generated, Map<String, Object> record,
            List<String> idColumns) {
        Map<?, ?> generatedColumns = generated instanceof Map ? (Map<?, ?>) generated : Map.of();
        Object generatedValue = generated instanceof Map ? null : generated;

        Map<String, Object> id = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String column : idColumns) {
            Object value = valueIgnoreCase(generatedColumns, column);
            if (value == null && idColumns.size() == 1) {
                value = generatedValue;
            }
            if (value == null) {
                value = record.get(column);
            }
            if (value == null) {
                missing.add(column);
            }
            id.put(column, value);
        }
        if (missing.size() == 1 && generatedValue != null) {
            id.put(missing.get(0), generatedValue);
            missing.clear();
        }
        if (!missing.isEmpty()) {
            return null;
        }
        return idColumns.size() == 1 ? id.get(idColumns.get(0)) : id;
    }

    private static Object valueIgnoreCase(Map<?, ?> columns, String column) {
        for (Map.Entry<?, ?> e : columns.entrySet()) {
            if (column.equalsIgnoreCase(String.valueOf(e.getKey()))) {
                return e.getValue();
            }
        }
        return null;
    }

    private static RecordInsertException withRecord(RecordInsertException e, String table,
            String localId) {
        return new RecordInsertException(e.getKind(), table, localId,
                "record '" + table + ":" + localId + "' could not be written: "
                        + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()),
                e.getCause());
    }
}
