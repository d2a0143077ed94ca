package io.github.yok.flexrecords.core;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.flexrecords.config.ConnectionConfig;
import io.github.yok.flexrecords.config.LoaderConfig;
import io.github.yok.flexrecords.config.PathsConfig;
import io.github.yok.flexrecords.db.JdbcQueryRunner;
import io.github.yok.flexrecords.db.QueryRunner;
import io.github.yok.flexrecords.db.SqlDialect;
import io.github.yok.flexrecords.model.ContentBatch;
import io.github.yok.flexrecords.parser.ContentBatchParser;
import io.github.yok.flexrecords.util.ErrorHandler;
import io.github.yok.flexrecords.util.JdbcDriverLoader;
import io.github.yok.flexrecords.util.LogPathUtil;
import java.io.File;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Command-line workflow that loads JSON content files into every targeted database.
 *
 * <p>
 * Per database one {@link RecordInserter} is created, and the files are submitted to it in the
 * given order, so records of a later file may reference records of an earlier one. Files are
 * read from {@link PathsConfig#getLoad()}; a missing file is skipped with a warning. The first
 * failure of a database is reported through {@link ErrorHandler#errorAndExit(String, Throwable)}
 * and ends the load of that database; rows written before it stay written.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ContentLoader {

    /**
     * Creates the {@link QueryRunner} of a connection (replaceable in tests).
     */
    @FunctionalInterface
    interface QueryRunnerFactory {

        /**
         * Creates a query runner.
         *
         * @param entry connection entry
         * @return query runner
         * @throws Exception if the connection cannot be prepared
         */
        QueryRunner create(ConnectionConfig.Entry entry) throws Exception;
    }

    // Base directory settings for content files
    private final PathsConfig pathsConfig;

    // Holder of JDBC connection settings
    private final ConnectionConfig connectionConfig;

    // loader.* settings
    private final LoaderConfig loaderConfig;

    // Factory function to create a SQL dialect
    private final Function<ConnectionConfig.Entry, SqlDialect> dialectFactory;

    // Query runner factory (replaceable in tests)
    private final QueryRunnerFactory queryRunnerFactory;

    private final ContentBatchParser parser = new ContentBatchParser();

    // Load summary: dbId → (table → outcome counts)
    private final Map<String, Map<String, Map<RecordOutcome, Integer>>> loadSummary =
            new LinkedHashMap<>();

    // Engines of the last execute call: dbId → engine
    private final Map<String, RecordInserter> inserters = new LinkedHashMap<>();

    /**
     * Creates a loader that connects through {@link JdbcQueryRunner}.
     *
     * @param pathsConfig path settings
     * @param connectionConfig connection settings
     * @param loaderConfig loader settings
     * @param dialectFactory dialect resolver
     */
    public ContentLoader(PathsConfig pathsConfig, ConnectionConfig connectionConfig,
            LoaderConfig loaderConfig,
            Function<ConnectionConfig.Entry, SqlDialect> dialectFactory) {
        this(pathsConfig, connectionConfig, loaderConfig, dialectFactory,
                entry -> new JdbcQueryRunner(JdbcDriverLoader.createDataSource(entry)));
    }

    /**
     * Creates a loader with a custom query runner factory.
     *
     * @param pathsConfig path settings
     * @param connectionConfig connection settings
     * @param loaderConfig loader settings
     * @param dialectFactory dialect resolver
     * @param queryRunnerFactory query runner factory
     */
    ContentLoader(PathsConfig pathsConfig, ConnectionConfig connectionConfig,
            LoaderConfig loaderConfig,
            Function<ConnectionConfig.Entry, SqlDialect> dialectFactory,
            QueryRunnerFactory queryRunnerFactory) {
        this.pathsConfig = pathsConfig;
        this.connectionConfig = connectionConfig;
        this.loaderConfig = loaderConfig;
        this.dialectFactory = dialectFactory;
        this.queryRunnerFactory = queryRunnerFactory;
    }

    /**
     * Entry point for content loading.
     *
     * @param files content file names relative to the load directory, in submission order
     * @param targetDbIds list of target DB IDs; if {@code null} or empty, all DBs are targeted
     */
    public void execute(List<String> files, List<String> targetDbIds) {
        log.info("=== ContentLoader started (files={}, target DBs={}) ===", files, targetDbIds);
        loadSummary.clear();
        inserters.clear();

        for (ConnectionConfig.Entry entry : connectionConfig.getConnections()) {
            String dbId = entry.getId();
            if (targetDbIds != null && !targetDbIds.isEmpty() && !targetDbIds.contains(dbId)) {
                log.info("[{}] Not targeted → skipping", dbId);
                continue;
            }
            load(entry, files);
        }

        log.info("=== ContentLoader finished ===");
        logSummary();
    }

    /**
     * Returns the engines of the last {@link #execute} call.
     *
     * @return dbId → engine
     */
    Map<String, RecordInserter> getInserters() {
        return inserters;
    }

    /**
     * Loads all files into one database.
     *
     * @param entry connection entry
     * @param files content file names
     */
    private void load(ConnectionConfig.Entry entry, List<String> files) {
        String dbId = entry.getId();
        ExecutorService pool = null;
        try {
            SqlDialect dialect = dialectFactory.apply(entry);
            QueryRunner queryRunner = queryRunnerFactory.create(entry);

            Executor executor;
            int parallelism = loaderConfig.getLookupParallelism();
            if (parallelism <= 1) {
                executor = MoreExecutors.directExecutor();
            } else {
                pool = Executors.newFixedThreadPool(parallelism, new ThreadFactoryBuilder()
                        .setNameFormat(dbId + "-lookup-%d").setDaemon(true).build());
                executor = pool;
            }

            RecordInserter inserter = new RecordInserter(queryRunner, dialect, executor);
            inserters.put(dbId, inserter);
            Map<String, Map<RecordOutcome, Integer>> tables =
                    loadSummary.computeIfAbsent(dbId, k -> new LinkedHashMap<>());

            for (String name : files) {
                File file = new File(pathsConfig.getLoad(), name);
                if (!file.isFile()) {
                    log.warn("[{}] Content file does not exist → skipping: {}", dbId,
                            LogPathUtil.renderPathForLog(file));
                    continue;
                }
                log.info("[{}] Loading {}", dbId, LogPathUtil.renderPathForLog(file));
                ContentBatch batch = parser.parse(file);
                inserter.insert(batch).forEach(
                        (table, counts) -> tables.merge(table, counts, ContentLoader::merge));
            }

            inserter.getDiagnostics().forEach(d -> log.warn(
                    "[{}] Unresolved reference {} in Table[{}] Record[{}] field {}", dbId,
                    d.getReference(), d.getTable(), d.getLocalId(), d.getField()));
        } catch (Exception e) {
            log.error("[{}] Unexpected error occurred: {}", dbId, e.getMessage(), e);
            ErrorHandler.errorAndExit("Content load failed (DB=" + dbId + ")", e);
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }
    }

    private static Map<RecordOutcome, Integer> merge(Map<RecordOutcome, Integer> current,
            Map<RecordOutcome, Integer> added) {
        Map<RecordOutcome, Integer> merged = new EnumMap<>(RecordOutcome.class);
        merged.putAll(current);
        added.forEach((outcome, count) -> merged.merge(outcome, count, Integer::sum));
        return merged;
    }

    /**
     * Outputs a consolidated log of load results for all DBs.
     */
    private void logSummary() {
        log.info("===== Summary =====");
        loadSummary.forEach((dbId, tableMap) -> {
            log.info("DB[{}]:", dbId);
            int maxNameLen = tableMap.keySet().stream().mapToInt(String::length).max().orElse(0);
            String fmt = "  Table[%-" + maxNameLen + "s] %s";
            tableMap.forEach((table, counts) -> log.info(String.format(fmt, table, counts)));
        });
        log.info("== Content loading to all DBs has completed ==");
    }
}
