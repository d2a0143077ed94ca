package io.github.yok.flexrecords;

import io.github.yok.flexrecords.config.ConnectionConfig;
import io.github.yok.flexrecords.config.LoaderConfig;
import io.github.yok.flexrecords.config.PathsConfig;
import io.github.yok.flexrecords.core.ContentLoader;
import io.github.yok.flexrecords.db.SqlDialect;
import io.github.yok.flexrecords.db.SqlDialectFactory;
import io.github.yok.flexrecords.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options {@code --load}/{@code -l} and {@code --target}/{@code -t}, then
 * invokes {@link ContentLoader}.
 * </p>
 *
 * <ul>
 * <li>{@code --load a.json,b.json} or {@code -l a.json,b.json} names the content files under
 * {@code <data-path>/load}. They are submitted in the given order to one engine per database, so a
 * later file may reference records of an earlier one. Required.</li>
 * <li>{@code --target db1,db2} or {@code -t db1,db2} specifies the target DB ID list. If omitted,
 * all DBs are targeted.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ConnectionConfig
 * @see LoaderConfig
 * @see SqlDialectFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class, LoaderConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final LoaderConfig loaderConfig;
    private final SqlDialectFactory dialectFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        List<String> files = new ArrayList<>();
        List<String> targetDbIds = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--load":
                case "-l":
                    if (i + 1 < args.length) {
                        files = splitList(args[++i]);
                    }
                    break;
                case "--target":
                case "-t":
                    if (i + 1 < args.length) {
                        targetDbIds = splitList(args[++i]);
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (files.isEmpty()) {
            ErrorHandler.errorAndExit("At least one content file is required (--load a.json).");
            return;
        }

        // When --target is not specified, use all DB IDs from application.yml
        if (targetDbIds.isEmpty()) {
            targetDbIds = connectionConfig.getConnections().stream()
                    .map(ConnectionConfig.Entry::getId).collect(Collectors.toList());
        }

        log.info("Files: {}, Target DBs: {}", files, targetDbIds);

        Function<ConnectionConfig.Entry, SqlDialect> dialectProvider = dialectFactory::create;

        try {
            new ContentLoader(pathsConfig, connectionConfig, loaderConfig, dialectProvider)
                    .execute(files, targetDbIds);
            log.info("Content load completed. Files {}", files);
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
