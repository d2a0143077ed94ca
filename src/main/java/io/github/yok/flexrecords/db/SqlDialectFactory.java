package io.github.yok.flexrecords.db;

import io.github.yok.flexrecords.config.ConnectionConfig;
import io.github.yok.flexrecords.config.DialectMode;
import io.github.yok.flexrecords.config.LoaderConfig;
import io.github.yok.flexrecords.db.h2.H2Dialect;
import io.github.yok.flexrecords.db.mysql.MySqlDialect;
import io.github.yok.flexrecords.db.postgresql.PostgresqlDialect;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link SqlDialect} according to the database type.
 *
 * <p>
 * {@code loader.dialect} wins when configured. Otherwise the dialect is resolved per
 * {@link ConnectionConfig.Entry} using {@code connections[].driver-class} first and the JDBC URL as
 * a fallback.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlDialectFactory {

    // Loader settings (optional dialect override)
    private final LoaderConfig loaderConfig;

    /**
     * Creates a {@link SqlDialect} for the given connection entry.
     *
     * @param entry connection information
     * @return dialect
     * @throws IllegalStateException if the database type cannot be determined
     */
    public SqlDialect create(ConnectionConfig.Entry entry) {
        DialectMode mode = loaderConfig.getDialect();
        if (mode == null) {
            mode = resolveMode(entry);
        }
        log.info("[{}] Dialect: {}", entry.getId(), mode);
        return create(mode);
    }

    /**
     * Creates the {@link SqlDialect} of a dialect mode.
     *
     * @param mode dialect mode
     * @return dialect
     */
    public static SqlDialect create(DialectMode mode) {
        switch (mode) {
            case MYSQL:
                return new MySqlDialect();
            case POSTGRESQL:
                return new PostgresqlDialect();
            case H2:
                return new H2Dialect();
            default:
                throw new IllegalStateException("Unsupported dialect: " + mode);
        }
    }

    /**
     * Resolves the database type for a connection entry.
     *
     * @param entry connection entry
     * @return resolved database type
     * @throws IllegalStateException if the database type cannot be determined
     */
    private DialectMode resolveMode(ConnectionConfig.Entry entry) {
        DialectMode fromDriverClass = resolveModeFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }
        DialectMode fromUrl = resolveModeFromJdbcUrl(entry.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }
        throw new IllegalStateException(
                "Unsupported database dialect for connection id=" + entry.getId()
                        + " (driver-class=" + entry.getDriverClass() + ", url=" + entry.getUrl()
                        + ")");
    }

    /**
     * Resolves the database type from a JDBC driver class name.
     *
     * @param driverClass JDBC driver class name
     * @return resolved database type, or {@code null} when not recognized
     */
    private DialectMode resolveModeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)
                || "org.mariadb.jdbc.driver".equals(normalized)) {
            return DialectMode.MYSQL;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DialectMode.POSTGRESQL;
        }
        if ("org.h2.driver".equals(normalized)) {
            return DialectMode.H2;
        }
        return null;
    }

    /**
     * Resolves the database type from a JDBC URL.
     *
     * @param jdbcUrl JDBC URL
     * @return resolved database type, or {@code null} when not recognized
     */
    private DialectMode resolveModeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:mysql:") || normalized.startsWith("jdbc:mariadb:")) {
            return DialectMode.MYSQL;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DialectMode.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DialectMode.H2;
        }
        return null;
    }

    /**
     * Normalizes a string for case-insensitive comparison.
     *
     * @param value source string
     * @return lower-case trimmed value, or {@code null} when input is {@code null} or blank
     */
    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
