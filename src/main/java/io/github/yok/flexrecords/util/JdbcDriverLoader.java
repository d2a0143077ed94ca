package io.github.yok.flexrecords.util;

import io.github.yok.flexrecords.config.ConnectionConfig;
import javax.sql.DataSource;
import lombok.Generated;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Utility for optional JDBC driver class loading and data source creation.
 *
 * <p>
 * When a driver class name is configured, it is loaded explicitly via {@link Class#forName(String)}.
 * When the value is {@code null} or blank, nothing is loaded so JDBC 4 auto-loading can be used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcDriverLoader {

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    public static void loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        Class.forName(driverClass);
    }

    /**
     * Creates a non-pooling {@link DataSource} for a connection entry.
     *
     * <p>
     * Every {@code getConnection()} opens a new physical connection, which keeps concurrent
     * reference lookups independent of each other.
     * </p>
     *
     * @param entry connection entry
     * @return data source
     * @throws ClassNotFoundException when the configured driver class cannot be found
     */
    public static DataSource createDataSource(ConnectionConfig.Entry entry)
            throws ClassNotFoundException {
        loadIfConfigured(entry.getDriverClass());
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setUrl(entry.getUrl());
        dataSource.setUsername(entry.getUser());
        dataSource.setPassword(entry.getPassword());
        return dataSource;
    }
}
