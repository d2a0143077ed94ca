package io.github.yok.flexrecords.config;

import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that manages DB connection settings loaded from {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: db1
 *     url: jdbc:mysql://localhost:3306/app
 *     user: app
 *     password: password
 *     driver-class: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections;

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "db1")
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name (optional with JDBC 4 auto-loading)
        private String driverClass;
    }
}
