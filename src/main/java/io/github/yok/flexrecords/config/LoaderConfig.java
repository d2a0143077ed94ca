package io.github.yok.flexrecords.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code loader} section in {@code application.yml}.
 *
 * <pre>
 * loader:
 *   dialect: MYSQL
 *   lookup-parallelism: 4
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "loader")
@Data
public class LoaderConfig {

    /**
     * Dialect applied to every connection. When {@code null}, the dialect is resolved per
     * connection from {@code driver-class} or the JDBC URL.
     */
    private DialectMode dialect;

    /**
     * Number of threads used for independent reference lookups. {@code 1} runs every lookup on the
     * calling thread.
     */
    private int lookupParallelism = 4;
}
