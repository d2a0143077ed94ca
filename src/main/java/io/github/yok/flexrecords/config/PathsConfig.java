package io.github.yok.flexrecords.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that reads the {@code data-path} property and composes the directory that
 * content files are loaded from.
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the absolute path for the content file directory.
     *
     * @return the path to the load directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getLoad() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + "load" : dataPath + "/load";
    }
}
