package io.github.yok.flexrecords.util;

import com.google.common.base.Preconditions;
import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering content file paths for logs.
 *
 * <p>
 * If the given file is under {@code $PROJECT_ROOT/target/test-classes}, this utility returns the
 * path relative to that base; otherwise, it returns the absolute normalized path.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.flexrecords.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a file path for logs.
     *
     * @param file file or directory
     * @return path string rendered for logs
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public static String renderPathForLog(File file) {
        Preconditions.checkNotNull(file, "file must not be null");

        Path base = Paths.get(System.getProperty("user.dir"), "target", "test-classes")
                .toAbsolutePath().normalize();
        Path abs = file.toPath().toAbsolutePath().normalize();

        if (abs.startsWith(base)) {
            String rel = base.relativize(abs).toString();
            log.debug("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
            return rel;
        }
        return abs.toString();
    }
}
