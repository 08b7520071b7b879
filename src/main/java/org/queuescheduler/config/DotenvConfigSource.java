package org.queuescheduler.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings from the process environment, falling back to a {@code .env} file.
 * Priority:
 *     1. System environment variable
 *     2. .env file in the given directory (optional, ignored if missing or malformed)
 */
public class DotenvConfigSource implements ConfigSource {
    private static final Logger logger = LoggerFactory.getLogger(DotenvConfigSource.class);

    private final Dotenv dotenv;

    public DotenvConfigSource(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /** Working directory {@code .env}, as used by the daemon. */
    public static DotenvConfigSource load() {
        return load("./");
    }

    public static DotenvConfigSource load(String directory) {
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .ignoreIfMalformed()
                .ignoreIfMissing()
                .load();
        logger.debug("Environment loaded (.env directory: {})", directory);
        return new DotenvConfigSource(dotenv);
    }

    @Override
    public String lookup(String name) {
        // Dotenv checks System.getenv before the file entries
        return dotenv.get(name);
    }
}
