package org.queuescheduler.config;

import org.queuescheduler.config.database.DatabaseSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strict accessors for required settings.
 * Every value is mandatory: there are no defaults and no caching,
 * and an absent name raises {@link ConfigurationException} with "NAME must be set".
 */
public class EnvConfig {
    private static final Logger logger = LoggerFactory.getLogger(EnvConfig.class);

    public static final String ENV_DATABASE_URL = "DARK_CONFIG_DATABASE_URL";

    public static final String ENV_PUSHER_APP_ID = "DARK_CONFIG_PUSHER_APP_ID";
    public static final String ENV_PUSHER_KEY    = "DARK_CONFIG_PUSHER_KEY";
    public static final String ENV_PUSHER_SECRET = "DARK_CONFIG_PUSHER_SECRET";
    public static final String ENV_PUSHER_HOST   = "DARK_CONFIG_PUSHER_HOST";

    private final ConfigSource source;

    public EnvConfig(ConfigSource source) {
        this.source = source;
    }

    public String requireString(String name) {
        String value;
        try {
            value = source.lookup(name);
        } catch (RuntimeException e) {
            throw new ConfigurationException(name + " must be set", e);
        }
        if (value == null) {
            logger.debug("Missing required setting '{}'", name);
            throw ConfigurationException.missing(name);
        }
        return value;
    }

    public DatabaseSettings databaseSettings() {
        return DatabaseSettings.fromUrl(ENV_DATABASE_URL, requireString(ENV_DATABASE_URL));
    }

    public String pusherAppId() {
        return requireString(ENV_PUSHER_APP_ID);
    }

    public String pusherKey() {
        return requireString(ENV_PUSHER_KEY);
    }

    public String pusherSecret() {
        return requireString(ENV_PUSHER_SECRET);
    }

    public String pusherHost() {
        return requireString(ENV_PUSHER_HOST);
    }
}
