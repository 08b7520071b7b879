package org.queuescheduler.config;

/**
 * A required setting is missing or unusable.
 * Not meant to be caught below {@code Main}.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException missing(String name) {
        return new ConfigurationException(name + " must be set");
    }
}
