package org.queuescheduler.config;

/**
 * Raw lookup of a named setting.
 * Returns {@code null} when the setting is absent; an empty string is a value.
 */
@FunctionalInterface
public interface ConfigSource {
    String lookup(String name);
}
