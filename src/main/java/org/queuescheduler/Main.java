package org.queuescheduler;

import org.queuescheduler.config.ConfigSource;
import org.queuescheduler.config.ConfigurationException;
import org.queuescheduler.config.DotenvConfigSource;
import org.queuescheduler.config.EnvConfig;
import org.queuescheduler.config.database.DatabaseSettings;
import org.queuescheduler.config.logging.ProcessMetadata;
import org.queuescheduler.config.logging.StructuredLogSink;
import org.queuescheduler.config.utils.LogContext;
import org.queuescheduler.services.MetricsTicker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Entry point
 * Build the JSON tick sink on stdout
 * Load the database URL from the environment
 * Connect once and tick forever
 *
 * Every failure ends the process with status 1; an external supervisor restarts it.
 * Diagnostics go to stderr so stdout only ever carries tick records.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        System.exit(run(DotenvConfigSource.load(), System.out));
    }

    /**
     * Runs the daemon until it fails. Returns the exit status; it never returns 0.
     */
    static int run(ConfigSource source, OutputStream tickStream) {
        ProcessMetadata meta = ProcessMetadata.capture();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting {} ------------]", meta.name());
            StructuredLogSink tickLog = StructuredLogSink.create(
                    StructuredLogSink.TICK_LOGGER, meta, Clock.systemDefaultZone(), tickStream);

            EnvConfig config = new EnvConfig(source);
            DatabaseSettings db = config.databaseSettings();
            logger.debug("Configuration loaded: {}", db);

            new MetricsTicker().run(db, tickLog);
        } catch (ConfigurationException e) {
            logger.error("[------------ Configuration error: {} ------------]", e.getMessage());
        } catch (SQLException e) {
            logger.error("[------------ Database error: {} ------------]", e.getMessage(), e);
        } catch (IOException e) {
            logger.error("[------------ Tick stream error: {} ------------]", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("[------------ Tick loop interrupted ------------]");
        } catch (Exception e) {
            logger.error("[------------ {} failed: {} ------------]", meta.name(), e.getMessage(), e);
        } finally {
            LogContext.clear();
        }
        return EXIT_FAILURE;
    }
}
