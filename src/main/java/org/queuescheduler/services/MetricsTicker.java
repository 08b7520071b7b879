package org.queuescheduler.services;

import org.queuescheduler.config.database.DatabaseManager;
import org.queuescheduler.config.database.DatabaseSettings;
import org.queuescheduler.config.logging.StructuredLogSink;
import org.queuescheduler.services.tasks.MetricsTickTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;

/**
 * Owns the daemon's single connection and its tick loop.
 *
 * <p>INITIALIZING until the connection is open, then TICKING for the rest of the process.
 * Any failure moves to TERMINATED and is rethrown; nothing is retried and the
 * connection is never reopened.
 */
public class MetricsTicker {
    private static final Logger logger = LoggerFactory.getLogger(MetricsTicker.class);

    public enum State { INITIALIZING, TICKING, TERMINATED }

    private final Sleeper sleeper;
    private volatile State state = State.INITIALIZING;

    public MetricsTicker() {
        this(Sleeper.THREAD);
    }

    public MetricsTicker(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public State state() {
        return state;
    }

    /** Connects, then ticks until the process dies. Only returns by throwing. */
    public void run(DatabaseSettings settings, StructuredLogSink tickLog) throws Exception {
        Connection conn;
        try {
            conn = DatabaseManager.connect(settings);
        } catch (Exception e) {
            state = State.TERMINATED;
            throw e;
        }
        run(conn, tickLog);
    }

    public void run(Connection conn, StructuredLogSink tickLog) throws Exception {
        if (state != State.INITIALIZING) {
            throw new IllegalStateException("Ticker already started (state " + state + ")");
        }
        state = State.TICKING;
        logger.info("[------------ Ticking ------------]");
        try {
            new TaskLoop(new MetricsTickTask(conn, tickLog), sleeper).run();
        } catch (Exception e) {
            state = State.TERMINATED;
            throw e;
        }
    }
}
