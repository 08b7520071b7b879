package org.queuescheduler.services.tasks;

import org.queuescheduler.config.database.EventQueries;
import org.queuescheduler.config.logging.StructuredLogSink;
import org.queuescheduler.services.ScheduledTask;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Counts pending events and reports the count as one "tick" record.
 */
public class MetricsTickTask implements ScheduledTask {

    public static final Duration INTERVAL = Duration.ofSeconds(1);
    public static final String COUNT_FIELD = "new_events.count";

    private final Connection conn;
    private final StructuredLogSink tickLog;

    public MetricsTickTask(Connection conn, StructuredLogSink tickLog) {
        this.conn = conn;
        this.tickLog = tickLog;
    }

    @Override public String name() { return "MetricsTickTask"; }
    @Override public Duration interval() { return INTERVAL; }

    @Override
    public void execute() throws SQLException, IOException {
        long count = EventQueries.countNewEvents(conn);
        tickLog.logger().atInfo()
                .addKeyValue(COUNT_FIELD, count)
                .log("tick");
        // a tick that did not reach the stream is as fatal as a failed query
        tickLog.verifyWritten();
    }
}
