package org.queuescheduler.config.database;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Read-only queries against the events queue table.
 */
public final class EventQueries {

    public static final String COUNT_NEW_EVENTS = "SELECT COUNT(*) FROM events WHERE status = 'new'";

    private EventQueries() {}

    /**
     * Number of rows with status 'new' at the time of the query.
     * An empty result or a non-integer first column is an error.
     */
    public static long countNewEvents(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(COUNT_NEW_EVENTS)) {
            if (!rs.next()) {
                throw new SQLException("COUNT query returned no rows");
            }
            Object value = rs.getObject(1);
            if (!(value instanceof Number)) {
                throw new SQLException("COUNT query returned " +
                        (value == null ? "NULL" : value.getClass().getName()) + " instead of an integer");
            }
            return ((Number) value).longValue();
        }
    }
}
