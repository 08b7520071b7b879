package org.queuescheduler.config.database;

import org.queuescheduler.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens the daemon's single PostgreSQL connection.
 * No pool and no reconnection: the caller owns the connection for the life of the process.
 */
public final class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private DatabaseManager() {}

    public static Connection connect(DatabaseSettings settings) throws SQLException {
        String caller = LogContext.enter("DatabaseManager");
        try {
            logger.info("Opening database connection to {} (SSL disabled)", settings.jdbcUrl());
            Connection conn = DriverManager.getConnection(settings.jdbcUrl(), settings.connectionProperties());

            logger.debug("Testing database connection...");
            if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                conn.close();
                throw new SQLException("Connection failed: connection is invalid.");
            }

            conn.setReadOnly(true);
            logger.info("Database connection successful!");
            return conn;
        } finally {
            LogContext.restore(caller);
        }
    }
}
