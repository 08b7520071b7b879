package org.queuescheduler.config.database;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventQueriesTest {

    @Mock Connection conn;
    @Mock Statement statement;
    @Mock ResultSet rs;

    @BeforeEach
    void setUp() throws SQLException {
        when(conn.createStatement()).thenReturn(statement);
    }

    @Test
    void issuesFixedCountQuery() throws SQLException {
        when(statement.executeQuery(anyString())).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn(3L);

        assertEquals(3L, EventQueries.countNewEvents(conn));

        verify(statement).executeQuery("SELECT COUNT(*) FROM events WHERE status = 'new'");
        verify(rs).close();
        verify(statement).close();
    }

    @Test
    void zeroCount() throws SQLException {
        when(statement.executeQuery(EventQueries.COUNT_NEW_EVENTS)).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn(0L);

        assertEquals(0L, EventQueries.countNewEvents(conn));
    }

    @Test
    void acceptsAnyIntegerType() throws SQLException {
        when(statement.executeQuery(EventQueries.COUNT_NEW_EVENTS)).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn(7);

        assertEquals(7L, EventQueries.countNewEvents(conn));
    }

    @Test
    void noRowsIsAnError() throws SQLException {
        when(statement.executeQuery(EventQueries.COUNT_NEW_EVENTS)).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        SQLException e = assertThrows(SQLException.class, () -> EventQueries.countNewEvents(conn));
        assertEquals("COUNT query returned no rows", e.getMessage());
    }

    @Test
    void nonIntegerIsAnError() throws SQLException {
        when(statement.executeQuery(EventQueries.COUNT_NEW_EVENTS)).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn("three");

        assertThrows(SQLException.class, () -> EventQueries.countNewEvents(conn));
    }

    @Test
    void nullIsAnError() throws SQLException {
        when(statement.executeQuery(EventQueries.COUNT_NEW_EVENTS)).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn(null);

        assertThrows(SQLException.class, () -> EventQueries.countNewEvents(conn));
    }

    @Test
    void queryFailurePropagates() throws SQLException {
        SQLException boom = new SQLException("relation \"events\" does not exist");
        when(statement.executeQuery(EventQueries.COUNT_NEW_EVENTS)).thenThrow(boom);

        assertSame(boom, assertThrows(SQLException.class, () -> EventQueries.countNewEvents(conn)));
        verify(statement).close();
    }
}
