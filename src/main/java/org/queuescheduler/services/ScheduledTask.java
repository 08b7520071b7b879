package org.queuescheduler.services;

import java.time.Duration;

public interface ScheduledTask {
    /**
     * A short name used for logging.
     */
    String name();

    /**
     * Pause before each execution.
     */
    Duration interval();

    /**
     * The work to do. Failures propagate; the loop does not catch them.
     */
    void execute() throws Exception;
}
