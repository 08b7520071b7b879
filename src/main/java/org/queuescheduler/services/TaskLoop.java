package org.queuescheduler.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one task forever on the calling thread: sleep the task's interval, then execute it.
 *
 * <p>There is no thread pool, no catch-up and no retry. The first exception thrown by the
 * task (or an interrupt during the sleep) ends the loop and propagates to the caller.
 */
public class TaskLoop {
    private static final Logger logger = LoggerFactory.getLogger(TaskLoop.class);

    private final ScheduledTask task;
    private final Sleeper sleeper;

    public TaskLoop(ScheduledTask task) {
        this(task, Sleeper.THREAD);
    }

    public TaskLoop(ScheduledTask task, Sleeper sleeper) {
        this.task = task;
        this.sleeper = sleeper;
    }

    public void run() throws Exception {
        logger.info("Running task {} every {}ms", task.name(), task.interval().toMillis());
        while (true) {
            sleeper.sleep(task.interval());
            task.execute();
        }
    }
}
