package org.queuescheduler.config.logging;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Name and start time of this process, captured once at startup.
 * Age is measured on the monotonic clock so wall-clock changes do not affect it.
 */
public final class ProcessMetadata {

    public static final String PROCESS_NAME = "queue-scheduler";

    private final String name;
    private final LongSupplier nanoClock;
    private final long startNanos;

    public ProcessMetadata(String name, LongSupplier nanoClock) {
        this.name = name;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    public static ProcessMetadata capture() {
        return new ProcessMetadata(PROCESS_NAME, System::nanoTime);
    }

    public String name() {
        return name;
    }

    /** Whole seconds elapsed since construction. */
    public long processAgeSeconds() {
        return TimeUnit.NANOSECONDS.toSeconds(nanoClock.getAsLong() - startNanos);
    }
}
