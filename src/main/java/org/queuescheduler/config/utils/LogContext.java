package org.queuescheduler.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC context for the diagnostic log.
 * Adds "component" and "trace.id" to every diagnostic entry; tick records do not carry MDC.
 */
public class LogContext {
    private LogContext() {}

    public static void start(String component) {
        MDC.put("component", component);
        MDC.put("trace.id", UUID.randomUUID().toString());
    }

    public static void start(String component, String traceId) {
        MDC.put("component", component);
        MDC.put("trace.id", traceId != null ? traceId : UUID.randomUUID().toString());
    }

    public static void clear() {
        MDC.clear();
    }

    /** Switches the component, keeping the current trace id. Returns the previous component. */
    public static String enter(String component) {
        String previous = MDC.get("component");
        start(component, getTraceId());
        return previous;
    }

    public static void restore(String component) {
        if (component == null) {
            MDC.remove("component");
        } else {
            MDC.put("component", component);
        }
    }

    public static String getTraceId() {
        return MDC.get("trace.id");
    }
}
