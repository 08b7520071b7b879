package org.queuescheduler.config.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.slf4j.LoggerFactory;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

/**
 * The JSON-lines logger the ticker writes to.
 *
 * <p>Every record carries:
 * <ul>
 *   <li>{@code meta.name} - static process name</li>
 *   <li>{@code meta.process_age_s} - whole seconds since process start, computed per record</li>
 *   <li>{@code timestamp} - local wall-clock time, RFC 3339, computed per record</li>
 *   <li>{@code msg} - the log message</li>
 * </ul>
 * followed by the record's own key/value pairs.
 *
 * <p>The logger is wired in code, not through logback.xml, and does not propagate
 * to the root appenders. The appender holds a lock around each write, so lines
 * from concurrent callers never interleave.
 *
 * <p>Logback reports write errors as status messages only. {@link #verifyWritten()}
 * surfaces them so a broken stream stops the daemon.
 */
public final class StructuredLogSink {

    public static final String TICK_LOGGER = "queue-scheduler.ticks";

    /** Fixed nine-digit fraction, numeric offset even for UTC ("+00:00", never "Z"). */
    static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS")
            .appendOffset("+HH:MM", "+00:00")
            .toFormatter();

    private final Logger logger;
    private final OutputStreamAppender<ILoggingEvent> appender;
    private final FailureTrackingOutputStream out;
    private final PrintStream printStream;

    private StructuredLogSink(Logger logger, OutputStreamAppender<ILoggingEvent> appender,
                              FailureTrackingOutputStream out, PrintStream printStream) {
        this.logger = logger;
        this.appender = appender;
        this.out = out;
        this.printStream = printStream;
    }

    public static StructuredLogSink create(String loggerName, ProcessMetadata meta, Clock clock, OutputStream target) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();

        JsonLineLayout layout = new JsonLineLayout()
                .addField("meta.name", FieldProvider.constant(meta.name()))
                .addField("meta.process_age_s", event -> meta.processAgeSeconds())
                .addField("timestamp", event -> OffsetDateTime.now(clock).format(RFC3339))
                .addField("msg", ILoggingEvent::getFormattedMessage);
        layout.setContext(ctx);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(ctx);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.setLayout(layout);
        encoder.start();

        FailureTrackingOutputStream tracked = new FailureTrackingOutputStream(target);

        OutputStreamAppender<ILoggingEvent> appender = new OutputStreamAppender<>();
        appender.setContext(ctx);
        appender.setName(loggerName + "-json");
        appender.setEncoder(encoder);
        appender.setImmediateFlush(true);
        appender.setOutputStream(tracked);
        appender.start();

        Logger logger = ctx.getLogger(loggerName);
        logger.detachAndStopAllAppenders();
        logger.setAdditive(false);
        logger.setLevel(Level.INFO);
        logger.addAppender(appender);

        PrintStream printStream = target instanceof PrintStream ? (PrintStream) target : null;
        return new StructuredLogSink(logger, appender, tracked, printStream);
    }

    public org.slf4j.Logger logger() {
        return logger;
    }

    /**
     * Throws if any write to the tick stream has failed so far.
     * A {@link PrintStream} target never throws, so its error flag is checked too.
     */
    public void verifyWritten() throws IOException {
        IOException failure = out.failure();
        if (failure != null) {
            throw new IOException("Tick stream write failed: " + failure.getMessage(), failure);
        }
        if (printStream != null && printStream.checkError()) {
            throw new IOException("Tick stream write failed: output stream reported an error");
        }
        if (!appender.isStarted()) {
            throw new IOException("Tick stream appender " + appender.getName() + " is stopped");
        }
    }

    /** Remembers the first write or flush failure and rethrows it to the appender. */
    private static final class FailureTrackingOutputStream extends FilterOutputStream {
        private volatile IOException failure;

        FailureTrackingOutputStream(OutputStream target) {
            super(target);
        }

        IOException failure() {
            return failure;
        }

        @Override
        public void write(int b) throws IOException {
            try {
                out.write(b);
            } catch (IOException e) {
                throw record(e);
            }
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            try {
                out.write(b, off, len);
            } catch (IOException e) {
                throw record(e);
            }
        }

        @Override
        public void flush() throws IOException {
            try {
                out.flush();
            } catch (IOException e) {
                throw record(e);
            }
        }

        private IOException record(IOException e) {
            if (failure == null) {
                failure = e;
            }
            return e;
        }
    }
}
