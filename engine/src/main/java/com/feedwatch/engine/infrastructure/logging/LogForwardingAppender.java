package com.feedwatch.engine.infrastructure.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.AppenderBase;
import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.event.ChangeKind;
import com.feedwatch.common.event.ChangePayload.LogRecord;
import com.feedwatch.common.id.EventIdGenerator;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.core.task.TaskExecutor;

/**
 * Turns WARN and ERROR records into {@link ChangeKind#LOG} events and hands them to a consumer on
 * the given executor, so a slow chat API never blocks the thread that logged. The executor decides
 * what happens when records arrive faster than they are delivered.
 *
 * <p>Anything logged while an event is being forwarded is not forwarded again; otherwise a failing
 * delivery would report its own failure forever.
 */
public class LogForwardingAppender extends AppenderBase<ILoggingEvent> {

    public static final String NAME = "FEEDWATCH_FORWARD";
    private static final String ORIGIN = "reporter";

    private static final ThreadLocal<Boolean> FORWARDING = ThreadLocal.withInitial(() -> false);

    private final Consumer<List<ChangeEvent>> forwarder;
    private final TaskExecutor executor;

    public LogForwardingAppender(Consumer<List<ChangeEvent>> forwarder, TaskExecutor executor) {
        this.forwarder = forwarder;
        this.executor = executor;
        setName(NAME);
    }

    @Override
    protected void append(ILoggingEvent record) {
        if (FORWARDING.get() || !record.getLevel().isGreaterOrEqual(Level.WARN)) {
            return;
        }
        var event = toEvent(record);
        executor.execute(() -> forward(event));
    }

    private void forward(ChangeEvent event) {
        FORWARDING.set(true);
        try {
            forwarder.accept(List.of(event));
        } catch (RuntimeException e) {
            addError("Failed to forward log record", e);
        } finally {
            FORWARDING.set(false);
        }
    }

    static ChangeEvent toEvent(ILoggingEvent record) {
        var message = record.getFormattedMessage();
        if (record.getThrowableProxy() != null) {
            message = message + "\n" + ThrowableProxyUtil.asString(record.getThrowableProxy());
        }
        return ChangeEvent.builder()
                .eventId(EventIdGenerator.next())
                .subscriptionName(ORIGIN)
                .platform("log")
                .kind(ChangeKind.LOG)
                .payload(new LogRecord(record.getLevel().toString(), record.getLoggerName(), message))
                .detectedAt(Instant.ofEpochMilli(record.getTimeStamp()))
                .build();
    }
}
