package com.feedwatch.engine.application.job;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.feedwatch.engine.application.config.Catalog;
import com.feedwatch.engine.domain.routing.NotificationRouter;
import com.feedwatch.engine.infrastructure.logging.LogForwardingAppender;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/** Forwards the application's warnings and errors to the notify refs configured under {@code reporter.log}. */
@Slf4j
@Component
public class LogReporterJob {

    private final Catalog catalog;
    private final NotificationRouter router;
    private final TaskExecutor executor;

    private LogForwardingAppender appender;

    public LogReporterJob(
            Catalog catalog, NotificationRouter router, @Qualifier("logForwardExecutor") TaskExecutor executor) {
        this.catalog = catalog;
        this.router = router;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (catalog.logRefs().isEmpty()) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Log forwarding needs Logback, found {}", LoggerFactory.getILoggerFactory().getClass().getName());
            return;
        }
        appender = new LogForwardingAppender(events -> router.route("reporter", catalog.logRefs(), events), executor);
        appender.setContext(context);
        appender.start();
        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
        log.info("Forwarding warnings to {} notify refs", catalog.logRefs().size());
    }

    @PreDestroy
    public void stop() {
        if (appender != null) {
            appender.stop();
            ((LoggerContext) LoggerFactory.getILoggerFactory())
                    .getLogger(Logger.ROOT_LOGGER_NAME)
                    .detachAppender(appender);
        }
    }
}
