package org.luxbulb.webinfo.enricher;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.jetbrains.annotations.NotNull;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Applies the logging options of the command line to the Logback backend.
 */
public final class LoggingConfigurator {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String FILE_APPENDER_NAME = "FILE";
    static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger - %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * Replaces the root file appender with one that appends to the given file. Missing parent directories
     * are created.
     *
     * @param path The log file.
     * @return True if the file appender was replaced.
     */
    public static boolean useLogFile(@NotNull Path path) {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            Logger.warn("Cannot log to {}: the logging backend {} is not Logback", path,
                    factory.getClass().getName());
            return false;
        }

        final var context = (LoggerContext) factory;
        final var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        final var appender = new FileAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName(FILE_APPENDER_NAME);
        appender.setFile(path.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        if (!appender.isStarted()) {
            Logger.warn("Cannot open the log file {}", path);
            return false;
        }

        final var root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        final var previous = root.getAppender(FILE_APPENDER_NAME);
        if (previous != null) {
            root.detachAppender(previous);
            previous.stop();
        }
        root.addAppender(appender);

        Logger.debug("Logging to {}", path);
        return true;
    }
}
