package io.dagexec.core.log;

import java.nio.file.Path;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.google.common.base.CharMatcher;
import com.google.inject.Inject;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Writes every log event of a run to {@code <directory>/<dagName>.log} by
 * attaching a file appender to the logback root logger.
 */
public class LogbackFileLogSink
    implements DagLogSink
{
    private static final CharMatcher FILE_NAME_UNSAFE = CharMatcher.anyOf("/\\\0");

    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS Z} [%level] (%thread\\) %logger: %m%n";

    private final LoggerContext context;

    @Inject
    public LogbackFileLogSink()
    {
        this((LoggerContext) LoggerFactory.getILoggerFactory());
    }

    public LogbackFileLogSink(LoggerContext context)
    {
        this.context = context;
    }

    @Override
    public LogSinkHandle attach(String dagName, Path directory, LogLevel level)
    {
        Path file = logFilePath(directory, dagName);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        ThresholdFilter filter = new ThresholdFilter();
        filter.setLevel(level.toLogbackLevel().toString());
        filter.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(appenderName(dagName));
        appender.setFile(file.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.addFilter(filter);
        appender.start();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);

        return () -> {
            root.detachAppender(appender);
            appender.stop();
        };
    }

    /**
     * @throws IllegalArgumentException if the DAG name is empty or contains a path separator
     */
    public static Path logFilePath(Path directory, String dagName)
    {
        checkArgument(!dagName.isEmpty() && FILE_NAME_UNSAFE.matchesNoneOf(dagName),
                "DAG name can't be used as a log file name: '%s'", dagName);
        return directory.resolve(dagName + ".log");
    }

    static String appenderName(String dagName)
    {
        return "dagexec-" + dagName;
    }
}
