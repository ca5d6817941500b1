package io.dagexec.core.log;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import ch.qos.logback.classic.LoggerContext;
import io.dagexec.core.log.DagLogSink.LogSinkHandle;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

public class LogbackFileLogSinkTest
{
    private static final Logger logger = LoggerFactory.getLogger(LogbackFileLogSinkTest.class);

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @Test
    public void writesEventsWhileAttached()
            throws IOException
    {
        Path dir = tempFolder.getRoot().toPath();
        LogbackFileLogSink sink = new LogbackFileLogSink(context);

        LogSinkHandle handle = sink.attach("pipeline", dir, LogLevel.INFO);
        logger.info("while attached");
        handle.detach();
        logger.info("after detach");

        Path file = LogbackFileLogSink.logFilePath(dir, "pipeline");
        assertThat(file, is(dir.resolve("pipeline.log")));
        String content = new String(Files.readAllBytes(file), UTF_8);
        assertThat(content, containsString("while attached"));
        assertThat(content, not(containsString("after detach")));
    }

    @Test
    public void filtersBelowLevel()
            throws IOException
    {
        Path dir = tempFolder.getRoot().toPath();
        LogbackFileLogSink sink = new LogbackFileLogSink(context);

        LogSinkHandle handle = sink.attach("filtered", dir, LogLevel.WARN);
        logger.info("info message");
        logger.warn("warn message");
        handle.detach();

        String content = new String(Files.readAllBytes(dir.resolve("filtered.log")), UTF_8);
        assertThat(content, containsString("[WARN]"));
        assertThat(content, containsString("warn message"));
        assertThat(content, not(containsString("info message")));
    }

    @Test
    public void rejectsDagNameLeavingDirectory()
            throws IOException
    {
        Path dir = tempFolder.newFolder("logs").toPath();
        LogbackFileLogSink sink = new LogbackFileLogSink(context);
        ch.qos.logback.classic.Logger root = context.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME);

        assertThrows(IllegalArgumentException.class, () -> sink.attach("../escape", dir, LogLevel.INFO));
        assertThrows(IllegalArgumentException.class, () -> sink.attach("nested/name", dir, LogLevel.INFO));
        assertThrows(IllegalArgumentException.class, () -> LogbackFileLogSink.logFilePath(dir, ""));

        assertThat(Files.exists(tempFolder.getRoot().toPath().resolve("escape.log")), is(false));
        assertThat(root.getAppender(LogbackFileLogSink.appenderName("../escape")), nullValue());
    }

    @Test
    public void appenderIsRemovedFromRootLogger()
    {
        LogbackFileLogSink sink = new LogbackFileLogSink(context);
        ch.qos.logback.classic.Logger root = context.getLogger(ch.qos.logback.classic.Logger.ROOT_LOGGER_NAME);

        LogSinkHandle handle = sink.attach("removed", tempFolder.getRoot().toPath(), LogLevel.DEBUG);
        assertThat(root.getAppender(LogbackFileLogSink.appenderName("removed")), not(nullValue()));

        handle.detach();
        assertThat(root.getAppender(LogbackFileLogSink.appenderName("removed")), nullValue());
    }
}
