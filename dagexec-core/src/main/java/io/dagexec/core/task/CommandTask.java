package io.dagexec.core.task;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import io.dagexec.client.config.Config;
import io.dagexec.spi.SourceKind;
import io.dagexec.spi.TaskReport;
import io.dagexec.spi.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Locale.ENGLISH;

/**
 * A task that runs an external command. The command already runs in its own
 * process, so it's never isolated again.
 *
 * Build parameters are passed to the command as JSON in the
 * {@code DAGEXEC_PARAMS} environment variable.
 */
public class CommandTask
    extends AbstractTask
{
    private static final Logger logger = LoggerFactory.getLogger(CommandTask.class);

    static final String PARAMS_ENV = "DAGEXEC_PARAMS";

    private final List<String> commandLine;
    private final Path workingDirectory;

    public CommandTask(String name, List<String> commandLine, Path workingDirectory)
    {
        this(name, commandLine, workingDirectory, TaskStatus.WAITING);
    }

    public CommandTask(String name, List<String> commandLine, Path workingDirectory, TaskStatus entryStatus)
    {
        super(name, entryStatus);
        this.commandLine = ImmutableList.copyOf(commandLine);
        this.workingDirectory = workingDirectory;
    }

    @Override
    public SourceKind getSourceKind()
    {
        return SourceKind.EXTERNAL_DELEGATE;
    }

    @Override
    public TaskReport build(Config params)
    {
        Stopwatch stopwatch = Stopwatch.createStarted();

        ProcessBuilder pb = new ProcessBuilder(commandLine);
        pb.directory(workingDirectory.toFile());
        pb.redirectErrorStream(true);
        pb.environment().put(PARAMS_ENV, params.toString());

        int exitCode;
        try {
            Process p = pb.start();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(p.getInputStream(), UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.info("[{}] {}", getName(), line);
                }
            }
            exitCode = p.waitFor();
        }
        catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for command of task " + getName(), ex);
        }

        if (exitCode != 0) {
            throw new RuntimeException(String.format(ENGLISH, "Command %s failed with code %d", commandLine, exitCode));
        }

        return TaskReport.builder()
            .taskName(getName())
            .ran(true)
            .elapsedMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))
            .output(params.getFactory().create().set("exit_code", exitCode))
            .build();
    }
}
