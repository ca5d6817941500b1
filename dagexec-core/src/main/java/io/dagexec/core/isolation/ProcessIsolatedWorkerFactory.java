package io.dagexec.core.isolation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.inject.Inject;
import io.dagexec.client.config.Config;
import io.dagexec.client.config.ConfigException;
import io.dagexec.core.config.ExecutorConfig;
import io.dagexec.core.task.CallableTask;
import io.dagexec.spi.Task;
import io.dagexec.spi.TaskCallable;
import io.dagexec.spi.TaskReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Locale.ENGLISH;

/**
 * Builds each task in a child JVM that exits once the task is done, so
 * everything the task allocated is returned to the operating system.
 *
 * <p>
 * The child runs {@link IsolatedTaskRunner}. Parent and child talk through
 * two files in a temporary directory: {@code input.json} carries the task
 * name, the class of its {@link TaskCallable} with its state as JSON and the
 * build parameters; {@code output.json} carries either the report or the error.
 * </p>
 */
public class ProcessIsolatedWorkerFactory
    implements IsolatedWorkerFactory
{
    private static final Logger logger = LoggerFactory.getLogger(ProcessIsolatedWorkerFactory.class);

    static final String INPUT_FILE = "input.json";
    static final String OUTPUT_FILE = "output.json";

    private final ObjectMapper mapper;
    private final ObjectMapper stateMapper;
    private final Path javaCommand;
    private final String classPath;
    private final List<String> jvmOptions;

    @Inject
    public ProcessIsolatedWorkerFactory(ObjectMapper mapper, ExecutorConfig config)
    {
        this(mapper,
                Paths.get(System.getProperty("java.home"), "bin", "java"),
                System.getProperty("java.class.path"),
                config.getIsolationJvmOptions());
    }

    public ProcessIsolatedWorkerFactory(ObjectMapper mapper, Path javaCommand, String classPath, List<String> jvmOptions)
    {
        this.mapper = mapper;
        // callables without properties are written as {}
        this.stateMapper = mapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.javaCommand = javaCommand;
        this.classPath = classPath;
        this.jvmOptions = ImmutableList.copyOf(jvmOptions);
    }

    @Override
    public IsolationMode getType()
    {
        return IsolationMode.PROCESS;
    }

    @Override
    public IsolatedWorker acquire()
    {
        try {
            return new ProcessIsolatedWorker(Files.createTempDirectory("dagexec-worker-"));
        }
        catch (IOException ex) {
            throw new UncheckedIOException("Failed to create a directory for an isolated worker", ex);
        }
    }

    @VisibleForTesting
    List<String> buildCommandLine(Path inputPath, Path outputPath)
    {
        return ImmutableList.<String>builder()
            .add(javaCommand.toString())
            .addAll(jvmOptions)
            .add("-cp", classPath)
            .add(IsolatedTaskRunner.class.getName())
            .add(inputPath.toString())
            .add(outputPath.toString())
            .build();
    }

    class ProcessIsolatedWorker
        implements IsolatedWorker
    {
        private final Path workDir;
        private Process process;

        ProcessIsolatedWorker(Path workDir)
        {
            this.workDir = workDir;
        }

        Path getWorkDir()
        {
            return workDir;
        }

        @Override
        public TaskReport submit(Task task, Config params)
        {
            checkState(process == null, "An isolated worker builds only one task");

            TaskCallable callable = isolatableCallable(task);
            JsonNode state = callableState(task, callable);
            Path inputPath = workDir.resolve(INPUT_FILE);
            Path outputPath = workDir.resolve(OUTPUT_FILE);

            int exitCode;
            try {
                ObjectNode input = mapper.createObjectNode();
                input.put("task", task.getName());
                input.put("callable", callable.getClass().getName());
                input.set("state", state);
                input.set("params", params.getInternalObjectNode());
                mapper.writeValue(inputPath.toFile(), input);

                ProcessBuilder pb = new ProcessBuilder(buildCommandLine(inputPath, outputPath));
                pb.directory(workDir.toFile());
                pb.redirectErrorStream(true);

                logger.debug("Starting isolated worker for task {}: {}", task.getName(), pb.command());
                process = pb.start();
                copyOutput(task.getName(), process.getInputStream());

                // no timeout: a worker that never exits blocks the run
                exitCode = process.waitFor();
            }
            catch (IOException ex) {
                throw new UncheckedIOException("Failed to run isolated worker of task " + task.getName(), ex);
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while waiting for isolated worker of task " + task.getName(), ex);
            }

            return readOutput(task, outputPath, exitCode);
        }

        private TaskReport readOutput(Task task, Path outputPath, int exitCode)
        {
            if (!Files.exists(outputPath)) {
                throw new RuntimeException(String.format(ENGLISH,
                            "Isolated worker of task %s exited with code %d without writing %s",
                            task.getName(), exitCode, OUTPUT_FILE));
            }

            JsonNode output;
            try {
                output = mapper.readTree(outputPath.toFile());
            }
            catch (IOException ex) {
                throw new UncheckedIOException("Failed to read output of isolated worker of task " + task.getName(), ex);
            }

            JsonNode error = output.get("error");
            if (error != null) {
                JsonNode message = error.get("message");
                throw new IsolatedBuildException(
                        error.get("class").asText(),
                        message == null || message.isNull() ? Optional.absent() : Optional.of(message.asText()),
                        error.get("trace").asText());
            }

            try {
                return mapper.treeToValue(output.get("report"), TaskReport.class);
            }
            catch (IOException ex) {
                throw new UncheckedIOException("Invalid report of isolated worker of task " + task.getName(), ex);
            }
        }

        @Override
        public void close()
        {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                MoreFiles.deleteRecursively(workDir, RecursiveDeleteOption.ALLOW_INSECURE);
            }
            catch (IOException ex) {
                logger.warn("Failed to delete working directory of isolated worker {}", workDir, ex);
            }
        }
    }

    private TaskCallable isolatableCallable(Task task)
    {
        if (!(task instanceof CallableTask)) {
            throw new ConfigException(String.format(ENGLISH,
                        "Task %s can't be built in an isolated process because it is a %s, not a %s",
                        task.getName(), task.getClass().getName(), CallableTask.class.getSimpleName()));
        }
        TaskCallable callable = ((CallableTask) task).getCallable();
        try {
            IsolatedTaskRunner.checkInstantiable(callable.getClass());
            IsolatedTaskRunner.checkStateCarried(stateMapper, callable.getClass());
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException(String.format(ENGLISH,
                        "Task %s can't be built in an isolated process: %s", task.getName(), ex.getMessage()), ex);
        }
        return callable;
    }

    private JsonNode callableState(Task task, TaskCallable callable)
    {
        try {
            return stateMapper.valueToTree(callable);
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException(String.format(ENGLISH,
                        "Task %s can't be built in an isolated process: failed to write %s as JSON",
                        task.getName(), callable.getClass().getName()), ex);
        }
    }

    private static void copyOutput(String taskName, InputStream in)
        throws IOException
    {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.info("[{}] {}", taskName, line);
            }
        }
    }
}
