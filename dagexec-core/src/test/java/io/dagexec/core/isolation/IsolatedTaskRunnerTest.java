package io.dagexec.core.isolation;

import java.io.IOException;
import java.nio.file.Path;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dagexec.client.ObjectMappers;
import io.dagexec.core.SampleCallables;
import io.dagexec.spi.TaskCallable;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class IsolatedTaskRunnerTest
{
    private static final ObjectMapper MAPPER = ObjectMappers.objectMapper();

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private Path input;
    private Path output;

    @Before
    public void setUp()
            throws IOException
    {
        input = tempFolder.getRoot().toPath().resolve("input.json");
        output = tempFolder.getRoot().toPath().resolve("output.json");
    }

    private void writeInput(String taskName, Class<?> callable, ObjectNode params)
            throws IOException
    {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("task", taskName);
        node.put("callable", callable.getName());
        node.set("state", MAPPER.createObjectNode());
        node.set("params", params);
        MAPPER.writeValue(input.toFile(), node);
    }

    @Test
    public void writesReport()
            throws IOException
    {
        ObjectNode params = MAPPER.createObjectNode().put("x", 1);
        writeInput("load", SampleCallables.Echo.class, params);

        int code = new IsolatedTaskRunner(MAPPER).run(input, output);

        assertThat(code, is(IsolatedTaskRunner.EXIT_SUCCESS));
        JsonNode report = MAPPER.readTree(output.toFile()).get("report");
        assertThat(report.get("taskName").asText(), is("load"));
        assertThat(report.get("output").get("x").asInt(), is(1));
        assertThat(report.get("output").get("task").asText(), is("load"));
    }

    @Test
    public void writesError()
            throws IOException
    {
        writeInput("clean", SampleCallables.Fail.class, MAPPER.createObjectNode().put("reason", "oops"));

        int code = new IsolatedTaskRunner(MAPPER).run(input, output);

        assertThat(code, is(IsolatedTaskRunner.EXIT_TASK_FAILED));
        JsonNode error = MAPPER.readTree(output.toFile()).get("error");
        assertThat(error.get("class").asText(), is("java.lang.IllegalStateException"));
        assertThat(error.get("message").asText(), is("task clean crashed with oops"));
        assertThat(error.get("trace").asText(), containsString("SampleCallables$Fail.call"));
    }

    @Test
    public void unknownCallableIsAnError()
            throws IOException
    {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("task", "load");
        node.put("callable", "io.dagexec.core.NoSuchCallable");
        node.set("state", MAPPER.createObjectNode());
        node.set("params", MAPPER.createObjectNode());
        MAPPER.writeValue(input.toFile(), node);

        int code = new IsolatedTaskRunner(MAPPER).run(input, output);

        assertThat(code, is(IsolatedTaskRunner.EXIT_TASK_FAILED));
        JsonNode error = MAPPER.readTree(output.toFile()).get("error");
        assertThat(error.get("class").asText(), is(ClassNotFoundException.class.getName()));
    }

    @Test
    public void newCallableRestoresState()
            throws ReflectiveOperationException, IOException
    {
        TaskCallable callable = IsolatedTaskRunner.newCallable(MAPPER, SampleCallables.Prefix.class.getName(),
                MAPPER.createObjectNode().put("prefix", "restored"));
        assertThat(callable, instanceOf(SampleCallables.Prefix.class));
        assertThat(((SampleCallables.Prefix) callable).getPrefix(), is("restored"));
    }

    @Test
    public void stateInPropertiesIsCarried()
    {
        IsolatedTaskRunner.checkStateCarried(MAPPER, SampleCallables.Prefix.class);
        IsolatedTaskRunner.checkStateCarried(MAPPER, SampleCallables.Echo.class);
    }

    @Test
    public void rejectsStateOutsideProperties()
    {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> IsolatedTaskRunner.checkStateCarried(MAPPER, SampleCallables.HiddenState.class));
        assertThat(ex.getMessage(), containsString("field 'calls' of io.dagexec.core.SampleCallables$HiddenState"));
    }

    @Test
    public void rejectsNonCallableClass()
    {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> IsolatedTaskRunner.checkInstantiable(String.class));
        assertThat(ex.getMessage(), is("java.lang.String is not a TaskCallable"));
    }

    @Test
    public void rejectsInnerClass()
    {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> IsolatedTaskRunner.checkInstantiable(Inner.class));
        assertThat(ex.getMessage(), containsString("is an inner class"));
    }

    public class Inner
        implements TaskCallable
    {
        @Override
        public io.dagexec.client.config.Config call(String taskName, io.dagexec.client.config.Config params)
        {
            return params;
        }
    }
}
