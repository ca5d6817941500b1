package io.dagexec.core;

import java.util.List;
import java.util.Properties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.dagexec.client.config.Config;
import io.dagexec.client.config.ConfigFactory;
import io.dagexec.core.config.ExecutorConfig;
import io.dagexec.core.executor.DagBuildException;
import io.dagexec.core.executor.DagExecutor;
import io.dagexec.core.executor.SerialExecutor;
import io.dagexec.core.isolation.IsolatedWorkerFactory;
import io.dagexec.core.isolation.IsolationMode;
import io.dagexec.core.isolation.ProcessIsolatedWorkerFactory;
import io.dagexec.core.isolation.ThreadIsolatedWorkerFactory;
import io.dagexec.core.task.CallableTask;
import io.dagexec.spi.Dag;
import io.dagexec.spi.TaskReport;
import io.dagexec.spi.TaskStatus;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class DagExecEmbedTest
{
    private static DagExecEmbed embed(String... keyValues)
    {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new DagExecEmbed.Bootstrap()
            .setSystemConfig(props)
            .initialize();
    }

    @Test
    public void processIsolationByDefault()
    {
        DagExecEmbed embed = embed();

        ExecutorConfig config = embed.getInjector().getInstance(ExecutorConfig.class);
        assertThat(config.getIsolationMode(), is(IsolationMode.PROCESS));
        assertThat(embed.getInjector().getInstance(IsolatedWorkerFactory.class), instanceOf(ProcessIsolatedWorkerFactory.class));
        assertThat(embed.getExecutor(), instanceOf(SerialExecutor.class));
    }

    @Test
    public void injectedMapperReadsConfig()
            throws Exception
    {
        DagExecEmbed embed = embed();
        ObjectMapper mapper = embed.getInjector().getInstance(ObjectMapper.class);

        Config config = mapper.readValue("{\"rows\":5}", Config.class);

        assertThat(config.get("rows", int.class), is(5));
        assertThat(config.getFactory().create().set("a", 1).get("a", int.class), is(1));
        assertThat(embed.getInjector().getInstance(ObjectMapper.class), sameInstance(mapper));
    }

    @Test
    public void threadIsolation()
    {
        DagExecEmbed embed = embed("executor.isolation-mode", "thread");
        assertThat(embed.getInjector().getInstance(IsolatedWorkerFactory.class), instanceOf(ThreadIsolatedWorkerFactory.class));
    }

    @Test
    public void buildsDag()
    {
        DagExecEmbed embed = embed("executor.isolation-mode", "thread");
        DagExecutor executor = embed.getExecutor();
        Config params = embed.getInjector().getInstance(ConfigFactory.class).create(ImmutableMap.of("date", "2026-10-19"));

        CallableTask extract = new CallableTask("extract", new SampleCallables.Echo());
        CallableTask report = new CallableTask("report", new SampleCallables.Echo());
        Dag dag = Dag.builder()
            .name("daily")
            .addTasks(extract, report)
            .build();

        List<TaskReport> reports = executor.execute(dag, true, params);

        assertThat(reports, hasSize(2));
        assertThat(reports.get(1).getOutput().get("date", String.class), is("2026-10-19"));
        assertThat(extract.getStatus(), is(TaskStatus.EXECUTED));
        assertThat(report.getStatus(), is(TaskStatus.EXECUTED));
    }

    @Test
    public void failingDagWithoutIsolation()
    {
        DagExecutor executor = embed("executor.build-in-subprocess", "false").getExecutor();
        Config params = embed().getInjector().getInstance(ConfigFactory.class).create();

        CallableTask broken = new CallableTask("broken", new SampleCallables.Fail());
        CallableTask after = new CallableTask("after", new SampleCallables.Echo(), TaskStatus.ABORTED,
                Optional.absent());
        Dag dag = Dag.builder()
            .name("failing")
            .addTasks(broken, after)
            .build();

        DagBuildException ex = assertThrows(DagBuildException.class, () -> executor.execute(dag, false, params));
        assertThat(ex.getFailures(), hasSize(1));
        assertThat(broken.getStatus(), is(TaskStatus.ERRORED));
        assertThat(after.getStatus(), is(TaskStatus.ABORTED));
    }
}
