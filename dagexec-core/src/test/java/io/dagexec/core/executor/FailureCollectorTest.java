package io.dagexec.core.executor;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class FailureCollectorTest
{
    @Test
    public void emptyCollector()
    {
        FailureCollector collector = new FailureCollector();

        assertThat(collector.isEmpty(), is(true));
        assertThat(collector.size(), is(0));
        assertThat(collector.render(), is(""));
    }

    @Test
    public void rendersOneBlockPerFailureInOrder()
    {
        FailureCollector collector = new FailureCollector();
        collector.append("CallableTask: load", "java.lang.RuntimeException: no file\n\tat Load.call(Load.java:10)\n");
        collector.append("CommandTask: plot", "java.lang.RuntimeException: exit 1");

        String expected =
            "------------------------------ CallableTask: load ------------------------------\n" +
            "java.lang.RuntimeException: no file\n" +
            "\tat Load.call(Load.java:10)\n" +
            "\n" +
            "------------------------------ CommandTask: plot -------------------------------\n" +
            "java.lang.RuntimeException: exit 1\n";

        assertThat(collector.isEmpty(), is(false));
        assertThat(collector.size(), is(2));
        assertThat(collector.render(), is(expected));
        assertThat(collector.getRecords().get(1).getTaskIdentity(), is("CommandTask: plot"));
    }

    @Test
    public void headerIsCentered()
    {
        String header = FailureCollector.header("x");

        assertThat(header.length(), is(FailureCollector.HEADER_WIDTH));
        assertThat(header.indexOf(" x "), is(38));
    }

    @Test
    public void longIdentityIsNotTruncated()
    {
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            name.append('t');
        }

        assertThat(FailureCollector.header(name.toString()), is(" " + name + " "));
    }
}
