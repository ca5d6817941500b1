package io.dagexec.core.executor;

public interface ProgressReporter
{
    void start(String dagName, int total);

    void building(String taskName, int position, int total);

    void finish();

    static ProgressReporter empty()
    {
        return new ProgressReporter()
        {
            @Override
            public void start(String dagName, int total)
            { }

            @Override
            public void building(String taskName, int position, int total)
            { }

            @Override
            public void finish()
            { }
        };
    }
}
