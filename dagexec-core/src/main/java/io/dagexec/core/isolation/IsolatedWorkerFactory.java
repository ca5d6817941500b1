package io.dagexec.core.isolation;

public interface IsolatedWorkerFactory
{
    IsolationMode getType();

    IsolatedWorker acquire();
}
