package io.dagexec.spi;

public enum SourceKind
{
    // logic is a Java object in this JVM; eligible for isolation
    IN_MEMORY_CALLABLE,
    // logic is delegated to something that already runs out of process
    EXTERNAL_DELEGATE;
}
