package io.dagexec.spi;

import java.io.Closeable;

public interface ResourceClient
        extends Closeable
{
    @Override
    void close();
}
