package io.mistral.core.database;

import org.jdbi.v3.core.Handle;

public interface Transaction
{
    Handle getHandle();

    void commit();

    void abort();
}
