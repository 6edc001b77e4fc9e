package io.mistral.core.lock;

import org.immutables.value.Value;

import java.time.Instant;

@Value.Immutable
public abstract class StoredNamedLock
{
    public abstract String getId();

    public abstract String getName();

    public abstract Instant getCreatedAt();
}
