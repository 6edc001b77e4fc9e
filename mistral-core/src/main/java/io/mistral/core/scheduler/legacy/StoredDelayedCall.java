package io.mistral.core.scheduler.legacy;

import org.immutables.value.Value;

import java.time.Instant;

@Value.Immutable
public abstract class StoredDelayedCall
        extends DelayedCall
{
    public abstract String getId();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();
}
