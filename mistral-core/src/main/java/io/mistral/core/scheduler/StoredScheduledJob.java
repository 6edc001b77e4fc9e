package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import org.immutables.value.Value;

import java.time.Instant;

@Value.Immutable
public abstract class StoredScheduledJob
        extends ScheduledJob
{
    public abstract String getId();

    public abstract Instant getCreatedAt();

    public abstract Optional<Instant> getUpdatedAt();
}
