package io.mistral.core.scheduler;

/**
 * Converts a job argument to a JSON-compatible value (maps, lists, strings, numbers,
 * booleans) and back.
 */
public interface ArgumentSerializer <T>
{
    Object serialize(T value);

    T deserialize(Object serialized);
}
