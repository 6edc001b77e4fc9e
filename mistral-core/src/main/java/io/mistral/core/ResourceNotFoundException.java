package io.mistral.core;

/**
 * An exception thrown when a required row (scheduled job, delayed call, lock target, etc.) does not exist.
 *
 * This exception is deterministic.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }
}
