package io.ingestdesk.core.repository;

/**
 * An exception thrown when a request conflicts with the current state of a
 * resource, for example an active run already exists for the job.
 *
 * This exception is deterministic.
 */
public class ResourceConflictException extends Exception
{
    public ResourceConflictException(String message)
    {
        super(message);
    }

    public ResourceConflictException(Throwable cause)
    {
        super(cause);
    }

    public ResourceConflictException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
