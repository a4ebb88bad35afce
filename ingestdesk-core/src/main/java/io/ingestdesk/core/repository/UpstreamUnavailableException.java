package io.ingestdesk.core.repository;

/**
 * An exception thrown by a store when its backend can't be reached.
 *
 * This exception is not deterministic. Callers may retry the same request.
 */
public class UpstreamUnavailableException
        extends RuntimeException
{
    public UpstreamUnavailableException(String message)
    {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public boolean isRetryable()
    {
        return true;
    }
}
