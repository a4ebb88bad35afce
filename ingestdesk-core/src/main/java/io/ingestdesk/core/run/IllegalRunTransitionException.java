package io.ingestdesk.core.run;

/**
 * An exception thrown when a run can't move to the requested status, for
 * example marking a finished run as timed out. The run is left unchanged.
 *
 * This exception is deterministic.
 */
public class IllegalRunTransitionException
        extends Exception
{
    private final long runId;
    private final RunStatus from;
    private final RunStatus to;

    public IllegalRunTransitionException(long runId, RunStatus from, RunStatus to)
    {
        super(String.format("Run %d is %s and can't transition to %s", runId, from, to));
        this.runId = runId;
        this.from = from;
        this.to = to;
    }

    public long getRunId()
    {
        return runId;
    }

    public RunStatus getFrom()
    {
        return from;
    }

    public RunStatus getTo()
    {
        return to;
    }
}
