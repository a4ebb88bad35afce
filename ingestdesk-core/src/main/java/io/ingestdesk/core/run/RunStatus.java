package io.ingestdesk.core.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.ingestdesk.client.config.ConfigException;

/**
 * queued -> running -> success | failed | timeout | skipped | canceled.
 *
 * queued may also end directly in a terminal state. Terminal states have
 * no outgoing transitions.
 */
public enum RunStatus
{
    QUEUED("queued", false),
    RUNNING("running", false),
    SUCCESS("success", true),
    FAILED("failed", true),
    TIMEOUT("timeout", true),
    SKIPPED("skipped", true),
    CANCELED("canceled", true);

    private final String name;
    private final boolean terminal;

    RunStatus(String name, boolean terminal)
    {
        this.name = name;
        this.terminal = terminal;
    }

    @JsonValue
    public String getName()
    {
        return name;
    }

    public boolean isTerminal()
    {
        return terminal;
    }

    public boolean isActive()
    {
        return !terminal;
    }

    public boolean canTransitionTo(RunStatus next)
    {
        switch (this) {
        case QUEUED:
            return next != QUEUED;
        case RUNNING:
            return next.isTerminal();
        default:
            return false;
        }
    }

    @JsonCreator
    public static RunStatus fromName(String name)
    {
        for (RunStatus status : values()) {
            if (status.name.equals(name)) {
                return status;
            }
        }
        throw new ConfigException("Unknown run status: " + name);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
