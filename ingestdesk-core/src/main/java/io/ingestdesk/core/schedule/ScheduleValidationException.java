package io.ingestdesk.core.schedule;

import io.ingestdesk.client.config.ConfigException;

/**
 * Rejected schedule input. The message is meant to be shown to the operator
 * as is, next to the field being edited.
 */
public class ScheduleValidationException
        extends ConfigException
{
    public ScheduleValidationException(String message)
    {
        super(message);
    }

    public ScheduleValidationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
