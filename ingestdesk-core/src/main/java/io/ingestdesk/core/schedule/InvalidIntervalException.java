package io.ingestdesk.core.schedule;

public class InvalidIntervalException
        extends ScheduleValidationException
{
    public InvalidIntervalException(String message)
    {
        super(message);
    }
}
