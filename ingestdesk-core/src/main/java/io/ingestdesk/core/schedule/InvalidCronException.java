package io.ingestdesk.core.schedule;

public class InvalidCronException
        extends ScheduleValidationException
{
    public InvalidCronException(String message)
    {
        super(message);
    }
}
