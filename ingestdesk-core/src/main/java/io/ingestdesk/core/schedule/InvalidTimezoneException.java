package io.ingestdesk.core.schedule;

public class InvalidTimezoneException
        extends ScheduleValidationException
{
    public InvalidTimezoneException(String message)
    {
        super(message);
    }

    public InvalidTimezoneException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
