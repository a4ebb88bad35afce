package io.ingestdesk.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Simple-mode schedule as typed into the form. Values are raw text and are
 * clamped into range when translated.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRestSimpleSchedule.class)
public interface RestSimpleSchedule
{
    // daily, every_hours, every_minutes or weekly
    String getMode();

    // HH:MM
    Optional<String> getAt();

    Optional<String> getEvery();

    // comma separated day numbers, 1=Mon..7=Sun
    Optional<String> getDays();

    static ImmutableRestSimpleSchedule.Builder builder()
    {
        return ImmutableRestSimpleSchedule.builder();
    }
}
