package io.ingestdesk.core.run;

import io.ingestdesk.client.config.ConfigException;
import org.junit.Test;

import static io.ingestdesk.client.ObjectMappers.objectMapper;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class RunStatusTest
{
    @Test
    public void activeAndTerminal()
    {
        assertThat(RunStatus.QUEUED.isActive(), is(true));
        assertThat(RunStatus.RUNNING.isActive(), is(true));
        for (RunStatus status : new RunStatus[] {RunStatus.SUCCESS, RunStatus.FAILED, RunStatus.TIMEOUT, RunStatus.SKIPPED, RunStatus.CANCELED}) {
            assertThat(status.isTerminal(), is(true));
            assertThat(status.isActive(), is(false));
        }
    }

    @Test
    public void queuedMayGoAnywhereForward()
    {
        assertThat(RunStatus.QUEUED.canTransitionTo(RunStatus.QUEUED), is(false));
        assertThat(RunStatus.QUEUED.canTransitionTo(RunStatus.RUNNING), is(true));
        assertThat(RunStatus.QUEUED.canTransitionTo(RunStatus.TIMEOUT), is(true));
        assertThat(RunStatus.QUEUED.canTransitionTo(RunStatus.SKIPPED), is(true));
    }

    @Test
    public void runningOnlyFinishes()
    {
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.QUEUED), is(false));
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.RUNNING), is(false));
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.SUCCESS), is(true));
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.CANCELED), is(true));
    }

    @Test
    public void terminalStatesAreFinal()
    {
        for (RunStatus from : RunStatus.values()) {
            if (!from.isTerminal()) {
                continue;
            }
            for (RunStatus to : RunStatus.values()) {
                assertThat(from + " -> " + to, from.canTransitionTo(to), is(false));
            }
        }
    }

    @Test
    public void names()
            throws Exception
    {
        assertThat(RunStatus.fromName("timeout"), is(RunStatus.TIMEOUT));
        assertThat(RunStatus.CANCELED.toString(), is("canceled"));
        assertThat(objectMapper().writeValueAsString(RunStatus.RUNNING), is("\"running\""));
        assertThat(objectMapper().readValue("\"skipped\"", RunStatus.class), is(RunStatus.SKIPPED));
    }

    @Test(expected = ConfigException.class)
    public void unknownName()
    {
        RunStatus.fromName("paused");
    }
}
