package org.hpcbench.deploy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class JobStateTest {
    @Test
    void parsesSchedulerStateStrings() {
        assertEquals(JobState.PENDING, JobState.parse("PENDING"));
        assertEquals(JobState.PENDING, JobState.parse("requeued"));
        assertEquals(JobState.RUNNING, JobState.parse("COMPLETING"));
        assertEquals(JobState.CANCELLED, JobState.parse("CANCELLED by 1234"));
        assertEquals(JobState.CANCELLED, JobState.parse("CANCELLED+"));
        assertEquals(JobState.FAILED, JobState.parse("NODE_FAIL"));
        assertEquals(JobState.FAILED, JobState.parse("OUT_OF_MEMORY"));
        assertEquals(JobState.TIMEOUT, JobState.parse(" TIMEOUT "));
        assertEquals(JobState.UNKNOWN, JobState.parse("SPECIAL_EXIT"));
        assertEquals(JobState.UNKNOWN, JobState.parse(""));
        assertEquals(JobState.UNKNOWN, JobState.parse(null));
    }

    @Test
    void transitionsOnlyMoveForward() {
        assertTrue(JobState.SUBMITTED.canAdvanceTo(JobState.PENDING));
        assertTrue(JobState.SUBMITTED.canAdvanceTo(JobState.RUNNING));
        assertTrue(JobState.PENDING.canAdvanceTo(JobState.COMPLETED));
        assertTrue(JobState.RUNNING.canAdvanceTo(JobState.RUNNING));
        assertFalse(JobState.RUNNING.canAdvanceTo(JobState.PENDING));
        assertFalse(JobState.PENDING.canAdvanceTo(JobState.UNKNOWN));
    }

    @Test
    void terminalStatesAreAbsorbing() {
        for (JobState terminal : new JobState[] {JobState.COMPLETED, JobState.FAILED, JobState.CANCELLED, JobState.TIMEOUT}) {
            assertTrue(terminal.isTerminal());
            assertFalse(terminal.canAdvanceTo(JobState.RUNNING));
            assertFalse(terminal.canAdvanceTo(JobState.COMPLETED));
        }
        assertFalse(JobState.UNKNOWN.isTerminal());
        assertTrue(JobState.UNKNOWN.canAdvanceTo(JobState.PENDING));
    }
}
