package com.kmg.altbuddy.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void onlyForwardTransitionsAreAllowed() {
        assertTrue(JobStatus.STARTING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.STARTING.canTransitionTo(JobStatus.ERROR));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETE));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.ERROR));

        assertFalse(JobStatus.STARTING.canTransitionTo(JobStatus.COMPLETE));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.STARTING));
        assertFalse(JobStatus.COMPLETE.canTransitionTo(JobStatus.ERROR));
        assertFalse(JobStatus.ERROR.canTransitionTo(JobStatus.RUNNING));
    }

    @Test
    void terminalStates() {
        assertFalse(JobStatus.STARTING.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
        assertTrue(JobStatus.COMPLETE.isTerminal());
        assertTrue(JobStatus.ERROR.isTerminal());
        assertEquals("complete", JobStatus.COMPLETE.wireName());
    }
}
