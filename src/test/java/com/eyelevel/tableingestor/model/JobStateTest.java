package com.eyelevel.tableingestor.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStateTest {

    @Test
    @DisplayName("Should allow the forward path of the CSV and OCR branches")
    void canTransitionTo_forwardPath() {
        assertTrue(JobState.RECEIVED.canTransitionTo(JobState.CLASSIFYING));
        assertTrue(JobState.CLASSIFYING.canTransitionTo(JobState.STRUCTURING));
        assertTrue(JobState.CLASSIFYING.canTransitionTo(JobState.EXTRACTING));
        assertTrue(JobState.STRUCTURING.canTransitionTo(JobState.SCHEMA_READY));
        assertTrue(JobState.EXTRACTING.canTransitionTo(JobState.SCHEMA_READY));
        assertTrue(JobState.SCHEMA_READY.canTransitionTo(JobState.LOADING));
        assertTrue(JobState.LOADING.canTransitionTo(JobState.COMPLETED));
        assertTrue(JobState.LOADING.canTransitionTo(JobState.COMPLETED_WITH_WARNINGS));
    }

    @Test
    @DisplayName("Should allow failing from every non-terminal state")
    void canTransitionTo_failFromAnyActiveState() {
        for (JobState state : JobState.values()) {
            assertTrue(state.isTerminal() || state.canTransitionTo(JobState.FAILED), state.name());
        }
    }

    @Test
    @DisplayName("Should reject backward moves, skipped stages and leaving a terminal state")
    void canTransitionTo_rejectsIllegalMoves() {
        assertFalse(JobState.LOADING.canTransitionTo(JobState.CLASSIFYING));
        assertFalse(JobState.CLASSIFYING.canTransitionTo(JobState.LOADING));
        assertFalse(JobState.STRUCTURING.canTransitionTo(JobState.EXTRACTING));
        for (JobState terminal : EnumSet.of(JobState.COMPLETED, JobState.COMPLETED_WITH_WARNINGS, JobState.FAILED)) {
            assertTrue(terminal.isTerminal());
            for (JobState next : JobState.values()) {
                assertFalse(terminal.canTransitionTo(next));
            }
        }
    }
}
