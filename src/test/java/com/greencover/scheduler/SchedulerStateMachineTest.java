package com.greencover.scheduler;

import com.greencover.model.BatchRunStatus;
import com.greencover.model.SchedulerState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerStateMachineTest {

    private final SchedulerStateMachine stateMachine = new SchedulerStateMachine();

    @Test
    void testOnlyOneRunCanBegin() {
        assertTrue(stateMachine.tryBegin());
        assertFalse(stateMachine.tryBegin());
        assertTrue(stateMachine.isRunning());
    }

    @Test
    void testFinishReportsTerminalStateAndReturnsToIdle() {
        // Given
        stateMachine.tryBegin();

        // When
        SchedulerState terminal = stateMachine.finish(BatchRunStatus.ABORTED_ON_TIMEOUT);

        // Then
        assertEquals(SchedulerState.ABORTED_ON_TIMEOUT, terminal);
        assertEquals(SchedulerState.IDLE, stateMachine.getState());
        assertTrue(stateMachine.tryBegin());
        assertEquals(SchedulerState.COMPLETED, stateMachine.finish(BatchRunStatus.COMPLETED));
    }

    @Test
    void testFinishWithoutRunFails() {
        assertThrows(IllegalStateException.class, () -> stateMachine.finish(BatchRunStatus.COMPLETED));
    }

    @Test
    void testReleaseReturnsToIdle() {
        // Given
        stateMachine.tryBegin();

        // When
        stateMachine.release();

        // Then
        assertEquals(SchedulerState.IDLE, stateMachine.getState());
        assertFalse(stateMachine.isRunning());
    }
}
