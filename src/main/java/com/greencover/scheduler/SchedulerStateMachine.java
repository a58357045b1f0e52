package com.greencover.scheduler;

import com.greencover.model.BatchRunStatus;
import com.greencover.model.SchedulerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide run state of the batch scheduler:
 * IDLE, RUNNING, then COMPLETED or ABORTED_ON_TIMEOUT, then IDLE again.
 * Only one caller can move IDLE to RUNNING, so concurrent triggers are rejected
 * deterministically.
 */
@Slf4j
@Component
public class SchedulerStateMachine {

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);

    /**
     * @return true if this caller now owns the run
     */
    public boolean tryBegin() {
        return state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING);
    }

    /**
     * Report the run's terminal state, then return to IDLE
     */
    public SchedulerState finish(BatchRunStatus status) {
        SchedulerState terminal = status == BatchRunStatus.ABORTED_ON_TIMEOUT
                ? SchedulerState.ABORTED_ON_TIMEOUT
                : SchedulerState.COMPLETED;
        if (!state.compareAndSet(SchedulerState.RUNNING, terminal)) {
            throw new IllegalStateException("Cannot finish a run in state " + state.get());
        }
        log.debug("Batch run finished in state {}", terminal);
        state.set(SchedulerState.IDLE);
        return terminal;
    }

    /**
     * Return to IDLE after a run failed before reporting a terminal state
     */
    public void release() {
        if (state.compareAndSet(SchedulerState.RUNNING, SchedulerState.IDLE)) {
            log.warn("Batch run released without a terminal state");
        }
    }

    public SchedulerState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == SchedulerState.RUNNING;
    }
}
