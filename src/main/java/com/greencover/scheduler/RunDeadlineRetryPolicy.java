package com.greencover.scheduler;

import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Allows attempts only while the batch run's deadline, a {@link System#nanoTime()}
 * instant, has not been reached.
 */
class RunDeadlineRetryPolicy implements RetryPolicy {

    private final long deadline;

    RunDeadlineRetryPolicy(long deadline) {
        this.deadline = deadline;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        return !BatchRecomputationScheduler.pastDeadline(deadline);
    }

    @Override
    public RetryContext open(RetryContext parent) {
        return new RetryContextSupport(parent);
    }

    @Override
    public void close(RetryContext context) {
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
    }
}
