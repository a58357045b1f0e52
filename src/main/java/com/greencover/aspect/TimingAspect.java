package com.greencover.aspect;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Measures execution time of {@link Timed} methods
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class TimingAspect {

    static final String TIMER_NAME = "greencover.operation.duration";

    private final MeterRegistry meterRegistry;

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();
        String operation = timed.value().isEmpty() ? className + "." + methodName : timed.value();
        long startNanos = System.nanoTime();

        String outcome = "success";
        try {
            return joinPoint.proceed();
        } catch (Throwable e) {
            outcome = "failure";
            log.debug("{}#{} failed after {}ms: {}", className, methodName,
                      TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), e.getMessage());
            throw e;
        } finally {
            long elapsedNanos = System.nanoTime() - startNanos;
            Timer.builder(TIMER_NAME)
                 .description("Execution time of timed operations")
                 .tag("operation", operation)
                 .tag("outcome", outcome)
                 .register(meterRegistry)
                 .record(elapsedNanos, TimeUnit.NANOSECONDS);

            if ("success".equals(outcome)) {
                long millis = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
                if (timed.logLevel() == Timed.LogLevel.INFO) {
                    log.info("{}#{} executed in {}ms", className, methodName, millis);
                } else {
                    log.debug("{}#{} executed in {}ms", className, methodName, millis);
                }
            }
        }
    }
}
