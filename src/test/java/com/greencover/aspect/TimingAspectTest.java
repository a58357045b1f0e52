package com.greencover.aspect;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.junit.jupiter.api.Assertions.*;

class TimingAspectTest {

    private SimpleMeterRegistry meterRegistry;
    private Operations operations;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        AspectJProxyFactory factory = new AspectJProxyFactory(new Operations());
        factory.setProxyTargetClass(true);
        factory.addAspect(new TimingAspect(meterRegistry));
        operations = factory.getProxy();
    }

    @Test
    void testSuccessfulCallIsTimed() {
        // When
        int result = operations.named(21);

        // Then
        assertEquals(42, result);
        Timer timer = meterRegistry.get(TimingAspect.TIMER_NAME)
                .tag("operation", "ops.named")
                .tag("outcome", "success")
                .timer();
        assertEquals(1, timer.count());
    }

    @Test
    void testDefaultOperationNameIsClassAndMethod() {
        // When
        operations.unnamed();

        // Then
        assertEquals(1, meterRegistry.get(TimingAspect.TIMER_NAME)
                .tag("operation", "Operations.unnamed")
                .timer()
                .count());
    }

    @Test
    void testFailureIsTimedAndRethrown() {
        // When
        IllegalStateException e = assertThrows(IllegalStateException.class, operations::failing);

        // Then
        assertEquals("boom", e.getMessage());
        assertEquals(1, meterRegistry.get(TimingAspect.TIMER_NAME)
                .tag("outcome", "failure")
                .timer()
                .count());
    }

    @Test
    void testUnannotatedMethodIsNotTimed() {
        // When
        operations.plain();

        // Then
        assertTrue(meterRegistry.find(TimingAspect.TIMER_NAME).timers().isEmpty());
    }

    static class Operations {

        @Timed(value = "ops.named", logLevel = Timed.LogLevel.INFO)
        public int named(int value) {
            return value * 2;
        }

        @Timed
        public void unnamed() {
        }

        @Timed("ops.failing")
        public void failing() {
            throw new IllegalStateException("boom");
        }

        public void plain() {
        }
    }
}
