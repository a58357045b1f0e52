package com.greencover.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method whose execution time is logged and recorded in the
 * {@code greencover.operation.duration} timer
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

    /**
     * Operation name used as the timer's {@code operation} tag.
     * Defaults to {@code ClassName.method}.
     */
    String value() default "";

    /**
     * Log level for the timing line
     */
    LogLevel logLevel() default LogLevel.DEBUG;

    enum LogLevel {
        DEBUG, INFO
    }
}
