package com.platform.chaoslab.wrapper;

import com.platform.chaoslab.chaos.FaultType;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * One fault inside {@link ResilienceTest}. Attribute semantics match
 * {@link ChaosMonkey}, except that the probability defaults to 1.0.
 */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
public @interface Fault {

    FaultType type();

    double probability() default 1.0;

    long durationMs() default 500;

    int errorCode() default 500;

    String errorMessage() default "";
}
