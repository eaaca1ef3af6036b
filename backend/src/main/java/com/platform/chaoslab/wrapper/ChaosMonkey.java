package com.platform.chaoslab.wrapper;

import com.platform.chaoslab.chaos.FaultType;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Injects a single fault before every call to the annotated bean method.
 * Applied by {@link ChaosMonkeyAspect}.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ChaosMonkey {

    FaultType faultType() default FaultType.LATENCY;

    double probability() default 0.1;

    long durationMs() default 500;

    int errorCode() default 500;

    String errorMessage() default "Chaos monkey error";

    String[] targets() default {};
}
