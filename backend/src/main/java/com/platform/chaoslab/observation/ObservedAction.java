package com.platform.chaoslab.observation;

/**
 * Void form of {@link ObservedWork}.
 */
@FunctionalInterface
public interface ObservedAction<E extends Exception> {
    
    void run() throws E;
}
