package com.platform.chaoslab.observation;

/**
 * A unit of work run inside {@link ExperimentObserver#scoped}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface ObservedWork<T, E extends Exception> {
    
    T run() throws E;
}
