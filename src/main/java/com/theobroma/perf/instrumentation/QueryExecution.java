package com.theobroma.perf.instrumentation;

/**
 * A database call to be timed by {@link QueryTimer}.
 *
 * @param <T> result type
 * @param <E> checked exception the call may throw, {@code RuntimeException} when none
 */
@FunctionalInterface
public interface QueryExecution<T, E extends Exception> {

    T execute() throws E;
}
