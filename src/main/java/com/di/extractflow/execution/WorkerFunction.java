package com.di.extractflow.execution;

/**
 * Unit of work shipped to one worker invocation.
 */
@FunctionalInterface
public interface WorkerFunction<T, R> {

    R apply(T input, InvocationContext context) throws Exception;
}
