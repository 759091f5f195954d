package com.di.extractflow.execution;

import java.util.Map;

/**
 * What a worker knows about its own invocation.
 *
 * @param invocationId unique id of the invocation
 * @param index        position of the input in the mapped list
 * @param env          extra environment the invocation was started with
 * @param memoryMb     memory the worker was provisioned with
 * @param cpus         CPUs the worker was provisioned with
 */
public record InvocationContext(String invocationId, int index, Map<String, String> env, int memoryMb, int cpus) {}
