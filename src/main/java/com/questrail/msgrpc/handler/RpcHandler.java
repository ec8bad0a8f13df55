package com.questrail.msgrpc.handler;

/**
 * Type-erased handler entry point. {@code args} has already been bound to the
 * descriptor's parameter types.
 */
@FunctionalInterface
public interface RpcHandler
{
    Object handle(Object[] args) throws Exception;
}
