package com.questrail.msgrpc.endpoint;

/**
 * Lifecycle of an {@link Endpoint}. Transitions only move forward.
 */
public enum EndpointState
{
    OPEN,
    /** {@code close()} is releasing resources; new calls are refused. */
    CLOSING,
    CLOSED
}
