package com.questrail.msgrpc.observability;

import java.time.Instant;

/**
 * Lifecycle events of an endpoint's connection.
 */
public sealed interface RpcTransportEvent
        permits RpcTransportEvent.ServeStarted,
                RpcTransportEvent.ServeStopped,
                RpcTransportEvent.Closed
{
    Instant timestamp();

    /** The read loop began consuming the stream. */
    record ServeStarted(Instant timestamp) implements RpcTransportEvent { }

    /**
     * The read loop exited. {@code cause} is {@code null} after a clean end of
     * input or a local close.
     */
    record ServeStopped(Instant timestamp, Throwable cause) implements RpcTransportEvent { }

    /** {@code close()} finished releasing the endpoint. */
    record Closed(Instant timestamp) implements RpcTransportEvent { }
}
