package com.questrail.msgrpc.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the RPC endpoint.
 */
public record RpcErrorEvent(
    Instant timestamp,
    String method,
    String message,
    Throwable cause
) {
    public static RpcErrorEvent now(String method, String message, Throwable cause) {
        return new RpcErrorEvent(Instant.now(), method, message, cause);
    }
}
