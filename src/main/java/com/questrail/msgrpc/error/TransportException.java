package com.questrail.msgrpc.error;

/**
 * The connection failed or was closed. Fatal to the endpoint; every pending
 * and subsequent call observes it.
 */
public final class TransportException extends RpcException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransportException closed() {
        return new TransportException("msgrpc: connection closed");
    }
}
