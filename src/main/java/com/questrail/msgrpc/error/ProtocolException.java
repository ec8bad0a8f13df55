package com.questrail.msgrpc.error;

/**
 * A well-formed MessagePack value that is not a valid MessagePack-RPC
 * envelope, or a response whose id matches no pending call.
 *
 * <p>Raised only after the offending message has been fully consumed, so the
 * stream remains usable.</p>
 */
public final class ProtocolException extends RpcException
{
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
