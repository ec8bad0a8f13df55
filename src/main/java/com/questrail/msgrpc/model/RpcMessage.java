package com.questrail.msgrpc.model;

/**
 * RpcMessage
 * -----------------------------------------------------------------------------
 * Semantic representation of one MessagePack-RPC envelope.
 *
 * <p>Message fields whose Java type is unknown while the read loop runs
 * (parameters, results, error values) are carried as
 * {@link com.questrail.msgrpc.msgpack.RawValue} and bound later by whoever
 * knows the target type.</p>
 */
public sealed interface RpcMessage permits Request, Response, Notification
{
    /** Envelope discriminant: 0 request, 1 response, 2 notification. */
    int kind();
}
