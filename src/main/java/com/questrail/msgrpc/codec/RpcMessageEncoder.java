package com.questrail.msgrpc.codec;

import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;

/**
 * RpcMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a semantic {@link RpcMessage} and MessagePack
 * bytes.
 *
 * <p>The encoder appends exactly one complete envelope to the supplied
 * {@link MessagePackEncoder}. It never touches a stream: the caller decides
 * when, and under which lock, the accumulated bytes reach the transport.</p>
 */
public interface RpcMessageEncoder
{
    void encode(RpcMessage message, MessagePackEncoder out) throws MessagePackException;
}
