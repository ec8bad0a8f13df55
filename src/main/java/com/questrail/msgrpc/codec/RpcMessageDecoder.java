package com.questrail.msgrpc.codec;

import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;

import java.io.IOException;
import java.util.Optional;

/**
 * RpcMessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between a MessagePack stream and semantic
 * {@link RpcMessage} values.
 *
 * <p>The decoder distinguishes two classes of failure:</p>
 * <ul>
 *   <li>{@link com.questrail.msgrpc.error.ProtocolException}: the value was
 *       well-formed MessagePack but not a valid envelope. It has been consumed
 *       in full and the stream is still aligned; the caller may keep
 *       reading.</li>
 *   <li>{@link com.questrail.msgrpc.msgpack.MessagePackException} or
 *       {@link java.io.EOFException}: the byte stream itself is broken and
 *       must be abandoned.</li>
 * </ul>
 */
public interface RpcMessageDecoder
{
    /**
     * Reads one envelope.
     *
     * @return the message, or {@link Optional#empty()} at a clean end of input
     */
    Optional<RpcMessage> read(MessagePackDecoder in) throws IOException;
}
