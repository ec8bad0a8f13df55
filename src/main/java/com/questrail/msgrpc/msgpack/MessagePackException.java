package com.questrail.msgrpc.msgpack;

import java.io.IOException;

/**
 * Indicates malformed MessagePack input or a value that cannot be encoded.
 *
 * <p>When raised while decoding a stream (reserved marker byte, oversized
 * length), the stream position is no longer trustworthy and the owner of the
 * stream should treat it as unusable.</p>
 */
public class MessagePackException extends IOException
{
    public MessagePackException(String message) {
        super(message);
    }

    public MessagePackException(String message, Throwable cause) {
        super(message, cause);
    }
}
