package com.questrail.msgrpc.msgpack;

/**
 * Strategy for one application-defined extension tag.
 *
 * <p>Implementations turn an opaque extension payload into a domain value and
 * back. This is the seam through which typed handle values (for example
 * references to remote objects) travel without the protocol engine knowing
 * their meaning.</p>
 *
 * @param <T> domain type produced by this codec
 */
public interface ExtensionCodec<T>
{
    /** Extension tag handled by this codec, {@code -128..127}. */
    int type();

    /** Domain type produced by {@link #decode(byte[])}. */
    Class<T> valueType();

    /**
     * Decodes an extension payload.
     *
     * @throws MessagePackException if the payload is malformed
     */
    T decode(byte[] payload) throws MessagePackException;

    /** Encodes a domain value into an extension payload. */
    byte[] encode(T value) throws MessagePackException;
}
