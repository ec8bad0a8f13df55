package com.questrail.msgrpc.msgpack;

import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * RawValue
 * -----------------------------------------------------------------------------
 * The verbatim encoding of exactly one complete MessagePack value.
 *
 * <p>Composite values include all of their declared members. A raw value is
 * what the envelope layer hands upward when the Java type that should receive
 * the value is not yet known (handler parameters, call results, error
 * values). It can be re-opened with {@link #newDecoder()} or spliced into an
 * outbound message with {@link MessagePackEncoder#packRaw(RawValue)}.</p>
 *
 * <p>The bytes are copied on the way in and on the way out.</p>
 */
public final class RawValue
{
    /** The encoding of {@code nil}. */
    public static final RawValue NIL = new RawValue(new byte[] { (byte) MessagePackFormat.NIL });

    private final byte[] encoded;

    private RawValue(byte[] encoded) {
        this.encoded = encoded;
    }

    /**
     * Wraps a copy of {@code encoded}. The caller guarantees that the bytes hold
     * exactly one complete value.
     */
    public static RawValue of(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("raw value must contain at least one byte");
        }
        return new RawValue(encoded.clone());
    }

    static RawValue wrap(byte[] encoded) {
        return new RawValue(encoded);
    }

    public boolean isNil() {
        return encoded.length == 1 && (encoded[0] & 0xFF) == MessagePackFormat.NIL;
    }

    public int length() {
        return encoded.length;
    }

    /** Returns a copy of the encoded bytes. */
    public byte[] bytes() {
        return encoded.clone();
    }

    byte[] array() {
        return encoded;
    }

    /** Opens a decoder positioned before this value. */
    public MessagePackDecoder newDecoder() {
        return new MessagePackDecoder(new ByteArrayInputStream(encoded));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RawValue other && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return "RawValue[" + HexFormat.of().formatHex(encoded) + ']';
    }
}
