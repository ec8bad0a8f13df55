package com.questrail.msgrpc.msgpack;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.questrail.msgrpc.msgpack.MessagePackFormat.*;

/**
 * MessagePackDecoder
 * -----------------------------------------------------------------------------
 * Pull-style MessagePack reader over an {@link InputStream}.
 *
 * <p>Usage follows a strict rhythm:</p>
 * <ol>
 *   <li>{@link #unpack()} reads the next value header (and, for strings,
 *       binaries and extensions, the payload).</li>
 *   <li>{@link #type()} exposes the wire discriminant so the caller can
 *       branch.</li>
 *   <li>The caller invokes the matching accessor, or {@link #skip()} /
 *       {@link #readRaw()} to consume the value together with its members.</li>
 * </ol>
 *
 * <p>The decoder never descends into composites on its own. After an
 * {@link MessagePackType#ARRAY_HEADER} the caller must consume exactly
 * {@link #length()} members, or call {@link #skip()} to drop them.</p>
 *
 * <p>An accessor called against a mismatched wire type raises
 * {@link ConvertException}. Scalar payloads are read during {@code unpack()},
 * so the stream is still aligned when that happens.</p>
 *
 * <p>Instances are not thread-safe. A single reader owns each decoder.</p>
 */
public final class MessagePackDecoder
{
    private final InputStream in;

    private boolean hasValue;
    private MessagePackType type;
    private long bits;
    private double floatValue;
    private boolean singlePrecision;
    private byte[] payload;
    private int extensionType;

    public MessagePackDecoder(InputStream in) {
        Objects.requireNonNull(in, "in");
        this.in = (in instanceof BufferedInputStream || in instanceof ByteArrayInputStream)
                ? in
                : new BufferedInputStream(in);
    }

    /**
     * Reads the next value header.
     *
     * @return {@code false} if the stream ended cleanly between values
     * @throws EOFException if the stream ended inside a value
     * @throws MessagePackException if the header byte is not valid MessagePack
     */
    public boolean unpack() throws IOException {
        int b = in.read();
        if (b < 0) {
            hasValue = false;
            type = null;
            return false;
        }
        payload = null;
        hasValue = true;
        decodeHeader(b);
        return true;
    }

    /** Returns the wire type of the current value. */
    public MessagePackType type() {
        requireValue();
        return type;
    }

    public boolean booleanValue() throws ConvertException {
        if (type() != MessagePackType.BOOL) {
            throw new ConvertException(type, boolean.class);
        }
        return bits != 0;
    }

    /**
     * Returns an integer value. A {@link MessagePackType#UINT} above
     * {@link Long#MAX_VALUE} is returned with its raw 64-bit pattern; use
     * {@link #bigIntegerValue()} when the full unsigned range matters.
     */
    public long longValue() throws ConvertException {
        MessagePackType t = type();
        if (t != MessagePackType.INT && t != MessagePackType.UINT) {
            throw new ConvertException(t, long.class);
        }
        return bits;
    }

    public BigInteger bigIntegerValue() throws ConvertException {
        return switch (type()) {
            case INT -> BigInteger.valueOf(bits);
            case UINT -> new BigInteger(Long.toUnsignedString(bits));
            default -> throw new ConvertException(type, BigInteger.class);
        };
    }

    /** Returns a float value, widening integers when necessary. */
    public double doubleValue() throws ConvertException {
        return switch (type()) {
            case FLOAT -> floatValue;
            case INT -> (double) bits;
            case UINT -> bits >= 0 ? (double) bits : new BigInteger(Long.toUnsignedString(bits)).doubleValue();
            default -> throw new ConvertException(type, double.class);
        };
    }

    /** Returns a string value; binary payloads are decoded as UTF-8. */
    public String string() throws ConvertException {
        MessagePackType t = type();
        if (t != MessagePackType.STRING && t != MessagePackType.BINARY) {
            throw new ConvertException(t, String.class);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Returns the payload of a binary, string or extension value. The returned
     * array is owned by the caller.
     */
    public byte[] bytes() throws ConvertException {
        MessagePackType t = type();
        if (t != MessagePackType.BINARY && t != MessagePackType.STRING && t != MessagePackType.EXTENSION) {
            throw new ConvertException(t, byte[].class);
        }
        return payload;
    }

    /** Declared member count of an array or map header. */
    public int length() throws ConvertException {
        MessagePackType t = type();
        if (t != MessagePackType.ARRAY_HEADER && t != MessagePackType.MAP_HEADER) {
            throw new ConvertException(t, int.class, "not a composite header");
        }
        return (int) bits;
    }

    /** Application-defined tag of an extension value. */
    public int extensionType() throws ConvertException {
        if (type() != MessagePackType.EXTENSION) {
            throw new ConvertException(type, ExtensionValue.class);
        }
        return extensionType;
    }

    /**
     * Discards the current value. For an array header the declared members are
     * skipped as well; for a map header twice the declared count.
     */
    public void skip() throws IOException {
        requireValue();
        if (type == MessagePackType.ARRAY_HEADER) {
            skipMembers(bits);
        } else if (type == MessagePackType.MAP_HEADER) {
            skipMembers(bits * 2);
        }
    }

    /**
     * Consumes the current value, including all members of a composite, and
     * returns its encoding.
     */
    public RawValue readRaw() throws IOException {
        requireValue();
        MessagePackEncoder out = new MessagePackEncoder(64);
        copyCurrent(out);
        return out.toRawValue();
    }

    /**
     * Reads the next value as raw bytes.
     *
     * @throws EOFException if the stream has no further value
     */
    public RawValue nextRaw() throws IOException {
        nextOrFail();
        return readRaw();
    }

    private void skipMembers(long count) throws IOException {
        for (long i = 0; i < count; i++) {
            nextOrFail();
            skip();
        }
    }

    private void copyCurrent(MessagePackEncoder out) throws IOException {
        switch (type) {
            case NIL -> out.packNil();
            case BOOL -> out.packBool(bits != 0);
            case INT -> out.packInt(bits);
            case UINT -> out.packUint(bits);
            case FLOAT -> {
                if (singlePrecision) {
                    out.packFloat32((float) floatValue);
                } else {
                    out.packFloat(floatValue);
                }
            }
            case STRING -> out.packStringBytes(payload);
            case BINARY -> out.packBinary(payload);
            case EXTENSION -> out.packExtension(extensionType, payload);
            case ARRAY_HEADER -> {
                long count = bits;
                out.packArrayHeader(count);
                for (long i = 0; i < count; i++) {
                    nextOrFail();
                    copyCurrent(out);
                }
            }
            case MAP_HEADER -> {
                long count = bits * 2;
                out.packMapHeader(bits);
                for (long i = 0; i < count; i++) {
                    nextOrFail();
                    copyCurrent(out);
                }
            }
        }
    }

    private void nextOrFail() throws IOException {
        if (!unpack()) {
            throw new EOFException("msgpack: unexpected end of input inside composite value");
        }
    }

    private void requireValue() {
        if (!hasValue) {
            throw new IllegalStateException("no current value; call unpack() first");
        }
    }

    // -------------------------------------------------------------------------
    // Header decoding
    // -------------------------------------------------------------------------

    private void decodeHeader(int b) throws IOException {
        if (b <= POSITIVE_FIXINT_MAX) {
            setInt(MessagePackType.INT, b);
            return;
        }
        if (b >= NEGATIVE_FIXINT_PREFIX) {
            setInt(MessagePackType.INT, (byte) b);
            return;
        }
        if (b < FIXARRAY_PREFIX) {
            setCount(MessagePackType.MAP_HEADER, b & 0x0f);
            return;
        }
        if (b < FIXSTR_PREFIX) {
            setCount(MessagePackType.ARRAY_HEADER, b & 0x0f);
            return;
        }
        if (b < NIL) {
            readPayload(MessagePackType.STRING, b & 0x1f);
            return;
        }

        switch (b) {
            case NIL -> type = MessagePackType.NIL;
            case NEVER_USED -> throw new MessagePackException("msgpack: reserved marker byte 0xc1");
            case FALSE -> setInt(MessagePackType.BOOL, 0);
            case TRUE -> setInt(MessagePackType.BOOL, 1);

            case BIN8 -> readPayload(MessagePackType.BINARY, readUint8());
            case BIN16 -> readPayload(MessagePackType.BINARY, readUint16());
            case BIN32 -> readPayload(MessagePackType.BINARY, readLength32());

            case EXT8 -> readExtension(readUint8());
            case EXT16 -> readExtension(readUint16());
            case EXT32 -> readExtension(readLength32());

            case FLOAT32 -> {
                type = MessagePackType.FLOAT;
                singlePrecision = true;
                floatValue = Float.intBitsToFloat(readInt32());
            }
            case FLOAT64 -> {
                type = MessagePackType.FLOAT;
                singlePrecision = false;
                floatValue = Double.longBitsToDouble(readInt64());
            }

            case UINT8 -> setInt(MessagePackType.UINT, readUint8());
            case UINT16 -> setInt(MessagePackType.UINT, readUint16());
            case UINT32 -> setInt(MessagePackType.UINT, readInt32() & 0xffffffffL);
            case UINT64 -> setInt(MessagePackType.UINT, readInt64());

            case INT8 -> setInt(MessagePackType.INT, (byte) readUint8());
            case INT16 -> setInt(MessagePackType.INT, (short) readUint16());
            case INT32 -> setInt(MessagePackType.INT, readInt32());
            case INT64 -> setInt(MessagePackType.INT, readInt64());

            case FIXEXT1 -> readExtension(1);
            case FIXEXT2 -> readExtension(2);
            case FIXEXT4 -> readExtension(4);
            case FIXEXT8 -> readExtension(8);
            case FIXEXT16 -> readExtension(16);

            case STR8 -> readPayload(MessagePackType.STRING, readUint8());
            case STR16 -> readPayload(MessagePackType.STRING, readUint16());
            case STR32 -> readPayload(MessagePackType.STRING, readLength32());

            case ARRAY16 -> setCount(MessagePackType.ARRAY_HEADER, readUint16());
            case ARRAY32 -> setCount(MessagePackType.ARRAY_HEADER, readLength32());
            case MAP16 -> setCount(MessagePackType.MAP_HEADER, readUint16());
            case MAP32 -> setCount(MessagePackType.MAP_HEADER, readLength32());

            default -> throw new MessagePackException("msgpack: unknown marker byte 0x" + Integer.toHexString(b));
        }
    }

    private void setInt(MessagePackType t, long value) {
        type = t;
        bits = value;
    }

    private void setCount(MessagePackType t, int count) {
        type = t;
        bits = count;
    }

    private void readPayload(MessagePackType t, int length) throws IOException {
        type = t;
        bits = length;
        payload = readFully(length);
    }

    private void readExtension(int length) throws IOException {
        type = MessagePackType.EXTENSION;
        extensionType = (byte) readUint8();
        bits = length;
        payload = readFully(length);
    }

    private int readUint8() throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new EOFException("msgpack: unexpected end of input");
        }
        return b;
    }

    private int readUint16() throws IOException {
        return (readUint8() << 8) | readUint8();
    }

    private int readInt32() throws IOException {
        return (readUint16() << 16) | readUint16();
    }

    private long readInt64() throws IOException {
        return ((long) readInt32() << 32) | (readInt32() & 0xffffffffL);
    }

    private int readLength32() throws IOException {
        int n = readInt32();
        if (n < 0) {
            throw new MessagePackException("msgpack: length exceeds supported maximum: " + (n & 0xffffffffL));
        }
        return n;
    }

    private byte[] readFully(int length) throws IOException {
        byte[] out = in.readNBytes(length);
        if (out.length != length) {
            throw new EOFException("msgpack: unexpected end of input (wanted " + length
                    + " bytes, got " + out.length + ")");
        }
        return out;
    }
}
