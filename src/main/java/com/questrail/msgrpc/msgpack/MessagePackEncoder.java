package com.questrail.msgrpc.msgpack;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.questrail.msgrpc.msgpack.MessagePackFormat.*;

/**
 * MessagePackEncoder
 * -----------------------------------------------------------------------------
 * Buffer-backed MessagePack writer.
 *
 * <p>Every {@code pack*} method appends exactly one value header (plus its
 * payload for strings, binaries and extensions) using the shortest form that
 * can represent it. Array and map headers are separate values; the caller
 * appends the declared number of members afterwards.</p>
 *
 * <p>Output accumulates in memory until the owner drains it with
 * {@link #writeTo(OutputStream)}, {@link #toByteArray()} or
 * {@link #toRawValue()}. Accumulating a whole message before touching the
 * stream is what lets the endpoint write each message as one unit.</p>
 *
 * <h2>Netty containment</h2>
 * <p>The backing {@code ByteBuf} never escapes this class.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
public final class MessagePackEncoder
{
    private static final int INITIAL_CAPACITY = 256;

    private final ByteBuf buf;

    public MessagePackEncoder() {
        this(INITIAL_CAPACITY);
    }

    public MessagePackEncoder(int initialCapacity) {
        this.buf = Unpooled.buffer(initialCapacity);
    }

    public MessagePackEncoder packNil() {
        buf.writeByte(NIL);
        return this;
    }

    public MessagePackEncoder packBool(boolean value) {
        buf.writeByte(value ? TRUE : FALSE);
        return this;
    }

    /**
     * Packs a signed integer. Non-negative values use the unsigned forms.
     */
    public MessagePackEncoder packInt(long value) {
        if (value >= 0) {
            return packUint(value);
        }
        if (value >= NEGATIVE_FIXINT_MIN) {
            buf.writeByte((int) value);
        } else if (value >= Byte.MIN_VALUE) {
            buf.writeByte(INT8);
            buf.writeByte((int) value);
        } else if (value >= Short.MIN_VALUE) {
            buf.writeByte(INT16);
            buf.writeShort((int) value);
        } else if (value >= Integer.MIN_VALUE) {
            buf.writeByte(INT32);
            buf.writeInt((int) value);
        } else {
            buf.writeByte(INT64);
            buf.writeLong(value);
        }
        return this;
    }

    /**
     * Packs an unsigned integer. {@code value} is interpreted as an unsigned
     * 64-bit quantity, so {@code -1L} packs as {@code 0xffffffffffffffff}.
     */
    public MessagePackEncoder packUint(long value) {
        if (Long.compareUnsigned(value, POSITIVE_FIXINT_MAX) <= 0) {
            buf.writeByte((int) value);
        } else if (Long.compareUnsigned(value, UINT8_MAX) <= 0) {
            buf.writeByte(UINT8);
            buf.writeByte((int) value);
        } else if (Long.compareUnsigned(value, UINT16_MAX) <= 0) {
            buf.writeByte(UINT16);
            buf.writeShort((int) value);
        } else if (Long.compareUnsigned(value, UINT32_MAX) <= 0) {
            buf.writeByte(UINT32);
            buf.writeInt((int) value);
        } else {
            buf.writeByte(UINT64);
            buf.writeLong(value);
        }
        return this;
    }

    /** Packs a double-precision float. */
    public MessagePackEncoder packFloat(double value) {
        buf.writeByte(FLOAT64);
        buf.writeDouble(value);
        return this;
    }

    /** Packs a single-precision float. */
    public MessagePackEncoder packFloat32(float value) {
        buf.writeByte(FLOAT32);
        buf.writeFloat(value);
        return this;
    }

    public MessagePackEncoder packString(String value) {
        Objects.requireNonNull(value, "value");
        return packStringBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /** Packs a string whose UTF-8 bytes are already at hand. */
    MessagePackEncoder packStringBytes(byte[] utf8) {
        packStringHeader(utf8.length);
        buf.writeBytes(utf8);
        return this;
    }

    public MessagePackEncoder packBinary(byte[] value) {
        Objects.requireNonNull(value, "value");
        int n = value.length;
        if (n <= UINT8_MAX) {
            buf.writeByte(BIN8);
            buf.writeByte(n);
        } else if (n <= UINT16_MAX) {
            buf.writeByte(BIN16);
            buf.writeShort(n);
        } else {
            buf.writeByte(BIN32);
            buf.writeInt(n);
        }
        buf.writeBytes(value);
        return this;
    }

    public MessagePackEncoder packArrayHeader(long length) throws MessagePackException {
        checkLength(length, "array");
        if (length <= FIXCOLLECTION_MAX) {
            buf.writeByte(FIXARRAY_PREFIX | (int) length);
        } else if (length <= UINT16_MAX) {
            buf.writeByte(ARRAY16);
            buf.writeShort((int) length);
        } else {
            buf.writeByte(ARRAY32);
            buf.writeInt((int) length);
        }
        return this;
    }

    public MessagePackEncoder packMapHeader(long length) throws MessagePackException {
        checkLength(length, "map");
        if (length <= FIXCOLLECTION_MAX) {
            buf.writeByte(FIXMAP_PREFIX | (int) length);
        } else if (length <= UINT16_MAX) {
            buf.writeByte(MAP16);
            buf.writeShort((int) length);
        } else {
            buf.writeByte(MAP32);
            buf.writeInt((int) length);
        }
        return this;
    }

    /**
     * Packs an extension value. Payloads of length 1, 2, 4, 8 and 16 use the
     * fixext forms; all others use ext8/ext16/ext32.
     *
     * @param type application-defined tag, {@code -128..127}
     */
    public MessagePackEncoder packExtension(int type, byte[] data) throws MessagePackException {
        Objects.requireNonNull(data, "data");
        if (type < Byte.MIN_VALUE || type > Byte.MAX_VALUE) {
            throw new MessagePackException("msgpack: extension type out of range: " + type);
        }
        int n = data.length;
        switch (n) {
            case 1 -> buf.writeByte(FIXEXT1);
            case 2 -> buf.writeByte(FIXEXT2);
            case 4 -> buf.writeByte(FIXEXT4);
            case 8 -> buf.writeByte(FIXEXT8);
            case 16 -> buf.writeByte(FIXEXT16);
            default -> {
                if (n <= UINT8_MAX) {
                    buf.writeByte(EXT8);
                    buf.writeByte(n);
                } else if (n <= UINT16_MAX) {
                    buf.writeByte(EXT16);
                    buf.writeShort(n);
                } else {
                    buf.writeByte(EXT32);
                    buf.writeInt(n);
                }
            }
        }
        buf.writeByte(type);
        buf.writeBytes(data);
        return this;
    }

    /**
     * Appends bytes that are already MessagePack encoded. No validation is
     * performed; the caller guarantees well-formedness.
     */
    public MessagePackEncoder packRaw(byte[] encoded) {
        buf.writeBytes(Objects.requireNonNull(encoded, "encoded"));
        return this;
    }

    public MessagePackEncoder packRaw(RawValue value) {
        buf.writeBytes(Objects.requireNonNull(value, "value").array());
        return this;
    }

    /** Number of bytes accumulated so far. */
    public int size() {
        return buf.readableBytes();
    }

    /** Discards accumulated output so the encoder can be reused. */
    public void reset() {
        buf.clear();
    }

    public byte[] toByteArray() {
        return ByteBufUtil.getBytes(buf);
    }

    /**
     * Returns the accumulated output as a single raw value. Only meaningful
     * when exactly one complete value has been packed.
     */
    public RawValue toRawValue() {
        if (buf.readableBytes() == 0) {
            throw new IllegalStateException("no value has been packed");
        }
        return RawValue.wrap(toByteArray());
    }

    /**
     * Copies accumulated output to {@code out}. The encoder content is left
     * untouched; call {@link #reset()} to reuse it.
     */
    public void writeTo(OutputStream out) throws IOException {
        buf.getBytes(buf.readerIndex(), out, buf.readableBytes());
    }

    private void packStringHeader(int n) {
        if (n <= FIXSTR_MAX) {
            buf.writeByte(FIXSTR_PREFIX | n);
        } else if (n <= UINT8_MAX) {
            buf.writeByte(STR8);
            buf.writeByte(n);
        } else if (n <= UINT16_MAX) {
            buf.writeByte(STR16);
            buf.writeShort(n);
        } else {
            buf.writeByte(STR32);
            buf.writeInt(n);
        }
    }

    private static void checkLength(long length, String what) throws MessagePackException {
        if (length < 0 || length > UINT32_MAX) {
            throw new MessagePackException("msgpack: invalid " + what + " length: " + length);
        }
    }
}
