package com.questrail.msgrpc.msgpack;

import java.util.HexFormat;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;

/**
 * HandleExtensionCodec
 * -----------------------------------------------------------------------------
 * {@link ExtensionCodec} for opaque integer handles (buffer, window and similar
 * remote object references) whose extension payload is itself a MessagePack
 * integer.
 *
 * <p>Accepted payload forms: positive and negative fixint, {@code uint8},
 * {@code uint16}, {@code uint32}, {@code int8}, {@code int16}, {@code int32}.
 * Handles are always written in the five-byte {@code int32} form, which peers
 * of this convention expect.</p>
 *
 * @param <T> handle type
 */
public final class HandleExtensionCodec<T> implements ExtensionCodec<T>
{
    private final int type;
    private final Class<T> valueType;
    private final IntFunction<T> factory;
    private final ToIntFunction<T> idExtractor;

    public HandleExtensionCodec(int type,
                                Class<T> valueType,
                                IntFunction<T> factory,
                                ToIntFunction<T> idExtractor) {
        this.type = type;
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.idExtractor = Objects.requireNonNull(idExtractor, "idExtractor");
    }

    @Override
    public int type() {
        return type;
    }

    @Override
    public Class<T> valueType() {
        return valueType;
    }

    @Override
    public T decode(byte[] payload) throws MessagePackException {
        return factory.apply(decodeHandle(payload));
    }

    @Override
    public byte[] encode(T value) {
        return encodeHandle(idExtractor.applyAsInt(value));
    }

    static int decodeHandle(byte[] p) throws MessagePackException {
        int first = p.length > 0 ? p[0] & 0xFF : -1;
        if (p.length == 1 && first <= MessagePackFormat.POSITIVE_FIXINT_MAX) {
            return first;
        }
        if (p.length == 1 && first >= MessagePackFormat.NEGATIVE_FIXINT_PREFIX) {
            return (byte) first;
        }
        if (p.length == 2 && first == MessagePackFormat.UINT8) {
            return p[1] & 0xFF;
        }
        if (p.length == 3 && first == MessagePackFormat.UINT16) {
            return ((p[1] & 0xFF) << 8) | (p[2] & 0xFF);
        }
        if (p.length == 5 && (first == MessagePackFormat.UINT32 || first == MessagePackFormat.INT32)) {
            return ((p[1] & 0xFF) << 24) | ((p[2] & 0xFF) << 16) | ((p[3] & 0xFF) << 8) | (p[4] & 0xFF);
        }
        if (p.length == 2 && first == MessagePackFormat.INT8) {
            return p[1];
        }
        if (p.length == 3 && first == MessagePackFormat.INT16) {
            return (short) (((p[1] & 0xFF) << 8) | (p[2] & 0xFF));
        }
        throw new MessagePackException("msgpack: cannot decode handle from extension bytes "
                + HexFormat.of().formatHex(p));
    }

    static byte[] encodeHandle(int n) {
        return new byte[] {
                (byte) MessagePackFormat.INT32,
                (byte) (n >> 24),
                (byte) (n >> 16),
                (byte) (n >> 8),
                (byte) n
        };
    }
}
