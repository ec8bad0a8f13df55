package com.questrail.msgrpc.internal.bind;

import com.questrail.msgrpc.msgpack.ExtensionCodec;
import com.questrail.msgrpc.msgpack.ExtensionRegistry;
import com.questrail.msgrpc.msgpack.ExtensionValue;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.MessagePackWritable;
import com.questrail.msgrpc.msgpack.RawValue;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ValueEncoder
 * -----------------------------------------------------------------------------
 * Packs arbitrary Java values through a {@link MessagePackEncoder}.
 *
 * <p>Records are written as arrays of their components in declaration order.
 * Enums are written by name. Types registered in the {@link ExtensionRegistry}
 * take precedence over every structural rule.</p>
 */
public final class ValueEncoder
{
    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final ExtensionRegistry extensions;

    public ValueEncoder(ExtensionRegistry extensions) {
        this.extensions = Objects.requireNonNull(extensions, "extensions");
    }

    /** Packs {@code value} as exactly one MessagePack value. */
    public void encode(MessagePackEncoder out, Object value) throws MessagePackException {
        if (value == null) {
            out.packNil();
            return;
        }
        if (value instanceof RawValue raw) {
            out.packRaw(raw);
            return;
        }
        if (value instanceof MessagePackWritable writable) {
            writable.writeTo(out);
            return;
        }
        if (!extensions.isEmpty()) {
            Optional<? extends ExtensionCodec<?>> codec = extensions.forType(value.getClass());
            if (codec.isPresent()) {
                packExtension(out, codec.get(), value);
                return;
            }
        }

        if (value instanceof Boolean b) {
            out.packBool(b);
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            out.packInt(((Number) value).longValue());
        } else if (value instanceof BigInteger big) {
            packBigInteger(out, big);
        } else if (value instanceof Double d) {
            out.packFloat(d);
        } else if (value instanceof Float f) {
            out.packFloat32(f);
        } else if (value instanceof CharSequence || value instanceof Character) {
            out.packString(value.toString());
        } else if (value instanceof byte[] bytes) {
            out.packBinary(bytes);
        } else if (value instanceof ExtensionValue ext) {
            out.packExtension(ext.type(), ext.data());
        } else if (value instanceof Enum<?> e) {
            out.packString(e.name());
        } else if (value instanceof Optional<?> opt) {
            encode(out, opt.orElse(null));
        } else if (value.getClass().isArray()) {
            int n = Array.getLength(value);
            out.packArrayHeader(n);
            for (int i = 0; i < n; i++) {
                encode(out, Array.get(value, i));
            }
        } else if (value instanceof Collection<?> c) {
            out.packArrayHeader(c.size());
            for (Object element : c) {
                encode(out, element);
            }
        } else if (value instanceof Map<?, ?> m) {
            out.packMapHeader(m.size());
            for (Map.Entry<?, ?> e : m.entrySet()) {
                encode(out, e.getKey());
                encode(out, e.getValue());
            }
        } else if (value instanceof Record) {
            packRecord(out, value);
        } else {
            throw new MessagePackException("msgpack: cannot encode value of type " + value.getClass().getName());
        }
    }

    /**
     * Packs {@code args} as one array value, the shape of request and
     * notification parameters.
     */
    public void encodeArguments(MessagePackEncoder out, Object[] args) throws MessagePackException {
        Object[] a = args == null ? new Object[0] : args;
        out.packArrayHeader(a.length);
        for (Object arg : a) {
            encode(out, arg);
        }
    }

    /** Encodes {@code value} on its own. */
    public RawValue toRaw(Object value) throws MessagePackException {
        MessagePackEncoder out = new MessagePackEncoder(64);
        encode(out, value);
        return out.toRawValue();
    }

    @SuppressWarnings("unchecked")
    private static <T> void packExtension(MessagePackEncoder out, ExtensionCodec<T> codec, Object value)
            throws MessagePackException {
        out.packExtension(codec.type(), codec.encode((T) value));
    }

    private static void packBigInteger(MessagePackEncoder out, BigInteger big) throws MessagePackException {
        if (big.signum() < 0) {
            if (big.bitLength() > 63) {
                throw new MessagePackException("msgpack: integer out of int64 range: " + big);
            }
            out.packInt(big.longValue());
        } else {
            if (big.compareTo(UINT64_MAX) > 0) {
                throw new MessagePackException("msgpack: integer out of uint64 range: " + big);
            }
            out.packUint(big.longValue());
        }
    }

    private void packRecord(MessagePackEncoder out, Object record) throws MessagePackException {
        RecordComponent[] components = record.getClass().getRecordComponents();
        out.packArrayHeader(components.length);
        for (RecordComponent component : components) {
            encode(out, componentValue(component, record));
        }
    }

    private static Object componentValue(RecordComponent component, Object record) throws MessagePackException {
        try {
            var accessor = component.getAccessor();
            accessor.trySetAccessible();
            return accessor.invoke(record);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new MessagePackException("msgpack: cannot read record component "
                    + record.getClass().getSimpleName() + '.' + component.getName(), e);
        }
    }
}
