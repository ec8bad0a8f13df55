package com.questrail.msgrpc.msgpack;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * An extension value whose tag has no registered {@link ExtensionCodec}.
 *
 * <p>The payload is kept opaque so it can be forwarded or re-encoded without
 * loss.</p>
 */
public record ExtensionValue(int type, byte[] data)
{
    public ExtensionValue {
        if (type < Byte.MIN_VALUE || type > Byte.MAX_VALUE) {
            throw new IllegalArgumentException("extension type out of range: " + type);
        }
        data = Objects.requireNonNull(data, "data").clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExtensionValue other
                && type == other.type
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * type + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ExtensionValue[type=" + type + ", data=" + HexFormat.of().formatHex(data) + ']';
    }
}
