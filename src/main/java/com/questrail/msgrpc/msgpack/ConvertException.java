package com.questrail.msgrpc.msgpack;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * A wire value could not be coerced into the requested Java type.
 *
 * <p>The offending value has always been consumed (including declared members
 * of a composite) before this exception is raised, so the decoder remains
 * aligned on the next value.</p>
 */
public final class ConvertException extends MessagePackException
{
    private final MessagePackType wireType;
    private final Type requestedType;

    public ConvertException(MessagePackType wireType, Type requestedType) {
        this(wireType, requestedType, null);
    }

    public ConvertException(MessagePackType wireType, Type requestedType, String detail) {
        super(buildMessage(wireType, requestedType, detail));
        this.wireType = Objects.requireNonNull(wireType, "wireType");
        this.requestedType = Objects.requireNonNull(requestedType, "requestedType");
    }

    public MessagePackType wireType() {
        return wireType;
    }

    public Type requestedType() {
        return requestedType;
    }

    private static String buildMessage(MessagePackType wireType, Type requestedType, String detail) {
        String base = "msgpack: cannot convert " + wireType + " to " + requestedType.getTypeName();
        return detail == null ? base : base + " (" + detail + ")";
    }
}
