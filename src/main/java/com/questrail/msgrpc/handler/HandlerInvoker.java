package com.questrail.msgrpc.handler;

import com.questrail.msgrpc.error.ErrorKind;
import com.questrail.msgrpc.internal.bind.ValueDecoder;
import com.questrail.msgrpc.internal.bind.ValueEncoder;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.MessagePackType;
import com.questrail.msgrpc.msgpack.RawValue;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;

/**
 * HandlerInvoker
 * -----------------------------------------------------------------------------
 * Binds a params array to a {@link HandlerDescriptor}, runs the handler, and
 * encodes what it returns.
 *
 * <p>Binding is lenient about arity:</p>
 * <ul>
 *   <li>missing trailing params become {@code null}, or zero for primitives;</li>
 *   <li>surplus params are collected into the last parameter of a variadic
 *       handler and skipped otherwise.</li>
 * </ul>
 */
public final class HandlerInvoker
{
    private final ValueEncoder encoder;
    private final ValueDecoder decoder;

    public HandlerInvoker(ValueEncoder encoder, ValueDecoder decoder) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Runs the handler.
     *
     * @param endpoint passed ahead of the wire params when the handler asks for it
     * @return the encoded result, nil for void handlers
     * @throws Exception whatever binding or the handler throws
     */
    public RawValue invoke(HandlerDescriptor handler, Object endpoint, RawValue params) throws Exception {
        Object[] args = bind(handler, params);
        if (handler.receivesEndpoint()) {
            Object[] withEndpoint = new Object[args.length + 1];
            withEndpoint[0] = endpoint;
            System.arraycopy(args, 0, withEndpoint, 1, args.length);
            args = withEndpoint;
        }
        Object result = handler.invoker().handle(args);
        if (handler.returnShape() == ReturnShape.VOID) {
            return RawValue.NIL;
        }
        return encoder.toRaw(result);
    }

    Object[] bind(HandlerDescriptor handler, RawValue params) throws Exception {
        MessagePackDecoder in = params.newDecoder();
        if (!in.unpack() || in.type() != MessagePackType.ARRAY_HEADER) {
            throw HandlerException.validation("params must be an array");
        }
        int n = in.length();
        List<Type> types = handler.parameterTypes();
        int fixed = handler.fixedArity();

        Object[] args = new Object[types.size()];
        for (int i = 0; i < fixed; i++) {
            args[i] = i < n
                    ? decoder.read(in, types.get(i))
                    : ValueDecoder.absentValue(types.get(i));
        }

        int surplus = Math.max(0, n - fixed);
        if (handler.variadic()) {
            Type componentType = componentType(types.get(fixed));
            Class<?> componentClass = rawComponent(types.get(fixed));
            Object rest = Array.newInstance(componentClass, surplus);
            for (int i = 0; i < surplus; i++) {
                Object element = decoder.read(in, componentType);
                if (element != null || !componentClass.isPrimitive()) {
                    Array.set(rest, i, element);
                }
            }
            args[fixed] = rest;
        }
        // non-variadic surplus is left unread; the decoder is private to this call
        return args;
    }

    /**
     * The error value sent back for a failed handler: {@code [code, message]}
     * for a {@link HandlerException}, the message string otherwise.
     */
    public RawValue errorValue(Throwable failure) throws MessagePackException {
        MessagePackEncoder out = new MessagePackEncoder(64);
        if (failure instanceof HandlerException he) {
            out.packArrayHeader(2).packInt(he.kind().code()).packString(messageOf(he));
        } else {
            out.packString(messageOf(failure));
        }
        return out.toRawValue();
    }

    /** Kind reported for {@code failure} inside an atomic batch. */
    static ErrorKind kindOf(Throwable failure) {
        if (failure instanceof HandlerException he && he.kind() != ErrorKind.UNSPECIFIED) {
            return he.kind();
        }
        return ErrorKind.EXCEPTION;
    }

    static String messageOf(Throwable failure) {
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getName();
    }

    private static Type componentType(Type arrayType) {
        if (arrayType instanceof GenericArrayType g) {
            return g.getGenericComponentType();
        }
        return ((Class<?>) arrayType).getComponentType();
    }

    private static Class<?> rawComponent(Type arrayType) {
        return ValueDecoder.rawClass(componentType(arrayType));
    }
}
