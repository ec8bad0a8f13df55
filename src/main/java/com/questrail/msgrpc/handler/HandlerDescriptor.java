package com.questrail.msgrpc.handler;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;

/**
 * HandlerDescriptor
 * -----------------------------------------------------------------------------
 * Everything the dispatcher needs to call a handler without knowing its
 * static type: the parameter types to bind the params array to, whether the
 * last parameter collects surplus arguments, and how to treat the result.
 *
 * <p>Shape errors are rejected here, at registration time, never during
 * dispatch.</p>
 *
 * @param parameterTypes   wire parameters in order; for a variadic handler the
 *                         last entry is an array type
 * @param variadic         surplus params are collected into the last parameter
 * @param returnShape      whether a result is produced
 * @param returnType       result type, {@code void.class} for {@link ReturnShape#VOID}
 * @param receivesEndpoint the serving endpoint is passed ahead of the wire
 *                         parameters
 * @param invoker          the erased call
 */
public record HandlerDescriptor(
    List<Type> parameterTypes,
    boolean variadic,
    ReturnShape returnShape,
    Type returnType,
    boolean receivesEndpoint,
    RpcHandler invoker
) {
    public HandlerDescriptor {
        parameterTypes = List.copyOf(Objects.requireNonNull(parameterTypes, "parameterTypes"));
        Objects.requireNonNull(returnShape, "returnShape");
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(invoker, "invoker");

        if (variadic) {
            if (parameterTypes.isEmpty() || !isArray(parameterTypes.get(parameterTypes.size() - 1))) {
                throw new IllegalArgumentException("variadic handler must end with an array parameter");
            }
        }
        boolean isVoid = returnType == void.class || returnType == Void.class;
        if (returnShape == ReturnShape.VOID && !isVoid) {
            throw new IllegalArgumentException("void handler declares return type " + returnType.getTypeName());
        }
        if (returnShape == ReturnShape.VALUE && isVoid) {
            throw new IllegalArgumentException("value handler must declare a return type");
        }
    }

    public HandlerDescriptor(List<Type> parameterTypes, boolean variadic, ReturnShape returnShape,
                             Type returnType, RpcHandler invoker) {
        this(parameterTypes, variadic, returnShape, returnType, false, invoker);
    }

    /** Number of parameters bound positionally. */
    public int fixedArity() {
        return variadic ? parameterTypes.size() - 1 : parameterTypes.size();
    }

    private static boolean isArray(Type type) {
        return type instanceof GenericArrayType || (type instanceof Class<?> c && c.isArray());
    }
}
