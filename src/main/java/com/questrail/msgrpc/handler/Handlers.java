package com.questrail.msgrpc.handler;

import com.questrail.msgrpc.endpoint.Endpoint;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factories for {@link HandlerDescriptor}s.
 *
 * <p>The typed factories cover handlers of up to three parameters and check
 * their shape through the compiler. {@link #reflective(Object, Method)}
 * covers everything else.</p>
 */
public final class Handlers
{
    private Handlers() {
    }

    @FunctionalInterface
    public interface Function0<R> { R apply() throws Exception; }

    @FunctionalInterface
    public interface Function1<A, R> { R apply(A a) throws Exception; }

    @FunctionalInterface
    public interface Function2<A, B, R> { R apply(A a, B b) throws Exception; }

    @FunctionalInterface
    public interface Function3<A, B, C, R> { R apply(A a, B b, C c) throws Exception; }

    @FunctionalInterface
    public interface Procedure0 { void run() throws Exception; }

    @FunctionalInterface
    public interface Procedure1<A> { void run(A a) throws Exception; }

    @FunctionalInterface
    public interface Procedure2<A, B> { void run(A a, B b) throws Exception; }

    @FunctionalInterface
    public interface Procedure3<A, B, C> { void run(A a, B b, C c) throws Exception; }

    // -------------------------------------------------------------------------
    // Value-returning
    // -------------------------------------------------------------------------

    public static <R> HandlerDescriptor function(Class<R> result, Function0<R> fn) {
        Objects.requireNonNull(fn, "fn");
        return value(List.of(), result, args -> fn.apply());
    }

    @SuppressWarnings("unchecked")
    public static <A, R> HandlerDescriptor function(Class<A> a, Class<R> result, Function1<A, R> fn) {
        Objects.requireNonNull(fn, "fn");
        return value(List.of(a), result, args -> fn.apply((A) args[0]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, R> HandlerDescriptor function(Class<A> a, Class<B> b, Class<R> result,
                                                       Function2<A, B, R> fn) {
        Objects.requireNonNull(fn, "fn");
        return value(List.of(a, b), result, args -> fn.apply((A) args[0], (B) args[1]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, R> HandlerDescriptor function(Class<A> a, Class<B> b, Class<C> c, Class<R> result,
                                                          Function3<A, B, C, R> fn) {
        Objects.requireNonNull(fn, "fn");
        return value(List.of(a, b, c), result, args -> fn.apply((A) args[0], (B) args[1], (C) args[2]));
    }

    // -------------------------------------------------------------------------
    // Void
    // -------------------------------------------------------------------------

    public static HandlerDescriptor procedure(Procedure0 fn) {
        Objects.requireNonNull(fn, "fn");
        return nothing(List.of(), args -> {
            fn.run();
            return null;
        });
    }

    @SuppressWarnings("unchecked")
    public static <A> HandlerDescriptor procedure(Class<A> a, Procedure1<A> fn) {
        Objects.requireNonNull(fn, "fn");
        return nothing(List.of(a), args -> {
            fn.run((A) args[0]);
            return null;
        });
    }

    @SuppressWarnings("unchecked")
    public static <A, B> HandlerDescriptor procedure(Class<A> a, Class<B> b, Procedure2<A, B> fn) {
        Objects.requireNonNull(fn, "fn");
        return nothing(List.of(a, b), args -> {
            fn.run((A) args[0], (B) args[1]);
            return null;
        });
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C> HandlerDescriptor procedure(Class<A> a, Class<B> b, Class<C> c,
                                                        Procedure3<A, B, C> fn) {
        Objects.requireNonNull(fn, "fn");
        return nothing(List.of(a, b, c), args -> {
            fn.run((A) args[0], (B) args[1], (C) args[2]);
            return null;
        });
    }

    // -------------------------------------------------------------------------
    // Reflective
    // -------------------------------------------------------------------------

    /**
     * Describes {@code method} on {@code target}. A first parameter of type
     * {@link Endpoint} receives the serving endpoint and is not bound from the
     * wire. Java varargs methods are variadic. {@code target} may be
     * {@code null} for a static method.
     */
    public static HandlerDescriptor reflective(Object target, Method method) {
        Objects.requireNonNull(method, "method");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic) {
            Objects.requireNonNull(target, "target");
            if (!method.getDeclaringClass().isInstance(target)) {
                throw new IllegalArgumentException(method + " is not a member of " + target.getClass().getName());
            }
        }
        method.trySetAccessible();

        Type[] generic = method.getGenericParameterTypes();
        boolean receivesEndpoint = generic.length > 0 && method.getParameterTypes()[0] == Endpoint.class;
        List<Type> wire = Arrays.asList(generic).subList(receivesEndpoint ? 1 : 0, generic.length);

        Type returnType = method.getGenericReturnType();
        ReturnShape shape = returnType == void.class ? ReturnShape.VOID : ReturnShape.VALUE;
        Object receiver = isStatic ? null : target;

        RpcHandler invoker = args -> {
            try {
                return method.invoke(receiver, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw e;
            }
        };
        return new HandlerDescriptor(wire, method.isVarArgs(), shape, returnType, receivesEndpoint, invoker);
    }

    private static HandlerDescriptor value(List<Type> params, Class<?> result, RpcHandler invoker) {
        Objects.requireNonNull(result, "result");
        return new HandlerDescriptor(params, false, ReturnShape.VALUE, result, invoker);
    }

    private static HandlerDescriptor nothing(List<Type> params, RpcHandler invoker) {
        return new HandlerDescriptor(params, false, ReturnShape.VOID, void.class, invoker);
    }
}
