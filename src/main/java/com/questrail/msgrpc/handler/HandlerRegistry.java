package com.questrail.msgrpc.handler;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * HandlerRegistry
 * -----------------------------------------------------------------------------
 * Method name to {@link HandlerDescriptor} table consulted for every inbound
 * request and notification.
 *
 * <p>Registering a name again replaces the earlier handler. Lookups may race
 * with registration; a lookup sees either the old or the new descriptor.</p>
 */
public final class HandlerRegistry
{
    private final ConcurrentMap<String, HandlerDescriptor> handlers = new ConcurrentHashMap<>();

    public void register(String method, HandlerDescriptor descriptor) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(descriptor, "descriptor");
        if (method.isEmpty()) {
            throw new IllegalArgumentException("method name must not be empty");
        }
        handlers.put(method, descriptor);
    }

    /**
     * Registers every method of {@code bean} annotated with {@link RpcMethod}.
     *
     * @return number of handlers registered
     * @throws IllegalArgumentException if {@code bean} has no annotated method
     */
    public int registerAnnotated(Object bean) {
        Objects.requireNonNull(bean, "bean");
        int count = 0;
        for (Method method : bean.getClass().getMethods()) {
            RpcMethod annotation = method.getAnnotation(RpcMethod.class);
            if (annotation == null) {
                continue;
            }
            String name = annotation.value().isEmpty() ? method.getName() : annotation.value();
            Object target = Modifier.isStatic(method.getModifiers()) ? null : bean;
            register(name, Handlers.reflective(target, method));
            count++;
        }
        if (count == 0) {
            throw new IllegalArgumentException(bean.getClass().getName() + " has no @RpcMethod methods");
        }
        return count;
    }

    public Optional<HandlerDescriptor> lookup(String method) {
        return Optional.ofNullable(handlers.get(method));
    }

    public boolean unregister(String method) {
        return handlers.remove(method) != null;
    }

    public Set<String> methods() {
        return Set.copyOf(handlers.keySet());
    }
}
