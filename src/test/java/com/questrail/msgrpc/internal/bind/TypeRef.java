package com.questrail.msgrpc.internal.bind;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic type: {@code new TypeRef<List<String>>() {}.type()}.
 */
public abstract class TypeRef<T> {
    public Type type() {
        return ((ParameterizedType) getClass().getGenericSuperclass()).getActualTypeArguments()[0];
    }
}
