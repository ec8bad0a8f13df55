package com.questrail.msgrpc.endpoint;

import java.lang.reflect.Type;
import java.util.NoSuchElementException;

/**
 * Target for one call of a {@link Batch}. Filled in by
 * {@link Batch#execute()} when the call succeeded.
 *
 * @param <T> result type
 */
public final class BatchResult<T>
{
    private final String method;
    private final Type resultType;

    private volatile boolean delivered;
    private volatile T value;

    BatchResult(String method, Type resultType) {
        this.method = method;
        this.resultType = resultType;
    }

    public String method() {
        return method;
    }

    Type resultType() {
        return resultType;
    }

    @SuppressWarnings("unchecked")
    void deliver(Object result) {
        this.value = (T) result;
        this.delivered = true;
    }

    public boolean isDelivered() {
        return delivered;
    }

    /**
     * @throws NoSuchElementException if the call did not complete successfully
     */
    public T get() {
        if (!delivered) {
            throw new NoSuchElementException("no result delivered for " + method);
        }
        return value;
    }

    public T orElse(T other) {
        return delivered ? value : other;
    }

    @Override
    public String toString() {
        return "BatchResult[" + method + (delivered ? "=" + value : ", pending") + ']';
    }
}
