package com.questrail.msgrpc.model;

import com.questrail.msgrpc.msgpack.RawValue;

import java.util.Objects;

/**
 * {@code [2, method, params]}
 */
public record Notification(String method, RawValue params) implements RpcMessage
{
    public static final int KIND = 2;

    public Notification {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
    }

    @Override
    public int kind() {
        return KIND;
    }
}
