package com.questrail.msgrpc.model;

import com.questrail.msgrpc.msgpack.RawValue;

import java.util.Objects;

/**
 * {@code [0, id, method, params]}
 */
public record Request(long id, String method, RawValue params) implements RpcMessage
{
    public static final int KIND = 0;

    public Request {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
    }

    @Override
    public int kind() {
        return KIND;
    }
}
