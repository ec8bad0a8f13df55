package com.questrail.msgrpc.model;

import com.questrail.msgrpc.msgpack.RawValue;

import java.util.Objects;

/**
 * {@code [1, id, error, result]}. Exactly one of error and result is
 * meaningful; a nil error marks success.
 */
public record Response(long id, RawValue error, RawValue result) implements RpcMessage
{
    public static final int KIND = 1;

    public Response {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(result, "result");
    }

    public static Response success(long id, RawValue result) {
        return new Response(id, RawValue.NIL, result);
    }

    public static Response failure(long id, RawValue error) {
        return new Response(id, error, RawValue.NIL);
    }

    public boolean isError() {
        return !error.isNil();
    }

    @Override
    public int kind() {
        return KIND;
    }
}
