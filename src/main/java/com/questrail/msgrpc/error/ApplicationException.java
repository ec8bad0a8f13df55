package com.questrail.msgrpc.error;

import com.questrail.msgrpc.msgpack.RawValue;

import java.util.Objects;

/**
 * The peer answered a call with a non-nil error value.
 *
 * <p>When the error value follows the {@code [code, message]} convention the
 * kind is decoded from it; otherwise the kind is
 * {@link ErrorKind#UNSPECIFIED} and the message is the rendered value.</p>
 */
public final class ApplicationException extends RpcException
{
    private final String method;
    private final ErrorKind kind;
    private final String detail;
    private final RawValue errorValue;

    public ApplicationException(String method, ErrorKind kind, String detail, RawValue errorValue) {
        super(method + " " + kind.label() + ": " + detail);
        this.method = Objects.requireNonNull(method, "method");
        this.kind = kind;
        this.detail = detail;
        this.errorValue = Objects.requireNonNull(errorValue, "errorValue");
    }

    public String method() {
        return method;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** The peer-supplied message, without the method and kind prefix. */
    public String detail() {
        return detail;
    }

    /** The error value exactly as received. */
    public RawValue errorValue() {
        return errorValue;
    }
}
