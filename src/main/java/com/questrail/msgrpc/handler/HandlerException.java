package com.questrail.msgrpc.handler;

import com.questrail.msgrpc.error.ErrorKind;

import java.util.Objects;

/**
 * Thrown by a handler to reply with a classified error. The caller receives
 * the error value {@code [kind code, message]}.
 */
public class HandlerException extends Exception
{
    private final ErrorKind kind;

    public HandlerException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public HandlerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static HandlerException validation(String message) {
        return new HandlerException(ErrorKind.VALIDATION, message);
    }

    public ErrorKind kind() {
        return kind;
    }
}
