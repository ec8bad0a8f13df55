package com.questrail.msgrpc.error;

/**
 * Classification of an application error reported by a peer.
 *
 * <p>Peers that use the {@code [code, message]} error convention send code 0
 * for an exception raised while running the method, and 1 for a request
 * rejected before it ran.</p>
 */
public enum ErrorKind
{
    EXCEPTION(0, "exception"),
    VALIDATION(1, "validation"),
    UNSPECIFIED(-1, "error");

    private final int code;
    private final String label;

    ErrorKind(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    /** Returns the kind for a wire code, or {@code null} if the code is unknown. */
    public static ErrorKind fromCode(long code) {
        if (code == EXCEPTION.code) {
            return EXCEPTION;
        }
        if (code == VALIDATION.code) {
            return VALIDATION;
        }
        return null;
    }
}
