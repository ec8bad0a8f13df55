package com.questrail.msgrpc.handler;

/**
 * Whether a handler produces a result value.
 */
public enum ReturnShape
{
    /** The handler's return value is encoded as the response result. */
    VALUE,
    /** The handler returns nothing; the response result is nil. */
    VOID
}
