package com.questrail.msgrpc.msgpack;

/**
 * Wire-level discriminant of the value most recently read by a
 * {@link MessagePackDecoder}.
 *
 * <p>Positive fixint and the signed {@code int8..int64} forms report
 * {@link #INT}; the {@code uint8..uint64} forms report {@link #UINT}. Both
 * float widths report {@link #FLOAT}.</p>
 *
 * <p>{@link #ARRAY_HEADER} and {@link #MAP_HEADER} carry only the declared
 * element count. The codec does not descend into composites on its own; the
 * caller iterates the declared members (or calls
 * {@link MessagePackDecoder#skip()}).</p>
 */
public enum MessagePackType
{
    NIL,
    BOOL,
    INT,
    UINT,
    FLOAT,
    STRING,
    BINARY,
    ARRAY_HEADER,
    MAP_HEADER,
    EXTENSION
}
