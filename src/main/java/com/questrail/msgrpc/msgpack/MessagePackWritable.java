package com.questrail.msgrpc.msgpack;

/**
 * Implemented by types that encode themselves instead of relying on the
 * default object binding.
 */
@FunctionalInterface
public interface MessagePackWritable
{
    /** Packs exactly one complete value. */
    void writeTo(MessagePackEncoder encoder) throws MessagePackException;
}
