/**
 * Default MessagePack-RPC envelope codec.
 *
 * <p>Byte-level mechanics stay in {@code msgpack}; this package only applies
 * the envelope shape on top of it.</p>
 */
package com.questrail.msgrpc.codec.impl;
