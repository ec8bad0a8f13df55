/**
 * MessagePack-RPC Message Framer
 * =============================================================================
 *
 * <p>Maps between MessagePack values and the three RPC envelopes:</p>
 *
 * <pre>
 *   [0, msgid, method, params]   Request
 *   [1, msgid, error,  result]   Response
 *   [2, method, params]          Notification
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   MessagePackDecoder
 *        → RpcMessageDecoder   (envelope rules applied here)
 *            → RpcMessage
 *                → endpoint    (correlation and dispatch)
 * </pre>
 *
 * <p>Interfaces live here; the default implementations live in
 * {@code codec.impl}.</p>
 */
package com.questrail.msgrpc.codec;
