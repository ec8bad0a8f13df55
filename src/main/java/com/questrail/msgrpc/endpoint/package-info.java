/**
 * The RPC endpoint: call multiplexing, inbound dispatch, and atomic batches.
 *
 * <pre>
 *   StreamTransport
 *        → Endpoint read loop     (one thread)
 *            → Response           → PendingCall completed by id
 *            → Request / Notification → dispatch executor → handler
 * </pre>
 */
package com.questrail.msgrpc.endpoint;
