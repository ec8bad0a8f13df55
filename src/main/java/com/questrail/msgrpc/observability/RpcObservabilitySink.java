package com.questrail.msgrpc.observability;

/**
 * Main interface for receiving MessagePack-RPC endpoint observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the read loop and on dispatch threads; implementations
 * must be thread-safe and must not block.</p>
 */
public interface RpcObservabilitySink {
    /**
     * Called when an inbound message was malformed or unmatched and has been
     * discarded. The connection stays open.
     * @param event the error event
     */
    void onProtocolError(RpcErrorEvent event);

    /**
     * Called when a handler failed, or when a notification named no registered
     * handler. Request failures are also reported to the caller as error
     * replies.
     * @param event the error event
     */
    void onHandlerError(RpcErrorEvent event);

    /**
     * Called when the read loop starts or stops, or the endpoint closes.
     * @param event the transport event
     */
    void onTransportEvent(RpcTransportEvent event);
}
