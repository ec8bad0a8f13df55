package com.questrail.msgrpc.observability;

/**
 * No-op implementation of RpcObservabilitySink.
 */
public final class NullObservabilitySink implements RpcObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onProtocolError(RpcErrorEvent event) {}

    @Override
    public void onHandlerError(RpcErrorEvent event) {}

    @Override
    public void onTransportEvent(RpcTransportEvent event) {}
}
