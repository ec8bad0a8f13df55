package com.questrail.msgrpc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RpcObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRpcObservabilitySink implements RpcObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRpcObservabilitySink.class);

    @Override
    public void onProtocolError(RpcErrorEvent event) {
        log.warn("msgrpc protocol error: {}", event.message(), event.cause());
    }

    @Override
    public void onHandlerError(RpcErrorEvent event) {
        log.error("msgrpc handler {} failed: {}", event.method(), event.message(), event.cause());
    }

    @Override
    public void onTransportEvent(RpcTransportEvent event) {
        if (event instanceof RpcTransportEvent.ServeStopped stopped && stopped.cause() != null) {
            log.warn("msgrpc read loop stopped: {}", stopped.cause().toString());
        } else {
            log.debug("msgrpc transport event: {}", event);
        }
    }
}
