package com.questrail.msgrpc.codec.impl;

/**
 * RpcEnvelope
 * -----------------------------------------------------------------------------
 * Envelope constants shared by the default encoder and decoder.
 */
final class RpcEnvelope
{
    static final int REQUEST_ARITY = 4;
    static final int RESPONSE_ARITY = 4;
    static final int NOTIFICATION_ARITY = 3;

    private RpcEnvelope() {
    }
}
