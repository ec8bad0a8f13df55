package com.questrail.msgrpc.codec.impl;

import com.questrail.msgrpc.codec.RpcMessageEncoder;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;

import java.util.Objects;

/**
 * DefaultRpcMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RpcMessageEncoder}.
 */
public final class DefaultRpcMessageEncoder implements RpcMessageEncoder
{
    @Override
    public void encode(RpcMessage message, MessagePackEncoder out) throws MessagePackException
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(out, "out");

        if (message instanceof Request r) {
            checkId(r.id());
            out.packArrayHeader(RpcEnvelope.REQUEST_ARITY)
                    .packUint(Request.KIND)
                    .packUint(r.id())
                    .packString(r.method())
                    .packRaw(r.params());
        }
        else if (message instanceof Response r) {
            checkId(r.id());
            out.packArrayHeader(RpcEnvelope.RESPONSE_ARITY)
                    .packUint(Response.KIND)
                    .packUint(r.id())
                    .packRaw(r.error())
                    .packRaw(r.result());
        }
        else {
            Notification n = (Notification) message;
            out.packArrayHeader(RpcEnvelope.NOTIFICATION_ARITY)
                    .packUint(Notification.KIND)
                    .packString(n.method())
                    .packRaw(n.params());
        }
    }

    private static void checkId(long id) throws MessagePackException {
        if (id < 0) {
            throw new MessagePackException("msgrpc: message id out of range: " + id);
        }
    }
}
