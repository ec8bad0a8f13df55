package com.questrail.msgrpc.codec.impl;

import com.questrail.msgrpc.codec.RpcMessageDecoder;
import com.questrail.msgrpc.error.ProtocolException;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackType;
import com.questrail.msgrpc.msgpack.RawValue;

import java.io.IOException;
import java.util.Optional;

/**
 * DefaultRpcMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RpcMessageDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Read the top-level value header; anything but an array is consumed
 *       and rejected.</li>
 *   <li>Capture every declared member as a {@link RawValue}. After this step
 *       the stream is positioned on the next message no matter what the
 *       members contain.</li>
 *   <li>Interpret the captured members: kind discriminant, arity, and the
 *       type of each fixed field.</li>
 * </ol>
 */
public final class DefaultRpcMessageDecoder implements RpcMessageDecoder
{
    @Override
    public Optional<RpcMessage> read(MessagePackDecoder in) throws IOException
    {
        if (!in.unpack()) {
            return Optional.empty();
        }

        MessagePackType top = in.type();
        if (top != MessagePackType.ARRAY_HEADER) {
            in.skip();
            throw new ProtocolException("msgrpc: expected message array, got " + top);
        }

        // 1) Consume the whole envelope before judging it
        final int n = in.length();
        final RawValue[] fields = new RawValue[n];
        for (int i = 0; i < n; i++) {
            fields[i] = in.nextRaw();
        }

        // 2) Interpret
        if (n == 0) {
            throw new ProtocolException("msgrpc: empty message array");
        }
        final long kind = integer(fields[0], "message kind");
        if (kind == Request.KIND) {
            checkArity(n, RpcEnvelope.REQUEST_ARITY, "request");
            return Optional.of(new Request(
                    messageId(fields[1]),
                    string(fields[2], "request method"),
                    params(fields[3], "request params")));
        }
        if (kind == Response.KIND) {
            checkArity(n, RpcEnvelope.RESPONSE_ARITY, "response");
            return Optional.of(new Response(messageId(fields[1]), fields[2], fields[3]));
        }
        if (kind == Notification.KIND) {
            checkArity(n, RpcEnvelope.NOTIFICATION_ARITY, "notification");
            return Optional.of(new Notification(
                    string(fields[1], "notification method"),
                    params(fields[2], "notification params")));
        }
        throw new ProtocolException("msgrpc: unknown message kind " + kind);
    }

    private static void checkArity(int actual, int expected, String what) throws ProtocolException {
        if (actual != expected) {
            throw new ProtocolException("msgrpc: " + what + " has " + actual
                    + " elements, expected " + expected);
        }
    }

    private static long messageId(RawValue field) throws IOException {
        long id = integer(field, "message id");
        if (id < 0) {
            throw new ProtocolException("msgrpc: negative message id " + id);
        }
        return id;
    }

    private static long integer(RawValue field, String what) throws IOException {
        MessagePackDecoder d = field.newDecoder();
        d.unpack();
        MessagePackType t = d.type();
        if (t != MessagePackType.INT && t != MessagePackType.UINT) {
            throw new ProtocolException("msgrpc: " + what + " must be an integer, got " + t);
        }
        return d.longValue();
    }

    private static String string(RawValue field, String what) throws IOException {
        MessagePackDecoder d = field.newDecoder();
        d.unpack();
        MessagePackType t = d.type();
        if (t != MessagePackType.STRING && t != MessagePackType.BINARY) {
            throw new ProtocolException("msgrpc: " + what + " must be a string, got " + t);
        }
        return d.string();
    }

    private static RawValue params(RawValue field, String what) throws IOException {
        MessagePackDecoder d = field.newDecoder();
        d.unpack();
        if (d.type() != MessagePackType.ARRAY_HEADER) {
            throw new ProtocolException("msgrpc: " + what + " must be an array, got " + d.type());
        }
        return field;
    }
}
