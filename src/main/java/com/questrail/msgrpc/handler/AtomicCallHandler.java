package com.questrail.msgrpc.handler;

import com.questrail.msgrpc.error.ErrorKind;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.MessagePackType;
import com.questrail.msgrpc.msgpack.RawValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AtomicCallHandler
 * -----------------------------------------------------------------------------
 * Serves the atomic batch verb: one request whose single parameter is an
 * array of {@code [method, params]} pairs.
 *
 * <p>The sub-calls run in order on the calling dispatch thread while holding a
 * lock shared by every instance in the JVM, so no other batch interleaves with
 * them. Execution stops at the first failure. The reply is</p>
 *
 * <pre>
 *   [ [result0, result1, ...], nil ]                    all succeeded
 *   [ [result0, ..., result(i-1)], [i, kind, message] ] call i failed
 * </pre>
 *
 * <p>Malformed pairs are reported as a validation failure at their index
 * before any sub-call runs.</p>
 */
public final class AtomicCallHandler
{
    private static final Object ATOMIC_LOCK = new Object();

    private final HandlerRegistry registry;
    private final HandlerInvoker invoker;

    public AtomicCallHandler(HandlerRegistry registry, HandlerInvoker invoker) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    public HandlerDescriptor descriptor() {
        return new HandlerDescriptor(
                List.of(RawValue.class),
                false,
                ReturnShape.VALUE,
                RawValue.class,
                true,
                args -> execute(args[0], (RawValue) args[1]));
    }

    RawValue execute(Object endpoint, RawValue calls) throws Exception {
        if (calls == null) {
            throw HandlerException.validation("missing call list");
        }

        MessagePackDecoder in = calls.newDecoder();
        if (!in.unpack() || in.type() != MessagePackType.ARRAY_HEADER) {
            throw HandlerException.validation("call list must be an array");
        }
        int n = in.length();
        List<SubCall> parsed = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            SubCall call = SubCall.parse(in.nextRaw());
            if (call == null) {
                return reply(List.of(), i, ErrorKind.VALIDATION, "call " + i + " is not a [method, params] pair");
            }
            parsed.add(call);
        }

        List<RawValue> results = new ArrayList<>(n);
        synchronized (ATOMIC_LOCK) {
            for (int i = 0; i < parsed.size(); i++) {
                SubCall call = parsed.get(i);
                HandlerDescriptor handler = registry.lookup(call.method()).orElse(null);
                if (handler == null) {
                    return reply(results, i, ErrorKind.VALIDATION, "unknown request method: " + call.method());
                }
                try {
                    results.add(invoker.invoke(handler, endpoint, call.params()));
                } catch (Throwable t) {
                    return reply(results, i, HandlerInvoker.kindOf(t), HandlerInvoker.messageOf(t));
                }
            }
        }
        return reply(results, -1, null, null);
    }

    private static RawValue reply(List<RawValue> results, int failedIndex, ErrorKind kind, String message)
            throws MessagePackException {
        MessagePackEncoder out = new MessagePackEncoder();
        out.packArrayHeader(2);
        out.packArrayHeader(results.size());
        for (RawValue r : results) {
            out.packRaw(r);
        }
        if (failedIndex < 0) {
            out.packNil();
        } else {
            out.packArrayHeader(3)
                    .packInt(failedIndex)
                    .packInt(kind.code())
                    .packString(message);
        }
        return out.toRawValue();
    }

    private record SubCall(String method, RawValue params)
    {
        static SubCall parse(RawValue pair) throws IOException {
            MessagePackDecoder d = pair.newDecoder();
            d.unpack();
            if (d.type() != MessagePackType.ARRAY_HEADER || d.length() != 2) {
                return null;
            }
            d.unpack();
            if (d.type() != MessagePackType.STRING) {
                return null;
            }
            String method = d.string();
            RawValue params = d.nextRaw();
            return new SubCall(method, params);
        }
    }
}
