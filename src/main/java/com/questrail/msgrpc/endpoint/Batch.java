package com.questrail.msgrpc.endpoint;

import com.questrail.msgrpc.error.ApplicationException;
import com.questrail.msgrpc.error.BatchException;
import com.questrail.msgrpc.error.ErrorKind;
import com.questrail.msgrpc.error.RpcException;
import com.questrail.msgrpc.msgpack.ConvertException;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.MessagePackType;
import com.questrail.msgrpc.msgpack.RawValue;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Batch
 * -----------------------------------------------------------------------------
 * Accumulates calls that the peer executes atomically, in one round trip.
 *
 * <p>Each {@link #call} appends a {@code [method, params]} pair and returns
 * the {@link BatchResult} that {@link #execute()} will fill. If an argument
 * cannot be encoded the batch is poisoned: further calls are ignored and
 * {@code execute()} throws the encode failure without contacting the
 * peer.</p>
 *
 * <p>The peer replies {@code [results, error]}. When call {@code i} failed,
 * results {@code 0..i-1} are delivered and a {@link BatchException} carrying
 * {@code i} is thrown. The batch is empty again after every
 * {@code execute()}, whatever its outcome.</p>
 */
public final class Batch
{
    private final Endpoint endpoint;

    private final List<BatchResult<?>> results = new ArrayList<>();
    private final MessagePackEncoder calls = new MessagePackEncoder();
    private MessagePackException encodeError;

    Batch(Endpoint endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public <T> BatchResult<T> call(String method, Class<T> resultType, Object... args) {
        return call(method, (Type) resultType, args);
    }

    public synchronized <T> BatchResult<T> call(String method, Type resultType, Object... args) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(resultType, "resultType");
        BatchResult<T> result = new BatchResult<>(method, resultType);
        if (encodeError != null) {
            return result;
        }

        MessagePackEncoder pair = new MessagePackEncoder();
        try {
            pair.packArrayHeader(2).packString(method);
            endpoint.valueEncoder().encodeArguments(pair, args);
        } catch (MessagePackException e) {
            encodeError = e;
            return result;
        }
        calls.packRaw(pair.toByteArray());
        results.add(result);
        return result;
    }

    /** Number of calls queued. */
    public synchronized int size() {
        return results.size();
    }

    /**
     * Sends the queued calls as one atomic request and distributes the
     * results. An empty batch completes without contacting the peer.
     *
     * @throws MessagePackException the first encode failure, if the batch was poisoned
     * @throws BatchException if one of the calls failed
     * @throws RpcException if the reply does not have the expected shape
     */
    public synchronized void execute() throws IOException {
        try {
            if (encodeError != null) {
                throw encodeError;
            }
            int n = results.size();
            if (n == 0) {
                return;
            }

            MessagePackEncoder argument = new MessagePackEncoder(calls.size() + 5);
            argument.packArrayHeader(n).packRaw(calls.toByteArray());
            RawValue reply = endpoint.callRaw(endpoint.batchMethod(), argument.toRawValue());
            distribute(reply);
        } finally {
            reset();
        }
    }

    private void distribute(RawValue reply) throws IOException {
        MessagePackDecoder in = reply.newDecoder();
        if (!in.unpack() || in.type() != MessagePackType.ARRAY_HEADER || in.length() != 2) {
            throw new RpcException("msgrpc: malformed batch reply " + reply);
        }

        in.unpack();
        if (in.type() != MessagePackType.ARRAY_HEADER) {
            throw new RpcException("msgrpc: malformed batch results " + reply);
        }
        int delivered = in.length();
        ConvertException convertError = null;
        for (int i = 0; i < delivered; i++) {
            RawValue raw = in.nextRaw();
            if (i >= results.size()) {
                continue;
            }
            BatchResult<?> target = results.get(i);
            try {
                target.deliver(endpoint.valueDecoder().decode(raw, target.resultType()));
            } catch (ConvertException e) {
                if (convertError == null) {
                    convertError = e;
                }
            }
        }

        RawValue error = in.nextRaw();
        if (!error.isNil()) {
            throw batchFailure(error);
        }
        if (convertError != null) {
            throw convertError;
        }
    }

    private BatchException batchFailure(RawValue error) throws IOException {
        Object decoded = endpoint.valueDecoder().decode(error, Object.class);
        if (decoded instanceof List<?> triple && triple.size() == 3
                && triple.get(0) instanceof Long index
                && triple.get(1) instanceof Long code
                && triple.get(2) instanceof String message) {
            ErrorKind kind = ErrorKind.fromCode(code);
            if (index >= 0 && index < results.size() && kind != null) {
                int i = index.intValue();
                ApplicationException cause = new ApplicationException(results.get(i).method(), kind, message, error);
                return new BatchException(i, cause);
            }
        }
        throw new RpcException("msgrpc: malformed batch error " + decoded);
    }

    private void reset() {
        results.clear();
        calls.reset();
        encodeError = null;
    }
}
