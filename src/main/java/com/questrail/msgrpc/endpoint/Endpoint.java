package com.questrail.msgrpc.endpoint;

import com.questrail.msgrpc.codec.RpcMessageDecoder;
import com.questrail.msgrpc.codec.RpcMessageEncoder;
import com.questrail.msgrpc.codec.impl.DefaultRpcMessageDecoder;
import com.questrail.msgrpc.codec.impl.DefaultRpcMessageEncoder;
import com.questrail.msgrpc.config.EndpointConfig;
import com.questrail.msgrpc.error.ApplicationException;
import com.questrail.msgrpc.error.ErrorKind;
import com.questrail.msgrpc.error.ProtocolException;
import com.questrail.msgrpc.error.TransportException;
import com.questrail.msgrpc.handler.AtomicCallHandler;
import com.questrail.msgrpc.handler.HandlerDescriptor;
import com.questrail.msgrpc.handler.HandlerInvoker;
import com.questrail.msgrpc.handler.HandlerRegistry;
import com.questrail.msgrpc.handler.Handlers;
import com.questrail.msgrpc.internal.bind.ValueDecoder;
import com.questrail.msgrpc.internal.bind.ValueEncoder;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.RawValue;
import com.questrail.msgrpc.observability.RpcErrorEvent;
import com.questrail.msgrpc.observability.RpcObservabilitySink;
import com.questrail.msgrpc.observability.RpcTransportEvent;
import com.questrail.msgrpc.transport.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Endpoint
 * =============================================================================
 * One side of a MessagePack-RPC connection: issues calls and notifications,
 * and serves the peer's calls and notifications, over a single
 * {@link StreamTransport}.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>Exactly one thread runs the read loop ({@link #serve()} or
 *       {@link #start()}). It decodes envelopes, completes pending calls, and
 *       hands inbound requests and notifications to the dispatch executor. It
 *       never runs handler code.</li>
 *   <li>Any number of threads may call {@link #call}, {@link #notify(String, Object...)}
 *       and {@link Batch#execute()} concurrently. Each message is encoded into
 *       a private buffer first; only the write and flush happen under the
 *       write lock, so messages never interleave on the wire.</li>
 *   <li>The pending-call table is independent of the write lock. A call's
 *       entry is registered before its request is written, so the response
 *       always finds it.</li>
 * </ul>
 *
 * <h2>Failure Model</h2>
 * <ul>
 *   <li>A malformed envelope or an unmatched response id is reported to the
 *       {@link RpcObservabilitySink} and discarded; the connection stays
 *       up.</li>
 *   <li>An I/O error, a broken byte stream, or end of input ends the read
 *       loop. Every pending call is released with a
 *       {@link TransportException}, and every later call fails with it.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   OPEN  --close()-->  CLOSING  --resources released-->  CLOSED
 * </pre>
 */
public final class Endpoint implements Closeable
{
    private static final Logger log = LoggerFactory.getLogger(Endpoint.class);

    private static final AtomicInteger ENDPOINT_IDS = new AtomicInteger();
    private static final Duration EXECUTOR_SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final int endpointId = ENDPOINT_IDS.incrementAndGet();

    private final StreamTransport transport;
    private final EndpointConfig config;
    private final RpcObservabilitySink sink;

    private final RpcMessageEncoder messageEncoder = new DefaultRpcMessageEncoder();
    private final RpcMessageDecoder messageDecoder = new DefaultRpcMessageDecoder();
    private final ValueEncoder valueEncoder;
    private final ValueDecoder valueDecoder;

    private final HandlerRegistry handlers = new HandlerRegistry();
    private final HandlerInvoker invoker;

    private final ExecutorService dispatchExecutor;
    private final boolean ownsDispatchExecutor;

    private final AtomicLong nextId = new AtomicLong(1);
    private final ConcurrentMap<Long, PendingCall> pending = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    private final AtomicReference<EndpointState> state = new AtomicReference<>(EndpointState.OPEN);
    private final AtomicBoolean serving = new AtomicBoolean(false);
    private final AtomicReference<CompletableFuture<Void>> startTask = new AtomicReference<>();

    private final AtomicReference<TransportException> terminalError = new AtomicReference<>();
    private volatile CompletableFuture<Void> readLoopDone;

    public Endpoint(StreamTransport transport) {
        this(transport, EndpointConfig.defaults());
    }

    public Endpoint(StreamTransport transport, EndpointConfig config) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();

        this.valueEncoder = new ValueEncoder(config.extensions());
        this.valueDecoder = new ValueDecoder(config.extensions());
        this.invoker = new HandlerInvoker(valueEncoder, valueDecoder);

        if (config.dispatchExecutor() != null) {
            this.dispatchExecutor = config.dispatchExecutor();
            this.ownsDispatchExecutor = false;
        } else {
            this.dispatchExecutor = Executors.newCachedThreadPool(daemonThreads("msgrpc-dispatch-" + endpointId));
            this.ownsDispatchExecutor = true;
        }
    }

    // -------------------------------------------------------------------------
    // Handler registration
    // -------------------------------------------------------------------------

    public void registerHandler(String method, HandlerDescriptor descriptor) {
        handlers.register(method, descriptor);
    }

    public void registerHandler(String method, Object target, Method javaMethod) {
        handlers.register(method, Handlers.reflective(target, javaMethod));
    }

    /** Registers every {@code @RpcMethod} of {@code bean}. */
    public int registerHandlers(Object bean) {
        return handlers.registerAnnotated(bean);
    }

    /**
     * Serves the atomic batch verb ({@link EndpointConfig#batchMethod()})
     * against this endpoint's handlers.
     */
    public void registerAtomicCallHandler() {
        handlers.register(config.batchMethod(), new AtomicCallHandler(handlers, invoker).descriptor());
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Calls {@code method} and waits for its result.
     *
     * @throws ApplicationException if the peer replied with an error
     * @throws com.questrail.msgrpc.msgpack.ConvertException if the result does not fit {@code resultType}
     * @throws TransportException if the connection failed or was closed first
     * @throws MessagePackException if an argument cannot be encoded; nothing is sent
     */
    public <T> T call(String method, Class<T> resultType, Object... args) throws IOException {
        return call(method, (Type) resultType, args);
    }

    /** As {@link #call(String, Class, Object...)} for generic result types. */
    @SuppressWarnings("unchecked")
    public <T> T call(String method, Type resultType, Object... args) throws IOException {
        Objects.requireNonNull(resultType, "resultType");
        RawValue result = callRaw(method, args);
        return (T) valueDecoder.decode(result, resultType);
    }

    /** Calls {@code method} and returns its result undecoded. */
    public RawValue callRaw(String method, Object... args) throws IOException {
        Objects.requireNonNull(method, "method");
        RawValue params = encodeArguments(args);

        long id = nextId.getAndIncrement();
        PendingCall call = new PendingCall(id);
        MessagePackEncoder out = new MessagePackEncoder();
        messageEncoder.encode(new Request(id, method, params), out);

        synchronized (writeLock) {
            checkOpen();
            pending.put(id, call);
            // terminate() drains the table after publishing its error
            if (terminalError.get() != null && pending.remove(id) != null) {
                throw failure();
            }
            try {
                writeMessage(out);
            } catch (IOException e) {
                pending.remove(id);
                throw new TransportException("msgrpc: write failed: " + e.getMessage(), e);
            }
        }

        Response response;
        try {
            response = call.await();
        } catch (InterruptedIOException e) {
            pending.remove(id);
            throw e;
        }
        if (response.isError()) {
            throw applicationError(method, response.error());
        }
        return response.result();
    }

    /**
     * Sends a notification. Never waits for the peer and never allocates a
     * message id.
     */
    public void notify(String method, Object... args) throws IOException {
        Objects.requireNonNull(method, "method");
        RawValue params = encodeArguments(args);
        MessagePackEncoder out = new MessagePackEncoder();
        messageEncoder.encode(new Notification(method, params), out);

        synchronized (writeLock) {
            checkOpen();
            try {
                writeMessage(out);
            } catch (IOException e) {
                throw new TransportException("msgrpc: write failed: " + e.getMessage(), e);
            }
        }
    }

    public Batch newBatch() {
        return new Batch(this);
    }

    // -------------------------------------------------------------------------
    // Read loop
    // -------------------------------------------------------------------------

    /**
     * Runs the read loop on the calling thread until end of input, a transport
     * failure, or {@link #close()}.
     *
     * @throws IllegalStateException if a read loop has already been started
     * @throws IOException if the loop ended because the connection failed
     */
    public void serve() throws IOException {
        if (!serving.compareAndSet(false, true)) {
            throw new IllegalStateException("serve() is already running on this endpoint");
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        readLoopDone = done;

        IOException failure = null;
        try {
            checkOpen();
            sink.onTransportEvent(new RpcTransportEvent.ServeStarted(Instant.now()));
            readLoop();
        } catch (IOException e) {
            // errors caused by a local close() are an orderly stop
            if (state.get() == EndpointState.OPEN) {
                failure = e;
            }
        } finally {
            terminate(failure == null
                    ? TransportException.closed()
                    : new TransportException("msgrpc: connection failed: " + failure.getMessage(), failure));
            sink.onTransportEvent(new RpcTransportEvent.ServeStopped(Instant.now(), failure));
            done.complete(null);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Runs {@link #serve()} on a dedicated daemon thread. Its outcome is
     * reported by {@link #close()}.
     */
    public void start() {
        CompletableFuture<Void> outcome = new CompletableFuture<>();
        if (!startTask.compareAndSet(null, outcome)) {
            throw new IllegalStateException("start() has already been called on this endpoint");
        }
        Thread thread = new Thread(() -> {
            try {
                serve();
                outcome.complete(null);
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            }
        }, "msgrpc-serve-" + endpointId);
        thread.setDaemon(true);
        thread.start();
    }

    private void readLoop() throws IOException {
        MessagePackDecoder in = new MessagePackDecoder(transport.input());
        while (true) {
            Optional<RpcMessage> next;
            try {
                next = messageDecoder.read(in);
            } catch (ProtocolException e) {
                sink.onProtocolError(RpcErrorEvent.now(null, e.getMessage(), e));
                continue;
            }
            if (next.isEmpty()) {
                return;
            }

            RpcMessage message = next.get();
            if (message instanceof Response response) {
                completeCall(response);
            } else {
                dispatch(message);
            }
        }
    }

    private void completeCall(Response response) {
        PendingCall call = pending.remove(response.id());
        if (call == null) {
            ProtocolException e = new ProtocolException("msgrpc: response for unknown request id " + response.id());
            sink.onProtocolError(RpcErrorEvent.now(null, e.getMessage(), e));
            return;
        }
        call.complete(response);
    }

    private void dispatch(RpcMessage message) {
        try {
            if (message instanceof Request request) {
                dispatchExecutor.execute(() -> handleRequest(request));
            } else {
                Notification notification = (Notification) message;
                dispatchExecutor.execute(() -> handleNotification(notification));
            }
        } catch (RejectedExecutionException e) {
            sink.onHandlerError(RpcErrorEvent.now(methodOf(message), "dispatch rejected", e));
        }
    }

    // -------------------------------------------------------------------------
    // Inbound handling (dispatch threads)
    // -------------------------------------------------------------------------

    private void handleRequest(Request request) {
        RawValue error = RawValue.NIL;
        RawValue result = RawValue.NIL;

        HandlerDescriptor handler = handlers.lookup(request.method()).orElse(null);
        try {
            if (handler == null) {
                error = valueEncoder.toRaw("unknown request method: " + request.method());
            } else {
                try {
                    result = invoker.invoke(handler, this, request.params());
                } catch (Throwable t) {
                    // an Error still gets a reply, the caller is waiting on it
                    sink.onHandlerError(RpcErrorEvent.now(request.method(), messageOf(t), t));
                    error = invoker.errorValue(t);
                }
            }
        } catch (MessagePackException e) {
            sink.onHandlerError(RpcErrorEvent.now(request.method(), "cannot encode error reply", e));
            return;
        }

        MessagePackEncoder out = new MessagePackEncoder();
        try {
            messageEncoder.encode(new Response(request.id(), error, result), out);
            synchronized (writeLock) {
                checkOpen();
                writeMessage(out);
            }
        } catch (IOException e) {
            if (state.get() == EndpointState.OPEN) {
                sink.onHandlerError(RpcErrorEvent.now(request.method(), "cannot send response", e));
            } else {
                log.debug("Dropping response to {} after close", request.method());
            }
        }
    }

    private void handleNotification(Notification notification) {
        HandlerDescriptor handler = handlers.lookup(notification.method()).orElse(null);
        if (handler == null) {
            sink.onHandlerError(RpcErrorEvent.now(notification.method(),
                    "unknown notification method: " + notification.method(), null));
            return;
        }
        try {
            invoker.invoke(handler, this, notification.params());
        } catch (Throwable t) {
            sink.onHandlerError(RpcErrorEvent.now(notification.method(), messageOf(t), t));
        }
    }

    // -------------------------------------------------------------------------
    // Close
    // -------------------------------------------------------------------------

    /**
     * Closes the connection and releases every resource.
     *
     * <p>Pending calls are released immediately. Then, in order, this waits
     * for the read loop to exit, for whatever sits behind the transport to
     * terminate, and for the {@link #start()} task to report. Each wait is
     * bounded by {@link EndpointConfig#closeGracePeriod()}; a process transport
     * kills its child when that period runs out, which releases a read loop
     * still blocked on the child's output. The first failure
     * in that order is thrown; later ones are attached as suppressed.</p>
     *
     * <p>Only the first invocation does anything.</p>
     */
    @Override
    public void close() throws IOException {
        if (!state.compareAndSet(EndpointState.OPEN, EndpointState.CLOSING)) {
            return;
        }
        Duration grace = config.closeGracePeriod();
        List<IOException> errors = new ArrayList<>();

        terminate(TransportException.closed());
        try {
            transport.close(grace);
        } catch (IOException e) {
            errors.add(e);
        }

        // 1) read loop; a reader blocked on a child's stdout is only released
        // once the child is gone, so a miss here gets another chance after (2)
        CompletableFuture<Void> loop = readLoopDone;
        boolean loopExited = loop == null || completesWithin(loop, grace);

        // 2) peer process, if any
        IOException terminationError = null;
        try {
            transport.awaitTermination(grace);
        } catch (IOException e) {
            terminationError = e;
        }
        if (!loopExited) {
            await(loop, grace, "read loop did not exit within " + grace, errors);
        }
        if (terminationError != null) {
            errors.add(terminationError);
        }

        // 3) start() task
        CompletableFuture<Void> task = startTask.get();
        if (task != null) {
            await(task, grace, "serve task did not finish within " + grace, errors);
        }

        if (ownsDispatchExecutor) {
            shutdownExecutor();
        }
        state.set(EndpointState.CLOSED);
        sink.onTransportEvent(new RpcTransportEvent.Closed(Instant.now()));

        if (!errors.isEmpty()) {
            IOException first = errors.get(0);
            for (int i = 1; i < errors.size(); i++) {
                first.addSuppressed(errors.get(i));
            }
            throw first;
        }
    }

    public EndpointState state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == EndpointState.OPEN && terminalError.get() == null;
    }

    // -------------------------------------------------------------------------
    // Package-private collaborators for Batch
    // -------------------------------------------------------------------------

    String batchMethod() {
        return config.batchMethod();
    }

    ValueEncoder valueEncoder() {
        return valueEncoder;
    }

    ValueDecoder valueDecoder() {
        return valueDecoder;
    }

    int pendingCount() {
        return pending.size();
    }

    /**
     * Interprets a non-nil error value. {@code [code, message]} yields the
     * matching {@link ErrorKind}; anything else is rendered as text.
     */
    ApplicationException applicationError(String method, RawValue error) {
        Object decoded;
        try {
            decoded = valueDecoder.decode(error, Object.class);
        } catch (IOException e) {
            return new ApplicationException(method, ErrorKind.UNSPECIFIED, error.toString(), error);
        }
        if (decoded instanceof List<?> list && list.size() == 2
                && list.get(0) instanceof Long code && list.get(1) instanceof String message) {
            ErrorKind kind = ErrorKind.fromCode(code);
            return new ApplicationException(method, kind != null ? kind : ErrorKind.UNSPECIFIED, message, error);
        }
        return new ApplicationException(method, ErrorKind.UNSPECIFIED, String.valueOf(decoded), error);
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private RawValue encodeArguments(Object[] args) throws MessagePackException {
        MessagePackEncoder out = new MessagePackEncoder();
        valueEncoder.encodeArguments(out, args);
        return out.toRawValue();
    }

    /** Caller holds {@link #writeLock}. */
    private void writeMessage(MessagePackEncoder message) throws IOException {
        OutputStream os = transport.output();
        message.writeTo(os);
        os.flush();
    }

    private void checkOpen() throws TransportException {
        if (terminalError.get() != null) {
            throw failure();
        }
        if (state.get() != EndpointState.OPEN) {
            throw TransportException.closed();
        }
    }

    private TransportException failure() {
        TransportException t = terminalError.get();
        return new TransportException(t.getMessage(), t.getCause());
    }

    /** Records the terminal error once and releases every pending call with it. */
    private void terminate(TransportException error) {
        terminalError.compareAndSet(null, error);
        TransportException published = terminalError.get();
        for (Long id : List.copyOf(pending.keySet())) {
            PendingCall call = pending.remove(id);
            if (call != null) {
                call.fail(published);
            }
        }
    }

    private static boolean completesWithin(CompletableFuture<Void> future, Duration grace) {
        try {
            future.get(grace.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // reported by await()
            return false;
        }
    }

    private static void await(CompletableFuture<Void> future, Duration grace, String timeoutMessage,
                              List<IOException> errors) {
        try {
            future.get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            errors.add(new TransportException("msgrpc: " + timeoutMessage));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add(new InterruptedIOException("interrupted while closing"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            errors.add(cause instanceof IOException io ? io : new IOException(cause));
        }
    }

    private void shutdownExecutor() {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(EXECUTOR_SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String methodOf(RpcMessage message) {
        if (message instanceof Request r) {
            return r.method();
        }
        if (message instanceof Notification n) {
            return n.method();
        }
        return null;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String toString() {
        return "Endpoint[" + endpointId + ", " + state.get() + ", " + transport + ']';
    }
}
