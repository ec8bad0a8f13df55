package com.questrail.msgrpc.endpoint;

import com.questrail.msgrpc.config.EndpointConfig;
import com.questrail.msgrpc.error.TransportException;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.observability.RecordingObservabilitySink;
import com.questrail.msgrpc.observability.RpcTransportEvent;
import com.questrail.msgrpc.transport.LoopbackSockets;
import com.questrail.msgrpc.transport.SocketStreamTransport;
import com.questrail.msgrpc.transport.StreamTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EndpointTest
 * -----------------------------------------------------------------------------
 * Drives an {@link Endpoint} against a scripted {@link FakePeer}, which
 * decides exactly when and in which order replies arrive.
 */
final class EndpointTest
{
    private static final Duration WAIT = Duration.ofSeconds(5);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ExecutorService callers = Executors.newCachedThreadPool();

    private LoopbackSockets sockets;
    private FakePeer peer;
    private Endpoint endpoint;

    @BeforeEach
    void setUp() throws IOException
    {
        sockets = LoopbackSockets.open();
        peer = new FakePeer(sockets.right());
        endpoint = new Endpoint(new SocketStreamTransport(sockets.left()), config());
    }

    @AfterEach
    void tearDown() throws IOException
    {
        try {
            endpoint.close();
        } finally {
            callers.shutdownNow();
            sockets.close();
        }
    }

    private EndpointConfig config() {
        return EndpointConfig.builder()
                .withObservabilitySink(sink)
                .withCloseGracePeriod(Duration.ofSeconds(2))
                .build();
    }

    private Future<String> callAsync(String method, Object... args) {
        return callers.submit(() -> endpoint.call(method, String.class, args));
    }

    @Test
    void idsStartAtOneAndNotificationsDoNotConsumeIds() throws Exception
    {
        endpoint.start();
        endpoint.notify("event", 1, "two");
        Future<String> reply = callAsync("ping");

        Notification notification = peer.readNotification();
        assertEquals("event", notification.method());

        Request request = peer.readRequest();
        assertEquals(1, request.id());
        assertEquals("ping", request.method());

        peer.reply(request.id(), "pong");
        assertEquals("pong", reply.get(WAIT.toSeconds(), TimeUnit.SECONDS));

        Future<String> second = callAsync("ping");
        assertEquals(2, peer.readRequest().id());
        peer.reply(2, "again");
        assertEquals("again", second.get(WAIT.toSeconds(), TimeUnit.SECONDS));
    }

    @Test
    void outOfOrderRepliesReachTheirOwnCallers() throws Exception
    {
        endpoint.start();
        Future<String> a = callAsync("echo", "a");
        Request requestA = peer.readRequest();
        Future<String> b = callAsync("echo", "b");
        Request requestB = peer.readRequest();

        peer.reply(requestB.id(), "result-b");
        assertEquals("result-b", b.get(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertFalse(a.isDone());

        peer.reply(requestA.id(), "result-a");
        assertEquals("result-a", a.get(WAIT.toSeconds(), TimeUnit.SECONDS));
    }

    @Test
    void responseWithUnknownIdIsDiscardedWithoutClosing() throws Exception
    {
        endpoint.start();
        peer.reply(999, "stray");

        Future<String> reply = callAsync("ping");
        Request request = peer.readRequest();
        peer.reply(request.id(), "pong");

        assertEquals("pong", reply.get(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertTrue(sink.awaitProtocolErrors(1, WAIT));
        assertTrue(sink.getProtocolErrors().get(0).message().contains("unknown request id 999"));
        assertTrue(endpoint.isOpen());
    }

    @Test
    void malformedEnvelopeIsReportedAndSkipped() throws Exception
    {
        endpoint.start();
        // [9] and then [1, 5] : unknown kind, then wrong arity
        peer.sendBytes(HexFormat.of().parseHex("91099201" + "05"));

        Future<String> reply = callAsync("ping");
        Request request = peer.readRequest();
        peer.reply(request.id(), "pong");

        assertEquals("pong", reply.get(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertTrue(sink.awaitProtocolErrors(2, WAIT));
    }

    @Test
    void closeReleasesEveryPendingCall() throws Exception
    {
        endpoint.start();
        List<Future<String>> pending = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            pending.add(callAsync("stall", i));
        }
        for (int i = 0; i < 5; i++) {
            peer.readRequest();
        }

        endpoint.close();

        for (Future<String> call : pending) {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> call.get(WAIT.toSeconds(), TimeUnit.SECONDS));
            assertInstanceOf(TransportException.class, e.getCause());
        }
        assertEquals(EndpointState.CLOSED, endpoint.state());
        assertThrows(TransportException.class, () -> endpoint.call("after", String.class));
        assertThrows(TransportException.class, () -> endpoint.notify("after"));
    }

    @Test
    void peerEndOfInputFailsPendingCallsAndStopsCleanly() throws Exception
    {
        endpoint.start();
        Future<String> call = callAsync("stall");
        peer.readRequest();
        peer.shutdownOutput();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> call.get(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());

        assertTrue(sink.awaitEventOfType(RpcTransportEvent.ServeStopped.class, WAIT));
        assertNull(sink.getEventsOfType(RpcTransportEvent.ServeStopped.class).get(0).cause());
        assertThrows(TransportException.class, () -> endpoint.call("later", String.class));
        assertFalse(endpoint.isOpen());

        endpoint.close();
    }

    @Test
    void brokenStreamIsReportedByServeAndByClose() throws Exception
    {
        endpoint.start();
        // array of 4 whose members never arrive
        peer.sendBytes(new byte[] { (byte) 0x94, 0x00 });
        peer.shutdownOutput();

        assertTrue(sink.awaitEventOfType(RpcTransportEvent.ServeStopped.class, WAIT));
        Throwable cause = sink.getEventsOfType(RpcTransportEvent.ServeStopped.class).get(0).cause();
        assertInstanceOf(EOFException.class, cause);

        assertThrows(EOFException.class, endpoint::close);
    }

    @Test
    void secondReadLoopIsRejected() throws Exception
    {
        endpoint.start();
        assertTrue(sink.awaitEventOfType(RpcTransportEvent.ServeStarted.class, WAIT));

        assertThrows(IllegalStateException.class, endpoint::serve);
        assertThrows(IllegalStateException.class, endpoint::start);
    }

    @Test
    void serveOnCallingThreadReturnsNormallyOnEndOfInput() throws Exception
    {
        Future<?> loop = callers.submit(() -> {
            endpoint.serve();
            return null;
        });
        peer.shutdownOutput();
        assertNull(loop.get(WAIT.toSeconds(), TimeUnit.SECONDS));
    }

    @Test
    void inboundRequestForUnknownMethodGetsErrorReply() throws Exception
    {
        endpoint.start();
        peer.send(new Request(41, "nope", endpoint.valueEncoder().toRaw(List.of())));

        RpcMessage reply = peer.read();
        Response response = assertInstanceOf(Response.class, reply);
        assertEquals(41, response.id());
        assertEquals("unknown request method: nope", endpoint.valueDecoder().decode(response.error(), Object.class));
        assertTrue(response.result().isNil());
    }

    @Test
    void closeReportsTransportCloseFailureFirst() throws Exception
    {
        Socket socket = sockets.left();
        InputStream in = socket.getInputStream();
        OutputStream out = socket.getOutputStream();
        StreamTransport failing = new StreamTransport() {
            @Override
            public InputStream input() {
                return in;
            }

            @Override
            public OutputStream output() {
                return out;
            }

            @Override
            public void close() throws IOException {
                socket.close();
                throw new IOException("close failed");
            }

            @Override
            public void awaitTermination(Duration grace) throws IOException {
                throw new IOException("process failed");
            }
        };
        Endpoint other = new Endpoint(failing, config());
        other.start();
        assertTrue(sink.awaitEventOfType(RpcTransportEvent.ServeStarted.class, WAIT));

        IOException e = assertThrows(IOException.class, other::close);
        assertEquals("close failed", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("process failed", e.getSuppressed()[0].getMessage());

        other.close();
        assertEquals(EndpointState.CLOSED, other.state());
    }
}
