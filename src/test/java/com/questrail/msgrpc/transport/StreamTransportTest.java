package com.questrail.msgrpc.transport;

import com.questrail.msgrpc.codec.impl.DefaultRpcMessageEncoder;
import com.questrail.msgrpc.config.EndpointConfig;
import com.questrail.msgrpc.endpoint.Endpoint;
import com.questrail.msgrpc.handler.Handlers;
import com.questrail.msgrpc.internal.bind.ValueEncoder;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.msgpack.ExtensionRegistry;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.observability.NullObservabilitySink;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

final class StreamTransportTest
{
    @Test
    void adaptedStreamsCarryInboundNotifications() throws Exception
    {
        MessagePackEncoder wire = new MessagePackEncoder();
        ValueEncoder values = new ValueEncoder(ExtensionRegistry.empty());
        new DefaultRpcMessageEncoder().encode(new Notification("log", values.toRaw(List.of("first"))), wire);
        new DefaultRpcMessageEncoder().encode(new Notification("log", values.toRaw(List.of("second"))), wire);

        AtomicBoolean closed = new AtomicBoolean();
        StreamTransport transport = StreamTransport.of(
                new ByteArrayInputStream(wire.toByteArray()),
                new ByteArrayOutputStream(),
                () -> closed.set(true));

        Endpoint endpoint = new Endpoint(transport, EndpointConfig.builder()
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .build());
        List<String> lines = new CopyOnWriteArrayList<>();
        CountDownLatch both = new CountDownLatch(2);
        endpoint.registerHandler("log", Handlers.procedure(String.class, line -> {
            lines.add(line);
            both.countDown();
        }));

        endpoint.serve();

        assertTrue(both.await(5, TimeUnit.SECONDS));
        assertTrue(lines.containsAll(List.of("first", "second")));
        assertFalse(endpoint.isOpen());

        endpoint.close();
        assertTrue(closed.get());
    }
}
