package com.questrail.msgrpc.handler;

import com.questrail.msgrpc.error.ErrorKind;
import com.questrail.msgrpc.internal.bind.ValueDecoder;
import com.questrail.msgrpc.internal.bind.ValueEncoder;
import com.questrail.msgrpc.msgpack.ExtensionRegistry;
import com.questrail.msgrpc.msgpack.RawValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AtomicCallHandlerTest
 * -----------------------------------------------------------------------------
 * The peer side of an atomic batch, driven directly without a connection.
 */
final class AtomicCallHandlerTest
{
    private final ValueEncoder encoder = new ValueEncoder(ExtensionRegistry.empty());
    private final ValueDecoder decoder = new ValueDecoder(ExtensionRegistry.empty());
    private final HandlerRegistry registry = new HandlerRegistry();
    private final List<String> executed = new ArrayList<>();

    private AtomicCallHandler handler;

    @BeforeEach
    void setUp()
    {
        registry.register("add", Handlers.function(Long.class, Long.class, Long.class, (a, b) -> {
            executed.add("add");
            return a + b;
        }));
        registry.register("fail", Handlers.function(String.class, String.class, s -> {
            executed.add("fail");
            throw new HandlerException(ErrorKind.VALIDATION, "rejected " + s);
        }));
        registry.register("boom", Handlers.procedure(() -> {
            executed.add("boom");
            throw new IllegalStateException("exploded");
        }));
        registry.register("assert", Handlers.procedure(() -> {
            executed.add("assert");
            throw new AssertionError("invariant broken");
        }));
        handler = new AtomicCallHandler(registry, new HandlerInvoker(encoder, decoder));
    }

    private static List<Object> call(String method, Object... args) {
        return List.of(method, Arrays.asList(args));
    }

    private List<?> execute(List<?> calls) throws Exception {
        RawValue reply = handler.execute(null, encoder.toRaw(calls));
        return (List<?>) decoder.decode(reply, Object.class);
    }

    @Test
    void allCallsSucceed() throws Exception
    {
        List<?> reply = execute(List.of(call("add", 1, 2), call("add", 10, 20)));
        assertEquals(List.of(3L, 30L), reply.get(0));
        assertNull(reply.get(1));
    }

    @Test
    void stopsAtFirstFailureAndReportsIndexKindAndMessage() throws Exception
    {
        List<?> reply = execute(List.of(call("add", 1, 2), call("fail", "x"), call("add", 5, 5)));
        assertEquals(List.of(3L), reply.get(0));
        assertEquals(List.of(1L, 1L, "rejected x"), reply.get(1));
        assertEquals(List.of("add", "fail"), executed);
    }

    @Test
    void errorThrownByHandlerEndsTheBatchWithAReply() throws Exception
    {
        List<?> reply = execute(List.of(call("add", 1, 1), call("assert"), call("add", 2, 2)));
        assertEquals(List.of(2L), reply.get(0));
        assertEquals(List.of(1L, 0L, "invariant broken"), reply.get(1));
        assertEquals(List.of("add", "assert"), executed);
    }

    @Test
    void unclassifiedFailureIsReportedAsException() throws Exception
    {
        List<?> reply = execute(List.of(call("boom")));
        assertEquals(List.of(), reply.get(0));
        assertEquals(List.of(0L, 0L, "exploded"), reply.get(1));
    }

    @Test
    void unknownMethodIsAValidationFailure() throws Exception
    {
        List<?> reply = execute(List.of(call("add", 1, 1), call("missing")));
        assertEquals(List.of(1L, 1L, "unknown request method: missing"), reply.get(1));
    }

    @Test
    void malformedPairFailsBeforeAnythingRuns() throws Exception
    {
        List<?> reply = execute(List.of(call("add", 1, 1), List.of("no params")));
        assertEquals(List.of(), reply.get(0));
        List<?> error = (List<?>) reply.get(1);
        assertEquals(1L, error.get(0));
        assertEquals(1L, error.get(1));
        assertTrue(executed.isEmpty());
    }

    @Test
    void registeredDescriptorTakesCallListAndEndpoint() throws Exception
    {
        HandlerDescriptor d = handler.descriptor();
        assertTrue(d.receivesEndpoint());
        assertEquals(List.of(RawValue.class), d.parameterTypes());
    }
}
