package com.questrail.msgrpc.codec.impl;

import com.questrail.msgrpc.error.ProtocolException;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.util.HexFormat;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultRpcMessageDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultRpcMessageDecoder}.
 *
 * <p>Beyond the happy path, every malformed envelope must be consumed in full
 * before it is rejected, so that the message after it decodes normally.</p>
 */
final class DefaultRpcMessageDecoderTest
{
    private final DefaultRpcMessageDecoder decoder = new DefaultRpcMessageDecoder();

    private static MessagePackDecoder stream(MessagePackEncoder enc) {
        return new MessagePackDecoder(new ByteArrayInputStream(enc.toByteArray()));
    }

    private static MessagePackEncoder validNotification(MessagePackEncoder enc) throws Exception {
        return enc.packArrayHeader(3).packInt(2).packString("ok").packArrayHeader(0);
    }

    @Test
    void decodesAllThreeKinds() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packArrayHeader(4).packInt(0).packInt(7).packString("add").packArrayHeader(2).packInt(2).packInt(3);
        enc.packArrayHeader(4).packInt(1).packInt(7).packNil().packInt(5);
        enc.packArrayHeader(3).packInt(2).packString("event").packArrayHeader(1).packString("x");

        MessagePackDecoder in = stream(enc);

        Request request = (Request) decoder.read(in).orElseThrow();
        assertEquals(7, request.id());
        assertEquals("add", request.method());
        assertEquals("920203", HexFormat.of().formatHex(request.params().bytes()));

        Response response = (Response) decoder.read(in).orElseThrow();
        assertEquals(7, response.id());
        assertFalse(response.isError());
        assertArrayEquals(new byte[] { 5 }, response.result().bytes());

        Notification notification = (Notification) decoder.read(in).orElseThrow();
        assertEquals("event", notification.method());

        assertEquals(Optional.empty(), decoder.read(in));
    }

    @Test
    void wrongArityIsRejectedAfterConsumingTheMessage() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packArrayHeader(5).packInt(0).packInt(1).packString("m").packArrayHeader(0).packString("surplus");
        validNotification(enc);

        MessagePackDecoder in = stream(enc);
        ProtocolException e = assertThrows(ProtocolException.class, () -> decoder.read(in));
        assertTrue(e.getMessage().contains("request has 5 elements"));

        RpcMessage next = decoder.read(in).orElseThrow();
        assertInstanceOf(Notification.class, next);
    }

    @Test
    void unknownKindIsRejectedAfterConsumingNestedMembers() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packArrayHeader(3).packInt(9).packMapHeader(1).packString("k").packArrayHeader(2).packInt(1).packInt(2)
                .packString("z");
        validNotification(enc);

        MessagePackDecoder in = stream(enc);
        ProtocolException e = assertThrows(ProtocolException.class, () -> decoder.read(in));
        assertTrue(e.getMessage().contains("unknown message kind 9"));
        assertInstanceOf(Notification.class, decoder.read(in).orElseThrow());
    }

    @Test
    void nonArrayTopLevelValueIsRejected() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packMapHeader(1).packString("a").packInt(1);
        validNotification(enc);

        MessagePackDecoder in = stream(enc);
        assertThrows(ProtocolException.class, () -> decoder.read(in));
        assertInstanceOf(Notification.class, decoder.read(in).orElseThrow());
    }

    @Test
    void wronglyTypedFieldsAreRejected() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packArrayHeader(4).packInt(0).packString("id").packString("m").packArrayHeader(0);
        enc.packArrayHeader(4).packInt(0).packInt(1).packInt(42).packArrayHeader(0);
        enc.packArrayHeader(3).packInt(2).packString("m").packString("not an array");
        enc.packArrayHeader(0);
        validNotification(enc);

        MessagePackDecoder in = stream(enc);
        for (int i = 0; i < 4; i++) {
            assertThrows(ProtocolException.class, () -> decoder.read(in));
        }
        assertInstanceOf(Notification.class, decoder.read(in).orElseThrow());
    }

    @Test
    void truncatedEnvelopeIsATransportLevelFailure() throws Exception
    {
        MessagePackEncoder enc = new MessagePackEncoder();
        enc.packArrayHeader(4).packInt(0).packInt(1);

        assertThrows(EOFException.class, () -> decoder.read(stream(enc)));
    }

    @Test
    void invalidMessagePackIsNotAProtocolError()
    {
        MessagePackDecoder in = new MessagePackDecoder(new ByteArrayInputStream(new byte[] { (byte) 0x93, (byte) 0xc1 }));
        MessagePackException e = assertThrows(MessagePackException.class, () -> decoder.read(in));
        assertFalse(e instanceof com.questrail.msgrpc.msgpack.ConvertException);
    }
}
