package com.questrail.msgrpc.codec.impl;

import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;
import com.questrail.msgrpc.msgpack.MessagePackException;
import com.questrail.msgrpc.msgpack.RawValue;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultRpcMessageEncoderTest
{
    private final DefaultRpcMessageEncoder encoder = new DefaultRpcMessageEncoder();

    private static final RawValue EMPTY_ARRAY = RawValue.of(new byte[] { (byte) 0x90 });

    private String encode(com.questrail.msgrpc.model.RpcMessage message) throws MessagePackException {
        MessagePackEncoder out = new MessagePackEncoder();
        encoder.encode(message, out);
        return HexFormat.of().formatHex(out.toByteArray());
    }

    @Test
    void requestLayout() throws Exception
    {
        // [0, 1, "m", []]
        assertEquals("940001a16d90", encode(new Request(1, "m", EMPTY_ARRAY)));
    }

    @Test
    void responseLayout() throws Exception
    {
        // [1, 300, nil, 5]
        assertEquals("9401cd012cc005", encode(Response.success(300, RawValue.of(new byte[] { 5 }))));
    }

    @Test
    void notificationLayout() throws Exception
    {
        // [2, "ev", []]
        assertEquals("9302a2657690", encode(new Notification("ev", EMPTY_ARRAY)));
    }

    @Test
    void negativeIdIsRejected()
    {
        assertThrows(MessagePackException.class, () -> encode(new Request(-1, "m", EMPTY_ARRAY)));
    }
}
