package com.questrail.msgrpc.endpoint;

import com.questrail.msgrpc.codec.impl.DefaultRpcMessageDecoder;
import com.questrail.msgrpc.codec.impl.DefaultRpcMessageEncoder;
import com.questrail.msgrpc.internal.bind.ValueEncoder;
import com.questrail.msgrpc.model.Notification;
import com.questrail.msgrpc.model.Request;
import com.questrail.msgrpc.model.Response;
import com.questrail.msgrpc.model.RpcMessage;
import com.questrail.msgrpc.msgpack.ExtensionRegistry;
import com.questrail.msgrpc.msgpack.MessagePackDecoder;
import com.questrail.msgrpc.msgpack.MessagePackEncoder;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

/**
 * Scripted remote side of a connection. Tests read what the endpoint sent and
 * decide exactly what, and in which order, to answer.
 */
final class FakePeer implements Closeable {
    private final Socket socket;
    private final MessagePackDecoder in;
    private final OutputStream out;
    private final DefaultRpcMessageDecoder decoder = new DefaultRpcMessageDecoder();
    private final DefaultRpcMessageEncoder encoder = new DefaultRpcMessageEncoder();
    private final ValueEncoder values = new ValueEncoder(ExtensionRegistry.empty());

    FakePeer(Socket socket) throws IOException {
        this.socket = socket;
        this.socket.setSoTimeout(5000);
        this.in = new MessagePackDecoder(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    RpcMessage read() throws IOException {
        return decoder.read(in).orElseThrow(() -> new EOFException("endpoint closed the stream"));
    }

    Request readRequest() throws IOException {
        return (Request) read();
    }

    Notification readNotification() throws IOException {
        return (Notification) read();
    }

    void reply(long id, Object result) throws IOException {
        send(Response.success(id, values.toRaw(result)));
    }

    void replyError(long id, Object error) throws IOException {
        send(Response.failure(id, values.toRaw(error)));
    }

    synchronized void send(RpcMessage message) throws IOException {
        MessagePackEncoder buf = new MessagePackEncoder();
        encoder.encode(message, buf);
        buf.writeTo(out);
        out.flush();
    }

    synchronized void sendBytes(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /** Half-closes the peer's output so the endpoint sees end of input. */
    void shutdownOutput() throws IOException {
        socket.shutdownOutput();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
