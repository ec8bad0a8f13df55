package com.questrail.msgrpc.transport;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;

/**
 * StreamTransport over a connected {@link Socket} (TCP or Unix domain via a
 * socket factory). Closing the socket unblocks the reader.
 */
public final class SocketStreamTransport implements StreamTransport
{
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    public SocketStreamTransport(Socket socket) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket");
        if (!socket.isConnected()) {
            throw new IOException("socket is not connected");
        }
        this.in = socket.getInputStream();
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

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
    }

    @Override
    public String toString() {
        return "SocketStreamTransport[" + socket.getRemoteSocketAddress() + ']';
    }
}
