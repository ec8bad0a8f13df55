package com.questrail.msgrpc.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a duplex byte stream carrying MessagePack-RPC traffic.
 *
 * <p>The endpoint owns the transport once it is handed over: it reads
 * {@link #input()} from exactly one thread, writes {@link #output()} under its
 * own write lock, and calls {@link #close(Duration)} exactly once.</p>
 *
 * <p>Implementations may be backed by a socket, a child process, or a test
 * harness.</p>
 */
public interface StreamTransport extends Closeable
{
    InputStream input();

    OutputStream output();

    /**
     * Release the stream. Must unblock a reader parked in {@link #input()}.
     */
    @Override
    void close() throws IOException;

    /**
     * Release the stream and give whatever sits behind it {@code grace} to
     * finish, counted from now. The endpoint closes through this method.
     */
    default void close(Duration grace) throws IOException {
        close();
    }

    /**
     * Wait for whatever sits behind the stream to finish, for at most
     * {@code grace}. Called by the endpoint after {@link #close()}.
     *
     * @throws IOException if the peer terminated abnormally or had to be killed
     */
    default void awaitTermination(Duration grace) throws IOException {
    }

    /**
     * Adapts a pair of streams. {@code closer} is invoked on close; pass the
     * streams themselves, or the resource that owns both.
     */
    static StreamTransport of(InputStream in, OutputStream out, Closeable closer) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(closer, "closer");
        return new StreamTransport() {
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
                closer.close();
            }
        };
    }
}
