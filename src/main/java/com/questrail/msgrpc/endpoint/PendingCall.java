package com.questrail.msgrpc.endpoint;

import com.questrail.msgrpc.error.RpcException;
import com.questrail.msgrpc.error.TransportException;
import com.questrail.msgrpc.model.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A request awaiting its response. Holds only the id and the completion; the
 * endpoint resolves it by id.
 */
final class PendingCall
{
    private final long id;
    private final CompletableFuture<Response> completion = new CompletableFuture<>();

    PendingCall(long id) {
        this.id = id;
    }

    long id() {
        return id;
    }

    boolean complete(Response response) {
        return completion.complete(response);
    }

    boolean fail(RpcException failure) {
        return completion.completeExceptionally(failure);
    }

    /**
     * Blocks until the response arrives or the connection fails.
     *
     * @throws InterruptedIOException if the waiting thread is interrupted
     */
    Response await() throws IOException {
        try {
            return completion.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted waiting for response " + id);
            interrupted.initCause(e);
            throw interrupted;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException t) {
                // one instance per waiting caller
                throw new TransportException(t.getMessage(), t.getCause());
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new RpcException("msgrpc: call " + id + " failed", cause);
        }
    }
}
