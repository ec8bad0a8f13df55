package com.questrail.msgrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ProcessStreamTransport
 * -----------------------------------------------------------------------------
 * StreamTransport over the standard streams of an already started child
 * process: requests go to its stdin, replies come from its stdout.
 *
 * <p>{@link #close(Duration)} closes stdin, which signals end of input to the
 * child, and arms a kill deadline at the end of the grace period. Killing the
 * child is what finally unblocks a reader parked on its stdout.
 * {@link #awaitTermination(Duration)} waits for the exit and reports a kill or
 * a non-zero exit status.</p>
 */
public final class ProcessStreamTransport implements StreamTransport
{
    private static final Logger log = LoggerFactory.getLogger(ProcessStreamTransport.class);

    private final Process process;
    private final AtomicBoolean killed = new AtomicBoolean(false);
    private volatile long killDeadlineNanos;
    private volatile Duration grace;

    public ProcessStreamTransport(Process process) {
        this.process = Objects.requireNonNull(process, "process");
    }

    public Process process() {
        return process;
    }

    @Override
    public InputStream input() {
        return process.getInputStream();
    }

    @Override
    public OutputStream output() {
        return process.getOutputStream();
    }

    /** Closes both pipes without arming a kill deadline. */
    @Override
    public void close() throws IOException {
        IOException first = null;
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            first = e;
        }
        try {
            process.getInputStream().close();
        } catch (IOException e) {
            if (first == null) {
                first = e;
            } else {
                first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Closes stdin and schedules a forced kill for when {@code grace} runs
     * out. stdout stays open so the reader drains it to end of input.
     */
    @Override
    public void close(Duration grace) throws IOException {
        Objects.requireNonNull(grace, "grace");
        this.grace = grace;
        this.killDeadlineNanos = System.nanoTime() + grace.toNanos();
        CompletableFuture.delayedExecutor(grace.toMillis(), TimeUnit.MILLISECONDS)
                .execute(this::killIfAlive);
        process.getOutputStream().close();
    }

    @Override
    public void awaitTermination(Duration grace) throws IOException {
        Duration armed = this.grace;
        long waitNanos = armed != null
                ? Math.max(0L, killDeadlineNanos - System.nanoTime())
                : grace.toNanos();
        try {
            if (!process.waitFor(waitNanos, TimeUnit.NANOSECONDS)) {
                killIfAlive();
            }
            process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("interrupted while waiting for child process " + process.pid(), e);
        }

        if (killed.get()) {
            throw new IOException("child process " + process.pid() + " killed after "
                    + (armed != null ? armed : grace));
        }
        int status = process.exitValue();
        if (status != 0) {
            throw new IOException("child process " + process.pid() + " exited with status " + status);
        }
    }

    private void killIfAlive() {
        if (process.isAlive() && killed.compareAndSet(false, true)) {
            log.warn("Child process {} did not exit within its grace period; killing it", process.pid());
            process.destroyForcibly();
        }
    }
}
