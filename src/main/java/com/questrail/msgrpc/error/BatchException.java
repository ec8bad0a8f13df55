package com.questrail.msgrpc.error;

/**
 * One call inside an atomic batch failed. Results of the calls before
 * {@link #index()} were delivered; the rest were not.
 */
public final class BatchException extends RpcException
{
    private final int index;

    public BatchException(int index, ApplicationException cause) {
        super("msgrpc: batch call " + index + " failed: " + cause.getMessage(), cause);
        this.index = index;
    }

    public int index() {
        return index;
    }

    @Override
    public synchronized ApplicationException getCause() {
        return (ApplicationException) super.getCause();
    }
}
