package com.questrail.msgrpc.error;

import java.io.IOException;

/**
 * Root of all failures raised by the RPC layers.
 */
public class RpcException extends IOException
{
    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
