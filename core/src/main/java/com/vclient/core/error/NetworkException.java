package com.vclient.core.error;

import java.io.IOException;
import java.util.Map;

/** The transport failed before any HTTP status was received. The I/O error is the cause. */
public class NetworkException extends ApiException {
    public NetworkException(String message, IOException cause) {
        super(message, NO_STATUS, "", Map.of(), cause);
    }

    /** Connection refused or timed out, as opposed to other I/O failures. */
    public boolean isConnectOrTimeout() {
        return NetworkFaults.isRetryable(getCause());
    }
}
