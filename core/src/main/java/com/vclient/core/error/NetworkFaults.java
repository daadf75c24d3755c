package com.vclient.core.error;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;

/** Which transport failures count as transient. Only connect and timeout failures do. */
public final class NetworkFaults {
    private NetworkFaults() {}

    public static boolean isRetryable(Throwable t) {
        // HttpConnectTimeoutException extends HttpTimeoutException
        return t instanceof ConnectException || t instanceof HttpTimeoutException;
    }
}
