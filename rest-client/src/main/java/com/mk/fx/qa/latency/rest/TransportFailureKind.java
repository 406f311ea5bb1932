package com.mk.fx.qa.latency.rest;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import javax.net.ssl.SSLException;

/** Kind of failure that prevented a complete HTTP response from being received. */
public enum TransportFailureKind {
    CONNECT_TIMEOUT,
    READ_TIMEOUT,
    CONNECTION_REFUSED,
    DNS_FAILURE,
    TLS_FAILURE,
    IO_ERROR,
    CANCELLED,
    INVALID_REQUEST;

    /**
     * Maps an exception raised by the transport to its failure kind by inspecting the whole cause
     * chain. The most specific kind wins: a connect timeout is also an {@link HttpTimeoutException}
     * and a read timeout a {@link java.io.InterruptedIOException}, so cancellation is recognised by an
     * {@link InterruptedException} cause rather than by type.
     *
     * @param error the exception thrown by the HTTP client
     * @return the matching kind, {@link #IO_ERROR} when nothing more specific applies
     */
    public static TransportFailureKind classify(Throwable error) {
        if (error == null) {
            return IO_ERROR;
        }
        if (hasCause(error, InterruptedException.class)) {
            return CANCELLED;
        }
        if (hasCause(error, HttpConnectTimeoutException.class)) {
            return CONNECT_TIMEOUT;
        }
        if (hasCause(error, HttpTimeoutException.class) || hasCause(error, SocketTimeoutException.class)) {
            return READ_TIMEOUT;
        }
        if (hasCause(error, UnknownHostException.class) || hasCause(error, UnresolvedAddressException.class)) {
            return DNS_FAILURE;
        }
        if (hasCause(error, SSLException.class)) {
            return TLS_FAILURE;
        }
        if (hasCause(error, ConnectException.class)) {
            return CONNECTION_REFUSED;
        }
        return IO_ERROR;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
