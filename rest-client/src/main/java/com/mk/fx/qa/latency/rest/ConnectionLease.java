package com.mk.fx.qa.latency.rest;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

/**
 * The single connection a request is executed on. The socket is created unconnected when the lease
 * is opened and is connected (through the proxy and TLS where configured) by {@link
 * #connect(PreparedRequest, Duration)}. {@link #close()} closes the socket and any TLS layer on top
 * of it, so no descriptor or thread outlives the lease. Closing is idempotent.
 */
public final class ConnectionLease implements AutoCloseable {

    private final long id;
    private final Socket socket;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile Socket channel;

    private ConnectionLease(long id, Socket socket, Runnable onRelease) {
        this.id = id;
        this.socket = socket;
        this.channel = socket;
        this.onRelease = onRelease;
    }

    /**
     * Opens a lease for one request. Nothing touches the network yet.
     *
     * @param id identifier used in logs
     * @param onRelease callback run once when the lease is released
     * @return the open lease
     */
    static ConnectionLease open(long id, Runnable onRelease) {
        Objects.requireNonNull(onRelease, "onRelease");
        return new ConnectionLease(id, new Socket(), onRelease);
    }

    /**
     * Resolves and connects to the request's first hop, opens a proxy tunnel for https targets
     * behind a proxy and completes the TLS handshake for https targets. The whole sequence is bounded
     * by {@code connectTimeout}.
     *
     * @throws HttpConnectTimeoutException when the budget runs out
     * @throws UnknownHostException when the first hop cannot be resolved
     * @throws IOException for any other connection failure
     */
    void connect(PreparedRequest request, Duration connectTimeout) throws IOException {
        ensureOpen();
        var deadline = Deadline.after(connectTimeout, "Connect");
        ProxySpec proxy = request.proxy();
        String host = proxy != null ? proxy.host() : request.host();
        int port = proxy != null ? proxy.port() : request.port();

        var address = new InetSocketAddress(host, port);
        if (address.isUnresolved()) {
            throw new UnknownHostException(host);
        }
        try {
            socket.setTcpNoDelay(true);
            socket.connect(address, deadline.remainingMillis());
            if (proxy != null && request.secure()) {
                HttpWire.openTunnel(socket, request, deadline);
            }
            if (request.secure()) {
                channel = handshake(request, deadline);
            }
        } catch (SocketTimeoutException e) {
            var timeout =
                    new HttpConnectTimeoutException(
                            "Connection to " + host + ":" + port + " not established within " + connectTimeout.toMillis() + " ms");
            timeout.initCause(e);
            throw timeout;
        }
    }

    private Socket handshake(PreparedRequest request, Deadline deadline) throws IOException {
        var factory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        var tls = (SSLSocket) factory.createSocket(socket, request.host(), request.port(), true);
        SSLParameters parameters = tls.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        tls.setSSLParameters(parameters);
        tls.setSoTimeout(deadline.remainingMillis());
        tls.startHandshake();
        return tls;
    }

    public long id() {
        return id;
    }

    InputStream input() throws IOException {
        ensureOpen();
        return channel.getInputStream();
    }

    OutputStream output() throws IOException {
        ensureOpen();
        return channel.getOutputStream();
    }

    /** Limits the next blocking read on the connection. */
    void readTimeout(int millis) throws IOException {
        ensureOpen();
        channel.setSoTimeout(millis);
    }

    public boolean isReleased() {
        return released.get() && socket.isClosed();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        IOException failure = null;
        try {
            if (channel != socket) {
                try {
                    channel.close();
                } catch (IOException e) {
                    failure = e;
                }
            }
            if (!socket.isClosed()) {
                try {
                    socket.close();
                } catch (IOException e) {
                    if (failure != null) {
                        e.addSuppressed(failure);
                    }
                    failure = e;
                }
            }
        } finally {
            onRelease.run();
        }
        if (failure != null) {
            throw new IllegalStateException(
                    "Failed to close connection of lease " + id + ": " + failure.getMessage(), failure);
        }
    }

    private void ensureOpen() {
        if (released.get()) {
            throw new IllegalStateException("Connection lease " + id + " already released");
        }
    }
}
