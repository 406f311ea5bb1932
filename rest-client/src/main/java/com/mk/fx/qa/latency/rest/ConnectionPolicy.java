package com.mk.fx.qa.latency.rest;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection rules applied to a single request. Connections are never reused: every request is
 * executed on its own {@link ConnectionLease}, so each measurement pays the full connection-setup
 * cost.
 *
 * @param connectTimeout upper bound for establishing the TCP/TLS connection
 * @param readTimeout upper bound for receiving the response once the request was sent
 */
public record ConnectionPolicy(Duration connectTimeout, Duration readTimeout) {

    public ConnectionPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
    }

    /**
     * Creates a policy from millisecond values.
     *
     * @param connectTimeoutMs connect timeout in milliseconds
     * @param readTimeoutMs read timeout in milliseconds
     * @return the policy
     */
    public static ConnectionPolicy ofMillis(long connectTimeoutMs, long readTimeoutMs) {
        return new ConnectionPolicy(Duration.ofMillis(connectTimeoutMs), Duration.ofMillis(readTimeoutMs));
    }

    /**
     * Returns a copy with the given overrides applied; {@code null} keeps the current value.
     *
     * @param connectOverride replacement connect timeout or null
     * @param readOverride replacement read timeout or null
     * @return the resulting policy
     */
    public ConnectionPolicy withOverrides(Duration connectOverride, Duration readOverride) {
        if (connectOverride == null && readOverride == null) {
            return this;
        }
        return new ConnectionPolicy(
                connectOverride != null ? connectOverride : connectTimeout,
                readOverride != null ? readOverride : readTimeout);
    }
}
