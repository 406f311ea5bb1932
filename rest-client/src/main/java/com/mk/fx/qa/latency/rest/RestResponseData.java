package com.mk.fx.qa.latency.rest;

import java.time.Instant;
import java.util.Map;
import lombok.Data;

/**
 * Result of one timed exchange. Either a response was fully received ({@code statusCode} set) or
 * the transport failed ({@code transportFailure} set); the monotonic timestamps are populated in
 * both cases.
 */
@Data
public class RestResponseData {
    private Instant startedAt;
    private long startNanos;
    private long endNanos;
    private Integer statusCode;
    private Map<String, String> headers;
    private byte[] body;
    private TransportFailureKind transportFailure;
    private String errorMessage;
    private boolean resourcesReleased;
    private String cleanupError;

    public long elapsedNanos() {
        return Math.max(0L, endNanos - startNanos);
    }

    public boolean isTransportFailure() {
        return transportFailure != null;
    }

    /** Size of the received body, or null when no response was received. */
    public Integer bodySize() {
        if (statusCode == null) {
            return null;
        }
        return body != null ? body.length : 0;
    }
}
