package com.mk.fx.qa.latency.rest;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP proxy a request is routed through, with optional basic credentials.
 *
 * @param host proxy host name
 * @param port proxy port
 * @param username proxy user, may be null
 * @param password proxy password, may be null
 */
public record ProxySpec(String host, int port, String username, String password) {

    public ProxySpec {
        Objects.requireNonNull(host, "Proxy host cannot be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("Proxy host cannot be empty");
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("Proxy port out of range: " + port);
        }
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    /**
     * Value of the {@code Proxy-Authorization} header. It is sent with the first request so that an
     * authenticating proxy never has to challenge.
     */
    public String authorization() {
        String credentials = username + ":" + (password != null ? password : "");
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "ProxySpec[" + host + ":" + port + (hasCredentials() ? ", user=" + username : "") + "]";
    }
}
