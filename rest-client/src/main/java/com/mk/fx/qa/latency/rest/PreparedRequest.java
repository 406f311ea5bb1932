package com.mk.fx.qa.latency.rest;

import java.net.URI;
import java.util.Map;

/**
 * A request resolved down to what goes on the wire: placeholders substituted, query appended,
 * headers merged and body serialised.
 *
 * @param method request method
 * @param uri absolute http or https URI
 * @param headers header fields in sending order, without the connection-level ones
 * @param body body bytes, null when the request has none
 * @param proxy first hop when the request is proxied, null otherwise
 */
record PreparedRequest(
        HttpMethod method, URI uri, Map<String, String> headers, byte[] body, ProxySpec proxy) {

    boolean secure() {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    /** Host name or address literal, without IPv6 brackets. */
    String host() {
        String host = uri.getHost();
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    int port() {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return secure() ? 443 : 80;
    }

    /** Value of the Host header; the port is omitted when it is the scheme default. */
    String authority() {
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    /** Request target as sent: absolute form through a plain http proxy, origin form otherwise. */
    String target() {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        String query = uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "";
        if (proxy != null && !secure()) {
            return uri.getScheme().toLowerCase() + "://" + authority() + path + query;
        }
        return path + query;
    }
}
