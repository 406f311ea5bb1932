package com.mk.fx.qa.latency.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client that times single requests on dedicated connections. Every call to {@link
 * #execute(Request, ConnectionPolicy)} opens a fresh {@link ConnectionLease}, sends the request
 * with {@code Connection: close} and closes the connection before returning, whatever the outcome.
 *
 * <p>The measured interval starts immediately before name resolution and connection setup and ends
 * as soon as the last body byte has been received or the transport has failed. Building the request
 * and releasing the lease are outside the interval. The connect timeout bounds resolution, connect,
 * proxy tunnel and TLS handshake; the read timeout bounds the rest of the exchange, headers and body
 * together.
 *
 * <p>Transport failures are returned as data on {@link RestResponseData}; they are never thrown.
 */
@Slf4j
public class LatencyHttpClient {

    /** Maximum length kept for error descriptions. */
    static final int MAX_ERROR_LENGTH = 300;

    /** Header fields the client writes itself. */
    private static final Set<String> MANAGED_HEADERS =
            Set.of("host", "connection", "content-length", "transfer-encoding", "proxy-authorization");

    private static final String USER_AGENT = "latency-bench-runner";

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Variables for resolving placeholders in request URLs and queries. */
    private final Map<String, String> variables;

    private final MonotonicClock clock;

    private final AtomicLong leasesOpened = new AtomicLong();
    private final AtomicInteger liveLeases = new AtomicInteger();
    private final AtomicLong cleanupFailures = new AtomicLong();

    /**
     * Constructs a client using the system monotonic clock.
     *
     * @param headers global headers to include in all requests
     * @param variables variables for resolving placeholders in URLs and queries
     */
    public LatencyHttpClient(Map<String, String> headers, Map<String, String> variables) {
        this(headers, variables, MonotonicClock.SYSTEM);
    }

    /**
     * Constructs a client.
     *
     * @param headers global headers to include in all requests
     * @param variables variables for resolving placeholders in URLs and queries
     * @param clock time source for latency measurement
     */
    public LatencyHttpClient(
            Map<String, String> headers, Map<String, String> variables, MonotonicClock clock) {
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.variables = variables != null ? Map.copyOf(variables) : Map.of();
        this.clock = Objects.requireNonNull(clock, "clock");
        log.debug("LatencyHttpClient initialised with {} global headers", this.headers.size());
    }

    /**
     * Executes one request on a dedicated connection.
     *
     * @param request the request to execute
     * @param policy connection and timeout rules
     * @return timing, response and failure data; never null
     */
    public RestResponseData execute(Request request, ConnectionPolicy policy) {
        Objects.requireNonNull(request, "Request cannot be null");
        Objects.requireNonNull(policy, "Connection policy cannot be null");

        var result = new RestResponseData();

        PreparedRequest prepared;
        try {
            prepared = prepare(request);
        } catch (RuntimeException e) {
            long now = clock.nanoTime();
            result.setStartedAt(Instant.now());
            result.setStartNanos(now);
            result.setEndNanos(now);
            result.setTransportFailure(TransportFailureKind.INVALID_REQUEST);
            result.setErrorMessage(describe(e));
            result.setResourcesReleased(true);
            log.debug("Rejected request to {}: {}", request.getUrl(), e.getMessage());
            return result;
        }

        var lease = openLease();
        try {
            result.setStartedAt(Instant.now());
            long start = clock.nanoTime();
            result.setStartNanos(start);
            try {
                lease.connect(prepared, policy.connectTimeout());
                var response = HttpWire.exchange(lease, prepared, policy.readTimeout());
                result.setEndNanos(clock.nanoTime());
                result.setStatusCode(response.statusCode());
                result.setHeaders(response.headers());
                result.setBody(response.body());
            } catch (IOException e) {
                result.setEndNanos(clock.nanoTime());
                result.setTransportFailure(TransportFailureKind.classify(e));
                result.setErrorMessage(describe(e));
            }
        } finally {
            release(lease, result);
        }

        if (log.isDebugEnabled()) {
            log.debug(
                    "{} {} -> {} in {} ms",
                    prepared.method(),
                    prepared.uri(),
                    result.isTransportFailure() ? result.getTransportFailure() : result.getStatusCode(),
                    result.elapsedNanos() / 1_000_000.0);
        }
        return result;
    }

    /** Number of leases opened since construction. */
    public long leasesOpened() {
        return leasesOpened.get();
    }

    /** Number of leases currently open. */
    public int liveLeases() {
        return liveLeases.get();
    }

    /** Number of leases whose release raised an error. */
    public long cleanupFailures() {
        return cleanupFailures.get();
    }

    private ConnectionLease openLease() {
        long id = leasesOpened.incrementAndGet();
        liveLeases.incrementAndGet();
        return ConnectionLease.open(id, liveLeases::decrementAndGet);
    }

    private void release(ConnectionLease lease, RestResponseData result) {
        try {
            lease.close();
            result.setResourcesReleased(lease.isReleased());
        } catch (RuntimeException e) {
            cleanupFailures.incrementAndGet();
            result.setResourcesReleased(lease.isReleased());
            result.setCleanupError(describe(e));
            log.warn("Failed to release connection lease {}: {}", lease.id(), e.getMessage());
        }
    }

    /**
     * Resolves a Request into what is written on the wire.
     *
     * @param request the Request to resolve
     * @return the prepared request
     * @throws IllegalArgumentException if the URL, a header or the body cannot be used
     */
    PreparedRequest prepare(Request request) {
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            throw new IllegalArgumentException("Request URL cannot be empty");
        }
        var method = request.getMethod() != null ? request.getMethod() : HttpMethod.GET;

        var url = resolveVars(request.getUrl().trim(), variables);
        if (request.getQuery() != null && !request.getQuery().isEmpty()) {
            var queryStr = buildQueryString(request.getQuery(), variables);
            if (!queryStr.isEmpty()) {
                url += (url.contains("?") ? "&" : "?") + queryStr;
            }
        }

        var uri = URI.create(url);
        if (uri.getScheme() == null
                || !(uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Unsupported URL scheme: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }

        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.put("User-Agent", USER_AGENT);
        merged.put("Accept", "*/*");

        // global headers
        headers.forEach(merged::put);

        // request-specific headers override
        if (request.getHeaders() != null) {
            request.getHeaders().forEach(merged::put);
        }
        merged.keySet().removeIf(name -> MANAGED_HEADERS.contains(name.toLowerCase(Locale.ROOT)));
        merged.forEach(LatencyHttpClient::checkHeader);

        byte[] body = null;
        if (request.getBody() != null) {
            try {
                var text = request.getBody() instanceof String s ? s : JsonUtil.toJson(request.getBody());
                body = text.getBytes(StandardCharsets.UTF_8);
                merged.putIfAbsent("Content-Type", "application/json");
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to serialize request body: " + e.getMessage(), e);
            }
        }

        return new PreparedRequest(method, uri, merged, body, request.getProxy());
    }

    private static void checkHeader(String name, String value) {
        if (name.isBlank() || !name.chars().allMatch(c -> c > 32 && c < 127 && c != ':')) {
            throw new IllegalArgumentException("Invalid header name: " + name);
        }
        if (value == null || value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Invalid value for header " + name);
        }
    }

    /**
     * Builds a query string from the given query parameters and variables.
     *
     * @param query the query parameters
     * @param variables the variables for resolving placeholders
     * @return the constructed query string
     */
    private String buildQueryString(Map<String, String> query, Map<String, String> variables) {
        return query.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e ->
                        encode(resolveVars(e.getKey(), variables))
                                + "="
                                + encode(resolveVars(e.getValue(), variables)))
                .collect(Collectors.joining("&"));
    }

    private String encode(String value) {
        return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
    }

    /**
     * Resolves {@code {{name}}} placeholders in the given text.
     *
     * @param text the text containing placeholders
     * @param variables the variables map
     * @return the text with placeholders replaced by variable values
     */
    private String resolveVars(String text, Map<String, String> variables) {
        if (text == null || text.isEmpty() || variables.isEmpty()) {
            return text;
        }

        var result = text;
        for (var entry : variables.entrySet()) {
            var placeholder = "{{" + entry.getKey() + "}}";
            if (result.contains(placeholder)) {
                result = result.replace(placeholder, entry.getValue());
            }
        }
        return result;
    }

    static String describe(Throwable error) {
        var message = error.getMessage();
        var text = error.getClass().getSimpleName() + (message != null ? ": " + message : "");
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline);
        }
        return text.length() > MAX_ERROR_LENGTH ? text.substring(0, MAX_ERROR_LENGTH) : text;
    }
}
