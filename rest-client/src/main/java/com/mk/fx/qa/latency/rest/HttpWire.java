package com.mk.fx.qa.latency.rest;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.ProtocolException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * HTTP/1.1 framing for one request on one connection. Every read is bounded by the remaining time
 * of the exchange deadline, so a response that trickles in or stalls half way through the body
 * fails with a timeout once the deadline passes rather than when the peer gives up.
 */
final class HttpWire {

    static final int MAX_LINE_LENGTH = 16 * 1024;
    static final int MAX_HEADER_FIELDS = 256;
    static final long MAX_BODY_BYTES = 64L * 1024 * 1024;

    private HttpWire() {
        throw new UnsupportedOperationException("HttpWire cannot be instantiated");
    }

    /** Status, header fields (case-insensitive names, repeated fields joined with commas) and body. */
    record WireResponse(int statusCode, Map<String, String> headers, byte[] body) {}

    private record ResponseHead(int statusCode, Map<String, String> headers) {}

    /** Applies a read timeout to the connection before a blocking read. */
    @FunctionalInterface
    interface ReadLimit {
        void apply(int millis) throws IOException;
    }

    /**
     * Sends the request and reads the complete response. The read timeout covers everything from
     * the first byte written to the last body byte received.
     *
     * @throws java.net.SocketTimeoutException when the response is not complete within {@code
     *     readTimeout}
     * @throws IOException when the connection fails or the response is not valid HTTP/1.x
     */
    static WireResponse exchange(ConnectionLease lease, PreparedRequest request, Duration readTimeout)
            throws IOException {
        var deadline = Deadline.after(readTimeout, "Read");
        OutputStream out = lease.output();
        out.write(encodeHead(request));
        if (request.body() != null) {
            out.write(request.body());
        }
        out.flush();

        InputStream in = new BufferedInputStream(new DeadlineInputStream(lease.input(), lease::readTimeout, deadline));
        ResponseHead head = readHead(in);
        while (head.statusCode() >= 100 && head.statusCode() < 200 && head.statusCode() != 101) {
            head = readHead(in);
        }
        return new WireResponse(head.statusCode(), head.headers(), readBody(in, request.method(), head));
    }

    /**
     * Asks the proxy behind {@code socket} for a tunnel to the request's origin. Credentials are sent
     * with the first CONNECT, never in reply to a challenge.
     *
     * @throws ProtocolException when the proxy answers with anything but 2xx
     */
    static void openTunnel(Socket socket, PreparedRequest request, Deadline deadline) throws IOException {
        String authority = request.uri().getHost() + ":" + request.port();
        var head = new StringBuilder();
        head.append("CONNECT ").append(authority).append(" HTTP/1.1\r\n");
        head.append("Host: ").append(authority).append("\r\n");
        if (request.proxy().hasCredentials()) {
            head.append("Proxy-Authorization: ").append(request.proxy().authorization()).append("\r\n");
        }
        head.append("\r\n");
        OutputStream out = socket.getOutputStream();
        out.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        out.flush();

        // unbuffered: bytes after the proxy's reply belong to the tunnel
        ResponseHead reply = readHead(new DeadlineInputStream(socket.getInputStream(), socket::setSoTimeout, deadline));
        if (reply.statusCode() / 100 != 2) {
            throw new ProtocolException(
                    "Proxy " + request.proxy().host() + " refused tunnel to " + authority + ": HTTP " + reply.statusCode());
        }
    }

    static byte[] encodeHead(PreparedRequest request) {
        var head = new StringBuilder(256);
        head.append(request.method().name()).append(' ').append(request.target()).append(" HTTP/1.1\r\n");
        head.append("Host: ").append(request.authority()).append("\r\n");
        request.headers().forEach((name, value) -> head.append(name).append(": ").append(value).append("\r\n"));
        if (request.proxy() != null && !request.secure() && request.proxy().hasCredentials()) {
            head.append("Proxy-Authorization: ").append(request.proxy().authorization()).append("\r\n");
        }
        if (request.body() != null) {
            head.append("Content-Length: ").append(request.body().length).append("\r\n");
        } else if (expectsBody(request.method())) {
            head.append("Content-Length: 0\r\n");
        }
        head.append("Connection: close\r\n\r\n");
        return head.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static boolean expectsBody(HttpMethod method) {
        return method == HttpMethod.POST || method == HttpMethod.PUT || method == HttpMethod.PATCH;
    }

    private static ResponseHead readHead(InputStream in) throws IOException {
        String statusLine = readLine(in);
        if (statusLine == null) {
            throw new EOFException("Connection closed before a response was received");
        }
        int status = parseStatus(statusLine);

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        int fields = 0;
        String line;
        while (!(line = requireLine(in)).isEmpty()) {
            if (++fields > MAX_HEADER_FIELDS) {
                throw new ProtocolException("More than " + MAX_HEADER_FIELDS + " response header fields");
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new ProtocolException("Malformed response header field: " + line);
            }
            headers.merge(line.substring(0, colon).trim(), line.substring(colon + 1).trim(), (a, b) -> a + "," + b);
        }
        return new ResponseHead(status, headers);
    }

    static int parseStatus(String statusLine) throws ProtocolException {
        if (!statusLine.startsWith("HTTP/1.") || statusLine.length() < 12 || statusLine.charAt(8) != ' ') {
            throw new ProtocolException("Malformed status line: " + statusLine);
        }
        String code = statusLine.substring(9, 12);
        if (!code.chars().allMatch(Character::isDigit)
                || (statusLine.length() > 12 && statusLine.charAt(12) != ' ')) {
            throw new ProtocolException("Malformed status line: " + statusLine);
        }
        return Integer.parseInt(code);
    }

    private static byte[] readBody(InputStream in, HttpMethod method, ResponseHead head) throws IOException {
        int status = head.statusCode();
        if (method == HttpMethod.HEAD || status == 204 || status == 304 || status < 200) {
            return new byte[0];
        }
        String transferEncoding = head.headers().get("Transfer-Encoding");
        if (transferEncoding != null && transferEncoding.toLowerCase(Locale.ROOT).trim().endsWith("chunked")) {
            return readChunked(in);
        }
        String contentLength = head.headers().get("Content-Length");
        if (contentLength != null) {
            return readFixed(in, parseLength(contentLength));
        }
        return readToEnd(in);
    }

    /** Repeated Content-Length fields arrive joined with commas and must all agree. */
    private static long parseLength(String value) throws ProtocolException {
        long length = -1L;
        for (String part : value.split(",")) {
            long parsed;
            try {
                parsed = Long.parseLong(part.trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid Content-Length: " + value);
            }
            if (parsed < 0 || (length != -1L && parsed != length)) {
                throw new ProtocolException("Invalid Content-Length: " + value);
            }
            length = parsed;
        }
        return length;
    }

    private static byte[] readFixed(InputStream in, long length) throws IOException {
        checkSize(length);
        var body = new ByteArrayOutputStream((int) Math.min(length, 64 * 1024));
        copy(in, body, length);
        return body.toByteArray();
    }

    private static byte[] readChunked(InputStream in) throws IOException {
        var body = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = requireLine(in);
            int extension = sizeLine.indexOf(';');
            String hex = (extension >= 0 ? sizeLine.substring(0, extension) : sizeLine).trim();
            long size;
            try {
                size = Long.parseLong(hex, 16);
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid chunk size: " + sizeLine);
            }
            if (size == 0) {
                while (!requireLine(in).isEmpty()) {
                    // trailer fields are not kept
                }
                return body.toByteArray();
            }
            checkSize(body.size() + size);
            copy(in, body, size);
            if (!requireLine(in).isEmpty()) {
                throw new ProtocolException("Missing CRLF after chunk data");
            }
        }
    }

    private static byte[] readToEnd(InputStream in) throws IOException {
        var body = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            checkSize(body.size() + (long) read);
            body.write(buffer, 0, read);
        }
        return body.toByteArray();
    }

    private static void copy(InputStream in, ByteArrayOutputStream out, long length) throws IOException {
        byte[] buffer = new byte[8192];
        long remaining = length;
        while (remaining > 0) {
            int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read == -1) {
                throw new EOFException(
                        "Connection closed after " + (length - remaining) + " of " + length + " body bytes");
            }
            out.write(buffer, 0, read);
            remaining -= read;
        }
    }

    private static void checkSize(long size) throws ProtocolException {
        if (size > MAX_BODY_BYTES) {
            throw new ProtocolException("Response body larger than " + MAX_BODY_BYTES + " bytes");
        }
    }

    private static String requireLine(InputStream in) throws IOException {
        String line = readLine(in);
        if (line == null) {
            throw new EOFException("Connection closed inside the response head");
        }
        return line;
    }

    /** Reads one CRLF or LF terminated line; null when the stream ends before any byte. */
    static String readLine(InputStream in) throws IOException {
        var line = new ByteArrayOutputStream(64);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                byte[] bytes = line.toByteArray();
                int length = bytes.length > 0 && bytes[bytes.length - 1] == '\r' ? bytes.length - 1 : bytes.length;
                return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
            }
            if (line.size() >= MAX_LINE_LENGTH) {
                throw new ProtocolException("Response line longer than " + MAX_LINE_LENGTH + " bytes");
            }
            line.write(b);
        }
        if (line.size() == 0) {
            return null;
        }
        throw new EOFException("Connection closed inside a response line");
    }

    /** Sets the socket timeout to the time left before every blocking read. */
    static final class DeadlineInputStream extends FilterInputStream {

        private final ReadLimit limit;
        private final Deadline deadline;

        DeadlineInputStream(InputStream in, ReadLimit limit, Deadline deadline) {
            super(in);
            this.limit = limit;
            this.deadline = deadline;
        }

        @Override
        public int read() throws IOException {
            prepare();
            return super.read();
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            prepare();
            return super.read(buffer, offset, length);
        }

        private void prepare() throws IOException {
            if (Thread.currentThread().isInterrupted()) {
                var interrupted = new InterruptedIOException("Interrupted while waiting for the response");
                interrupted.initCause(new InterruptedException());
                throw interrupted;
            }
            limit.apply(deadline.remainingMillis());
        }
    }
}
