package com.mk.fx.qa.latency.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.net.ProtocolException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpWireTest {

  @Test
  void parseStatus_acceptsHttp1StatusLines() throws Exception {
    assertThat(HttpWire.parseStatus("HTTP/1.1 200 OK")).isEqualTo(200);
    assertThat(HttpWire.parseStatus("HTTP/1.0 503 Service Unavailable")).isEqualTo(503);
    assertThat(HttpWire.parseStatus("HTTP/1.1 204")).isEqualTo(204);
  }

  @Test
  void parseStatus_rejectsAnythingElse() {
    assertThatThrownBy(() -> HttpWire.parseStatus("HTTP/2 200 OK")).isInstanceOf(ProtocolException.class);
    assertThatThrownBy(() -> HttpWire.parseStatus("HTTP/1.1 2x0 OK")).isInstanceOf(ProtocolException.class);
    assertThatThrownBy(() -> HttpWire.parseStatus("HTTP/1.1 2000 OK")).isInstanceOf(ProtocolException.class);
    assertThatThrownBy(() -> HttpWire.parseStatus("<html>")).isInstanceOf(ProtocolException.class);
  }

  @Test
  void readLine_toleratesBareLineFeeds() throws Exception {
    var in = new ByteArrayInputStream("first\r\nsecond\n\r\n".getBytes(StandardCharsets.ISO_8859_1));

    assertThat(HttpWire.readLine(in)).isEqualTo("first");
    assertThat(HttpWire.readLine(in)).isEqualTo("second");
    assertThat(HttpWire.readLine(in)).isEmpty();
    assertThat(HttpWire.readLine(in)).isNull();
  }

  @Test
  void encodeHead_originFormWithBodyAndClose() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", "*/*");
    var request =
        new PreparedRequest(
            HttpMethod.POST,
            URI.create("http://api.example.com:8080/search?q=a+b"),
            headers,
            "{}".getBytes(StandardCharsets.UTF_8),
            null);

    String head = new String(HttpWire.encodeHead(request), StandardCharsets.UTF_8);

    assertThat(head)
        .isEqualTo(
            "POST /search?q=a+b HTTP/1.1\r\n"
                + "Host: api.example.com:8080\r\n"
                + "Accept: */*\r\n"
                + "Content-Length: 2\r\n"
                + "Connection: close\r\n\r\n");
  }

  @Test
  void encodeHead_absoluteFormThroughPlainProxy() {
    var request =
        new PreparedRequest(
            HttpMethod.GET,
            URI.create("http://ipinfo.example/json"),
            Map.of(),
            null,
            new ProxySpec("gw.na.proxy.example", 9999, "customer-country-us", "pw"));

    String head = new String(HttpWire.encodeHead(request), StandardCharsets.UTF_8);

    assertThat(head).startsWith("GET http://ipinfo.example/json HTTP/1.1\r\nHost: ipinfo.example\r\n");
    assertThat(head).contains("Proxy-Authorization: " + request.proxy().authorization() + "\r\n");
    assertThat(head).doesNotContain("Content-Length");
  }

  @Test
  void preparedRequest_defaultsPortsAndStripsIpv6Brackets() {
    var secure = new PreparedRequest(HttpMethod.GET, URI.create("https://[::1]/x"), Map.of(), null, null);
    var plain = new PreparedRequest(HttpMethod.GET, URI.create("http://example.com"), Map.of(), null, null);

    assertThat(secure.port()).isEqualTo(443);
    assertThat(secure.host()).isEqualTo("::1");
    assertThat(secure.authority()).isEqualTo("[::1]");
    assertThat(plain.port()).isEqualTo(80);
    assertThat(plain.target()).isEqualTo("/");
  }
}
