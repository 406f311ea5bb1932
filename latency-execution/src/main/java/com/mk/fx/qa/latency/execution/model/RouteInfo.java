package com.mk.fx.qa.latency.execution.model;

/**
 * Where a geo-proxied request was sent and where it came out. All fields are null for targets
 * without a proxy rotation.
 *
 * @param region proxy region the request was routed through
 * @param requestedCountry country hint sent to the proxy
 * @param exitIp address the target saw, read from the response body
 * @param exitCountry country the target reported, read from the response body
 */
public record RouteInfo(String region, String requestedCountry, String exitIp, String exitCountry) {

  public static final RouteInfo NONE = new RouteInfo(null, null, null, null);

  public RouteInfo withExit(String ip, String country) {
    return new RouteInfo(region, requestedCountry, ip, country);
  }
}
