package com.mk.fx.qa.latency.rest;

import java.util.List;
import java.util.Objects;

/**
 * Geo-proxy whose exit region and country hint change from one request to the next. The host
 * template may contain {@code {region}} and the username template {@code {country}}; request
 * {@code n} of a target uses region {@code n mod regions} and country {@code n mod countries}.
 *
 * @param hostTemplate proxy host, e.g. {@code gw.{region}.proxy.example}
 * @param port proxy port
 * @param usernameTemplate proxy user, e.g. {@code customer-country-{country}}; may be null
 * @param password proxy password, may be null
 * @param regions regions cycled through, may be empty
 * @param countries country hints cycled through, may be empty
 */
public record ProxyRotation(
        String hostTemplate,
        int port,
        String usernameTemplate,
        String password,
        List<String> regions,
        List<String> countries) {

    public static final String REGION_PLACEHOLDER = "{region}";
    public static final String COUNTRY_PLACEHOLDER = "{country}";

    public ProxyRotation {
        Objects.requireNonNull(hostTemplate, "Proxy host template cannot be null");
        if (hostTemplate.isBlank()) {
            throw new IllegalArgumentException("Proxy host template cannot be empty");
        }
        regions = regions != null ? List.copyOf(regions) : List.of();
        countries = countries != null ? List.copyOf(countries) : List.of();
        if (hostTemplate.contains(REGION_PLACEHOLDER) && regions.isEmpty()) {
            throw new IllegalArgumentException("Proxy host template uses " + REGION_PLACEHOLDER + " but no regions are set");
        }
        // validates the port and the first host once, up front
        route(0);
    }

    /**
     * Proxy for the request with the given index within its target.
     *
     * @param sequence zero-based request index
     * @return the proxy and the region and country it was built for
     */
    public ProxyRoute route(int sequence) {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
        String region = regions.isEmpty() ? null : regions.get(sequence % regions.size());
        String country = countries.isEmpty() ? null : countries.get(sequence % countries.size());
        String host = hostTemplate.replace(REGION_PLACEHOLDER, region != null ? region : "");
        String username =
                usernameTemplate != null
                        ? usernameTemplate.replace(COUNTRY_PLACEHOLDER, country != null ? country : "")
                        : null;
        return new ProxyRoute(new ProxySpec(host, port, username, password), region, country);
    }

    /**
     * One resolved hop of a rotation.
     *
     * @param proxy proxy to send the request through
     * @param region region the proxy host was built for, or null
     * @param country country hint carried in the username, or null
     */
    public record ProxyRoute(ProxySpec proxy, String region, String country) {}
}
