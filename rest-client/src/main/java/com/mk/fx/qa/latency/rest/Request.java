package com.mk.fx.qa.latency.rest;

import java.util.Map;
import lombok.Data;

@Data
public class Request {
    private HttpMethod method = HttpMethod.GET;
    private String url;
    private Map<String, String> headers;
    private Map<String, String> query;
    private Object body;
    private ProxySpec proxy;
}
