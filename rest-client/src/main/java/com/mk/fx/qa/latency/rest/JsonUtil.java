package com.mk.fx.qa.latency.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

public class JsonUtil {

    /** Tolerant mapper for request bodies and hand-written configuration. */
    private static final ObjectMapper MAPPER;

    /** Standard JSON only; used to judge response bodies. */
    private static final ObjectMapper STRICT_MAPPER;

    static {
        MAPPER =
                JsonMapper.builder()
                        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
                        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
                        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
                        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES.mappedFeature())
                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .build();
        MAPPER.registerModule(new JavaTimeModule());

        STRICT_MAPPER =
                JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build();
    }

    private JsonUtil() {
        // Prevent instantiation
    }

    public static <T> T read(String json, Class<T> type) throws JsonProcessingException {
        return MAPPER.readValue(json, type);
    }

    /** Converts an object to a compact JSON string. */
    public static String toJson(Object obj) throws JsonProcessingException {
        return MAPPER.writeValueAsString(obj);
    }

    /**
     * Parses a response body as a single strict JSON document.
     *
     * @throws IOException when the bytes are empty, malformed or followed by trailing content
     */
    public static JsonNode readStrictTree(byte[] body) throws IOException {
        if (body == null || body.length == 0) {
            throw new IOException("Empty body");
        }
        var node = STRICT_MAPPER.readTree(body);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty body");
        }
        return node;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
