package com.conveyal.gtfspublisher.manager.utils.json;

import com.conveyal.gtfspublisher.manager.utils.SimpleHttpResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON utilities to aid with JSON parsing.
 */
public class JsonUtil {
    public static final ObjectMapper objectMapper = new ObjectMapper();

    public static JsonNode getJsonNodeFromResponse(SimpleHttpResponse response) throws IOException {
        return objectMapper.readTree(response.body);
    }
}
