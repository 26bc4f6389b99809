package com.taskgateway.engine.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgateway.client.ExternalApiException;
import com.taskgateway.client.http.ApiRequest;
import com.taskgateway.client.http.ApiResponse;
import com.taskgateway.client.http.ResilientApiClient;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.engine.logging.LoggingContext;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Topic handler that forwards the payload to one external API call described by a {@link TopicRoute}.
 * JSON responses become the task result; other bodies are wrapped as {@code {statusCode, body}}.
 */
public class ExternalApiTopicHandler implements TopicHandler {

    private static final Pattern PATH_VARIABLE = Pattern.compile("\\{([^}/]+)}");

    private final TopicRoute route;
    private final ResilientApiClient apiClient;
    private final ObjectMapper objectMapper;

    public ExternalApiTopicHandler(TopicRoute route, ResilientApiClient apiClient, ObjectMapper objectMapper) {
        this.route = route;
        this.apiClient = apiClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode handle(JsonNode payload) throws TopicHandlerException {
        LoggingContext.setApiName(route.apiName());
        ApiRequest request = new ApiRequest(
            route.method(),
            expandPath(payload),
            route.contentType() != null ? route.contentType() : ApiRequest.JSON,
            buildBody(payload),
            route.soapAction(),
            route.callClass()
        );

        ApiResponse response;
        try {
            response = apiClient.call(route.apiName(), route.accountId(), request);
        } catch (ExternalApiException e) {
            throw TopicHandlerException.from(e);
        }
        return toResult(response);
    }

    @Override
    public List<String> requiredFields() {
        return route.requiredFields();
    }

    // ========== Helper Methods ==========

    private String expandPath(JsonNode payload) throws TopicHandlerException {
        Matcher matcher = PATH_VARIABLE.matcher(route.path());
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String field = matcher.group(1);
            JsonNode value = payload != null ? payload.get(field) : null;
            if (value == null || value.isNull()) {
                throw TopicHandlerException.validation("Path variable missing from payload: " + field);
            }
            String encoded = URLEncoder.encode(value.asText(), StandardCharsets.UTF_8).replace("+", "%20");
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(encoded));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }

    private String buildBody(JsonNode payload) throws TopicHandlerException {
        if ("GET".equals(route.method()) || "DELETE".equals(route.method())) {
            return null;
        }
        JsonNode body = route.bodyField() != null && payload != null ? payload.get(route.bodyField()) : payload;
        if (body == null || body.isNull()) {
            if (route.bodyField() != null) {
                throw TopicHandlerException.validation("Body field missing from payload: " + route.bodyField());
            }
            return null;
        }
        if (body.isTextual()) {
            return body.asText();
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TopicHandlerException(ErrorClass.VALIDATION, "Payload cannot be serialized", e);
        }
    }

    private JsonNode toResult(ApiResponse response) throws TopicHandlerException {
        String body = response.body();
        if (response.isJson() && body != null && !body.isBlank()) {
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new TopicHandlerException(ErrorClass.BUSINESS_REJECTED,
                    "Response declared JSON but could not be parsed: " + e.getOriginalMessage(), e);
            }
        }
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.put("statusCode", response.statusCode());
        wrapped.put("body", body);
        return wrapped;
    }
}
