package com.taskgateway.worker.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgateway.core.model.TypedVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * External-task client for the Camunda 7 REST API ({@code {engine}/external-task/...}).
 */
public class CamundaRestEngineClient implements EngineClient {

    private static final Logger log = LoggerFactory.getLogger(CamundaRestEngineClient.class);

    private final String engineUrl;
    private final String authorization;
    private final Duration requestTimeout;
    private final Duration asyncResponseTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CamundaRestEngineClient(
            String engineUrl,
            String username,
            String password,
            Duration requestTimeout,
            Duration asyncResponseTimeout,
            HttpClient httpClient,
            ObjectMapper objectMapper) {
        this.engineUrl = engineUrl.endsWith("/") ? engineUrl.substring(0, engineUrl.length() - 1) : engineUrl;
        this.authorization = username != null && !username.isBlank()
            ? "Basic " + Base64.getEncoder().encodeToString(
                (username + ":" + (password != null ? password : "")).getBytes(StandardCharsets.UTF_8))
            : null;
        this.requestTimeout = requestTimeout;
        this.asyncResponseTimeout = asyncResponseTimeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ExternalTask> fetchAndLock(String workerId, int maxTasks, List<TopicLock> topics) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workerId", workerId);
        body.put("maxTasks", maxTasks);
        body.put("usePriority", true);
        if (!asyncResponseTimeout.isZero()) {
            body.put("asyncResponseTimeout", asyncResponseTimeout.toMillis());
        }
        ArrayNode topicNodes = body.putArray("topics");
        for (TopicLock topic : topics) {
            topicNodes.addObject()
                .put("topicName", topic.topicName())
                .put("lockDuration", topic.lockDuration().toMillis());
        }

        // Long polling holds the request open for up to asyncResponseTimeout
        String response = post("/external-task/fetchAndLock", body, requestTimeout.plus(asyncResponseTimeout));
        try {
            return Arrays.asList(objectMapper.readValue(response, ExternalTask[].class));
        } catch (JsonProcessingException e) {
            throw new EngineClientException("Unreadable fetchAndLock response: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void complete(String taskId, String workerId, Map<String, TypedVariable> variables) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workerId", workerId);
        ObjectNode variableNodes = body.putObject("variables");
        for (Map.Entry<String, TypedVariable> entry : variables.entrySet()) {
            variableNodes.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
        post("/external-task/" + taskId + "/complete", body, requestTimeout);
        log.debug("Completed external task {}", taskId);
    }

    @Override
    public void failure(String taskId, String workerId, String errorMessage, String errorDetails,
                        int retries, Duration retryTimeout) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workerId", workerId);
        body.put("errorMessage", errorMessage);
        if (errorDetails != null) {
            body.put("errorDetails", errorDetails);
        }
        body.put("retries", Math.max(retries, 0));
        body.put("retryTimeout", retryTimeout.toMillis());
        post("/external-task/" + taskId + "/failure", body, requestTimeout);
    }

    @Override
    public void bpmnError(String taskId, String workerId, String errorCode, String errorMessage) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workerId", workerId);
        body.put("errorCode", errorCode);
        body.put("errorMessage", errorMessage);
        post("/external-task/" + taskId + "/bpmnError", body, requestTimeout);
    }

    @Override
    public void extendLock(String taskId, String workerId, Duration newDuration) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workerId", workerId);
        body.put("newDuration", newDuration.toMillis());
        post("/external-task/" + taskId + "/extendLock", body, requestTimeout);
    }

    // ========== Helper Methods ==========

    private String post(String path, ObjectNode body, Duration timeout) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(engineUrl + path))
            .header("Content-Type", "application/json")
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EngineClientException("Workflow engine unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineClientException("Interrupted while calling " + path, e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new EngineClientException(String.format("POST %s returned HTTP %d: %s",
                path, response.statusCode(), response.body()), response.statusCode());
        }
        return response.body();
    }
}
