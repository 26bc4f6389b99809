package com.taskgateway.worker.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Gateway client over the gateway's REST API, for adapters running outside the gateway process.
 */
public class HttpGatewayClient implements GatewayClient {

    private static final Logger log = LoggerFactory.getLogger(HttpGatewayClient.class);

    private final String gatewayUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpGatewayClient(String gatewayUrl, Duration requestTimeout, HttpClient httpClient,
                             ObjectMapper objectMapper) {
        this.gatewayUrl = gatewayUrl.endsWith("/") ? gatewayUrl.substring(0, gatewayUrl.length() - 1) : gatewayUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayTask submit(String topic, JsonNode payload, String submissionKey) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("topic", topic);
        body.set("payload", payload);
        body.put("submissionKey", submissionKey);

        HttpResponse<String> response = send(HttpRequest.newBuilder()
            .uri(URI.create(gatewayUrl + "/api/v1/tasks"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString())));
        if (response.statusCode() != 202 && response.statusCode() != 200) {
            throw new GatewayClientException(String.format(
                "Submit of %s returned HTTP %d: %s", topic, response.statusCode(), response.body()));
        }

        // The submit answer only carries id and status
        String taskId = readTree(response.body()).path("taskId").asText();
        log.debug("Submitted {} as gateway task {}", topic, taskId);
        return getTask(taskId);
    }

    @Override
    public GatewayTask getTask(String taskId) {
        HttpResponse<String> response = send(HttpRequest.newBuilder()
            .uri(URI.create(gatewayUrl + "/api/v1/tasks/" + URLEncoder.encode(taskId, StandardCharsets.UTF_8)))
            .GET());
        if (response.statusCode() != 200) {
            throw new GatewayClientException(String.format(
                "Lookup of task %s returned HTTP %d: %s", taskId, response.statusCode(), response.body()));
        }
        try {
            return objectMapper.readValue(response.body(), GatewayTask.class);
        } catch (JsonProcessingException e) {
            throw new GatewayClientException("Unreadable task " + taskId + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void registerCorrelation(String correlationKey, String workflowInstanceReference,
                                    String businessKey, String messageName) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("correlationKey", correlationKey);
        body.put("workflowInstanceReference", workflowInstanceReference);
        if (businessKey != null) {
            body.put("businessKey", businessKey);
        }
        if (messageName != null) {
            body.put("messageName", messageName);
        }

        HttpResponse<String> response = send(HttpRequest.newBuilder()
            .uri(URI.create(gatewayUrl + "/api/v1/correlations"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString())));
        if (response.statusCode() / 100 != 2) {
            throw new GatewayClientException(String.format(
                "Correlation registration for %s returned HTTP %d: %s",
                correlationKey, response.statusCode(), response.body()));
        }
    }

    // ========== Helper Methods ==========

    private HttpResponse<String> send(HttpRequest.Builder request) {
        try {
            return httpClient.send(request.timeout(requestTimeout).build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GatewayClientException("Gateway unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayClientException("Interrupted while calling the gateway", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GatewayClientException("Unreadable gateway response: " + e.getOriginalMessage(), e);
        }
    }
}
