package com.taskgateway.engine.correlation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgateway.core.exception.SignalDeliveryException;
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
import java.util.Base64;
import java.util.Map;

/**
 * Sends resume signals through the Camunda REST message endpoint ({@code POST {engine}/message}).
 */
public class CamundaMessageSignalSender implements ResumeSignalSender {

    private static final Logger log = LoggerFactory.getLogger(CamundaMessageSignalSender.class);

    private final String engineUrl;
    private final String authorization;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CamundaMessageSignalSender(
            String engineUrl,
            String username,
            String password,
            Duration timeout,
            HttpClient httpClient,
            ObjectMapper objectMapper) {
        this.engineUrl = engineUrl.endsWith("/") ? engineUrl.substring(0, engineUrl.length() - 1) : engineUrl;
        this.authorization = username != null && !username.isBlank()
            ? "Basic " + Base64.getEncoder().encodeToString(
                (username + ":" + (password != null ? password : "")).getBytes(StandardCharsets.UTF_8))
            : null;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(ResumeSignal signal) {
        String body = toMessageBody(signal);

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(engineUrl + "/message"))
            .header("Content-Type", "application/json")
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SignalDeliveryException("Workflow engine unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SignalDeliveryException("Interrupted while sending message " + signal.messageName(), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new SignalDeliveryException(String.format(
                "Workflow engine rejected message %s with HTTP %d: %s",
                signal.messageName(), response.statusCode(), response.body()));
        }
        log.debug("Message {} accepted by workflow engine (HTTP {})", signal.messageName(), response.statusCode());
    }

    String toMessageBody(ResumeSignal signal) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("messageName", signal.messageName());
        if (signal.businessKey() != null) {
            message.put("businessKey", signal.businessKey());
        }
        if (signal.processInstanceId() != null) {
            message.put("processInstanceId", signal.processInstanceId());
        }
        ObjectNode variables = message.putObject("processVariables");
        for (Map.Entry<String, TypedVariable> entry : signal.variables().entrySet()) {
            variables.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new SignalDeliveryException("Message body cannot be serialized", e);
        }
    }
}
