package com.taskgateway.worker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.taskgateway.core.model.TypedVariable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;

class CamundaRestEngineClientTest {

    private static final String FETCHED = """
        [{
          "id": "ext-1",
          "topicName": "search",
          "workerId": "adapter-1",
          "processInstanceId": "proc-1",
          "businessKey": "BK-1",
          "retries": null,
          "priority": 0,
          "variables": {"numero_processo": {"value": "0001", "type": "String", "valueInfo": {}}}
        }]
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, String> requests = new ConcurrentHashMap<>();

    private HttpServer server;
    private CamundaRestEngineClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/engine-rest/external-task", exchange -> {
            String path = exchange.getRequestURI().getPath();
            requests.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            if (path.endsWith("/fetchAndLock")) {
                byte[] body = FETCHED.getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            } else if (path.contains("missing")) {
                byte[] body = "{\"type\":\"RestException\"}".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(404, body.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            } else {
                exchange.sendResponseHeaders(204, -1);
            }
            exchange.close();
        });
        server.start();
        client = new CamundaRestEngineClient("http://127.0.0.1:" + server.getAddress().getPort() + "/engine-rest",
            null, null, Duration.ofSeconds(5), Duration.ZERO, HttpClient.newHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void fetchAndLock_shouldSendTopicsAndReadTasks() throws Exception {
        List<ExternalTask> tasks = client.fetchAndLock("adapter-1", 5,
            List.of(new EngineClient.TopicLock("search", Duration.ofSeconds(60))));

        assertThat(tasks).hasSize(1);
        ExternalTask task = tasks.get(0);
        assertThat(task.id()).isEqualTo("ext-1");
        assertThat(task.retries()).isNull();
        assertThat(task.variable("numero_processo").asText()).isEqualTo("0001");

        JsonNode sent = objectMapper.readTree(requests.get("/engine-rest/external-task/fetchAndLock"));
        assertThat(sent.get("workerId").asText()).isEqualTo("adapter-1");
        assertThat(sent.get("maxTasks").asInt()).isEqualTo(5);
        assertThat(sent.has("asyncResponseTimeout")).isFalse();
        assertThat(sent.at("/topics/0/lockDuration").asLong()).isEqualTo(60_000);
    }

    @Test
    void complete_shouldSendTypedVariables() throws Exception {
        client.complete("ext-1", "adapter-1", Map.of("partes", new TypedVariable(2, "Integer")));

        JsonNode sent = objectMapper.readTree(requests.get("/engine-rest/external-task/ext-1/complete"));
        assertThat(sent.at("/variables/partes/value").asInt()).isEqualTo(2);
        assertThat(sent.at("/variables/partes/type").asText()).isEqualTo("Integer");
    }

    @Test
    void failure_shouldSendRetriesAndTimeout() throws Exception {
        client.failure("ext-1", "adapter-1", "timeout", null, 2, Duration.ofMinutes(1));

        JsonNode sent = objectMapper.readTree(requests.get("/engine-rest/external-task/ext-1/failure"));
        assertThat(sent.get("retries").asInt()).isEqualTo(2);
        assertThat(sent.get("retryTimeout").asLong()).isEqualTo(60_000);
        assertThat(sent.has("errorDetails")).isFalse();
    }

    @Test
    void rejectedCall_shouldCarryStatusCode() {
        assertThatThrownBy(() -> client.extendLock("missing", "adapter-1", Duration.ofSeconds(60)))
            .isInstanceOf(EngineClientException.class)
            .satisfies(e -> assertThat(((EngineClientException) e).getStatusCode()).isEqualTo(404));
    }
}
