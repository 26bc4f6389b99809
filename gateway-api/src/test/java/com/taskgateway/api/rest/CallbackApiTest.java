package com.taskgateway.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CallbackApiTest {

    private static HttpServer engine;
    private static final List<String> messages = new CopyOnWriteArrayList<>();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @DynamicPropertySource
    static void engine(DynamicPropertyRegistry registry) throws IOException {
        engine = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        engine.createContext("/engine-rest/message", exchange -> {
            messages.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        engine.start();
        registry.add("gateway.engine.url",
            () -> "http://127.0.0.1:" + engine.getAddress().getPort() + "/engine-rest");
    }

    @AfterAll
    static void stopEngine() {
        engine.stop(0);
    }

    @Test
    void receiveCallback_shouldAcknowledgeAndDetectRedelivery() throws Exception {
        String payload = """
            {"chave_de_pesquisa": "K-100", "status_pesquisa": "S", "timestamp": "2024-01-01T10:00:00"}
            """;
        String redelivered = """
            {"timestamp": "2024-01-01T10:05:00", "status_pesquisa": "S", "chave_de_pesquisa": "K-100"}
            """;

        String first = mockMvc.perform(post("/api/v1/callbacks/dw-law")
                .contentType(MediaType.APPLICATION_JSON).content(payload))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.received").value(true))
            .andExpect(jsonPath("$.duplicate").value(false))
            .andReturn().getResponse().getContentAsString();
        String callbackId = objectMapper.readTree(first).get("callbackId").asText();

        mockMvc.perform(post("/api/v1/callbacks/dw-law")
                .contentType(MediaType.APPLICATION_JSON).content(redelivered))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.duplicate").value(true))
            .andExpect(jsonPath("$.callbackId").value(callbackId));

        mockMvc.perform(get("/api/v1/callbacks/{callbackId}", callbackId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.correlationKey").value("K-100"))
            .andExpect(jsonPath("$.deliveryCount").value(2))
            .andExpect(jsonPath("$.signalSent").value(false));
    }

    @Test
    @DisplayName("Callback arriving before registration is signalled once the workflow registers")
    void registerCorrelation_afterCallback_shouldSignalWaitingInstance() throws Exception {
        mockMvc.perform(post("/api/v1/callbacks/dw-law")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chave_de_pesquisa\": \"K-200\", \"numero_processo\": \"555\"}"))
            .andExpect(status().isAccepted());

        mockMvc.perform(post("/api/v1/correlations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"correlationKey": "K-200", "workflowInstanceReference": "proc-200", "businessKey": "BK-200"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.correlationKey").value("K-200"))
            .andExpect(jsonPath("$.expiresAt").isNotEmpty());

        String message = awaitMessage("proc-200");
        JsonNode body = objectMapper.readTree(message);
        assertThat(body.get("messageName").asText()).isEqualTo("retorno_dw_law");
        assertThat(message).contains("555");
    }

    @Test
    void receiveCallback_withoutCorrelationKey_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/v1/callbacks/dw-law")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status_pesquisa\": \"S\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.path").value("/api/v1/callbacks/dw-law"));
    }

    @Test
    void receiveCallback_fromUnknownSource_shouldReturn404() throws Exception {
        mockMvc.perform(post("/api/v1/callbacks/unknown")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chave_de_pesquisa\": \"K-1\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void registerCorrelation_withoutInstanceReference_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/v1/correlations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"correlationKey\": \"K-300\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void cancelCorrelation_shouldRemoveOnce() throws Exception {
        mockMvc.perform(post("/api/v1/correlations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"correlationKey\": \"K-400\", \"workflowInstanceReference\": \"proc-400\", \"ttl\": \"PT1H\"}"))
            .andExpect(status().isCreated());

        mockMvc.perform(delete("/api/v1/correlations/{key}", "K-400"))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/correlations/{key}", "K-400"))
            .andExpect(status().isNotFound());
    }

    @Test
    void invalidateCredentials_shouldSucceedWithoutCachedToken() throws Exception {
        mockMvc.perform(delete("/api/v1/credentials/{api}/{account}", "dw-law", "default"))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/credentials/{api}", "dw-law"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.apiName").value("dw-law"))
            .andExpect(jsonPath("$.invalidated").value(0));
    }

    // ========== Helper Methods ==========

    private String awaitMessage(String fragment) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            for (String message : messages) {
                if (message.contains(fragment)) {
                    return message;
                }
            }
            Thread.sleep(20);
        }
        return fail("No message mentioning " + fragment + " reached the engine");
    }
}
