package com.taskgateway.api.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.core.exception.NotFoundException;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.engine.service.CorrelationService;
import com.taskgateway.engine.service.TaskService;
import com.taskgateway.worker.gateway.GatewayClientException;
import com.taskgateway.worker.gateway.GatewayTask;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocalGatewayClientTest {

    @Mock
    private TaskService taskService;

    @Mock
    private CorrelationService correlationService;

    @InjectMocks
    private LocalGatewayClient client;

    private final JsonNode payload = new ObjectMapper().createObjectNode().put("numero_processo", "1");

    @Test
    void submit_shouldReturnStoredTask() {
        TaskRecord task = TaskRecord.create("lookup", payload, "engine-task-1", Instant.now());
        when(taskService.submit("lookup", payload, "engine-task-1")).thenReturn(task);

        GatewayTask submitted = client.submit("lookup", payload, "engine-task-1");

        assertThat(submitted.taskId()).isEqualTo(task.taskId());
        assertThat(submitted.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(submitted.isTerminal()).isFalse();
    }

    @Test
    void submit_whenStoreUnavailable_shouldThrowGatewayClientException() {
        when(taskService.submit(any(), any(), any()))
            .thenThrow(new StoreUnavailableException("Task store", new SQLException("connection refused")));

        assertThatThrownBy(() -> client.submit("lookup", payload, "k"))
            .isInstanceOf(GatewayClientException.class)
            .hasMessageContaining("connection refused");
    }

    @Test
    void getTask_unknown_shouldThrowGatewayClientException() {
        when(taskService.getTask("missing")).thenThrow(new NotFoundException("Task", "missing"));

        assertThatThrownBy(() -> client.getTask("missing"))
            .isInstanceOf(GatewayClientException.class);
    }

    @Test
    void registerCorrelation_shouldUseDefaultTtl() {
        client.registerCorrelation("K-1", "proc-1", "BK-1", "retorno_dw_law");

        verify(correlationService).register(eq("K-1"), eq("proc-1"), eq("BK-1"), eq("retorno_dw_law"), isNull());
    }
}
