package me.golemcore.agentloop.adapter.inbound.web.controller;

import me.golemcore.agentloop.adapter.inbound.web.dto.ToolExecuteRequest;
import me.golemcore.agentloop.adapter.inbound.web.dto.ToolExecuteResponse;
import me.golemcore.agentloop.adapter.inbound.web.dto.ToolListResponse;
import me.golemcore.agentloop.domain.model.ToolContext;
import me.golemcore.agentloop.domain.model.ToolExecutionRecord;
import me.golemcore.agentloop.domain.model.ToolFailureKind;
import me.golemcore.agentloop.domain.service.ToolArgumentValidator;
import me.golemcore.agentloop.domain.service.ToolExecutionService;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.tools.EchoTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ToolsControllerTest {

    private ToolRegistry toolRegistry;
    private ToolExecutionService toolExecutionService;
    private ToolsController controller;

    @BeforeEach
    void setUp() {
        toolRegistry = ToolRegistry.of(new EchoTool());
        toolExecutionService = mock(ToolExecutionService.class);
        controller = new ToolsController(toolRegistry, toolExecutionService);
    }

    @Test
    void shouldListRegisteredTools() {
        StepVerifier.create(controller.listTools())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ToolListResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isOk());
                    assertEquals(1, body.getCount());
                    assertEquals("echo", body.getTools().get(0).getName());
                    assertEquals("object", body.getTools().get(0).getInputSchema().get("type"));
                })
                .verifyComplete();
    }

    @Test
    void shouldExecuteToolWithRouteContext() {
        when(toolExecutionService.execute(eq("echo"), any(), isNull(), any()))
                .thenReturn(new ToolExecutionRecord("echo", Map.of("text", "hi"), true, 2,
                        Map.of("text", "hi", "user_id", "bob"), null, null));
        ToolExecuteRequest request = ToolExecuteRequest.builder()
                .name("echo")
                .args(Map.of("text", "hi"))
                .traceId("trace-1")
                .build();

        StepVerifier.create(controller.executeTool(request, "bob"))
                .assertNext(response -> {
                    ToolExecuteResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isOk());
                    assertEquals("echo", body.getTool());
                    assertEquals("bob", body.getOutput().get("user_id"));
                })
                .verifyComplete();

        ArgumentCaptor<ToolContext> context = ArgumentCaptor.forClass(ToolContext.class);
        verify(toolExecutionService).execute(eq("echo"), eq(Map.of("text", "hi")), isNull(), context.capture());
        assertEquals("bob", context.getValue().getUserId());
        assertEquals("trace-1", context.getValue().getTraceId());
        assertEquals(ToolsController.EXECUTE_SOURCE, context.getValue().getMetadata().get("source"));
    }

    @Test
    void shouldReturnFailureRecordAsOkResponse() {
        ToolExecutionService realService = new ToolExecutionService(toolRegistry, new ToolArgumentValidator(),
                Clock.systemUTC());
        controller = new ToolsController(toolRegistry, realService);
        ToolExecuteRequest request = ToolExecuteRequest.builder().name("missing").build();

        StepVerifier.create(controller.executeTool(request, null))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertFalse(response.getBody().isOk());
                    assertNotNull(response.getBody().getError());
                    assertTrue(response.getBody().getOutput().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapFailureRecord() {
        ToolExecuteResponse response = ToolExecuteResponse.from(ToolExecutionRecord.failure("echo", Map.of(), 1,
                ToolFailureKind.INVALID_INPUT, "text: is required"));

        assertFalse(response.isOk());
        assertEquals("text: is required", response.getError());
    }
}
