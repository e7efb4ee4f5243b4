package me.golemcore.agentloop.adapter.inbound.web.controller;

import me.golemcore.agentloop.adapter.inbound.web.dto.AgentRunRequestDto;
import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.AgentRunRequest;
import me.golemcore.agentloop.domain.model.AgentRunResponse;
import me.golemcore.agentloop.domain.model.AgentStepResult;
import me.golemcore.agentloop.domain.model.ToolTrace;
import me.golemcore.agentloop.domain.service.AgentRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerSentEvent;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentRunControllerTest {

    private AgentRunService agentRunService;
    private AgentRunController controller;

    @BeforeEach
    void setUp() {
        agentRunService = mock(AgentRunService.class);
        controller = new AgentRunController(agentRunService);
    }

    private static AgentRunResponse response() {
        return AgentRunResponse.builder()
                .ok(true)
                .answer("Result: {tz=UTC}")
                .steps(List.of(
                        AgentStepResult.builder().stepIndex(0).action(AgentAction.TOOL).build(),
                        AgentStepResult.builder().stepIndex(1).action(AgentAction.FINAL).build()))
                .toolTraces(List.of(new ToolTrace(0, "now", true, 3, Map.of("tz", "UTC"), null)))
                .decisionTrace(Map.of("iterations", 2))
                .build();
    }

    @Test
    void shouldRunWithDefaultsAndHeaderUser() {
        when(agentRunService.run(any())).thenReturn(response());
        AgentRunRequestDto request = AgentRunRequestDto.builder().prompt("What time is it?").build();

        StepVerifier.create(controller.run(request, "  alice "))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("Result: {tz=UTC}", response.getBody().getAnswer());
                })
                .verifyComplete();

        ArgumentCaptor<AgentRunRequest> captor = ArgumentCaptor.forClass(AgentRunRequest.class);
        verify(agentRunService).run(captor.capture());
        AgentRunRequest runRequest = captor.getValue();
        assertEquals("alice", runRequest.getUserId());
        assertNull(runRequest.getMaxIterations());
        assertTrue(runRequest.isAllowTools());
        assertNull(runRequest.getToolWhitelist());
        assertEquals(20_000L, runRequest.getTimeoutMs());
    }

    @Test
    void shouldFallBackToLocalUserWithoutHeader() {
        when(agentRunService.run(any())).thenReturn(response());
        AgentRunRequestDto request = AgentRunRequestDto.builder()
                .prompt("hi")
                .maxIterations(3)
                .allowTools(false)
                .toolWhitelist(List.of("echo", "echo"))
                .timeoutMs(5_000L)
                .build();

        StepVerifier.create(controller.run(request, null))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<AgentRunRequest> captor = ArgumentCaptor.forClass(AgentRunRequest.class);
        verify(agentRunService).run(captor.capture());
        AgentRunRequest runRequest = captor.getValue();
        assertEquals("local-dev", runRequest.getUserId());
        assertEquals(3, runRequest.getMaxIterations());
        assertFalse(runRequest.isAllowTools());
        assertEquals(1, runRequest.getToolWhitelist().size());
        assertEquals(5_000L, runRequest.getTimeoutMs());
    }

    @Test
    void shouldStreamStepsThenTracesThenFinalAndDone() {
        when(agentRunService.run(any())).thenReturn(response());
        AgentRunRequestDto request = AgentRunRequestDto.builder().prompt("What time is it?").build();

        StepVerifier.create(controller.stream(request, null).map(ServerSentEvent::event))
                .expectNext(AgentRunController.EVENT_STEP, AgentRunController.EVENT_STEP,
                        AgentRunController.EVENT_TOOL_TRACE, AgentRunController.EVENT_FINAL,
                        AgentRunController.EVENT_DONE)
                .verifyComplete();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCarryAnswerInFinalEvent() {
        when(agentRunService.run(any())).thenReturn(AgentRunResponse.builder()
                .ok(false)
                .answer("")
                .error("Agent timeout after 21000ms")
                .build());
        AgentRunRequestDto request = AgentRunRequestDto.builder().prompt("slow").build();

        StepVerifier.create(controller.stream(request, null))
                .assertNext(event -> {
                    assertEquals(AgentRunController.EVENT_FINAL, event.event());
                    Map<String, Object> data = (Map<String, Object>) event.data();
                    assertEquals("", data.get("final"));
                    assertEquals(false, data.get("ok"));
                    assertEquals("Agent timeout after 21000ms", data.get("error"));
                })
                .assertNext(event -> {
                    assertEquals(AgentRunController.EVENT_DONE, event.event());
                    assertEquals(Map.of("done", true), event.data());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateServiceErrors() {
        when(agentRunService.run(any())).thenThrow(new IllegalStateException("planner down"));
        AgentRunRequestDto request = AgentRunRequestDto.builder().prompt("hi").build();

        StepVerifier.create(controller.run(request, null))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
