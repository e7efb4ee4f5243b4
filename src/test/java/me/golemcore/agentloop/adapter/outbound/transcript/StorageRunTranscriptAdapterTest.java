package me.golemcore.agentloop.adapter.outbound.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentloop.domain.model.RunTranscript;
import me.golemcore.agentloop.domain.model.ToolTrace;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.infrastructure.config.AutoConfiguration;
import me.golemcore.agentloop.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StorageRunTranscriptAdapterTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    private StoragePort storagePort;
    private AgentLoopProperties properties;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        properties = new AgentLoopProperties();
    }

    private static RunTranscript transcript(String userId) {
        return RunTranscript.builder()
                .taskId("task-1")
                .userId(userId)
                .prompt("What time is it?")
                .outcome(RunTranscript.OUTCOME_COMPLETED)
                .status("completed")
                .recordedAt(Instant.parse("2026-01-01T12:00:00Z"))
                .maxIterations(6)
                .allowTools(true)
                .timeoutMs(20_000)
                .answer("noon")
                .decisionTrace(Map.of("iterations", 2))
                .toolTraces(List.of(new ToolTrace(0, "now", true, 4, Map.of("tz", "UTC"), null)))
                .stepsCount(2)
                .build();
    }

    @Test
    void shouldAppendSnakeCaseJsonLinePerUser() throws Exception {
        StorageRunTranscriptAdapter adapter = new StorageRunTranscriptAdapter(storagePort, objectMapper, properties);

        adapter.record(transcript("alice"));

        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(storagePort).appendText(eq("transcripts"), eq("alice.jsonl"), line.capture());
        assertTrue(line.getValue().endsWith("\n"));

        JsonNode json = objectMapper.readTree(line.getValue());
        assertEquals("task-1", json.get("task_id").asText());
        assertEquals("agent_run_completed", json.get("outcome").asText());
        assertEquals("2026-01-01T12:00:00Z", json.get("recorded_at").asText());
        assertEquals(2, json.get("steps_count").asInt());
        assertEquals(4, json.get("tool_traces").get(0).get("latency_ms").asInt());
    }

    @Test
    void shouldSkipWhenDisabled() {
        properties.getTranscripts().setEnabled(false);
        StorageRunTranscriptAdapter adapter = new StorageRunTranscriptAdapter(storagePort, objectMapper, properties);

        adapter.record(transcript("alice"));

        verifyNoInteractions(storagePort);
    }

    @Test
    void shouldPropagateStorageFailure() {
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        StorageRunTranscriptAdapter adapter = new StorageRunTranscriptAdapter(storagePort, objectMapper, properties);

        assertThrows(RuntimeException.class, () -> adapter.record(transcript("alice")));
    }

    @Test
    void shouldSanitizeUserIdForFileName() {
        assertEquals("local-dev.jsonl", StorageRunTranscriptAdapter.toFileName(null));
        assertEquals("local-dev.jsonl", StorageRunTranscriptAdapter.toFileName("  "));
        assertEquals(".._.._etc.jsonl", StorageRunTranscriptAdapter.toFileName("../../etc"));
        assertEquals("__.jsonl", StorageRunTranscriptAdapter.toFileName(".."));
        assertEquals("user_42.jsonl", StorageRunTranscriptAdapter.toFileName("user 42"));
    }
}
