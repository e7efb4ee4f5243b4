package me.golemcore.agentloop.domain.loop;

import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.AgentPolicy;
import me.golemcore.agentloop.domain.model.AgentRunRequest;
import me.golemcore.agentloop.domain.model.AgentRunResponse;
import me.golemcore.agentloop.domain.model.AgentStepResult;
import me.golemcore.agentloop.domain.model.PlannerProposal;
import me.golemcore.agentloop.domain.model.PlannerRequest;
import me.golemcore.agentloop.domain.model.RetryPolicy;
import me.golemcore.agentloop.domain.model.ToolTrace;
import me.golemcore.agentloop.domain.model.WorkingMemoryEntry;
import me.golemcore.agentloop.domain.service.HybridArbiter;
import me.golemcore.agentloop.domain.service.ToolArgumentValidator;
import me.golemcore.agentloop.domain.service.ToolExecutionService;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.testsupport.MutableClock;
import me.golemcore.agentloop.testsupport.ScriptedPlanner;
import me.golemcore.agentloop.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IterativeAgentLoopTest {

    private static final double EPSILON = 1e-9;
    private static final String TOOL_NOW = "now";
    private static final String TOOL_FLAKY = "flaky";

    private MutableClock clock;
    private ToolRegistry registry;
    private StubTool nowTool;
    private StubTool flakyTool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        nowTool = StubTool.succeeding(TOOL_NOW, Map.of("utc_now", "2026-01-01T12:00:00Z"));
        flakyTool = StubTool.failing(TOOL_FLAKY, "upstream unavailable");
        registry = ToolRegistry.of(nowTool, flakyTool);
    }

    private IterativeAgentLoop loop(ScriptedPlanner planner) {
        ToolExecutionService executor = new ToolExecutionService(registry, new ToolArgumentValidator(), clock);
        return new IterativeAgentLoop(planner, executor, new HybridArbiter(), AgentPolicy.defaults(), clock);
    }

    private static AgentRunRequest request(int maxIterations) {
        return AgentRunRequest.builder()
                .userId("alice")
                .prompt("What time is it?")
                .maxIterations(maxIterations)
                .build();
    }

    @Test
    void shouldCallToolThenFinalizeWithEvidence() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("Need current time.", TOOL_NOW, Map.of("tz", "UTC"), 0.62),
                PlannerProposal.finalAnswer("Tool result available.", "It is noon.", 0.2));

        AgentRunResponse response = loop(planner).run(request(6));

        assertTrue(response.isOk());
        assertNull(response.getError());
        assertEquals("It is noon.", response.getAnswer());
        assertEquals(2, response.getSteps().size());

        AgentStepResult toolStep = response.getSteps().get(0);
        assertEquals(AgentAction.TOOL, toolStep.getAction());
        assertEquals(TOOL_NOW, toolStep.getFunctionCall().name());
        assertEquals(Boolean.TRUE, toolStep.getNotes().get("tool_ok"));
        assertTrue(toolStep.getNotes().containsKey("tool_error"));
        assertNull(toolStep.getNotes().get("tool_error"));

        AgentStepResult finalStep = response.getSteps().get(1);
        assertEquals(AgentAction.FINAL, finalStep.getAction());
        assertEquals(1, finalStep.getStepIndex());
        assertEquals("It is noon.", finalStep.getFinalText());
        assertTrue(finalStep.getNotes().isEmpty());

        assertEquals(1, response.getToolTraces().size());
        ToolTrace trace = response.getToolTraces().get(0);
        assertEquals(0, trace.step());
        assertEquals(TOOL_NOW, trace.tool());
        assertTrue(trace.ok());

        assertEquals(Map.of("tz", "UTC"), nowTool.getCalls().get(0));
        assertEquals("alice", nowTool.getContexts().get(0).getUserId());
        assertEquals(Map.of("step", 0), nowTool.getContexts().get(0).getMetadata());
    }

    @Test
    void shouldFeedToolResultsIntoWorkingMemory() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("t", TOOL_NOW, Map.of(), 0.6),
                PlannerProposal.finalAnswer("f", "done", 0.9));

        loop(planner).run(request(6));

        List<PlannerRequest> requests = planner.getRequests();
        assertEquals(2, requests.size());
        assertTrue(requests.get(0).getWorkingMemory().isEmpty());
        assertEquals(0, requests.get(0).getStep());
        assertEquals(1, requests.get(1).getStep());

        WorkingMemoryEntry entry = requests.get(1).getWorkingMemory().get(0);
        assertEquals(WorkingMemoryEntry.TYPE_TOOL_RESULT, entry.type());
        assertEquals(TOOL_NOW, entry.tool());
        assertTrue(entry.ok());
        assertEquals(requests.get(0).getTraceId(), requests.get(1).getTraceId());
    }

    @Test
    void shouldFinalizeImmediatelyWhenConfident() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.finalAnswer("easy", "42", 0.9));

        AgentRunResponse response = loop(planner).run(request(6));

        assertTrue(response.isOk());
        assertEquals("42", response.getAnswer());
        assertEquals(1, response.getSteps().size());
        assertTrue(response.getToolTraces().isEmpty());
        assertEquals(1, response.getDecisionTrace().get("iterations"));
    }

    @Test
    void shouldExhaustIterationsWhenFinalizationKeepsBeingBlocked() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.finalAnswer("guess", "maybe", 0.2));

        AgentRunResponse response = loop(planner).run(request(3));

        assertTrue(response.isOk());
        assertEquals(IterativeAgentLoop.DEFAULT_ANSWER, response.getAnswer());
        assertEquals(3, response.getSteps().size());
        for (AgentStepResult step : response.getSteps()) {
            assertEquals(AgentAction.REFLECT, step.getAction());
            assertEquals("low_confidence_finalize", step.getNotes().get("arbiter_reason"));
            assertEquals(0.2, step.getConfidence(), EPSILON);
        }
    }

    @Test
    void shouldRetryFailingToolUntilPerToolBudgetThenReflect() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("try flaky", TOOL_FLAKY, Map.of(), 0.6));

        AgentRunResponse response = loop(planner).run(request(3));

        assertTrue(response.isOk());
        assertEquals(IterativeAgentLoop.DEFAULT_ANSWER, response.getAnswer());
        List<AgentStepResult> steps = response.getSteps();
        assertEquals(6, steps.size());

        assertEquals(AgentAction.TOOL, steps.get(0).getAction());
        assertEquals(Boolean.FALSE, steps.get(0).getNotes().get("tool_ok"));
        assertEquals("upstream unavailable", steps.get(0).getNotes().get("tool_error"));

        AgentStepResult firstRetry = steps.get(1);
        assertEquals(AgentAction.RETRY, firstRetry.getAction());
        assertEquals("Tool failed; retry authorized by policy.", firstRetry.getThought());
        assertEquals(0.5, firstRetry.getConfidence(), EPSILON);
        assertEquals(TOOL_FLAKY, firstRetry.getNotes().get("failed_tool"));
        assertEquals(1, firstRetry.getNotes().get("total_retries"));
        assertEquals(1, firstRetry.getNotes().get("tool_retries"));

        assertEquals(AgentAction.RETRY, steps.get(3).getAction());
        assertEquals(2, steps.get(3).getNotes().get("tool_retries"));

        AgentStepResult exhausted = steps.get(5);
        assertEquals(AgentAction.REFLECT, exhausted.getAction());
        assertEquals("Retry budget exhausted; switching to reflection.", exhausted.getThought());
        assertEquals(0.4, exhausted.getConfidence(), EPSILON);
        assertEquals(Boolean.TRUE, exhausted.getNotes().get("retry_exhausted"));

        assertEquals(3, response.getToolTraces().size());
        assertEquals(3, flakyTool.getCalls().size());
        assertEquals(2, response.getDecisionTrace().get("retry_total"));
        assertEquals(Map.of(TOOL_FLAKY, 2), response.getDecisionTrace().get("retry_per_tool"));
    }

    @Test
    void shouldNotCountFailureTowardsEvidence() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("try flaky", TOOL_FLAKY, Map.of(), 0.6),
                PlannerProposal.finalAnswer("guess", "maybe", 0.2));

        AgentRunResponse response = loop(planner).run(request(2));

        AgentStepResult last = response.getSteps().get(response.getSteps().size() - 1);
        assertEquals(AgentAction.REFLECT, last.getAction());
        assertEquals("low_confidence_finalize", last.getNotes().get("arbiter_reason"));
    }

    @Test
    void shouldDenyToolsOutsideWhitelist() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("t", TOOL_NOW, Map.of(), 0.6),
                PlannerProposal.finalAnswer("f", "without tools", 0.9));
        AgentRunRequest request = AgentRunRequest.builder()
                .prompt("time?")
                .toolWhitelist(new LinkedHashSet<>(List.of("zeta", "echo")))
                .build();

        AgentRunResponse response = loop(planner).run(request);

        assertTrue(nowTool.getCalls().isEmpty());
        ToolTrace trace = response.getToolTraces().get(0);
        assertFalse(trace.ok());
        assertEquals("Tool 'now' is not allowed by whitelist", trace.error());
        assertEquals(AgentAction.RETRY, response.getSteps().get(1).getAction());
        assertEquals(Boolean.TRUE, response.getDecisionTrace().get("whitelist_active"));
        assertEquals(List.of("echo", "zeta"), response.getDecisionTrace().get("whitelist"));
        assertEquals(List.of("echo", "zeta"), planner.getRequests().get(0).getToolWhitelist());
    }

    @Test
    void shouldTreatEmptyWhitelistAsInactive() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("t", TOOL_NOW, Map.of(), 0.6),
                PlannerProposal.finalAnswer("f", "ok", 0.9));
        AgentRunRequest request = AgentRunRequest.builder().prompt("time?").toolWhitelist(Set.of()).build();

        AgentRunResponse response = loop(planner).run(request);

        assertTrue(response.getToolTraces().get(0).ok());
        assertEquals(Boolean.FALSE, response.getDecisionTrace().get("whitelist_active"));
        assertNull(response.getDecisionTrace().get("whitelist"));
    }

    @Test
    void shouldReflectWhenToolsDisabled() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.toolCall("t", TOOL_NOW, Map.of(), 0.6));
        AgentRunRequest request = AgentRunRequest.builder().prompt("time?").maxIterations(2).allowTools(false)
                .build();

        AgentRunResponse response = loop(planner).run(request);

        assertTrue(nowTool.getCalls().isEmpty());
        assertTrue(response.getToolTraces().isEmpty());
        AgentStepResult step = response.getSteps().get(0);
        assertEquals(AgentAction.REFLECT, step.getAction());
        assertEquals("tools_disabled", step.getNotes().get("arbiter_reason"));
        assertEquals(0.4, step.getConfidence(), EPSILON);
        assertFalse(planner.getRequests().get(0).isAllowTools());
    }

    @Test
    void shouldTimeOutAtIterationBoundary() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.reflect("thinking", 0.3))
                .onStep(request -> clock.advanceMillis(15_000));
        AgentRunRequest request = AgentRunRequest.builder().prompt("slow").timeoutMs(20_000).build();

        AgentRunResponse response = loop(planner).run(request);

        assertFalse(response.isOk());
        assertEquals("", response.getAnswer());
        assertEquals("Agent timeout after 30000ms", response.getError());
        assertEquals(2, response.getSteps().size());
        assertEquals(30_000L, response.getDecisionTrace().get("elapsed_ms"));
    }

    @Test
    void shouldGateRetryWithoutPriorToolByGlobalBudget() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.builder()
                .action("retry")
                .confidence(0.5)
                .build());

        AgentRunResponse response = loop(planner).run(request(5));

        List<AgentStepResult> steps = response.getSteps();
        assertEquals(5, steps.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(AgentAction.RETRY, steps.get(i).getAction());
            assertEquals("Retry selected.", steps.get(i).getThought());
            assertTrue(steps.get(i).getNotes().containsKey("retry_target_tool"));
            assertNull(steps.get(i).getNotes().get("retry_target_tool"));
            assertEquals(i + 1, steps.get(i).getNotes().get("total_retries"));
        }
        AgentStepResult denied = steps.get(3);
        assertEquals(AgentAction.REFLECT, denied.getAction());
        assertEquals("Retry denied by policy budget.", denied.getThought());
        assertEquals(0.3, denied.getConfidence(), EPSILON);
        assertEquals(Map.of("retry_exhausted", true), denied.getNotes());
        assertEquals(3, response.getDecisionTrace().get("retry_total"));
    }

    @Test
    void shouldTargetLastToolOnExplicitRetry() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("t", TOOL_NOW, Map.of(), 0.6),
                PlannerProposal.builder().action("retry").thought("again").confidence(0.5).build(),
                PlannerProposal.finalAnswer("f", "done", 0.9));

        AgentRunResponse response = loop(planner).run(request(6));

        AgentStepResult retry = response.getSteps().get(1);
        assertEquals(AgentAction.RETRY, retry.getAction());
        assertEquals("again", retry.getThought());
        assertEquals(TOOL_NOW, retry.getNotes().get("retry_target_tool"));
        assertEquals(1, retry.getNotes().get("tool_retries"));
    }

    @Test
    void shouldTreatNullProposalAsReflect() {
        ScriptedPlanner planner = new ScriptedPlanner();

        AgentRunResponse response = loop(planner).run(request(2));

        assertEquals(2, response.getSteps().size());
        assertEquals(AgentAction.REFLECT, response.getSteps().get(0).getAction());
        assertTrue(response.getSteps().get(0).getNotes().isEmpty());
    }

    @Test
    void shouldClampIterationsAndReportPolicyInTrace() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.reflect("hmm", 0.3));

        AgentRunResponse response = loop(planner).run(request(50));

        assertEquals(20, response.getSteps().size());
        Map<String, Object> trace = response.getDecisionTrace();
        assertEquals(20, trace.get("max_iterations"));
        assertEquals(20_000L, trace.get("timeout_ms"));
        assertNotNull(trace.get("trace_id"));
        @SuppressWarnings("unchecked")
        Map<String, Object> policy = (Map<String, Object>) trace.get("policy");
        assertEquals(0.45, policy.get("min_confidence_to_finalize"));
        assertEquals(3, policy.get("max_total_retries"));
        assertEquals(2, policy.get("max_retries_per_tool"));
        assertEquals(150L, policy.get("backoff_base_ms"));
    }

    @Test
    void shouldKeepStepIndicesWithinIterationRange() {
        ScriptedPlanner planner = new ScriptedPlanner(
                PlannerProposal.toolCall("try flaky", TOOL_FLAKY, Map.of(), 0.6));

        AgentRunResponse response = loop(planner).run(request(4));

        for (AgentStepResult step : response.getSteps()) {
            assertTrue(step.getStepIndex() >= 0 && step.getStepIndex() < 4);
        }
        int toolSteps = (int) response.getSteps().stream().filter(s -> s.getAction() == AgentAction.TOOL).count();
        assertEquals(toolSteps, response.getToolTraces().size());
    }

    @Test
    void shouldUsePolicyDefaultWhenIterationsNotRequested() {
        AgentPolicy policy = new AgentPolicy(3, 20, 0.45, RetryPolicy.defaults());
        ToolExecutionService executor = new ToolExecutionService(registry, new ToolArgumentValidator(), clock);
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.reflect("Thinking.", 0.3));
        IterativeAgentLoop agentLoop = new IterativeAgentLoop(planner, executor, new HybridArbiter(), policy, clock);

        AgentRunResponse response = agentLoop.run(AgentRunRequest.builder().prompt("hi").build());

        assertEquals(3, response.getSteps().size());
        assertEquals(3, response.getDecisionTrace().get("max_iterations"));
        assertEquals(IterativeAgentLoop.DEFAULT_ANSWER, response.getAnswer());
    }

    @Test
    void shouldFallBackToDefaultAnswerWhenFinalTextIsAlwaysEmpty() {
        ScriptedPlanner planner = new ScriptedPlanner(PlannerProposal.finalAnswer("Done.", "", 0.95));

        AgentRunResponse response = loop(planner).run(request(4));

        assertTrue(response.isOk());
        assertEquals(IterativeAgentLoop.DEFAULT_ANSWER, response.getAnswer());
        assertEquals(4, response.getSteps().size());
        for (AgentStepResult step : response.getSteps()) {
            assertEquals(AgentAction.REFLECT, step.getAction());
            assertEquals("empty_final_text", step.getNotes().get("arbiter_reason"));
            assertNull(step.getFinalText());
        }
    }
}
