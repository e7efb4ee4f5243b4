package me.golemcore.agentloop.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.AgentPolicy;
import me.golemcore.agentloop.domain.model.AgentRunRequest;
import me.golemcore.agentloop.domain.model.AgentRunResponse;
import me.golemcore.agentloop.domain.model.AgentStepResult;
import me.golemcore.agentloop.domain.model.ArbitrationDecision;
import me.golemcore.agentloop.domain.model.FunctionCall;
import me.golemcore.agentloop.domain.model.PlannerProposal;
import me.golemcore.agentloop.domain.model.PlannerRequest;
import me.golemcore.agentloop.domain.model.RetryState;
import me.golemcore.agentloop.domain.model.ToolContext;
import me.golemcore.agentloop.domain.model.ToolExecutionRecord;
import me.golemcore.agentloop.domain.model.ToolTrace;
import me.golemcore.agentloop.domain.model.WorkingMemoryEntry;
import me.golemcore.agentloop.domain.service.HybridArbiter;
import me.golemcore.agentloop.domain.service.ToolExecutionService;
import me.golemcore.agentloop.port.outbound.PlannerPort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Iterative agent loop: planner, arbiter and execution boundary driven step by
 * step until a final answer, the iteration cap or the timeout.
 *
 * <p>
 * Per iteration:
 * <ol>
 * <li>timeout check (cooperative, at the iteration boundary only)</li>
 * <li>planner call with the rolling working memory</li>
 * <li>arbitration, with tool evidence taken from successful tool results</li>
 * <li>dispatch on the arbitrated action</li>
 * </ol>
 * Tool failures never abort the run; they become {@code retry} or
 * {@code reflect} steps depending on the retry budget. Only the timeout ends a
 * run with {@code ok=false}. Planner exceptions are not caught here.
 *
 * <p>
 * One instance serves concurrent runs; all run state is local to
 * {@link #run}.
 */
@Slf4j
public class IterativeAgentLoop {

    static final String DEFAULT_ANSWER = "No final answer produced within iteration budget.";

    private static final double RETRY_PENALTY = 0.1;
    private static final double EXHAUSTED_PENALTY = 0.2;

    private final PlannerPort planner;
    private final ToolExecutionService toolExecutor;
    private final HybridArbiter arbiter;
    private final AgentPolicy policy;
    private final Clock clock;

    public IterativeAgentLoop(PlannerPort planner, ToolExecutionService toolExecutor, HybridArbiter arbiter,
            AgentPolicy policy) {
        this(planner, toolExecutor, arbiter, policy, Clock.systemUTC());
    }

    public IterativeAgentLoop(PlannerPort planner, ToolExecutionService toolExecutor, HybridArbiter arbiter,
            AgentPolicy policy, Clock clock) {
        this.planner = planner;
        this.toolExecutor = toolExecutor;
        this.arbiter = arbiter;
        this.policy = policy;
        this.clock = clock;
    }

    public AgentPolicy getPolicy() {
        return policy;
    }

    public AgentRunResponse run(AgentRunRequest request) {
        RunState run = new RunState(UUID.randomUUID().toString(), request, clock.millis());
        int maxIterations = policy.resolveIterations(request.getMaxIterations());

        log.info("[AgentLoop] Run {} started: maxIterations={}, allowTools={}, whitelist={}, planner={}",
                run.traceId, maxIterations, request.isAllowTools(), run.sortedWhitelist, planner.getPlannerId());

        for (int i = 0; i < maxIterations; i++) {
            long elapsedMs = clock.millis() - run.startedMs;
            if (elapsedMs > request.getTimeoutMs()) {
                run.error = "Agent timeout after " + elapsedMs + "ms";
                log.warn("[AgentLoop] Run {} timed out at iteration {} after {}ms", run.traceId, i, elapsedMs);
                break;
            }

            PlannerProposal proposal = planner.nextStep(buildPlannerRequest(run, i));
            if (proposal == null) {
                proposal = PlannerProposal.empty();
            }
            boolean hasToolResult = run.workingMemory.stream()
                    .anyMatch(WorkingMemoryEntry::isSuccessfulToolResult);
            ArbitrationDecision decision = arbiter.decide(proposal, request.isAllowTools(),
                    policy.minConfidenceToFinalize(), hasToolResult);

            log.debug("[AgentLoop] Run {} step {}: proposed={}, decided={}, reason={}, confidence={}",
                    run.traceId, i, proposal.getAction(), decision.action(), decision.reason(),
                    decision.confidence());

            if (decision.action() == AgentAction.FINAL) {
                recordFinal(run, i, decision);
                break;
            }
            if (decision.action() == AgentAction.TOOL && request.isAllowTools()) {
                executeTool(run, i, decision);
            } else if (decision.action() == AgentAction.RETRY) {
                recordRetry(run, i, decision);
            } else {
                recordReflect(run, i, decision);
            }
        }

        if (run.finalAnswer == null && run.error == null) {
            run.finalAnswer = DEFAULT_ANSWER;
        }

        Map<String, Object> decisionTrace = buildDecisionTrace(run, maxIterations);
        log.info("[AgentLoop] Run {} finished: ok={}, steps={}, toolCalls={}, retries={}, elapsed={}ms",
                run.traceId, run.error == null, run.steps.size(), run.toolTraces.size(),
                run.retryState.getTotalRetries(), decisionTrace.get("elapsed_ms"));

        return AgentRunResponse.builder()
                .ok(run.error == null)
                .answer(run.finalAnswer != null ? run.finalAnswer : "")
                .steps(List.copyOf(run.steps))
                .toolTraces(List.copyOf(run.toolTraces))
                .decisionTrace(decisionTrace)
                .error(run.error)
                .build();
    }

    private PlannerRequest buildPlannerRequest(RunState run, int step) {
        return PlannerRequest.builder()
                .traceId(run.traceId)
                .step(step)
                .prompt(run.request.getPrompt())
                .workingMemory(List.copyOf(run.workingMemory))
                .allowTools(run.request.isAllowTools())
                .toolWhitelist(run.sortedWhitelist)
                .build();
    }

    private void recordFinal(RunState run, int step, ArbitrationDecision decision) {
        String answer = decision.finalText() != null ? decision.finalText() : "";
        run.finalAnswer = answer;
        run.steps.add(AgentStepResult.builder()
                .stepIndex(step)
                .thought(decision.thought())
                .action(AgentAction.FINAL)
                .finalText(answer)
                .confidence(decision.confidence())
                .notes(reasonNotes(decision))
                .build());
    }

    private void executeTool(RunState run, int step, ArbitrationDecision decision) {
        FunctionCall call = decision.functionCall();
        String toolName = call.name().trim();
        run.lastToolName = toolName;

        ToolContext context = ToolContext.builder()
                .userId(run.request.getUserId())
                .traceId(run.traceId)
                .metadata(Map.of("step", step))
                .build();
        ToolExecutionRecord record = toolExecutor.execute(toolName, call.arguments(), run.whitelist, context);

        run.toolTraces.add(ToolTrace.from(step, record));
        run.workingMemory.add(WorkingMemoryEntry.toolResult(step, record));

        Map<String, Object> toolNotes = new LinkedHashMap<>();
        toolNotes.put("tool_ok", record.ok());
        toolNotes.put("tool_error", record.error());
        run.steps.add(AgentStepResult.builder()
                .stepIndex(step)
                .thought(decision.thought())
                .action(AgentAction.TOOL)
                .functionCall(FunctionCall.of(toolName, call.arguments()))
                .confidence(decision.confidence())
                .notes(toolNotes)
                .build());

        if (record.ok()) {
            return;
        }

        if (run.retryState.canRetry(toolName, policy)) {
            run.retryState.markRetry(toolName);
            Map<String, Object> notes = new LinkedHashMap<>();
            notes.put("failed_tool", toolName);
            notes.put("total_retries", run.retryState.getTotalRetries());
            notes.put("tool_retries", run.retryState.getToolRetries(toolName));
            run.steps.add(AgentStepResult.builder()
                    .stepIndex(step)
                    .thought("Tool failed; retry authorized by policy.")
                    .action(AgentAction.RETRY)
                    .confidence(Math.max(decision.confidence() - RETRY_PENALTY, 0.0))
                    .notes(notes)
                    .build());
            log.debug("[AgentLoop] Run {} retry authorized for '{}' ({} total)", run.traceId, toolName,
                    run.retryState.getTotalRetries());
        } else {
            Map<String, Object> notes = new LinkedHashMap<>();
            notes.put("failed_tool", toolName);
            notes.put("retry_exhausted", true);
            run.steps.add(AgentStepResult.builder()
                    .stepIndex(step)
                    .thought("Retry budget exhausted; switching to reflection.")
                    .action(AgentAction.REFLECT)
                    .confidence(Math.max(decision.confidence() - EXHAUSTED_PENALTY, 0.0))
                    .notes(notes)
                    .build());
            log.info("[AgentLoop] Run {} retry budget exhausted for '{}'", run.traceId, toolName);
        }
    }

    private void recordRetry(RunState run, int step, ArbitrationDecision decision) {
        String target = run.lastToolName;
        if (run.retryState.canRetry(target, policy)) {
            run.retryState.markRetry(target);
            Map<String, Object> notes = new LinkedHashMap<>();
            notes.put("retry_target_tool", target);
            notes.put("total_retries", run.retryState.getTotalRetries());
            notes.put("tool_retries", run.retryState.getToolRetries(target));
            String thought = decision.thought() != null && !decision.thought().isEmpty()
                    ? decision.thought()
                    : "Retry selected.";
            run.steps.add(AgentStepResult.builder()
                    .stepIndex(step)
                    .thought(thought)
                    .action(AgentAction.RETRY)
                    .confidence(decision.confidence())
                    .notes(notes)
                    .build());
        } else {
            run.steps.add(AgentStepResult.builder()
                    .stepIndex(step)
                    .thought("Retry denied by policy budget.")
                    .action(AgentAction.REFLECT)
                    .confidence(Math.max(decision.confidence() - EXHAUSTED_PENALTY, 0.0))
                    .notes(Map.of("retry_exhausted", true))
                    .build());
        }
    }

    private void recordReflect(RunState run, int step, ArbitrationDecision decision) {
        run.steps.add(AgentStepResult.builder()
                .stepIndex(step)
                .thought(decision.thought())
                .action(AgentAction.REFLECT)
                .confidence(decision.confidence())
                .notes(reasonNotes(decision))
                .build());
    }

    private Map<String, Object> reasonNotes(ArbitrationDecision decision) {
        if (decision.reason() == null) {
            return Map.of();
        }
        return Map.of("arbiter_reason", decision.reason().getCode());
    }

    private Map<String, Object> buildDecisionTrace(RunState run, int maxIterations) {
        Map<String, Object> policySnapshot = new LinkedHashMap<>();
        policySnapshot.put("min_confidence_to_finalize", policy.minConfidenceToFinalize());
        policySnapshot.put("max_total_retries", policy.retry().maxTotalRetries());
        policySnapshot.put("max_retries_per_tool", policy.retry().maxRetriesPerTool());
        policySnapshot.put("backoff_base_ms", policy.retry().backoffBaseMs());
        policySnapshot.put("max_iterations_cap", policy.maxIterationsCap());

        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put("trace_id", run.traceId);
        trace.put("iterations", run.steps.size());
        trace.put("max_iterations", maxIterations);
        trace.put("timeout_ms", run.request.getTimeoutMs());
        trace.put("elapsed_ms", clock.millis() - run.startedMs);
        trace.put("retry_total", run.retryState.getTotalRetries());
        trace.put("retry_per_tool", new LinkedHashMap<>(run.retryState.getPerTool()));
        trace.put("policy", policySnapshot);
        trace.put("whitelist_active", run.whitelist != null);
        trace.put("whitelist", run.sortedWhitelist);
        return Collections.unmodifiableMap(trace);
    }

    /**
     * Mutable state of a single run. Never shared between runs.
     */
    private static final class RunState {

        private final String traceId;
        private final AgentRunRequest request;
        private final long startedMs;
        private final Set<String> whitelist;
        private final List<String> sortedWhitelist;
        private final List<AgentStepResult> steps = new ArrayList<>();
        private final List<ToolTrace> toolTraces = new ArrayList<>();
        private final List<WorkingMemoryEntry> workingMemory = new ArrayList<>();
        private final RetryState retryState = new RetryState();
        private String lastToolName;
        private String finalAnswer;
        private String error;

        private RunState(String traceId, AgentRunRequest request, long startedMs) {
            this.traceId = traceId;
            this.request = request;
            this.startedMs = startedMs;
            List<String> requested = request.getToolWhitelist() == null ? List.of()
                    : request.getToolWhitelist().stream().filter(Objects::nonNull).sorted().toList();
            if (requested.isEmpty()) {
                this.whitelist = null;
                this.sortedWhitelist = null;
            } else {
                this.whitelist = Collections.unmodifiableSet(new LinkedHashSet<>(requested));
                this.sortedWhitelist = requested;
            }
        }
    }
}
