package me.golemcore.agentloop.domain.service;

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

import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.ArbitrationDecision;
import me.golemcore.agentloop.domain.model.ArbitrationReason;
import me.golemcore.agentloop.domain.model.FunctionCall;
import me.golemcore.agentloop.domain.model.PlannerProposal;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Deterministic safety/quality arbitration over planner output.
 *
 * <p>
 * Gates run in order and each one short-circuits to a {@code reflect}
 * decision:
 * <ol>
 * <li>tool requested while tools are disabled ({@code tools_disabled})</li>
 * <li>tool requested with a missing or nameless call
 * ({@code invalid_function_call})</li>
 * <li>finalization with blank text ({@code empty_final_text})</li>
 * <li>finalization below the confidence threshold with no successful tool
 * result ({@code low_confidence_finalize})</li>
 * </ol>
 * Gates 1-3 reduce confidence by {@value #MALFORMED_PENALTY}; gate 4 keeps it.
 * Pure function of its inputs: no I/O, no state.
 */
@Component
public class HybridArbiter {

    static final double MALFORMED_PENALTY = 0.2;

    private static final String DEFAULT_ACTION = "reflect";

    public ArbitrationDecision decide(PlannerProposal proposal, boolean allowTools, double minConfidenceToFinalize,
            boolean hasToolResult) {
        PlannerProposal step = proposal != null ? proposal : PlannerProposal.empty();
        String rawAction = step.getAction() != null ? step.getAction() : DEFAULT_ACTION;
        Optional<AgentAction> parsed = AgentAction.parse(rawAction);
        if (parsed.isEmpty()) {
            return ArbitrationDecision.downgrade("Invalid planner action normalized to reflect.", 0.0,
                    ArbitrationReason.INVALID_ACTION);
        }

        AgentAction action = parsed.get();
        String thought = step.getThought() != null ? step.getThought() : "";
        double confidence = step.getConfidence() != null ? step.getConfidence() : 0.0;

        return switch (action) {
        case TOOL -> decideTool(step, allowTools, thought, confidence);
        case FINAL -> decideFinal(step, minConfidenceToFinalize, hasToolResult, thought, confidence);
        case REFLECT, RETRY -> new ArbitrationDecision(action, thought, confidence, null, null, null);
        };
    }

    private ArbitrationDecision decideTool(PlannerProposal step, boolean allowTools, String thought,
            double confidence) {
        if (!allowTools) {
            return ArbitrationDecision.downgrade("Tools are disabled by request.", penalize(confidence),
                    ArbitrationReason.TOOLS_DISABLED);
        }
        FunctionCall call = toFunctionCall(step.getFunctionCall());
        if (call == null) {
            return ArbitrationDecision.downgrade("Invalid function_call payload.", penalize(confidence),
                    ArbitrationReason.INVALID_FUNCTION_CALL);
        }
        return new ArbitrationDecision(AgentAction.TOOL, thought, confidence, call, null, null);
    }

    private ArbitrationDecision decideFinal(PlannerProposal step, double minConfidenceToFinalize,
            boolean hasToolResult, String thought, double confidence) {
        String finalText = step.getFinalText();
        if (finalText == null || finalText.isBlank()) {
            return ArbitrationDecision.downgrade("Finalization blocked: empty final_text.", penalize(confidence),
                    ArbitrationReason.EMPTY_FINAL_TEXT);
        }
        if (confidence < minConfidenceToFinalize && !hasToolResult) {
            return ArbitrationDecision.downgrade("Finalization blocked: low confidence without evidence.",
                    confidence, ArbitrationReason.LOW_CONFIDENCE_FINALIZE);
        }
        return new ArbitrationDecision(AgentAction.FINAL, thought, confidence, null, finalText, null);
    }

    /**
     * Accepts a {@link FunctionCall} or a map carrying a non-blank
     * {@code name}. Returns null for anything else.
     */
    @SuppressWarnings("unchecked")
    private FunctionCall toFunctionCall(Object raw) {
        if (raw instanceof FunctionCall call) {
            return call.name() != null && !call.name().isBlank() ? call : null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        Object name = map.get("name");
        if (name == null || name.toString().isBlank()) {
            return null;
        }
        Object arguments = map.get("arguments");
        Map<String, Object> args = arguments instanceof Map<?, ?> argMap ? (Map<String, Object>) argMap : Map.of();
        return FunctionCall.of(name.toString().trim(), args);
    }

    private static double penalize(double confidence) {
        return Math.max(confidence - MALFORMED_PENALTY, 0.0);
    }
}
