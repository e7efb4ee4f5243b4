package me.golemcore.agentloop.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw, untrusted next-step proposal returned by a planner. Nothing here is
 * validated; the arbiter decides what survives.
 *
 * <p>
 * {@code functionCall} is kept as an arbitrary value because planners may
 * return anything in that slot. A {@link FunctionCall} or a map with a
 * {@code name} entry is accepted by arbitration, everything else is rejected.
 */
@Value
@Builder
public class PlannerProposal {

    /** Raw action string; null means the planner omitted it. */
    String action;
    String thought;
    Double confidence;
    Object functionCall;
    String finalText;

    public static PlannerProposal empty() {
        return PlannerProposal.builder().build();
    }

    public static PlannerProposal toolCall(String thought, String toolName, Map<String, Object> arguments,
            double confidence) {
        Map<String, Object> call = new LinkedHashMap<>();
        call.put("name", toolName);
        call.put("arguments", arguments != null ? arguments : Map.of());
        return PlannerProposal.builder()
                .action(AgentAction.TOOL.wireName())
                .thought(thought)
                .functionCall(call)
                .confidence(confidence)
                .build();
    }

    public static PlannerProposal finalAnswer(String thought, String finalText, double confidence) {
        return PlannerProposal.builder()
                .action(AgentAction.FINAL.wireName())
                .thought(thought)
                .finalText(finalText)
                .confidence(confidence)
                .build();
    }

    public static PlannerProposal reflect(String thought, double confidence) {
        return PlannerProposal.builder()
                .action(AgentAction.REFLECT.wireName())
                .thought(thought)
                .confidence(confidence)
                .build();
    }
}
