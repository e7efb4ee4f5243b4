package me.golemcore.agentloop.adapter.outbound.planner;

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
import me.golemcore.agentloop.domain.model.PlannerProposal;
import me.golemcore.agentloop.domain.model.PlannerRequest;
import me.golemcore.agentloop.domain.model.WorkingMemoryEntry;
import me.golemcore.agentloop.port.outbound.PlannerPort;
import me.golemcore.agentloop.tools.NowTool;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic planner used when no language model is configured.
 *
 * <p>
 * Rules, first match wins:
 * <ul>
 * <li>step 0 and the prompt mentions "time": call {@code now}</li>
 * <li>last working-memory entry is a successful tool result: finalize with
 * it</li>
 * <li>otherwise: reflect</li>
 * </ul>
 */
@Slf4j
public class FallbackPlannerAdapter implements PlannerPort {

    public static final String PLANNER_ID = "fallback";

    static final double TIME_TOOL_CONFIDENCE = 0.62;
    static final double FINAL_CONFIDENCE = 0.71;
    static final double REFLECT_CONFIDENCE = 0.35;

    @Override
    public String getPlannerId() {
        return PLANNER_ID;
    }

    @Override
    public PlannerProposal nextStep(PlannerRequest request) {
        String prompt = request.getPrompt() != null ? request.getPrompt() : "";
        if (request.getStep() == 0 && prompt.toLowerCase(Locale.ROOT).contains("time")) {
            return PlannerProposal.toolCall("Need current time.", NowTool.NAME, Map.of("tz", "UTC"),
                    TIME_TOOL_CONFIDENCE);
        }

        List<WorkingMemoryEntry> memory = request.getWorkingMemory();
        if (memory != null && !memory.isEmpty()) {
            WorkingMemoryEntry last = memory.get(memory.size() - 1);
            if (last.isSuccessfulToolResult()) {
                return PlannerProposal.finalAnswer("Tool result available.", "Result: " + last.output(),
                        FINAL_CONFIDENCE);
            }
        }

        log.trace("[Planner] No rule matched at step {}, reflecting", request.getStep());
        return PlannerProposal.reflect("Need more evidence for: " + prompt, REFLECT_CONFIDENCE);
    }
}
