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

/**
 * Normalized result of judging one planner proposal. Created once per
 * iteration by the arbiter and never mutated.
 *
 * @param action
 *            arbitrated action
 * @param thought
 *            planner thought, or a fixed explanation when downgraded
 * @param confidence
 *            confidence after any penalty
 * @param functionCall
 *            present only when {@code action} is {@link AgentAction#TOOL}
 * @param finalText
 *            present only when {@code action} is {@link AgentAction#FINAL}
 * @param reason
 *            set only when the arbiter downgraded the proposal
 */
public record ArbitrationDecision(
        AgentAction action,
        String thought,
        double confidence,
        FunctionCall functionCall,
        String finalText,
        ArbitrationReason reason
) {
    public static ArbitrationDecision downgrade(String thought, double confidence, ArbitrationReason reason) {
        return new ArbitrationDecision(AgentAction.REFLECT, thought, confidence, null, null, reason);
    }
}
