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

import java.util.List;
import java.util.Map;

/**
 * Final result of one run, produced exactly once when the loop terminates.
 * {@code ok=false} is the only run-level failure signal.
 */
@Value
@Builder
public class AgentRunResponse {

    boolean ok;
    String answer;
    @Builder.Default
    List<AgentStepResult> steps = List.of();
    @Builder.Default
    List<ToolTrace> toolTraces = List.of();
    @Builder.Default
    Map<String, Object> decisionTrace = Map.of();
    String error;
}
