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

import java.util.Map;

/**
 * One recorded step of a run. Most iterations produce one step; a failed tool
 * call adds a second {@code retry} or {@code reflect} step with the same
 * index.
 */
@Value
@Builder
public class AgentStepResult {

    int stepIndex;
    String thought;
    AgentAction action;
    FunctionCall functionCall;
    String finalText;
    double confidence;

    /** Free-form diagnostics: arbiter reason, retry counters, tool outcome. */
    @Builder.Default
    Map<String, Object> notes = Map.of();
}
