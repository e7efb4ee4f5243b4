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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit record of a completed run, written to the transcript sink.
 */
@Value
@Builder
public class RunTranscript {

    public static final String OUTCOME_COMPLETED = "agent_run_completed";
    public static final String OUTCOME_FAILED = "agent_run_failed";

    String taskId;
    String userId;
    String prompt;
    String outcome;
    String status;
    Instant recordedAt;
    int maxIterations;
    boolean allowTools;
    List<String> toolWhitelist;
    long timeoutMs;
    String answer;
    String error;
    Map<String, Object> decisionTrace;
    List<ToolTrace> toolTraces;
    int stepsCount;
}
