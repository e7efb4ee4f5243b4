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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.loop.IterativeAgentLoop;
import me.golemcore.agentloop.domain.model.AgentRunRequest;
import me.golemcore.agentloop.domain.model.AgentRunResponse;
import me.golemcore.agentloop.domain.model.RunTranscript;
import me.golemcore.agentloop.port.outbound.RunTranscriptPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs the agent loop for one request and records the outcome as a run
 * transcript. A failing transcript sink never changes the run result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AgentRunService {

    private final IterativeAgentLoop agentLoop;
    private final RunTranscriptPort transcriptPort;
    private final Clock clock;

    public AgentRunResponse run(AgentRunRequest request) {
        String taskId = UUID.randomUUID().toString();
        log.debug("[AgentLoop] Task {} for user {}", taskId, request.getUserId());
        AgentRunResponse response = agentLoop.run(request);
        recordTranscript(taskId, request, response);
        return response;
    }

    private void recordTranscript(String taskId, AgentRunRequest request, AgentRunResponse response) {
        RunTranscript transcript = RunTranscript.builder()
                .taskId(taskId)
                .userId(request.getUserId())
                .prompt(request.getPrompt())
                .outcome(response.isOk() ? RunTranscript.OUTCOME_COMPLETED : RunTranscript.OUTCOME_FAILED)
                .status(response.isOk() ? "completed" : "failed")
                .recordedAt(clock.instant())
                .maxIterations(agentLoop.getPolicy().resolveIterations(request.getMaxIterations()))
                .allowTools(request.isAllowTools())
                .toolWhitelist(sortedWhitelist(request))
                .timeoutMs(request.getTimeoutMs())
                .answer(response.getAnswer())
                .error(response.getError())
                .decisionTrace(response.getDecisionTrace())
                .toolTraces(response.getToolTraces())
                .stepsCount(response.getSteps().size())
                .build();
        try {
            transcriptPort.record(transcript);
        } catch (RuntimeException e) {
            log.warn("[Transcript] Failed to record task {}: {}", taskId, e.getMessage());
        }
    }

    private static List<String> sortedWhitelist(AgentRunRequest request) {
        if (request.getToolWhitelist() == null) {
            return null;
        }
        List<String> names = request.getToolWhitelist().stream()
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        return names.isEmpty() ? null : names;
    }
}
