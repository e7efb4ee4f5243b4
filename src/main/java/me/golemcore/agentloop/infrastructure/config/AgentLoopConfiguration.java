package me.golemcore.agentloop.infrastructure.config;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.adapter.outbound.planner.FallbackPlannerAdapter;
import me.golemcore.agentloop.adapter.outbound.planner.LlmPlannerAdapter;
import me.golemcore.agentloop.domain.loop.IterativeAgentLoop;
import me.golemcore.agentloop.domain.model.AgentPolicy;
import me.golemcore.agentloop.domain.model.RetryPolicy;
import me.golemcore.agentloop.domain.service.HybridArbiter;
import me.golemcore.agentloop.domain.service.ToolExecutionService;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.port.outbound.PlannerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Wires the policy, the planner and the agent loop from
 * {@link AgentLoopProperties}.
 *
 * <p>
 * Planner selection by {@code agent.planner.mode}:
 * <ul>
 * <li>{@code llm} - always the LLM planner (requires an API key)</li>
 * <li>{@code fallback} - always the deterministic planner</li>
 * <li>{@code auto} - LLM planner when {@code agent.planner.llm.api-key} is
 * set</li>
 * </ul>
 */
@Configuration
@Slf4j
public class AgentLoopConfiguration {

    static final String MODE_AUTO = "auto";
    static final String MODE_LLM = "llm";
    static final String MODE_FALLBACK = "fallback";

    @Bean
    public AgentPolicy agentPolicy(AgentLoopProperties properties) {
        AgentLoopProperties.LoopProperties loop = properties.getLoop();
        return new AgentPolicy(
                loop.getMaxIterationsDefault(),
                loop.getMaxIterationsCap(),
                loop.getMinConfidenceToFinalize(),
                new RetryPolicy(loop.getMaxTotalRetries(), loop.getMaxRetriesPerTool(), loop.getBackoffBaseMs()));
    }

    @Bean
    public PlannerPort plannerPort(AgentLoopProperties properties, ToolRegistry toolRegistry,
            ObjectMapper objectMapper) {
        AgentLoopProperties.PlannerProperties planner = properties.getPlanner();
        String mode = planner.getMode() != null ? planner.getMode().trim().toLowerCase(Locale.ROOT) : MODE_AUTO;
        boolean hasApiKey = planner.getLlm().getApiKey() != null && !planner.getLlm().getApiKey().isBlank();

        switch (mode) {
        case MODE_FALLBACK -> {
            log.info("[Planner] Using deterministic fallback planner");
            return new FallbackPlannerAdapter();
        }
        case MODE_LLM -> {
            if (!hasApiKey) {
                throw new IllegalStateException("agent.planner.mode=llm requires agent.planner.llm.api-key");
            }
            return createLlmPlanner(planner, toolRegistry, objectMapper);
        }
        case MODE_AUTO -> {
            if (hasApiKey) {
                return createLlmPlanner(planner, toolRegistry, objectMapper);
            }
            log.info("[Planner] No LLM API key configured, using deterministic fallback planner");
            return new FallbackPlannerAdapter();
        }
        default -> throw new IllegalStateException("Unknown agent.planner.mode: " + planner.getMode());
        }
    }

    @Bean
    public IterativeAgentLoop iterativeAgentLoop(PlannerPort plannerPort, ToolExecutionService toolExecutionService,
            HybridArbiter hybridArbiter, AgentPolicy agentPolicy, Clock clock) {
        return new IterativeAgentLoop(plannerPort, toolExecutionService, hybridArbiter, agentPolicy, clock);
    }

    private PlannerPort createLlmPlanner(AgentLoopProperties.PlannerProperties planner, ToolRegistry toolRegistry,
            ObjectMapper objectMapper) {
        AgentLoopProperties.LlmProperties llm = planner.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .maxRetries(0) // Planner degrades to the deterministic fallback instead
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        ChatModel chatModel = builder.build();
        log.info("[Planner] Using LLM planner with model {}", llm.getModel());
        return new LlmPlannerAdapter(chatModel, toolRegistry, objectMapper, planner.getWorkingMemoryWindow());
    }
}
