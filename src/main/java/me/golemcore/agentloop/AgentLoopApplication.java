package me.golemcore.agentloop;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Agent Loop.
 *
 * <p>
 * Runs a bounded plan/arbitrate/act loop: a planner proposes the next step, a
 * rule-based arbiter gates it, and tools run behind a whitelist-aware
 * execution boundary with a retry budget.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → AgentRunController, ToolsController
 * Domain Layer       → IterativeAgentLoop, HybridArbiter, ToolExecutionService
 * Infrastructure     → Planner (LLM/fallback), Storage, Transcript adapters
 * </pre>
 *
 * @see me.golemcore.agentloop.domain.loop.IterativeAgentLoop
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentLoopApplication.class, args);
    }
}
