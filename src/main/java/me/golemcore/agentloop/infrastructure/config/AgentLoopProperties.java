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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the agent loop, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LoopProperties} - iteration and retry policy</li>
 * <li>{@link PlannerProperties} - planner selection and LLM settings</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link TranscriptProperties} - run transcript sink</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentLoopProperties {

    private LoopProperties loop = new LoopProperties();
    private PlannerProperties planner = new PlannerProperties();
    private StorageProperties storage = new StorageProperties();
    private TranscriptProperties transcripts = new TranscriptProperties();

    @Data
    public static class LoopProperties {
        private int maxIterationsDefault = 6;
        private int maxIterationsCap = 20;
        private double minConfidenceToFinalize = 0.45;
        private int maxTotalRetries = 3;
        private int maxRetriesPerTool = 2;
        private long backoffBaseMs = 150;
    }

    @Data
    public static class PlannerProperties {
        /** One of {@code auto}, {@code llm}, {@code fallback}. */
        private String mode = "auto";
        private int workingMemoryWindow = 8;
        private LlmProperties llm = new LlmProperties();
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.1;
        private long timeoutMs = 30_000;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore-agent-loop/workspace";
    }

    @Data
    public static class TranscriptProperties {
        private boolean enabled = true;
        private String directory = "transcripts";
    }
}
