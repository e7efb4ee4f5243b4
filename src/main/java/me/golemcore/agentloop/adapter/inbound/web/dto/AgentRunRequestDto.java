package me.golemcore.agentloop.adapter.inbound.web.dto;

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

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agentloop.domain.model.AgentRunRequest;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Request DTO for running the agent loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunRequestDto {

    @NotBlank(message = "prompt is required")
    private String prompt;

    @Min(value = 1, message = "max_iterations must be at least 1")
    @Max(value = 20, message = "max_iterations must be at most 20")
    private Integer maxIterations;

    private Boolean allowTools;

    private List<String> toolWhitelist;

    @Min(value = 1_000, message = "timeout_ms must be at least 1000")
    @Max(value = 120_000, message = "timeout_ms must be at most 120000")
    private Long timeoutMs;

    /**
     * Convert to domain model, applying defaults for omitted fields.
     */
    public AgentRunRequest toRunRequest(String userId) {
        return AgentRunRequest.builder()
                .userId(userId)
                .prompt(prompt)
                .maxIterations(maxIterations)
                .allowTools(allowTools == null || allowTools)
                .toolWhitelist(toolWhitelist != null ? new LinkedHashSet<>(toolWhitelist) : null)
                .timeoutMs(timeoutMs != null ? timeoutMs : AgentRunRequest.DEFAULT_TIMEOUT_MS)
                .build();
    }
}
