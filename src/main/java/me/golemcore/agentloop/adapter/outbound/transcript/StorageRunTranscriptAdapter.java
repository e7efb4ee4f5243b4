package me.golemcore.agentloop.adapter.outbound.transcript;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.AgentRunRequest;
import me.golemcore.agentloop.domain.model.RunTranscript;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.RunTranscriptPort;
import me.golemcore.agentloop.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Appends one JSON line per run to {@code <directory>/<user-id>.jsonl}.
 *
 * <p>
 * Write-only: transcripts are never read back by the loop. Disabled with
 * {@code agent.transcripts.enabled=false}.
 */
@Component
@Slf4j
public class StorageRunTranscriptAdapter implements RunTranscriptPort {

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String directory;

    public StorageRunTranscriptAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            AgentLoopProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.enabled = properties.getTranscripts().isEnabled();
        this.directory = properties.getTranscripts().getDirectory();
    }

    @Override
    public void record(RunTranscript transcript) {
        if (!enabled) {
            return;
        }
        String line;
        try {
            line = objectMapper.writeValueAsString(transcript) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transcript " + transcript.getTaskId(), e);
        }
        String fileName = toFileName(transcript.getUserId());
        storagePort.appendText(directory, fileName, line).join();
        log.debug("[Transcript] Recorded {} for task {} in {}/{}", transcript.getOutcome(), transcript.getTaskId(),
                directory, fileName);
    }

    static String toFileName(String userId) {
        String id = userId == null || userId.isBlank() ? AgentRunRequest.DEFAULT_USER_ID : userId.trim();
        String safe = UNSAFE_FILE_CHARS.matcher(id).replaceAll("_");
        if (safe.chars().allMatch(c -> c == '.')) {
            safe = safe.replace('.', '_');
        }
        return safe + ".jsonl";
    }
}
