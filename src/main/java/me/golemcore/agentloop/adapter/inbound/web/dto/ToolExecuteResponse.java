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

import lombok.Builder;
import lombok.Value;
import me.golemcore.agentloop.domain.model.ToolExecutionRecord;

import java.util.Map;

@Value
@Builder
public class ToolExecuteResponse {

    boolean ok;
    String tool;
    long latencyMs;
    Map<String, Object> output;
    String error;

    public static ToolExecuteResponse from(ToolExecutionRecord record) {
        return ToolExecuteResponse.builder()
                .ok(record.ok())
                .tool(record.toolName())
                .latencyMs(record.latencyMs())
                .output(record.output())
                .error(record.error())
                .build();
    }
}
