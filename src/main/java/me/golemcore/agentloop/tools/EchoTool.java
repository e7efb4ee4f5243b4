package me.golemcore.agentloop.tools;

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

import me.golemcore.agentloop.domain.component.ToolComponent;
import me.golemcore.agentloop.domain.model.ToolContext;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns the provided text together with the calling user id.
 *
 * <p>
 * Always enabled.
 */
@Component
public class EchoTool implements ToolComponent {

    public static final String NAME = "echo";
    static final int MAX_TEXT_LENGTH = 10_000;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Returns back the provided text.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "text", Map.of(
                                        "type", "string",
                                        "minLength", 1,
                                        "maxLength", MAX_TEXT_LENGTH,
                                        "description", "Text to echo back")),
                        "required", List.of("text")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> arguments) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", arguments.get("text"));
        data.put("user_id", context != null ? context.getUserId() : null);
        return CompletableFuture.completedFuture(ToolResult.success(data));
    }
}
