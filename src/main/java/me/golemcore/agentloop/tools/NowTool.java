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

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting the current UTC time.
 *
 * <p>
 * The {@code tz} argument is echoed back as a label; the timestamp itself is
 * always UTC, ISO-8601 formatted.
 */
@Component
public class NowTool implements ToolComponent {

    public static final String NAME = "now";
    static final String DEFAULT_TZ = "UTC";

    private final Clock clock;

    public NowTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Returns current UTC time.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "tz", Map.of(
                                        "type", "string",
                                        "default", DEFAULT_TZ,
                                        "description", "Timezone label (e.g., 'UTC', 'Europe/London')")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> arguments) {
        Object tz = arguments.get("tz");
        String label = tz instanceof String s && !s.isEmpty() ? s : DEFAULT_TZ;
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        return CompletableFuture.completedFuture(ToolResult.success(Map.of(
                "utc_now", now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "tz", label)));
    }
}
