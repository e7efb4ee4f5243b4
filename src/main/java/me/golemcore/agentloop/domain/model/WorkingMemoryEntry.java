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

import java.util.Map;

/**
 * Entry of the rolling working memory fed back to the planner.
 */
public record WorkingMemoryEntry(
        String type,
        int step,
        String tool,
        boolean ok,
        Map<String, Object> output,
        String error
) {
    public static final String TYPE_TOOL_RESULT = "tool_result";

    public static WorkingMemoryEntry toolResult(int step, ToolExecutionRecord record) {
        return new WorkingMemoryEntry(TYPE_TOOL_RESULT, step, record.toolName(), record.ok(), record.output(),
                record.error());
    }

    public boolean isSuccessfulToolResult() {
        return TYPE_TOOL_RESULT.equals(type) && ok;
    }
}
