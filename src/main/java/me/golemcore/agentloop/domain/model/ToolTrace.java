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
 * Tool invocation entry in the run's tool trace list, in invocation order.
 */
public record ToolTrace(
        int step,
        String tool,
        boolean ok,
        long latencyMs,
        Map<String, Object> output,
        String error
) {
    public static ToolTrace from(int step, ToolExecutionRecord record) {
        return new ToolTrace(step, record.toolName(), record.ok(), record.latencyMs(), record.output(),
                record.error());
    }
}
