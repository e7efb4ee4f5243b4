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
 * Outcome of one capability invocation through the execution boundary.
 * Always produced, success or not.
 *
 * @param toolName
 *            requested tool name
 * @param args
 *            arguments as received
 * @param ok
 *            whether the tool ran and reported success
 * @param latencyMs
 *            wall-clock time spent in the boundary, whole milliseconds
 * @param output
 *            tool output data, empty on failure
 * @param error
 *            failure description, null on success
 * @param failureKind
 *            failure classification, null on success
 */
public record ToolExecutionRecord(
        String toolName,
        Map<String, Object> args,
        boolean ok,
        long latencyMs,
        Map<String, Object> output,
        String error,
        ToolFailureKind failureKind
) {
    public ToolExecutionRecord {
        args = args != null ? args : Map.of();
        output = output != null ? output : Map.of();
    }

    public static ToolExecutionRecord failure(String toolName, Map<String, Object> args, long latencyMs,
            ToolFailureKind kind, String error) {
        return new ToolExecutionRecord(toolName, args, false, latencyMs, Map.of(), error, kind);
    }
}
