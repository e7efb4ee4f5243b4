package me.golemcore.agentloop.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.component.ToolComponent;
import me.golemcore.agentloop.domain.model.ToolContext;
import me.golemcore.agentloop.domain.model.ToolExecutionRecord;
import me.golemcore.agentloop.domain.model.ToolFailureKind;
import me.golemcore.agentloop.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Execution boundary for capability calls: whitelist enforcement, registry
 * resolution, argument validation and invocation.
 *
 * <p>
 * Always returns a {@link ToolExecutionRecord}; no exception crosses this
 * boundary. Does not retry. Retry policy belongs to the loop.
 */
@Component
@Slf4j
public class ToolExecutionService {

    private final ToolRegistry toolRegistry;
    private final ToolArgumentValidator argumentValidator;
    private final Clock clock;

    public ToolExecutionService(ToolRegistry toolRegistry, ToolArgumentValidator argumentValidator, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.argumentValidator = argumentValidator;
        this.clock = clock;
    }

    /**
     * Executes one capability call.
     *
     * @param toolName
     *            requested tool name
     * @param args
     *            raw arguments
     * @param whitelist
     *            allowed tool names, or null for no restriction
     * @param context
     *            caller identity and trace id passed to the tool
     * @return the execution record, never null
     */
    public ToolExecutionRecord execute(String toolName, Map<String, Object> args, Set<String> whitelist,
            ToolContext context) {
        long started = clock.millis();
        Map<String, Object> safeArgs = args != null ? args : Map.of();

        if (whitelist != null && (toolName == null || !whitelist.contains(toolName))) {
            log.warn("[Tools] Tool '{}' rejected by whitelist {}", toolName, whitelist);
            return ToolExecutionRecord.failure(toolName, safeArgs, elapsedSince(started),
                    ToolFailureKind.WHITELIST_DENIED, "Tool '" + toolName + "' is not allowed by whitelist");
        }

        try {
            ToolComponent tool = toolRegistry.require(toolName);
            Map<String, Object> validated = argumentValidator.validate(tool.getDefinition(), safeArgs);
            ToolResult result = invoke(tool, context, validated);
            long latency = elapsedSince(started);
            if (result == null) {
                return ToolExecutionRecord.failure(toolName, safeArgs, latency, ToolFailureKind.EXECUTION_FAILED,
                        "Unhandled tool error: tool returned no result");
            }
            log.debug("[Tools] '{}' finished: success={}, latency={}ms", toolName, result.isSuccess(), latency);
            ToolFailureKind kind = result.isSuccess() ? null
                    : result.getFailureKind() != null ? result.getFailureKind() : ToolFailureKind.EXECUTION_FAILED;
            return new ToolExecutionRecord(toolName, safeArgs, result.isSuccess(), latency, result.getData(),
                    result.getError(), kind);
        } catch (UnknownToolException e) {
            log.warn("[Tools] {}", e.getMessage());
            return ToolExecutionRecord.failure(toolName, safeArgs, elapsedSince(started),
                    ToolFailureKind.UNKNOWN_TOOL, e.getMessage());
        } catch (ToolInputValidationException e) {
            log.warn("[Tools] {}", e.getMessage());
            return ToolExecutionRecord.failure(toolName, safeArgs, elapsedSince(started),
                    ToolFailureKind.INVALID_INPUT, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolExecutionRecord.failure(toolName, safeArgs, elapsedSince(started),
                    ToolFailureKind.EXECUTION_FAILED, "Unhandled tool error: interrupted");
        } catch (Exception e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolExecutionRecord.failure(toolName, safeArgs, elapsedSince(started),
                    ToolFailureKind.EXECUTION_FAILED, "Unhandled tool error: " + safeCauseMessage(e));
        }
    }

    private ToolResult invoke(ToolComponent tool, ToolContext context, Map<String, Object> arguments)
            throws InterruptedException, ExecutionException {
        CompletableFuture<ToolResult> future = tool.execute(context, arguments);
        if (future == null) {
            return null;
        }
        return future.get();
    }

    private long elapsedSince(long started) {
        return Math.max(clock.millis() - started, 0);
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
