package me.golemcore.agentloop.domain.component;

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

import me.golemcore.agentloop.domain.model.ToolContext;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable capability that the planner can
 * invoke. Tools expose their JSON Schema definition, which the execution
 * boundary uses to validate arguments before {@link #execute} is called.
 */
public interface ToolComponent extends Component {

    /**
     * Returns the tool definition with the JSON Schema of its input.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with already validated arguments.
     *
     * @param context
     *            caller identity and trace id
     * @param arguments
     *            arguments validated against the input schema, defaults applied
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> arguments);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
