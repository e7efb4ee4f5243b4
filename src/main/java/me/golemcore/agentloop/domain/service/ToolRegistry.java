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
import me.golemcore.agentloop.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability registry. Populated from Spring-managed {@link ToolComponent}
 * beans at startup and treated as read-only while runs execute.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        if (toolComponents == null) {
            return;
        }
        for (ToolComponent tool : toolComponents) {
            if (!tool.isEnabled()) {
                log.info("[Tools] Skipping disabled tool: {}", tool.getToolName());
                continue;
            }
            register(tool);
        }
    }

    public static ToolRegistry of(ToolComponent... toolComponents) {
        return new ToolRegistry(List.of(toolComponents));
    }

    /**
     * Registers a tool under its definition name.
     *
     * @throws IllegalArgumentException
     *             if the name is blank or already registered
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        if (tools.putIfAbsent(name, tool) != null) {
            throw new IllegalArgumentException("Tool '" + name + "' already registered");
        }
        log.debug("[Tools] Registered tool: {}", name);
    }

    public Optional<ToolComponent> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public ToolComponent require(String name) {
        return get(name).orElseThrow(() -> new UnknownToolException(name));
    }

    /**
     * Lists all tool definitions sorted by name.
     */
    public List<ToolDefinition> listDefinitions() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }

    /**
     * Lists tool definitions sorted by name, restricted to the whitelist when
     * one is given.
     */
    public List<ToolDefinition> listDefinitions(Collection<String> whitelist) {
        if (whitelist == null) {
            return listDefinitions();
        }
        return listDefinitions().stream()
                .filter(definition -> whitelist.contains(definition.getName()))
                .toList();
    }
}
