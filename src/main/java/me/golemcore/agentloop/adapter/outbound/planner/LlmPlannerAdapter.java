package me.golemcore.agentloop.adapter.outbound.planner;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.PlannerProposal;
import me.golemcore.agentloop.domain.model.PlannerRequest;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.model.WorkingMemoryEntry;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.port.outbound.PlannerPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Planner backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * The model is asked for one JSON object per turn. A native tool call in the
 * response takes precedence over the JSON content. Model failures and
 * unparsable content degrade to a deterministic finalization, so this adapter
 * never throws.
 */
@Slf4j
public class LlmPlannerAdapter implements PlannerPort {

    public static final String PLANNER_ID = "llm";

    static final String SYSTEM_PROMPT = """
            You are the planning core of an autonomous task agent.
            Return strictly one JSON object per turn with fields:
            - action: one of ["tool","reflect","retry","final"]
            - thought: short internal rationale
            - confidence: float 0..1
            - function_call: optional object {name:string, arguments:object}
            - final_text: required when action="final"

            Rules:
            1) Prefer tool usage when a concrete external/actionable check is needed.
            2) If previous tool failed, either retry with corrected arguments or reflect.
            3) Stop with action="final" when enough evidence exists.
            4) Never output markdown, code fences, or prose outside JSON.
            """;

    static final double NATIVE_TOOL_CALL_CONFIDENCE = 0.6;
    static final double INVALID_TOOL_CONFIDENCE = 0.3;
    static final double FALLBACK_RESULT_CONFIDENCE = 0.65;
    static final double FALLBACK_RECEIVED_CONFIDENCE = 0.4;

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ChatModel chatModel;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final int workingMemoryWindow;

    public LlmPlannerAdapter(ChatModel chatModel, ToolRegistry toolRegistry, ObjectMapper objectMapper,
            int workingMemoryWindow) {
        this.chatModel = chatModel;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.workingMemoryWindow = Math.max(workingMemoryWindow, 0);
    }

    @Override
    public String getPlannerId() {
        return PLANNER_ID;
    }

    @Override
    public PlannerProposal nextStep(PlannerRequest request) {
        String prompt = request.getPrompt() != null ? request.getPrompt() : "";
        List<WorkingMemoryEntry> memory = request.getWorkingMemory() != null ? request.getWorkingMemory()
                : List.of();

        AiMessage aiMessage;
        try {
            ChatResponse response = chatModel.chat(buildChatRequest(request, prompt, memory));
            aiMessage = response != null ? response.aiMessage() : null;
        } catch (RuntimeException e) {
            log.warn("[Planner] LLM call failed at step {}: {}", request.getStep(), e.getMessage());
            return fallback(prompt, memory);
        }
        if (aiMessage == null) {
            return fallback(prompt, memory);
        }

        if (aiMessage.hasToolExecutionRequests() && request.isAllowTools()) {
            ToolExecutionRequest call = aiMessage.toolExecutionRequests().get(0);
            log.debug("[Planner] LLM selected function call '{}'", call.name());
            return PlannerProposal.toolCall("LLM selected function call.",
                    call.name() != null ? call.name() : "",
                    decodeArguments(call.arguments()),
                    NATIVE_TOOL_CALL_CONFIDENCE);
        }

        return parseContent(aiMessage.text(), request.isAllowTools(), prompt, memory);
    }

    private ChatRequest buildChatRequest(PlannerRequest request, String prompt, List<WorkingMemoryEntry> memory) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(SYSTEM_PROMPT));
        messages.add(UserMessage.from("Step: " + request.getStep() + "\n"
                + "User objective: " + prompt + "\n"
                + "Recent working memory (JSON): " + toJson(recentMemory(memory)) + "\n"
                + "Return next-step JSON only."));

        ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
        if (request.isAllowTools()) {
            List<ToolSpecification> tools = toolRegistry.listDefinitions(request.getToolWhitelist()).stream()
                    .map(this::convertToolDefinition)
                    .toList();
            if (!tools.isEmpty()) {
                builder.toolSpecifications(tools);
            }
        }
        return builder.build();
    }

    private List<WorkingMemoryEntry> recentMemory(List<WorkingMemoryEntry> memory) {
        if (memory.size() <= workingMemoryWindow) {
            return memory;
        }
        return memory.subList(memory.size() - workingMemoryWindow, memory.size());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[Planner] Failed to serialize working memory: {}", e.getMessage());
            return "[]";
        }
    }

    private PlannerProposal parseContent(String content, boolean allowTools, String prompt,
            List<WorkingMemoryEntry> memory) {
        if (content == null || content.isBlank()) {
            return fallback(prompt, memory);
        }
        Map<String, Object> payload;
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !node.isObject()) {
                log.debug("[Planner] LLM content is not a JSON object, using fallback");
                return fallback(prompt, memory);
            }
            payload = objectMapper.convertValue(node, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.debug("[Planner] Unparsable LLM content, using fallback: {}", e.getOriginalMessage());
            return fallback(prompt, memory);
        }

        String action = String.valueOf(payload.getOrDefault("action", AgentAction.REFLECT.wireName()));
        action = AgentAction.parse(action).map(AgentAction::wireName).orElse(AgentAction.REFLECT.wireName());

        Object functionCall = payload.get("function_call");
        if (AgentAction.TOOL.wireName().equals(action)) {
            if (!allowTools || !(functionCall instanceof Map<?, ?> callMap)) {
                return PlannerProposal.reflect("Tool requested but unavailable/invalid.",
                        toConfidence(payload.get("confidence"), INVALID_TOOL_CONFIDENCE));
            }
            Map<String, Object> normalized = new LinkedHashMap<>();
            Object name = callMap.get("name");
            normalized.put("name", name != null ? String.valueOf(name) : "");
            normalized.put("arguments", decodeArguments(callMap.get("arguments")));
            functionCall = normalized;
        } else {
            functionCall = null;
        }

        Object thought = payload.get("thought");
        Object finalText = payload.get("final_text");
        return PlannerProposal.builder()
                .action(action)
                .thought(thought != null ? String.valueOf(thought) : "")
                .confidence(toConfidence(payload.get("confidence"), 0.0))
                .functionCall(functionCall)
                .finalText(finalText != null ? String.valueOf(finalText) : null)
                .build();
    }

    /**
     * Deterministic finalization used when the model is unavailable or its
     * output cannot be used.
     */
    PlannerProposal fallback(String prompt, List<WorkingMemoryEntry> memory) {
        if (!memory.isEmpty()) {
            WorkingMemoryEntry last = memory.get(memory.size() - 1);
            if (last.isSuccessfulToolResult()) {
                return PlannerProposal.finalAnswer("Tool result available; finalize.", "Result: " + last.output(),
                        FALLBACK_RESULT_CONFIDENCE);
            }
        }
        return PlannerProposal.finalAnswer("LLM unavailable; deterministic fallback.", "Received: " + prompt,
                FALLBACK_RECEIVED_CONFIDENCE);
    }

    /**
     * Decodes function-call arguments. Objects pass through; JSON strings are
     * parsed; anything else is wrapped under {@code value} or {@code raw}.
     */
    @SuppressWarnings("unchecked")
    Map<String, Object> decodeArguments(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (raw instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        if (!(raw instanceof String text)) {
            return Map.of("value", raw);
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node.isObject()) {
                return objectMapper.convertValue(node, MAP_TYPE_REF);
            }
            Object value = objectMapper.convertValue(node, Object.class);
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("value", value);
            return wrapped;
        } catch (JsonProcessingException e) {
            return Map.of("raw", trimmed);
        }
    }

    private static double toConfidence(Object value, double defaultValue) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required((List<String>) required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> propertySchema) {
        String description = propertySchema.get("description") instanceof String text && !text.isBlank()
                ? text
                : null;
        if (propertySchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            List<String> values = enumValues.stream().map(String::valueOf).toList();
            return JsonEnumSchema.builder().enumValues(values).description(description).build();
        }

        String type = propertySchema.get("type") instanceof String text ? text : "string";
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder arrayBuilder = JsonArraySchema.builder().description(description);
            if (propertySchema.get("items") instanceof Map<?, ?> items) {
                arrayBuilder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield arrayBuilder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder objectBuilder = JsonObjectSchema.builder().description(description);
            if (propertySchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    objectBuilder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield objectBuilder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }
}
