package me.golemcore.agentloop.adapter.inbound.web.controller;

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

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.adapter.inbound.web.dto.ToolExecuteRequest;
import me.golemcore.agentloop.adapter.inbound.web.dto.ToolExecuteResponse;
import me.golemcore.agentloop.adapter.inbound.web.dto.ToolListResponse;
import me.golemcore.agentloop.domain.model.ToolContext;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.service.ToolExecutionService;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Tool catalog and direct tool invocation through the execution boundary.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    static final String EXECUTE_SOURCE = "route:/tools/execute";

    private final ToolRegistry toolRegistry;
    private final ToolExecutionService toolExecutionService;

    @GetMapping
    public Mono<ResponseEntity<ToolListResponse>> listTools() {
        List<ToolListResponse.ToolDescriptor> tools = toolRegistry.listDefinitions().stream()
                .map(this::toDescriptor)
                .toList();
        return Mono.just(ResponseEntity.ok(ToolListResponse.builder()
                .ok(true)
                .count(tools.size())
                .tools(tools)
                .build()));
    }

    @PostMapping("/execute")
    public Mono<ResponseEntity<ToolExecuteResponse>> executeTool(
            @Valid @RequestBody ToolExecuteRequest request,
            @RequestHeader(value = UserIdResolver.USER_ID_HEADER, required = false) String userIdHeader) {
        ToolContext context = ToolContext.builder()
                .userId(UserIdResolver.resolve(userIdHeader))
                .taskId(request.getTaskId())
                .traceId(request.getTraceId())
                .metadata(Map.of("source", EXECUTE_SOURCE))
                .build();
        Map<String, Object> args = request.getArgs() != null ? request.getArgs() : Map.of();
        log.info("[API] Direct execution of tool '{}' by {}", request.getName(), context.getUserId());

        return Mono.fromCallable(() -> toolExecutionService.execute(request.getName(), args, null, context))
                .subscribeOn(Schedulers.boundedElastic())
                .map(record -> ResponseEntity.ok(ToolExecuteResponse.from(record)));
    }

    private ToolListResponse.ToolDescriptor toDescriptor(ToolDefinition definition) {
        return ToolListResponse.ToolDescriptor.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .inputSchema(definition.getInputSchema())
                .build();
    }
}
