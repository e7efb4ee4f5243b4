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
import me.golemcore.agentloop.adapter.inbound.web.dto.AgentRunRequestDto;
import me.golemcore.agentloop.domain.model.AgentRunRequest;
import me.golemcore.agentloop.domain.model.AgentRunResponse;
import me.golemcore.agentloop.domain.service.AgentRunService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent loop endpoints: synchronous run and server-sent event replay.
 *
 * <p>
 * The loop is blocking, so each run is moved to the bounded elastic
 * scheduler.
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentRunController {

    static final String EVENT_STEP = "step";
    static final String EVENT_TOOL_TRACE = "tool_trace";
    static final String EVENT_FINAL = "final";
    static final String EVENT_DONE = "done";

    private final AgentRunService agentRunService;

    @PostMapping("/run")
    public Mono<ResponseEntity<AgentRunResponse>> run(
            @Valid @RequestBody AgentRunRequestDto request,
            @RequestHeader(value = UserIdResolver.USER_ID_HEADER, required = false) String userIdHeader) {
        AgentRunRequest runRequest = request.toRunRequest(UserIdResolver.resolve(userIdHeader));
        log.info("[API] Agent run requested by {}", runRequest.getUserId());
        return runAsync(runRequest).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(
            @Valid @RequestBody AgentRunRequestDto request,
            @RequestHeader(value = UserIdResolver.USER_ID_HEADER, required = false) String userIdHeader) {
        AgentRunRequest runRequest = request.toRunRequest(UserIdResolver.resolve(userIdHeader));
        log.info("[API] Agent stream requested by {}", runRequest.getUserId());
        return runAsync(runRequest).flatMapMany(this::toEvents);
    }

    private Mono<AgentRunResponse> runAsync(AgentRunRequest runRequest) {
        return Mono.fromCallable(() -> agentRunService.run(runRequest))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<ServerSentEvent<Object>> toEvents(AgentRunResponse response) {
        Flux<ServerSentEvent<Object>> steps = Flux.fromIterable(response.getSteps())
                .map(step -> event(EVENT_STEP, step));
        Flux<ServerSentEvent<Object>> traces = Flux.fromIterable(response.getToolTraces())
                .map(trace -> event(EVENT_TOOL_TRACE, trace));

        Map<String, Object> finalPayload = new LinkedHashMap<>();
        finalPayload.put("final", response.getAnswer());
        finalPayload.put("ok", response.isOk());
        finalPayload.put("error", response.getError());

        return Flux.concat(steps, traces, Flux.just(
                event(EVENT_FINAL, finalPayload),
                event(EVENT_DONE, Map.of("done", true))));
    }

    private static ServerSentEvent<Object> event(String name, Object data) {
        return ServerSentEvent.builder(data).event(name).build();
    }
}
