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

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Single agent run request. Range validation happens at the transport layer;
 * the loop still clamps iterations against its policy.
 */
@Value
@Builder
public class AgentRunRequest {

    public static final String DEFAULT_USER_ID = "local-dev";
    public static final long DEFAULT_TIMEOUT_MS = 20_000;

    @Builder.Default
    String userId = DEFAULT_USER_ID;
    String prompt;

    /** Null means the policy default applies. */
    Integer maxIterations;
    @Builder.Default
    boolean allowTools = true;

    /** Null or empty means no whitelist is enforced. */
    Set<String> toolWhitelist;
    @Builder.Default
    long timeoutMs = DEFAULT_TIMEOUT_MS;
}
