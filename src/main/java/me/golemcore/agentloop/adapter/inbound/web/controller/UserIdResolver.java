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

import me.golemcore.agentloop.domain.model.AgentRunRequest;

/**
 * Resolves the caller identity from the {@code X-User-Id} header.
 */
final class UserIdResolver {

    static final String USER_ID_HEADER = "X-User-Id";

    private UserIdResolver() {
    }

    static String resolve(String headerValue) {
        String value = headerValue != null ? headerValue.trim() : "";
        return value.isEmpty() ? AgentRunRequest.DEFAULT_USER_ID : value;
    }
}
