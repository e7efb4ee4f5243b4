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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of actions a planner step resolves to after arbitration. The wire
 * form is the lower-case name ({@code "tool"}, {@code "reflect"},
 * {@code "retry"}, {@code "final"}).
 */
public enum AgentAction {

    TOOL, REFLECT, RETRY, FINAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a raw planner action string. The value is trimmed and lower-cased
     * before matching; anything outside the closed set yields an empty result.
     */
    public static Optional<AgentAction> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AgentAction action : values()) {
            if (action.wireName().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
