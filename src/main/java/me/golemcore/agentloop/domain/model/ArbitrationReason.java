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

/**
 * Machine-readable reason attached to an arbitration decision when the arbiter
 * downgraded the planner proposal.
 */
public enum ArbitrationReason {

    INVALID_ACTION("invalid_action"),

    TOOLS_DISABLED("tools_disabled"),

    INVALID_FUNCTION_CALL("invalid_function_call"),

    EMPTY_FINAL_TEXT("empty_final_text"),

    /**
     * Evidentiary gate: the proposal is well-formed, so confidence is not
     * penalized.
     */
    LOW_CONFIDENCE_FINALIZE("low_confidence_finalize");

    private final String code;

    ArbitrationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
