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

/**
 * Global and per-tool retry ceilings.
 *
 * @param maxTotalRetries
 *            retries allowed across the whole run
 * @param maxRetriesPerTool
 *            retries allowed for a single named tool
 * @param backoffBaseMs
 *            backoff hint for callers, reported in the decision trace
 */
public record RetryPolicy(
        int maxTotalRetries,
        int maxRetriesPerTool,
        long backoffBaseMs
) {
    public static final int DEFAULT_MAX_TOTAL_RETRIES = 3;
    public static final int DEFAULT_MAX_RETRIES_PER_TOOL = 2;
    public static final long DEFAULT_BACKOFF_BASE_MS = 150;

    public RetryPolicy {
        if (maxTotalRetries < 0 || maxRetriesPerTool < 0 || backoffBaseMs < 0) {
            throw new IllegalArgumentException("Retry limits must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_TOTAL_RETRIES, DEFAULT_MAX_RETRIES_PER_TOOL, DEFAULT_BACKOFF_BASE_MS);
    }
}
