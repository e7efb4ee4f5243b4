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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run retry counters. Owned by a single run and mutated only by the loop
 * thread executing it.
 *
 * <p>
 * {@code totalRetries} counts every authorized retry, including retries with
 * no attributable tool, so it may exceed the sum of the per-tool counters.
 * Both only increase.
 */
public class RetryState {

    private int totalRetries;
    private final Map<String, Integer> perTool = new LinkedHashMap<>();

    /**
     * Checks the global budget first; a null or blank tool name is gated by the
     * global budget only.
     */
    public boolean canRetry(String toolName, AgentPolicy policy) {
        if (totalRetries >= policy.retry().maxTotalRetries()) {
            return false;
        }
        if (toolName == null || toolName.isEmpty()) {
            return true;
        }
        return getToolRetries(toolName) < policy.retry().maxRetriesPerTool();
    }

    /**
     * Records one authorized retry. Callers check {@link #canRetry} right
     * before marking.
     */
    public void markRetry(String toolName) {
        totalRetries++;
        if (toolName != null && !toolName.isEmpty()) {
            perTool.merge(toolName, 1, Integer::sum);
        }
    }

    public int getTotalRetries() {
        return totalRetries;
    }

    public int getToolRetries(String toolName) {
        if (toolName == null) {
            return 0;
        }
        return perTool.getOrDefault(toolName, 0);
    }

    public Map<String, Integer> getPerTool() {
        return Collections.unmodifiableMap(perTool);
    }
}
