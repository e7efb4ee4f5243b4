package me.golemcore.agentloop.port.outbound;

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

import me.golemcore.agentloop.domain.model.PlannerProposal;
import me.golemcore.agentloop.domain.model.PlannerRequest;

/**
 * Port for the planning oracle that proposes the next step of a run. Backed
 * either by a language model or by a deterministic fallback.
 *
 * <p>
 * Implementations must not throw and must return within the caller's timeout
 * budget; their own fallback absorbs backend failures. A null return is
 * treated as an empty proposal.
 */
public interface PlannerPort {

    /**
     * Returns the planner identifier (e.g., "llm", "fallback").
     */
    String getPlannerId();

    /**
     * Proposes the next step for the given objective and working memory.
     */
    PlannerProposal nextStep(PlannerRequest request);
}
