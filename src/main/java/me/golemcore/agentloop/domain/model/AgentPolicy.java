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
 * Immutable iteration and finalization policy for the agent loop. Built once
 * when the loop is wired and shared read-only across runs.
 *
 * @param maxIterationsDefault
 *            iterations used when a request does not specify any
 * @param maxIterationsCap
 *            hard upper bound for requested iterations
 * @param minConfidenceToFinalize
 *            confidence required to finalize without tool evidence
 * @param retry
 *            retry ceilings
 */
public record AgentPolicy(
        int maxIterationsDefault,
        int maxIterationsCap,
        double minConfidenceToFinalize,
        RetryPolicy retry
) {
    public static final int DEFAULT_MAX_ITERATIONS = 6;
    public static final int DEFAULT_MAX_ITERATIONS_CAP = 20;
    public static final double DEFAULT_MIN_CONFIDENCE_TO_FINALIZE = 0.45;

    public AgentPolicy {
        if (maxIterationsCap < 1) {
            throw new IllegalArgumentException("maxIterationsCap must be at least 1");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry policy is required");
        }
    }

    public static AgentPolicy defaults() {
        return new AgentPolicy(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS_CAP,
                DEFAULT_MIN_CONFIDENCE_TO_FINALIZE, RetryPolicy.defaults());
    }

    /**
     * Clamps a requested iteration count into {@code [1, maxIterationsCap]}.
     */
    public int clampIterations(int requested) {
        if (requested < 1) {
            return 1;
        }
        if (requested > maxIterationsCap) {
            return maxIterationsCap;
        }
        return requested;
    }

    /**
     * Iteration budget for a run: the requested count, or
     * {@code maxIterationsDefault} when none was requested, clamped to the cap.
     */
    public int resolveIterations(Integer requested) {
        return clampIterations(requested != null ? requested : maxIterationsDefault);
    }
}
