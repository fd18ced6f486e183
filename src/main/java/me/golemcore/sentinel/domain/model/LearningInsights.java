package me.golemcore.sentinel.domain.model;

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

import java.util.List;
import java.util.Map;

/**
 * Aggregated learning signal derived from the feedback window.
 *
 * @param patternSuccessRates
 *            keyed by {@code <type>-<floor(severity/2)>}
 * @param actionPerformance
 *            keyed by action id
 */
public record LearningInsights(
        Map<String, PatternStats> patternSuccessRates,
        Map<String, ActionPerformance> actionPerformance,
        int totalSamples,
        List<String> recommendations) {

    public LearningInsights {
        patternSuccessRates = patternSuccessRates == null ? Map.of() : patternSuccessRates;
        actionPerformance = actionPerformance == null ? Map.of() : actionPerformance;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public record PatternStats(int total, int successful) {

        public double successRate() {
            return total == 0 ? 0 : (double) successful / total;
        }
    }

    /**
     * @param averageRating
     *            0 when the action has no ratings
     * @param effectivenessRate
     *            0 when the action has no outcomes
     */
    public record ActionPerformance(
            double averageRating,
            double effectivenessRate,
            int ratingCount,
            int outcomeCount,
            int sampleSize) {
    }
}
