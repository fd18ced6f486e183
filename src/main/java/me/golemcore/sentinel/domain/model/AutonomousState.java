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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of the monitor's process-wide state.
 */
@Data
@Builder
public class AutonomousState {

    private boolean active;
    private Instant lastAnalysis;
    private List<ActionDecision> recentActions;
    private LearningData learningData;
    private Statistics statistics;

    /**
     * Pattern keys ({@code <type>-<floor(severity/2)>}) counted by whether the
     * rated actions they triggered succeeded, plus average rating per action.
     */
    @Data
    @Builder
    public static class LearningData {
        private Map<String, Integer> successfulPatterns;
        private Map<String, Integer> failedPatterns;
        private Map<String, Double> userPreferences;
    }

    @Data
    @Builder
    public static class Statistics {
        private int actionsToday;
        private double successRate;
        private double averageConfidence;
        private String mostCommonAction;
    }
}
