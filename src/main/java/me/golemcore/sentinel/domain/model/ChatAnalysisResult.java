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

/**
 * Outcome of one analyzer pass over the message window.
 *
 * @param overallSentiment
 *            mood of the batch, -1 (very negative) to 1 (very positive)
 * @param activityLevel
 *            0 (dead) to 10 (very active)
 */
public record ChatAnalysisResult(
        List<ChatPattern> patterns,
        double overallSentiment,
        double activityLevel,
        boolean needsAttention,
        List<String> recommendations) {

    public ChatAnalysisResult {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public ChatAnalysisResult withPatterns(List<ChatPattern> filtered) {
        return new ChatAnalysisResult(filtered, overallSentiment, activityLevel, needsAttention, recommendations);
    }

    public static ChatAnalysisResult neutral(double activityLevel, String recommendation) {
        return new ChatAnalysisResult(List.of(), 0, activityLevel, false, List.of(recommendation));
    }
}
