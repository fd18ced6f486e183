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
 * Full intermediate results of a manually forced cycle.
 */
public record ForcedAnalysisResult(
        ChatAnalysisResult analysis,
        List<ActionDecision> decisions,
        List<ActionDecision> executed) {

    public ForcedAnalysisResult {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        executed = executed == null ? List.of() : List.copyOf(executed);
    }

    public List<ChatPattern> patterns() {
        return analysis != null ? analysis.patterns() : List.of();
    }

    public static ForcedAnalysisResult empty() {
        return new ForcedAnalysisResult(null, List.of(), List.of());
    }
}
