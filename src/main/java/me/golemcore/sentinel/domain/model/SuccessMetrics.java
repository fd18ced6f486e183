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
 * Seven-day aggregate over the feedback store.
 *
 * @param successRate
 *            successes divided by all entries in the window, with or without
 *            feedback
 * @param averageRating
 *            mean latest rating over rated entries, 0 when none
 */
public record SuccessMetrics(
        int totalActions,
        double successRate,
        double averageRating,
        List<String> mostSuccessfulActions,
        List<String> leastSuccessfulActions) {

    public SuccessMetrics {
        mostSuccessfulActions = mostSuccessfulActions == null ? List.of() : List.copyOf(mostSuccessfulActions);
        leastSuccessfulActions = leastSuccessfulActions == null ? List.of() : List.copyOf(leastSuccessfulActions);
    }
}
