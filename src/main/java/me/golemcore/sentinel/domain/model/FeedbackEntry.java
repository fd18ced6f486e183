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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Durable record linking an executed {@link ActionDecision} to ratings and
 * outcomes that arrive later.
 *
 * <p>
 * Ratings are never replaced: each accepted rating is appended to
 * {@code feedbackHistory} and {@code userFeedback} points at the latest one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackEntry {

    private String id;
    private Instant timestamp;
    private ActionDecision actionTaken;
    private UserFeedback userFeedback;
    @Builder.Default
    private List<UserFeedback> feedbackHistory = new ArrayList<>();
    private ActionOutcome outcome;

    public static FeedbackEntry of(ActionDecision decision) {
        return FeedbackEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(decision.timestamp())
                .actionTaken(decision)
                .build();
    }

    public void attachFeedback(UserFeedback feedback) {
        if (feedbackHistory == null) {
            feedbackHistory = new ArrayList<>();
        }
        feedbackHistory.add(feedback);
        userFeedback = feedback;
    }

    @JsonIgnore
    public boolean isSuccessful() {
        boolean wellRated = userFeedback != null && userFeedback.getRating() >= 3;
        boolean effective = outcome != null && outcome.isEffective();
        return wellRated || effective;
    }

    @JsonIgnore
    public boolean hasFeedbackSignal() {
        return userFeedback != null || outcome != null;
    }

    @JsonIgnore
    public String actionName() {
        return actionTaken != null ? actionTaken.action() : "unknown";
    }
}
