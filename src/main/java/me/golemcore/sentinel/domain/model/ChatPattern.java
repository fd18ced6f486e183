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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured observation extracted from a batch of chat messages.
 *
 * <p>
 * Severity is on a 1-10 scale, confidence on 0-1. Metadata carries the
 * oracle's reasoning ({@code reason}), its suggested moderation
 * ({@code recommendedAction}) or reply ({@code suggestedResponse}).
 */
@Builder(toBuilder = true)
public record ChatPattern(
        PatternType type,
        int severity,
        double confidence,
        List<String> users,
        List<String> messages,
        Instant timestamp,
        Map<String, Object> metadata) {

    public static final String META_REASON = "reason";
    public static final String META_RECOMMENDED_ACTION = "recommendedAction";
    public static final String META_SUGGESTED_RESPONSE = "suggestedResponse";
    public static final String META_AI_GENERATED = "aiGenerated";

    public ChatPattern {
        users = users == null ? List.of() : List.copyOf(users);
        messages = messages == null ? List.of() : List.copyOf(messages);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String firstUser() {
        return users.isEmpty() ? "unknown" : users.get(0);
    }

    public String firstMessage() {
        return messages.isEmpty() ? "" : messages.get(0);
    }

    public String metadataText(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
