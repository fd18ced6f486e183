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
 * A concrete proposed invocation of an external tool, with bound parameters and
 * the patterns that justified it. Provenance may be empty for fallback or
 * manual decisions.
 */
@Builder(toBuilder = true)
public record ActionDecision(
        String action,
        Map<String, Object> parameters,
        String reason,
        double confidence,
        List<ChatPattern> patterns,
        Instant timestamp) {

    public ActionDecision {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
