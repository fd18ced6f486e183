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

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * An external capability the decision engine may propose. Parameters map names
 * to a short description; required ones are listed separately so the engine can
 * guarantee they are bound.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, String> parameters;
    private Set<String> requiredParameters;
    private RiskLevel riskLevel;
    private Duration cooldown;

    public boolean hasCooldown() {
        return cooldown != null && !cooldown.isZero() && !cooldown.isNegative();
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH
    }
}
