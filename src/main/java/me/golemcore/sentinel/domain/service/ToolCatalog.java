package me.golemcore.sentinel.domain.service;

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

import me.golemcore.sentinel.domain.model.ToolDefinition;
import me.golemcore.sentinel.domain.model.ToolDefinition.RiskLevel;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed set of actions the sentinel may take, with their risk level and
 * cooldown.
 *
 * <p>
 * Default cooldowns can be overridden per tool via
 * {@code sentinel.tools.cooldowns.<tool>}; polls additionally follow
 * {@code sentinel.rules.poll-automation.cooldown} unless an explicit override
 * exists.
 */
@Component
public class ToolCatalog {

    public static final String SEND_MESSAGE = "sendMessageToChat";
    public static final String TIMEOUT_USER = "timeoutUser";
    public static final String BAN_USER = "banUser";
    public static final String CREATE_POLL = "createTwitchPoll";
    public static final String CREATE_PREDICTION = "createTwitchPrediction";
    public static final String CREATE_CLIP = "createTwitchClip";
    public static final String UPDATE_TITLE = "updateStreamTitle";
    public static final String UPDATE_CATEGORY = "updateStreamCategory";

    private final SentinelProperties properties;

    public ToolCatalog(SentinelProperties properties) {
        this.properties = properties;
    }

    /**
     * All tools in catalog order, with cooldowns resolved against current
     * configuration.
     */
    public List<ToolDefinition> getTools() {
        return List.of(
                tool(SEND_MESSAGE, "Send a message to the chat", RiskLevel.LOW, null,
                        params("message", "The message to send to chat"), Set.of("message")),
                tool(TIMEOUT_USER, "Temporarily time out a chat user", RiskLevel.HIGH, Duration.ofMinutes(1),
                        params("usernameOrDescriptor", "Username to time out",
                                "reason", "Reason for the timeout",
                                "duration", "Timeout length in seconds"),
                        Set.of("usernameOrDescriptor")),
                tool(BAN_USER, "Permanently ban a user from the chat", RiskLevel.HIGH, Duration.ofMinutes(5),
                        params("usernameOrDescriptor", "Username to ban",
                                "reason", "Reason for the ban"),
                        Set.of("usernameOrDescriptor")),
                tool(CREATE_POLL, "Create a poll for viewers", RiskLevel.MEDIUM, pollCooldown(),
                        params("title", "Poll title",
                                "choices", "Comma-separated choices",
                                "duration", "Duration in seconds"),
                        Set.of("title", "choices", "duration")),
                tool(CREATE_PREDICTION, "Create a prediction viewers can bet on", RiskLevel.MEDIUM,
                        Duration.ofMinutes(20),
                        params("title", "Prediction title",
                                "outcomes", "Comma-separated outcomes",
                                "duration", "Duration in seconds"),
                        Set.of("title", "outcomes", "duration")),
                tool(CREATE_CLIP, "Clip the current stream moment", RiskLevel.LOW, Duration.ofMinutes(5),
                        Map.of(), Set.of()),
                tool(UPDATE_TITLE, "Update the stream title", RiskLevel.MEDIUM, Duration.ofMinutes(30),
                        params("title", "The new stream title"), Set.of("title")),
                tool(UPDATE_CATEGORY, "Update the stream category", RiskLevel.MEDIUM, Duration.ofMinutes(30),
                        params("category", "The new category"), Set.of("category")));
    }

    public Optional<ToolDefinition> find(String name) {
        return getTools().stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    /**
     * Whether configuration currently allows the tool at all, cooldowns aside.
     */
    public boolean isPermitted(ToolDefinition tool) {
        SentinelProperties.RulesProperties rules = properties.getRules();
        if (tool.getRiskLevel() == RiskLevel.HIGH && !properties.isEnabled()) {
            return false;
        }
        return switch (tool.getName()) {
        case TIMEOUT_USER, BAN_USER -> rules.getSpamDetection().isEnabled()
                || rules.getToxicityDetection().isEnabled();
        case CREATE_POLL -> rules.getPollAutomation().isEnabled();
        case SEND_MESSAGE -> rules.getChatEngagement().isEnabled();
        default -> true;
        };
    }

    private Duration pollCooldown() {
        Duration configured = properties.getRules().getPollAutomation().getCooldown();
        return configured != null ? configured : Duration.ofMinutes(15);
    }

    private ToolDefinition tool(String name, String description, RiskLevel risk, Duration defaultCooldown,
            Map<String, String> parameters, Set<String> required) {
        Duration override = properties.getTools().getCooldowns().get(name);
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .riskLevel(risk)
                .cooldown(override != null ? override : defaultCooldown)
                .parameters(parameters)
                .requiredParameters(required)
                .build();
    }

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
