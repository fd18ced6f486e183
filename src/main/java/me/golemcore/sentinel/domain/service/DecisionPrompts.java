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

import me.golemcore.sentinel.domain.model.ChatAnalysisResult;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.ToolDefinition;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prompt templates for action selection and parameter synthesis.
 */
final class DecisionPrompts {

    private DecisionPrompts() {
    }

    static String actionSelection(ChatAnalysisResult analysis, List<ToolDefinition> tools,
            SentinelProperties properties) {
        SentinelProperties.RulesProperties rules = properties.getRules();
        StringBuilder sb = new StringBuilder();
        sb.append("You manage a live stream chat on your own. Based on the analysis below, decide which ")
                .append("of the available tools to use, if any.\n\n");

        sb.append("CHAT ANALYSIS:\n");
        sb.append("- Overall sentiment: ").append(analysis.overallSentiment()).append(" (-1 to 1)\n");
        sb.append("- Activity level: ").append(analysis.activityLevel()).append(" (0 to 10)\n");
        sb.append("- Needs attention: ").append(analysis.needsAttention()).append("\n");
        sb.append("- Recommendations: ").append(String.join(", ", analysis.recommendations())).append("\n\n");

        sb.append("DETECTED PATTERNS:\n");
        if (analysis.patterns().isEmpty()) {
            sb.append("- none\n");
        }
        for (ChatPattern pattern : analysis.patterns()) {
            sb.append(describe(pattern)).append("\n");
        }

        sb.append("\nAVAILABLE TOOLS:\n");
        for (ToolDefinition tool : tools) {
            sb.append("- ").append(tool.getName()).append(": ").append(tool.getDescription())
                    .append(" (risk: ").append(tool.getRiskLevel().name().toLowerCase(Locale.ROOT)).append(")\n");
            if (!tool.getParameters().isEmpty()) {
                sb.append("  Parameters: ").append(tool.getParameters().entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", "))).append("\n");
            }
        }

        sb.append("\nCONFIGURATION:\n");
        sb.append("- Spam detection: ").append(onOff(rules.getSpamDetection().isEnabled()))
                .append(" (action: ").append(rules.getSpamDetection().getAction()).append(")\n");
        sb.append("- Toxicity detection: ").append(onOff(rules.getToxicityDetection().isEnabled()))
                .append(" (action: ").append(rules.getToxicityDetection().getAction()).append(")\n");
        sb.append("- Chat engagement: ").append(onOff(rules.getChatEngagement().isEnabled())).append("\n");
        sb.append("- Poll automation: ").append(onOff(rules.getPollAutomation().isEnabled())).append("\n\n");

        sb.append("""
                DECISION CRITERIA:
                - Act only on patterns with confidence above 0.6 and matching severity
                - Moderation of toxicity and spam comes first
                - Use engagement opportunities for positive interaction
                - Be conservative with timeouts and bans
                - Do not stack polls or predictions
                - Only use tools from the list above

                Respond with a JSON array only (empty if no action is needed):
                [{"action": "toolName", "parameters": {"name": "value"}, "reason": "why this action", \
                "confidence": 0.8, "targetPattern": "toxicity|spam|question|quiet|excitement|request"}]
                """);
        return sb.toString();
    }

    static String parameterGeneration(String action, ChatPattern pattern, String context) {
        return "Generate parameters for the tool \"" + action + "\" based on this chat pattern.\n\n"
                + "PATTERN:\n" + describe(pattern) + "\n\n"
                + "CONTEXT: " + context + "\n\n"
                + """
                        Be specific and fit the situation:
                        - sendMessageToChat: an engaging, relevant message for chat
                        - createTwitchPoll: a poll drawn from the conversation (title, choices, duration)
                        - createTwitchPrediction: a prediction drawn from the conversation (title, outcomes, duration)
                        - updateStreamTitle: a short title reflecting what is happening

                        Respond with a JSON object only: {"parameter_name": "parameter_value"}
                        """;
    }

    private static String describe(ChatPattern pattern) {
        String suggestion = pattern.metadataText(ChatPattern.META_RECOMMENDED_ACTION);
        if (suggestion == null) {
            suggestion = pattern.metadataText(ChatPattern.META_SUGGESTED_RESPONSE);
        }
        return "- Type: " + pattern.type().id()
                + "\n  Severity: " + pattern.severity() + "/10"
                + "\n  Confidence: " + pattern.confidence()
                + "\n  Users: " + String.join(", ", pattern.users())
                + "\n  Messages: " + String.join(" | ", pattern.messages())
                + "\n  Reason: " + orNa(pattern.metadataText(ChatPattern.META_REASON))
                + "\n  Suggestion: " + orNa(suggestion);
    }

    private static String onOff(boolean enabled) {
        return enabled ? "enabled" : "disabled";
    }

    private static String orNa(String value) {
        return value != null ? value : "N/A";
    }
}
