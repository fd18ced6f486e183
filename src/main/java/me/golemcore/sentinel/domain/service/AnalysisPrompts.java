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

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed prompt templates for the five analysis queries. Every template numbers
 * the batch from 1 and names the exact JSON shape expected back.
 */
final class AnalysisPrompts {

    private AnalysisPrompts() {
    }

    private static final String TOXICITY_SYSTEM = """
            You are a chat moderation assistant. Look for toxic behavior: harassment, hate speech, \
            personal attacks, threats, discrimination or severely inappropriate language.
            Score toxicity from 1 to 10:
            1-3: mildly rude or inappropriate
            4-6: moderately toxic, personal attacks
            7-8: severely toxic, harassment
            9-10: extreme toxicity, threats, hate speech""";

    private static final String SPAM_SYSTEM = """
            You are a chat spam detector. Look for promotional content and external links, \
            repeated messages from one user, bot-like behavior, scam attempts and emote floods.
            Score spam from 1 to 10:
            1-3: minor repetition or borderline promotion
            4-6: clear spam attempts
            7-8: aggressive spam or scams
            9-10: malicious spam or bot attacks""";

    private static final String ENGAGEMENT_SYSTEM = """
            You are a chat engagement assistant. Find moments where the streamer should respond: \
            direct questions, requests for interaction, conversation starters, community moments.
            Score each opportunity from 1 to 10 by how much a streamer reply would help.""";

    private static final String SENTIMENT_SYSTEM = """
            You are a chat sentiment analyst. Judge the overall mood of the chat segment, \
            weighing excitement and support against frustration and anger.
            Report sentiment from -1 (very negative) to 1 (very positive).""";

    private static final String ACTIVITY_SYSTEM = """
            You are a chat activity analyst. Decide whether the chat is very active, moderately active, \
            quiet or dead, considering both message frequency and how many users take part.
            Report the activity level from 0 (dead) to 10 (very active).""";

    static String toxicity(List<String> lines) {
        return TOXICITY_SYSTEM + "\n\n"
                + "Score every message below for toxicity and recommend an action (ignore/warn/timeout/ban).\n\n"
                + "Messages:\n" + numbered(lines) + "\n\n"
                + "Respond with JSON only: "
                + "[{\"messageIndex\": number, \"toxicityScore\": number, \"reason\": string, "
                + "\"action\": string, \"username\": string}]";
    }

    static String spam(List<String> lines, Map<String, Integer> userRates, int threshold) {
        return SPAM_SYSTEM + "\n\n"
                + "Score these messages for spam, taking per-user frequency into account.\n\n"
                + "Messages:\n" + numbered(lines) + "\n\n"
                + "Messages per user in the last minute: " + rates(userRates) + "\n"
                + "A user above " + threshold + " messages per minute is likely flooding.\n\n"
                + "Respond with JSON only: "
                + "[{\"messageIndex\": number, \"spamScore\": number, \"reason\": string, "
                + "\"action\": string, \"username\": string}]";
    }

    static String engagement(List<String> lines) {
        return ENGAGEMENT_SYSTEM + "\n\n"
                + "Find engagement opportunities in these messages:\n\n"
                + numbered(lines) + "\n\n"
                + "Respond with JSON only: "
                + "[{\"messageIndex\": number, \"engagementScore\": number, \"reason\": string, "
                + "\"suggestedResponse\": string, \"username\": string}]";
    }

    static String sentiment(List<String> lines) {
        return SENTIMENT_SYSTEM + "\n\n"
                + "Chat segment:\n" + numbered(lines) + "\n\n"
                + "Respond with JSON only: "
                + "{\"overallSentiment\": number, \"reasoning\": string, \"keyIndicators\": [string]}";
    }

    static String activity(List<String> lines, String timeSpan, int uniqueUsers) {
        return ACTIVITY_SYSTEM + "\n\n"
                + "Chat over the last " + timeSpan + " (" + lines.size() + " messages from "
                + uniqueUsers + " users):\n" + numbered(lines) + "\n\n"
                + "Respond with JSON only: "
                + "{\"activityLevel\": number, \"description\": string, \"recommendations\": [string]}";
    }

    private static String numbered(List<String> lines) {
        return IntStream.range(0, lines.size())
                .mapToObj(i -> (i + 1) + ". " + lines.get(i))
                .collect(Collectors.joining("\n"));
    }

    private static String rates(Map<String, Integer> userRates) {
        if (userRates == null || userRates.isEmpty()) {
            return "{}";
        }
        return userRates.entrySet().stream()
                .map(e -> "\"" + e.getKey() + "\": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
