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
import me.golemcore.sentinel.domain.model.ChatMessage;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.PatternType;
import me.golemcore.sentinel.domain.service.OracleResponseParser.ActivityAssessment;
import me.golemcore.sentinel.domain.service.OracleResponseParser.MessageFinding;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.port.outbound.OraclePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Scores a batch of chat messages through five independent oracle queries:
 * toxicity, spam, engagement, sentiment and activity.
 *
 * <p>
 * The queries run in parallel and fail independently. A query that throws or
 * returns malformed JSON contributes its neutral value (no findings, sentiment
 * 0, activity 5) while the others still count. Only when every oracle call
 * throws does the analyzer fall back to the neutral result.
 *
 * <p>
 * Findings below the materiality floor are discarded: toxicity and spam need a
 * score of at least {@value #MODERATION_FLOOR}, engagement at least
 * {@value #ENGAGEMENT_FLOOR} to become a question pattern.
 *
 * <p>
 * Emitted patterns are also kept in a short trend buffer (10 minutes, 50
 * items) exposed via {@link #getPatternTrends()}.
 */
@Service
@Slf4j
public class PatternAnalyzer {

    static final int MODERATION_FLOOR = 4;
    static final int ENGAGEMENT_FLOOR = 6;

    static final String NO_ACTIVITY = "No recent chat activity";
    static final String ORACLE_UNAVAILABLE = "AI analysis unavailable - manual review recommended";
    static final String HEALTHY = "Chat is healthy - no immediate action needed";
    static final String DEGRADED_ACTIVITY = "Monitor chat";

    private static final double TOXICITY_CONFIDENCE = 0.9;
    private static final double SPAM_CONFIDENCE = 0.8;
    private static final double QUESTION_CONFIDENCE = 0.7;
    private static final double DEGRADED_ACTIVITY_LEVEL = 5.0;
    private static final String ACTIVITY_TIME_SPAN = "5 minutes";

    private static final Duration TREND_HORIZON = Duration.ofMinutes(10);
    private static final int TREND_CAPACITY = 50;

    private final OraclePort oraclePort;
    private final OracleResponseParser parser;
    private final SentinelProperties properties;
    private final Clock clock;

    private final Deque<ChatPattern> recentPatterns = new ArrayDeque<>();

    public PatternAnalyzer(OraclePort oraclePort, OracleResponseParser parser,
            SentinelProperties properties, Clock clock) {
        this.oraclePort = oraclePort;
        this.parser = parser;
        this.properties = properties;
        this.clock = clock;
    }

    public ChatAnalysisResult analyze(List<ChatMessage> messages) {
        return analyze(messages, Map.of());
    }

    /**
     * Analyzes the batch.
     *
     * @param userRates
     *            messages per user over the last minute, passed to the spam query
     */
    public ChatAnalysisResult analyze(List<ChatMessage> messages, Map<String, Integer> userRates) {
        if (messages == null || messages.isEmpty()) {
            return ChatAnalysisResult.neutral(0, NO_ACTIVITY);
        }

        List<String> lines = messages.stream()
                .map(m -> m.username() + ": " + m.content())
                .toList();
        int uniqueUsers = (int) messages.stream().map(ChatMessage::username).distinct().count();
        int spamThreshold = properties.getRules().getSpamDetection().getThreshold();

        CompletableFuture<QueryOutcome<List<MessageFinding>>> toxicity = query("toxicity",
                AnalysisPrompts.toxicity(lines), r -> parser.parseFindings(r, "toxicityScore"), List.of());
        CompletableFuture<QueryOutcome<List<MessageFinding>>> spam = query("spam",
                AnalysisPrompts.spam(lines, userRates, spamThreshold),
                r -> parser.parseFindings(r, "spamScore"), List.of());
        CompletableFuture<QueryOutcome<List<MessageFinding>>> engagement = query("engagement",
                AnalysisPrompts.engagement(lines), r -> parser.parseFindings(r, "engagementScore"), List.of());
        CompletableFuture<QueryOutcome<Double>> sentiment = query("sentiment",
                AnalysisPrompts.sentiment(lines), parser::parseSentiment, 0.0);
        CompletableFuture<QueryOutcome<ActivityAssessment>> activity = query("activity",
                AnalysisPrompts.activity(lines, ACTIVITY_TIME_SPAN, uniqueUsers), parser::parseActivity,
                new ActivityAssessment(DEGRADED_ACTIVITY_LEVEL, "Moderate activity", List.of(DEGRADED_ACTIVITY)));

        CompletableFuture.allOf(toxicity, spam, engagement, sentiment, activity).join();

        List<QueryOutcome<?>> outcomes = List.of(toxicity.join(), spam.join(), engagement.join(),
                sentiment.join(), activity.join());
        if (outcomes.stream().allMatch(QueryOutcome::oracleFailed)) {
            log.warn("[Analyzer] All oracle queries failed, returning neutral analysis");
            return ChatAnalysisResult.neutral(Math.min(10, messages.size()), ORACLE_UNAVAILABLE);
        }

        Instant now = clock.instant();
        List<ChatPattern> patterns = new ArrayList<>();
        patterns.addAll(toPatterns(PatternType.TOXICITY, toxicity.join().value(), MODERATION_FLOOR,
                TOXICITY_CONFIDENCE, messages, now));
        patterns.addAll(toPatterns(PatternType.SPAM, spam.join().value(), MODERATION_FLOOR,
                SPAM_CONFIDENCE, messages, now));
        patterns.addAll(toPatterns(PatternType.QUESTION, engagement.join().value(), ENGAGEMENT_FLOOR,
                QUESTION_CONFIDENCE, messages, now));

        double overallSentiment = sentiment.join().value();
        ActivityAssessment activityAssessment = activity.join().value();

        boolean needsAttention = needsAttention(patterns);
        List<String> recommendations = recommendations(patterns, overallSentiment, activityAssessment);

        rememberPatterns(patterns, now);

        log.debug("[Analyzer] {} messages -> {} patterns, sentiment={}, activity={}, attention={}",
                messages.size(), patterns.size(), overallSentiment, activityAssessment.activityLevel(),
                needsAttention);

        return new ChatAnalysisResult(patterns, overallSentiment, activityAssessment.activityLevel(),
                needsAttention, recommendations);
    }

    /**
     * Counts patterns per type emitted over the last 10 minutes (at most the 50
     * most recent).
     */
    public synchronized Map<PatternType, Integer> getPatternTrends() {
        pruneTrends(clock.instant());
        Map<PatternType, Integer> trends = new EnumMap<>(PatternType.class);
        for (ChatPattern pattern : recentPatterns) {
            trends.merge(pattern.type(), 1, Integer::sum);
        }
        return trends;
    }

    private <T> CompletableFuture<QueryOutcome<T>> query(String name, String prompt,
            Function<String, T> parse, T neutral) {
        CompletableFuture<String> call;
        try {
            call = oraclePort.complete(prompt);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((response, error) -> {
            if (error != null) {
                log.warn("[Analyzer] {} query failed: {}", name, rootMessage(error));
                return new QueryOutcome<>(neutral, true);
            }
            try {
                return new QueryOutcome<>(parse.apply(response), false);
            } catch (OracleParseException e) {
                log.warn("[Analyzer] {} response unparseable: {}", name, e.getMessage());
                return new QueryOutcome<>(neutral, false);
            }
        });
    }

    private List<ChatPattern> toPatterns(PatternType type, List<MessageFinding> findings, int floor,
            double confidence, List<ChatMessage> messages, Instant now) {
        List<ChatPattern> patterns = new ArrayList<>();
        for (MessageFinding finding : findings) {
            if (finding.score() < floor) {
                continue;
            }
            int index = finding.messageIndex() - 1;
            if (index < 0 || index >= messages.size()) {
                log.debug("[Analyzer] Dropping {} finding with out-of-range index {}", type.id(),
                        finding.messageIndex());
                continue;
            }
            ChatMessage message = messages.get(index);

            Map<String, Object> metadata = new LinkedHashMap<>();
            if (finding.reason() != null) {
                metadata.put(ChatPattern.META_REASON, finding.reason());
            }
            if (type == PatternType.QUESTION) {
                if (finding.suggestedResponse() != null) {
                    metadata.put(ChatPattern.META_SUGGESTED_RESPONSE, finding.suggestedResponse());
                }
            } else if (finding.action() != null) {
                metadata.put(ChatPattern.META_RECOMMENDED_ACTION, finding.action());
            }
            metadata.put(ChatPattern.META_AI_GENERATED, true);

            patterns.add(ChatPattern.builder()
                    .type(type)
                    .severity(Math.max(1, Math.min(10, (int) Math.round(finding.score()))))
                    .confidence(confidence)
                    .users(List.of(resolveUser(finding, message)))
                    .messages(List.of(message.content() != null ? message.content() : ""))
                    .timestamp(now)
                    .metadata(metadata)
                    .build());
        }
        return patterns;
    }

    private String resolveUser(MessageFinding finding, ChatMessage message) {
        if (finding.username() != null) {
            return finding.username();
        }
        if (message.username() != null && !message.username().isBlank()) {
            return message.username();
        }
        return "unknown";
    }

    static boolean needsAttention(List<ChatPattern> patterns) {
        long spamCount = patterns.stream().filter(p -> p.type() == PatternType.SPAM).count();
        if (spamCount >= 2) {
            return true;
        }
        return patterns.stream().anyMatch(p -> (p.type() == PatternType.SPAM && p.severity() >= 7)
                || (p.type() == PatternType.TOXICITY && p.severity() >= 6));
    }

    private List<String> recommendations(List<ChatPattern> patterns, double sentiment,
            ActivityAssessment activity) {
        List<String> recommendations = new ArrayList<>();

        highest(patterns, PatternType.TOXICITY).ifPresent(p -> recommendations.add(String.format(Locale.ROOT,
                "%s %s - %s", orDefault(p.metadataText(ChatPattern.META_RECOMMENDED_ACTION), "Moderate"),
                p.firstUser(), orDefault(p.metadataText(ChatPattern.META_REASON), "toxic behavior"))));

        highest(patterns, PatternType.SPAM).ifPresent(p -> recommendations.add(String.format(Locale.ROOT,
                "%s %s - %s", orDefault(p.metadataText(ChatPattern.META_RECOMMENDED_ACTION), "Address spam from"),
                p.firstUser(), orDefault(p.metadataText(ChatPattern.META_REASON), "spam"))));

        patterns.stream()
                .filter(p -> p.type() == PatternType.QUESTION)
                .findFirst()
                .ifPresent(p -> recommendations.add(orDefault(p.metadataText(ChatPattern.META_SUGGESTED_RESPONSE),
                        "Engage with viewer questions")));

        if (sentiment < -0.3) {
            recommendations.add("Chat sentiment is negative - consider addressing concerns or changing topic");
        } else if (sentiment > 0.5) {
            recommendations.add("Great positive energy in chat - good time for interaction");
        }

        for (String rec : activity.recommendations()) {
            recommendations.add("Activity: " + rec);
        }

        if (recommendations.isEmpty()) {
            recommendations.add(HEALTHY);
        }
        return recommendations;
    }

    private Optional<ChatPattern> highest(List<ChatPattern> patterns, PatternType type) {
        return patterns.stream()
                .filter(p -> p.type() == type)
                .max(Comparator.comparingInt(ChatPattern::severity));
    }

    private synchronized void rememberPatterns(List<ChatPattern> patterns, Instant now) {
        recentPatterns.addAll(patterns);
        pruneTrends(now);
    }

    private void pruneTrends(Instant now) {
        Instant horizon = now.minus(TREND_HORIZON);
        recentPatterns.removeIf(p -> p.timestamp() != null && p.timestamp().isBefore(horizon));
        while (recentPatterns.size() > TREND_CAPACITY) {
            recentPatterns.removeFirst();
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private record QueryOutcome<T>(T value, boolean oracleFailed) {
    }
}
