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

import me.golemcore.sentinel.domain.model.ActionDecision;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.FeedbackEntry;
import me.golemcore.sentinel.domain.model.LearningInsights;
import me.golemcore.sentinel.domain.model.LearningInsights.ActionPerformance;
import me.golemcore.sentinel.domain.model.LearningInsights.PatternStats;
import me.golemcore.sentinel.domain.model.UserFeedback;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Markdown renderers for the feedback logs, daily reports and learning
 * insights. All times are UTC.
 */
final class FeedbackReports {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final int DETAILED_ACTIONS_LIMIT = 10;

    private FeedbackReports() {
    }

    static String actionLogEntry(ActionDecision decision, String parametersJson) {
        String patterns = decision.patterns().stream()
                .map(p -> p.type().id() + " (" + p.severity() + "/10)")
                .collect(Collectors.joining(", "));
        return "### " + time(decision.timestamp()) + " - " + decision.action() + "\n\n"
                + "**Reason:** " + decision.reason() + "\n\n"
                + "**Confidence:** " + decision.confidence() + "\n\n"
                + "**Parameters:** `" + parametersJson + "`\n\n"
                + "**Patterns:** " + (patterns.isEmpty() ? "none" : patterns) + "\n\n";
    }

    static String userFeedbackEntry(FeedbackEntry entry, UserFeedback feedback) {
        StringBuilder sb = new StringBuilder();
        sb.append("### ").append(time(entry.getTimestamp())).append(" - Feedback on ")
                .append(entry.actionName()).append("\n\n");
        sb.append("**Rating:** ").append(feedback.getRating()).append("/5\n\n");
        sb.append("**Source:** ").append(feedback.getSource().name().toLowerCase(Locale.ROOT)).append("\n\n");
        if (feedback.getComment() != null && !feedback.getComment().isBlank()) {
            sb.append("**Comment:** ").append(feedback.getComment()).append("\n\n");
        }
        sb.append("**Original Action:** ").append(entry.getActionTaken().reason()).append("\n\n");
        return sb.toString();
    }

    static String dailyReport(LocalDate date, List<FeedbackEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Daily Sentinel Report - ").append(date).append("\n\n");
        sb.append("## Summary\n\n");

        if (entries.isEmpty()) {
            sb.append("No autonomous actions were taken on this day.\n\n");
            sb.append("Possible causes: monitoring disabled, no significant patterns, or all tools on cooldown.\n");
            return sb.toString();
        }

        List<FeedbackEntry> rated = entries.stream().filter(e -> e.getUserFeedback() != null).toList();
        List<FeedbackEntry> withOutcome = entries.stream().filter(e -> e.getOutcome() != null).toList();
        double averageRating = rated.stream().mapToInt(e -> e.getUserFeedback().getRating()).average().orElse(0);
        long effective = withOutcome.stream().filter(e -> e.getOutcome().isEffective()).count();
        double effectiveness = withOutcome.isEmpty() ? 0 : (double) effective / withOutcome.size();

        sb.append("- **Total Actions:** ").append(entries.size()).append("\n");
        sb.append("- **Actions with Feedback:** ").append(rated.size()).append("\n");
        sb.append("- **Average Rating:** ").append(format1(averageRating)).append("/5\n");
        sb.append("- **Effectiveness:** ").append(percent(effectiveness)).append("\n\n");

        sb.append("## Action Breakdown\n\n");
        Map<String, Long> counts = entries.stream()
                .collect(Collectors.groupingBy(FeedbackEntry::actionName, LinkedHashMap::new,
                        Collectors.counting()));
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(e -> sb.append("- **").append(e.getKey()).append(":** ").append(e.getValue())
                        .append(" times\n"));
        sb.append("\n");

        if (!rated.isEmpty()) {
            Comparator<FeedbackEntry> byRating = Comparator.comparingInt(e -> e.getUserFeedback().getRating());
            FeedbackEntry best = rated.stream().max(byRating).orElseThrow();
            FeedbackEntry worst = rated.stream().min(byRating).orElseThrow();
            sb.append("## Feedback Highlights\n\n");
            appendHighlight(sb, "Best Rated Action", best);
            if (worst.getUserFeedback().getRating() != best.getUserFeedback().getRating()) {
                appendHighlight(sb, "Lowest Rated Action", worst);
            }
        }

        sb.append("## Detailed Actions\n\n");
        List<FeedbackEntry> latest = entries.subList(Math.max(0, entries.size() - DETAILED_ACTIONS_LIMIT),
                entries.size());
        for (FeedbackEntry entry : latest) {
            sb.append("### ").append(time(entry.getTimestamp())).append(" - ").append(entry.actionName())
                    .append("\n");
            sb.append("- **Reason:** ").append(entry.getActionTaken().reason()).append("\n");
            sb.append("- **Confidence:** ").append(entry.getActionTaken().confidence()).append("\n");
            if (entry.getUserFeedback() != null) {
                sb.append("- **Rating:** ").append(entry.getUserFeedback().getRating()).append("/5\n");
            }
            if (entry.getOutcome() != null) {
                sb.append("- **Effective:** ").append(entry.getOutcome().isEffective() ? "yes" : "no").append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    static String learningInsights(LearningInsights insights, Instant generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Learning Insights\n\n");
        sb.append("*Generated: ").append(generatedAt).append("*\n\n");
        sb.append("**Sample Size:** ").append(insights.totalSamples()).append(" actions\n\n");

        sb.append("## Pattern Recognition Performance\n\n");
        if (insights.patternSuccessRates().isEmpty()) {
            sb.append("No pattern data available yet.\n");
        }
        for (Map.Entry<String, PatternStats> e : insights.patternSuccessRates().entrySet()) {
            PatternStats stats = e.getValue();
            sb.append("- **").append(e.getKey()).append(":** ").append(percent(stats.successRate()))
                    .append(" success rate (").append(stats.successful()).append("/").append(stats.total())
                    .append(")\n");
        }
        sb.append("\n");

        sb.append("## Action Performance\n\n");
        if (insights.actionPerformance().isEmpty()) {
            sb.append("No action performance data available yet.\n\n");
        }
        insights.actionPerformance().entrySet().stream()
                .sorted(Map.Entry.<String, ActionPerformance>comparingByValue(
                        Comparator.comparingDouble(ActionPerformance::averageRating)).reversed())
                .forEach(e -> {
                    ActionPerformance perf = e.getValue();
                    sb.append("### ").append(e.getKey()).append("\n");
                    if (perf.ratingCount() > 0) {
                        sb.append("- **Average Rating:** ").append(format1(perf.averageRating())).append("/5\n");
                    }
                    if (perf.outcomeCount() > 0) {
                        sb.append("- **Effectiveness Rate:** ").append(percent(perf.effectivenessRate()))
                                .append("\n");
                    }
                    sb.append("- **Sample Size:** ").append(perf.sampleSize()).append("\n\n");
                });

        sb.append("## Recommendations\n\n");
        for (String recommendation : insights.recommendations()) {
            sb.append("- ").append(recommendation).append("\n");
        }
        return sb.toString();
    }

    static String patternKey(ChatPattern pattern) {
        return pattern.type().id() + "-" + Math.floorDiv(pattern.severity(), 2);
    }

    static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }

    static String format1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static void appendHighlight(StringBuilder sb, String title, FeedbackEntry entry) {
        UserFeedback feedback = entry.getUserFeedback();
        sb.append("### ").append(title).append(" (").append(feedback.getRating()).append("/5)\n");
        sb.append("- **Action:** ").append(entry.actionName()).append("\n");
        sb.append("- **Reason:** ").append(entry.getActionTaken().reason()).append("\n");
        if (feedback.getComment() != null && !feedback.getComment().isBlank()) {
            sb.append("- **Comment:** \"").append(feedback.getComment()).append("\"\n");
        }
        sb.append("\n");
    }

    private static String time(Instant instant) {
        return instant != null ? TIME.format(instant) : "--:--:--";
    }
}
