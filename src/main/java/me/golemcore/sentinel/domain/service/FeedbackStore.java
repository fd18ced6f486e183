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
import me.golemcore.sentinel.domain.model.ActionOutcome;
import me.golemcore.sentinel.domain.model.AutonomousState;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.FeedbackEntry;
import me.golemcore.sentinel.domain.model.FeedbackSource;
import me.golemcore.sentinel.domain.model.LearningInsights;
import me.golemcore.sentinel.domain.model.LearningInsights.ActionPerformance;
import me.golemcore.sentinel.domain.model.LearningInsights.PatternStats;
import me.golemcore.sentinel.domain.model.SuccessMetrics;
import me.golemcore.sentinel.domain.model.UserFeedback;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Records executed actions and the ratings and outcomes that arrive for them
 * later, and derives success metrics and learning insights.
 *
 * <p>
 * Persistence is append-only and partitioned by UTC date under the feedback
 * directory:
 * <ul>
 * <li>{@code actions-<date>.md} - one block per executed action</li>
 * <li>{@code feedback-<date>.jsonl} - a full entry snapshot per change; the
 * last snapshot of an entry is its current state</li>
 * <li>{@code user-feedback-<date>.md} - one block per accepted rating</li>
 * <li>{@code reports/daily-<date>.md} - daily report</li>
 * <li>{@code learning-insights.md} - rolling document, rewritten
 * atomically</li>
 * </ul>
 *
 * <p>
 * Ratings and outcomes are matched to the entry nearest in time within the
 * configured tolerance (60 seconds by default). Exact ties between different
 * entries are ambiguous and rejected unless an action name narrows them to
 * one. Storage failures are logged and never propagate.
 */
@Service
@Slf4j
public class FeedbackStore {

    private static final String ACTIONS_PREFIX = "actions-";
    private static final String SNAPSHOT_PREFIX = "feedback-";
    private static final String USER_FEEDBACK_PREFIX = "user-feedback-";
    private static final String REPORTS_DIR = "reports";
    private static final String INSIGHTS_FILE = "learning-insights.md";
    private static final Pattern DATED_FILE = Pattern.compile("(?:^|/)[a-z-]+-(\\d{4}-\\d{2}-\\d{2})\\.(?:md|jsonl)$");
    private static final Pattern SNAPSHOT_FILE = Pattern.compile("^feedback-(\\d{4}-\\d{2}-\\d{2})\\.jsonl$");

    private static final int RANKING_MIN_SAMPLES = 2;
    private static final int RANKING_SIZE = 3;
    private static final int ACTION_RECOMMENDATION_MIN_SAMPLES = 5;
    private static final int PATTERN_RECOMMENDATION_MIN_SAMPLES = 3;
    private static final int INSUFFICIENT_DATA_SAMPLES = 10;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SentinelProperties properties;
    private final Clock clock;

    private final List<FeedbackEntry> entries = new ArrayList<>();

    public FeedbackStore(StoragePort storagePort, ObjectMapper objectMapper, SentinelProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Replays the JSONL snapshots covering the metrics window so metrics survive
     * restarts.
     */
    @PostConstruct
    public synchronized void loadPersisted() {
        LocalDate oldest = utcDate(clock.instant().minus(properties.getFeedback().getMetricsWindow()));
        Map<String, FeedbackEntry> latestById = new LinkedHashMap<>();

        try {
            List<String> files = storagePort.listObjects(directory(), "").join();
            for (String file : files) {
                Matcher matcher = SNAPSHOT_FILE.matcher(file);
                LocalDate fileDate = matcher.matches() ? parseDate(matcher.group(1)) : null;
                if (fileDate == null || fileDate.isBefore(oldest)) {
                    continue;
                }
                String content = storagePort.getText(directory(), file).join();
                if (content == null) {
                    continue;
                }
                for (String line : content.split("\n")) {
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        FeedbackEntry entry = objectMapper.readValue(line, FeedbackEntry.class);
                        if (entry.getActionTaken() == null || entry.getTimestamp() == null) {
                            continue;
                        }
                        latestById.put(entryKey(entry), entry);
                    } catch (JsonProcessingException e) {
                        log.debug("[Feedback] Skipping malformed snapshot line in {}", file);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Feedback] Failed to load persisted feedback: {}", e.getMessage());
        }

        List<FeedbackEntry> loaded = new ArrayList<>(latestById.values());
        loaded.sort(Comparator.comparing(FeedbackEntry::getTimestamp));
        entries.clear();
        entries.addAll(loaded);
        if (!loaded.isEmpty()) {
            log.info("[Feedback] Loaded {} feedback entries", loaded.size());
        }
    }

    public synchronized FeedbackEntry recordAction(ActionDecision decision) {
        FeedbackEntry entry = FeedbackEntry.of(decision);
        entries.add(entry);

        appendSnapshot(entry);
        String file = ACTIONS_PREFIX + utcDate(entry.getTimestamp()) + ".md";
        persist("action log", storagePort.appendText(directory(), file,
                FeedbackReports.actionLogEntry(decision, toJson(decision.parameters()))));
        log.debug("[Feedback] Recorded action {}", decision.action());
        return entry;
    }

    public boolean addUserFeedback(Instant actionTimestamp, int rating, String comment, FeedbackSource source) {
        return addUserFeedback(actionTimestamp, rating, comment, source, null);
    }

    /**
     * Attaches a rating to the entry nearest {@code actionTimestamp}.
     *
     * @param action
     *            optional action name restricting the match
     * @return {@code false} if no single entry matches or the rating is outside
     *         1-5
     */
    public synchronized boolean addUserFeedback(Instant actionTimestamp, int rating, String comment,
            FeedbackSource source, String action) {
        if (rating < 1 || rating > 5) {
            log.warn("[Feedback] Rejecting rating outside 1-5: {}", rating);
            return false;
        }
        FeedbackEntry entry = findMatch(actionTimestamp, action);
        if (entry == null) {
            return false;
        }

        UserFeedback feedback = UserFeedback.builder()
                .rating(rating)
                .comment(comment)
                .source(source != null ? source : FeedbackSource.CHAT)
                .receivedAt(clock.instant())
                .build();
        entry.attachFeedback(feedback);

        appendSnapshot(entry);
        String file = USER_FEEDBACK_PREFIX + utcDate(entry.getTimestamp()) + ".md";
        persist("user feedback log", storagePort.appendText(directory(), file,
                FeedbackReports.userFeedbackEntry(entry, feedback)));
        log.info("[Feedback] Rating {}/5 attached to {}", rating, entry.actionName());
        return true;
    }

    public boolean recordOutcome(Instant actionTimestamp, boolean effective, String chatResponse,
            List<String> sideEffects) {
        return recordOutcome(actionTimestamp, effective, chatResponse, sideEffects, null);
    }

    /**
     * Attaches an outcome to the entry nearest {@code actionTimestamp}. A later
     * outcome supersedes the earlier one; both stay in the snapshot log.
     */
    public synchronized boolean recordOutcome(Instant actionTimestamp, boolean effective, String chatResponse,
            List<String> sideEffects, String action) {
        FeedbackEntry entry = findMatch(actionTimestamp, action);
        if (entry == null) {
            return false;
        }

        entry.setOutcome(ActionOutcome.builder()
                .effective(effective)
                .chatResponse(chatResponse)
                .sideEffects(sideEffects != null ? new ArrayList<>(sideEffects) : new ArrayList<>())
                .recordedAt(clock.instant())
                .build());
        appendSnapshot(entry);
        log.info("[Feedback] Outcome (effective={}) attached to {}", effective, entry.actionName());
        return true;
    }

    public synchronized List<FeedbackEntry> getRecentFeedback(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return entries.stream()
                .filter(e -> !e.getTimestamp().isBefore(cutoff))
                .toList();
    }

    /**
     * Success metrics over the metrics window. Every entry in the window counts
     * in the denominator, rated or not.
     */
    public synchronized SuccessMetrics calculateSuccessMetrics() {
        List<FeedbackEntry> window = getRecentFeedback(properties.getFeedback().getMetricsWindow());

        long successes = window.stream().filter(FeedbackEntry::isSuccessful).count();
        double successRate = (double) successes / Math.max(1, window.size());
        double averageRating = window.stream()
                .filter(e -> e.getUserFeedback() != null)
                .mapToInt(e -> e.getUserFeedback().getRating())
                .average()
                .orElse(0);

        Map<String, int[]> perAction = new TreeMap<>();
        for (FeedbackEntry entry : window) {
            if (!entry.hasFeedbackSignal()) {
                continue;
            }
            int[] stats = perAction.computeIfAbsent(entry.actionName(), key -> new int[2]);
            stats[0]++;
            if (entry.isSuccessful()) {
                stats[1]++;
            }
        }

        List<Map.Entry<String, Double>> ranked = perAction.entrySet().stream()
                .filter(e -> e.getValue()[0] >= RANKING_MIN_SAMPLES)
                .map(e -> Map.entry(e.getKey(), (double) e.getValue()[1] / e.getValue()[0]))
                .toList();

        List<String> most = ranked.stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(RANKING_SIZE)
                .map(Map.Entry::getKey)
                .toList();
        List<String> least = ranked.stream()
                .sorted(Map.Entry.comparingByValue())
                .limit(RANKING_SIZE)
                .map(Map.Entry::getKey)
                .toList();

        return new SuccessMetrics(window.size(), successRate, averageRating, most, least);
    }

    /**
     * Aggregates the metrics window and rewrites {@code learning-insights.md}.
     */
    public synchronized LearningInsights generateLearningInsights() {
        LearningInsights insights = computeInsights();
        persist("learning insights", storagePort.putTextAtomic(directory(), INSIGHTS_FILE,
                FeedbackReports.learningInsights(insights, clock.instant()), false));
        return insights;
    }

    /**
     * Renders {@code insights} the way {@code learning-insights.md} is written.
     */
    public String renderInsights(LearningInsights insights) {
        return FeedbackReports.learningInsights(insights, clock.instant());
    }

    /**
     * Writes {@code reports/daily-<date>.md} from the entries recorded on that
     * UTC date and returns its text.
     */
    public synchronized String generateDailyReport(LocalDate date) {
        List<FeedbackEntry> dayEntries = entries.stream()
                .filter(e -> utcDate(e.getTimestamp()).equals(date))
                .toList();
        String report = FeedbackReports.dailyReport(date, dayEntries);
        persist("daily report", storagePort.putText(directory(), REPORTS_DIR + "/daily-" + date + ".md", report));
        log.info("[Feedback] Daily report for {} written ({} actions)", date, dayEntries.size());
        return report;
    }

    /**
     * Deletes date-partitioned files older than {@code retentionDays} and drops
     * the matching in-memory entries.
     *
     * @return number of files deleted
     */
    public synchronized int cleanup(int retentionDays) {
        LocalDate cutoff = utcDate(clock.instant()).minusDays(retentionDays);
        int deleted = 0;
        try {
            for (String file : storagePort.listObjects(directory(), "").join()) {
                Matcher matcher = DATED_FILE.matcher(file);
                if (!matcher.find()) {
                    continue;
                }
                LocalDate fileDate = parseDate(matcher.group(1));
                if (fileDate != null && fileDate.isBefore(cutoff)) {
                    storagePort.deleteObject(directory(), file).join();
                    deleted++;
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Feedback] Cleanup failed: {}", e.getMessage());
        }

        entries.removeIf(e -> utcDate(e.getTimestamp()).isBefore(cutoff));
        if (deleted > 0) {
            log.info("[Feedback] Cleanup removed {} files older than {}", deleted, cutoff);
        }
        return deleted;
    }

    /**
     * Pattern and preference counters over the metrics window: rated entries
     * count their patterns as successful (rating 3 or more) or failed, and each
     * action gets its average rating.
     */
    public synchronized AutonomousState.LearningData buildLearningData() {
        Map<String, Integer> successful = new TreeMap<>();
        Map<String, Integer> failed = new TreeMap<>();
        Map<String, List<Integer>> ratings = new TreeMap<>();

        for (FeedbackEntry entry : getRecentFeedback(properties.getFeedback().getMetricsWindow())) {
            if (entry.getUserFeedback() == null) {
                continue;
            }
            int rating = entry.getUserFeedback().getRating();
            Map<String, Integer> target = rating >= 3 ? successful : failed;
            for (ChatPattern pattern : entry.getActionTaken().patterns()) {
                target.merge(FeedbackReports.patternKey(pattern), 1, Integer::sum);
            }
            ratings.computeIfAbsent(entry.actionName(), key -> new ArrayList<>()).add(rating);
        }

        Map<String, Double> preferences = new TreeMap<>();
        ratings.forEach((action, values) -> preferences.put(action,
                values.stream().mapToInt(Integer::intValue).average().orElse(0)));

        return AutonomousState.LearningData.builder()
                .successfulPatterns(successful)
                .failedPatterns(failed)
                .userPreferences(preferences)
                .build();
    }

    private LearningInsights computeInsights() {
        List<FeedbackEntry> window = getRecentFeedback(properties.getFeedback().getMetricsWindow());

        Map<String, int[]> patternCounts = new TreeMap<>();
        Map<String, List<Integer>> ratings = new LinkedHashMap<>();
        Map<String, List<Boolean>> effectiveness = new LinkedHashMap<>();

        for (FeedbackEntry entry : window) {
            boolean success = entry.isSuccessful();
            for (ChatPattern pattern : entry.getActionTaken().patterns()) {
                int[] counts = patternCounts.computeIfAbsent(FeedbackReports.patternKey(pattern), k -> new int[2]);
                counts[0]++;
                if (success) {
                    counts[1]++;
                }
            }
            String action = entry.actionName();
            ratings.computeIfAbsent(action, k -> new ArrayList<>());
            effectiveness.computeIfAbsent(action, k -> new ArrayList<>());
            if (entry.getUserFeedback() != null) {
                ratings.get(action).add(entry.getUserFeedback().getRating());
            }
            if (entry.getOutcome() != null) {
                effectiveness.get(action).add(entry.getOutcome().isEffective());
            }
        }

        Map<String, PatternStats> patternStats = new LinkedHashMap<>();
        patternCounts.forEach((key, counts) -> patternStats.put(key, new PatternStats(counts[0], counts[1])));

        Map<String, ActionPerformance> performance = new LinkedHashMap<>();
        for (String action : ratings.keySet()) {
            List<Integer> actionRatings = ratings.get(action);
            List<Boolean> outcomes = effectiveness.get(action);
            double averageRating = actionRatings.stream().mapToInt(Integer::intValue).average().orElse(0);
            double effectiveRate = outcomes.isEmpty() ? 0
                    : (double) outcomes.stream().filter(Boolean::booleanValue).count() / outcomes.size();
            performance.put(action, new ActionPerformance(averageRating, effectiveRate, actionRatings.size(),
                    outcomes.size(), Math.max(actionRatings.size(), outcomes.size())));
        }

        return new LearningInsights(patternStats, performance, window.size(),
                recommendations(patternStats, performance, window.size()));
    }

    private List<String> recommendations(Map<String, PatternStats> patternStats,
            Map<String, ActionPerformance> performance, int totalSamples) {
        List<String> recommendations = new ArrayList<>();

        performance.forEach((action, perf) -> {
            if (perf.sampleSize() < ACTION_RECOMMENDATION_MIN_SAMPLES) {
                return;
            }
            if (perf.ratingCount() > 0 && perf.averageRating() < 2.5) {
                recommendations.add("Consider reducing frequency of " + action + " (low rating: "
                        + FeedbackReports.format1(perf.averageRating()) + "/5)");
            }
            if (perf.outcomeCount() > 0 && perf.effectivenessRate() < 0.3) {
                recommendations.add("Review parameters for " + action + " (low effectiveness: "
                        + FeedbackReports.percent(perf.effectivenessRate()) + ")");
            }
        });

        patternStats.forEach((pattern, stats) -> {
            if (stats.total() >= PATTERN_RECOMMENDATION_MIN_SAMPLES && stats.successRate() < 0.4) {
                recommendations.add("Pattern " + pattern + " has low success rate ("
                        + FeedbackReports.percent(stats.successRate()) + ") - consider adjusting thresholds");
            }
        });

        if (totalSamples < INSUFFICIENT_DATA_SAMPLES) {
            recommendations.add("Need more data for meaningful insights (current: " + totalSamples + " samples)");
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Performance looks good. Keep monitoring.");
        }
        return recommendations;
    }

    private FeedbackEntry findMatch(Instant timestamp, String action) {
        if (timestamp == null) {
            return null;
        }
        Duration tolerance = properties.getFeedback().getMatchTolerance();

        List<FeedbackEntry> nearest = new ArrayList<>();
        Duration best = null;
        for (FeedbackEntry entry : entries) {
            if (action != null && !action.equals(entry.actionName())) {
                continue;
            }
            Duration distance = Duration.between(entry.getTimestamp(), timestamp).abs();
            if (distance.compareTo(tolerance) > 0) {
                continue;
            }
            int cmp = best == null ? -1 : distance.compareTo(best);
            if (cmp < 0) {
                best = distance;
                nearest.clear();
                nearest.add(entry);
            } else if (cmp == 0) {
                nearest.add(entry);
            }
        }

        if (nearest.isEmpty()) {
            log.debug("[Feedback] No action within {} of {}", tolerance, timestamp);
            return null;
        }
        if (nearest.size() > 1) {
            log.warn("[Feedback] Ambiguous match for {}: {} actions at the same distance ({})", timestamp,
                    nearest.size(), nearest.stream().map(FeedbackEntry::actionName).toList());
            return null;
        }
        return nearest.get(0);
    }

    private void appendSnapshot(FeedbackEntry entry) {
        String file = SNAPSHOT_PREFIX + utcDate(entry.getTimestamp()) + ".jsonl";
        try {
            String json = objectMapper.writeValueAsString(entry);
            persist("feedback snapshot", storagePort.appendText(directory(), file, json + "\n"));
        } catch (JsonProcessingException e) {
            log.warn("[Feedback] Failed to serialize entry {}: {}", entry.getId(), e.getMessage());
        }
    }

    private void persist(String what, CompletableFuture<Void> write) {
        try {
            write.join();
        } catch (RuntimeException e) {
            log.warn("[Feedback] Failed to persist {}: {}", what, e.getMessage());
        }
    }

    private String toJson(Map<String, Object> parameters) {
        try {
            return objectMapper.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            return String.valueOf(parameters);
        }
    }

    private String entryKey(FeedbackEntry entry) {
        if (entry.getId() != null) {
            return entry.getId();
        }
        return entry.getTimestamp() + "|" + entry.actionName();
    }

    private String directory() {
        return properties.getFeedback().getDirectory();
    }

    private static LocalDate utcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
