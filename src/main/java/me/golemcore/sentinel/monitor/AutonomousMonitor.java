package me.golemcore.sentinel.monitor;

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
import me.golemcore.sentinel.domain.model.ActionResult;
import me.golemcore.sentinel.domain.model.AutonomousState;
import me.golemcore.sentinel.domain.model.ChatAnalysisResult;
import me.golemcore.sentinel.domain.model.ChatMessage;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.FeedbackSource;
import me.golemcore.sentinel.domain.model.ForcedAnalysisResult;
import me.golemcore.sentinel.domain.model.LearningInsights;
import me.golemcore.sentinel.domain.model.MonitorDiagnostics;
import me.golemcore.sentinel.domain.model.SuccessMetrics;
import me.golemcore.sentinel.domain.service.DecisionEngine;
import me.golemcore.sentinel.domain.service.FeedbackStore;
import me.golemcore.sentinel.domain.service.MessageWindow;
import me.golemcore.sentinel.domain.service.PatternAnalyzer;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.port.outbound.ActionExecutorPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the autonomous loop: message window, pattern analysis, decisions,
 * sequential execution and feedback recording.
 *
 * <p>
 * Lifecycle:
 * <ul>
 * <li>{@link #start()} schedules a cycle every
 * {@code sentinel.monitoring-interval} and daily maintenance at the next local
 * midnight. No-op when already running or when {@code sentinel.enabled} is
 * false.</li>
 * <li>{@link #stop()} cancels both timers without interrupting a cycle in
 * flight and writes a best-effort daily report.</li>
 * </ul>
 *
 * <p>
 * Periodic and forced cycles share one lock, so the cooldown ledger, recent
 * actions and statistics are only ever mutated by one cycle at a time.
 * Decisions of a cycle execute strictly in order with a pause between them;
 * only successful executions are recorded. Any failure inside a cycle is
 * logged and the next cycle runs normally.
 *
 * @since 1.0
 * @see PatternAnalyzer
 * @see DecisionEngine
 * @see FeedbackStore
 */
@Component
@Slf4j
public class AutonomousMonitor {

    static final double SIGNIFICANT_CONFIDENCE = 0.6;
    static final int SIGNIFICANT_SEVERITY = 5;
    private static final int RECENT_ACTIONS_CAP = 50;

    private final PatternAnalyzer patternAnalyzer;
    private final DecisionEngine decisionEngine;
    private final FeedbackStore feedbackStore;
    private final ActionExecutorPort actionExecutor;
    private final SentinelProperties properties;
    private final Clock clock;
    private final MessageWindow window;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final Object lifecycleLock = new Object();
    private final Object stateLock = new Object();

    private volatile boolean running;
    private volatile boolean active;

    // guarded by stateLock
    private Instant lastAnalysis;
    private final List<ActionDecision> recentActions = new ArrayList<>();
    private int actionsToday;
    private double averageConfidence;
    private String mostCommonAction = "";

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> cycleTask;
    private ScheduledFuture<?> maintenanceTask;

    public AutonomousMonitor(PatternAnalyzer patternAnalyzer, DecisionEngine decisionEngine,
            FeedbackStore feedbackStore, ActionExecutorPort actionExecutor, SentinelProperties properties,
            Clock clock) {
        this.patternAnalyzer = patternAnalyzer;
        this.decisionEngine = decisionEngine;
        this.feedbackStore = feedbackStore;
        this.actionExecutor = actionExecutor;
        this.properties = properties;
        this.clock = clock;
        SentinelProperties.WindowProperties windowConfig = properties.getWindow();
        this.window = new MessageWindow(windowConfig.getCapacity(), windowConfig.getUserHistoryHorizon(),
                windowConfig.getRateWindow(), clock);
        this.lastAnalysis = clock.instant();
    }

    @PostConstruct
    public void init() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                scheduler = null;
            }
        }
        log.info("[Monitor] Shut down");
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Monitor] Already running");
                return;
            }
            if (!properties.isEnabled()) {
                log.info("[Monitor] Monitoring disabled (sentinel.enabled=false)");
                return;
            }

            if (scheduler == null) {
                scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "sentinel-monitor");
                    t.setDaemon(true);
                    return t;
                });
            }

            running = true;
            active = true;

            long intervalMs = Math.max(1, properties.getMonitoringInterval().toMillis());
            cycleTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

            long untilMidnightMs = untilNextLocalMidnight().toMillis();
            maintenanceTask = scheduler.scheduleAtFixedRate(this::maintenanceTick, untilMidnightMs,
                    Duration.ofDays(1).toMillis(), TimeUnit.MILLISECONDS);

            log.info("[Monitor] Started with interval {}ms, next maintenance in {}min", intervalMs,
                    untilMidnightMs / 60000);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                log.debug("[Monitor] Not running");
                return;
            }
            running = false;
            active = false;

            if (cycleTask != null) {
                cycleTask.cancel(false);
                cycleTask = null;
            }
            if (maintenanceTask != null) {
                maintenanceTask.cancel(false);
                maintenanceTask = null;
            }
        }

        try {
            feedbackStore.generateDailyReport(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
        } catch (RuntimeException e) {
            log.warn("[Monitor] Final daily report failed: {}", e.getMessage());
        }
        log.info("[Monitor] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public void ingest(ChatMessage message) {
        if (!properties.isEnabled()) {
            return;
        }
        window.ingest(message);
    }

    public void ingestAll(Collection<ChatMessage> messages) {
        if (!properties.isEnabled()) {
            return;
        }
        window.ingestAll(messages);
    }

    /**
     * One periodic cycle. Skipped while inactive or when the window is empty;
     * only significant patterns reach the decision engine.
     *
     * @return decisions that executed successfully
     */
    public List<ActionDecision> runCycle() {
        if (!active || !properties.isEnabled() || window.isEmpty()) {
            return List.of();
        }

        cycleLock.lock();
        try {
            if (!active) {
                log.debug("[Monitor] Stopped while waiting for the cycle lock, skipping");
                return List.of();
            }
            ChatAnalysisResult analysis = analyzeWindow();

            List<ChatPattern> significant = analysis.patterns().stream()
                    .filter(p -> p.confidence() >= SIGNIFICANT_CONFIDENCE
                            && (p.severity() >= SIGNIFICANT_SEVERITY || analysis.needsAttention()))
                    .toList();
            if (significant.isEmpty()) {
                return List.of();
            }
            log.info("[Monitor] {} significant pattern(s) detected", significant.size());

            List<ActionDecision> decisions = decisionEngine.decide(analysis.withPatterns(significant));
            if (decisions.isEmpty()) {
                return List.of();
            }
            log.info("[Monitor] Planning {} action(s)", decisions.size());

            return executeAndRecord(decisions);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs analysis, decisions and execution immediately, without the
     * significance filter. Serialized with periodic cycles.
     */
    public ForcedAnalysisResult forceAnalysis() {
        if (!properties.isEnabled()) {
            return ForcedAnalysisResult.empty();
        }
        log.info("[Monitor] Forcing immediate analysis");

        cycleLock.lock();
        try {
            ChatAnalysisResult analysis = analyzeWindow();
            log.info("[Monitor] Analysis: {} patterns, needs attention: {}", analysis.patterns().size(),
                    analysis.needsAttention());

            List<ActionDecision> decisions = decisionEngine.decide(analysis);
            List<ActionDecision> executed = decisions.isEmpty() ? List.of() : executeAndRecord(decisions);
            log.info("[Monitor] Forced analysis executed {}/{} decision(s)", executed.size(), decisions.size());
            return new ForcedAnalysisResult(analysis, decisions, executed);
        } finally {
            cycleLock.unlock();
        }
    }

    public AutonomousState getState() {
        SuccessMetrics metrics = feedbackStore.calculateSuccessMetrics();
        AutonomousState.LearningData learningData = feedbackStore.buildLearningData();
        synchronized (stateLock) {
            return AutonomousState.builder()
                    .active(active)
                    .lastAnalysis(lastAnalysis)
                    .recentActions(List.copyOf(recentActions))
                    .learningData(learningData)
                    .statistics(AutonomousState.Statistics.builder()
                            .actionsToday(actionsToday)
                            .successRate(metrics.successRate())
                            .averageConfidence(averageConfidence)
                            .mostCommonAction(mostCommonAction)
                            .build())
                    .build();
        }
    }

    public boolean addUserFeedback(Instant actionTimestamp, int rating, String comment, FeedbackSource source) {
        return feedbackStore.addUserFeedback(actionTimestamp, rating, comment, source);
    }

    public boolean addUserFeedback(Instant actionTimestamp, int rating, String comment, FeedbackSource source,
            String action) {
        return feedbackStore.addUserFeedback(actionTimestamp, rating, comment, source, action);
    }

    public boolean recordActionOutcome(Instant actionTimestamp, boolean effective, String chatResponse,
            List<String> sideEffects) {
        return feedbackStore.recordOutcome(actionTimestamp, effective, chatResponse, sideEffects);
    }

    public boolean recordActionOutcome(Instant actionTimestamp, boolean effective, String chatResponse,
            List<String> sideEffects, String action) {
        return feedbackStore.recordOutcome(actionTimestamp, effective, chatResponse, sideEffects, action);
    }

    public String generatePerformanceReport() {
        SuccessMetrics metrics = feedbackStore.calculateSuccessMetrics();
        LearningInsights insights = feedbackStore.generateLearningInsights();
        Map<String, Duration> cooldowns = decisionEngine.getCooldownStatus();

        StringBuilder sb = new StringBuilder();
        sb.append("# Sentinel Performance Report\n\n");
        sb.append("*Generated: ").append(clock.instant()).append("*\n\n");

        synchronized (stateLock) {
            sb.append("## Current Status\n\n");
            sb.append("- **Active:** ").append(active ? "yes" : "no").append("\n");
            sb.append("- **Last Analysis:** ").append(lastAnalysis).append("\n");
            sb.append("- **Recent Actions:** ").append(recentActions.size()).append("\n");
            sb.append("- **Actions Today:** ").append(actionsToday).append("\n\n");
        }

        sb.append("## Performance Metrics (7 days)\n\n");
        sb.append("- **Total Actions:** ").append(metrics.totalActions()).append("\n");
        sb.append("- **Success Rate:** ")
                .append(String.format(Locale.ROOT, "%.1f%%", metrics.successRate() * 100)).append("\n");
        sb.append("- **Average Rating:** ")
                .append(String.format(Locale.ROOT, "%.1f", metrics.averageRating())).append("/5\n\n");

        if (!metrics.mostSuccessfulActions().isEmpty()) {
            sb.append("### Most Successful Actions\n");
            metrics.mostSuccessfulActions().forEach(a -> sb.append("- ").append(a).append("\n"));
            sb.append("\n");
        }
        if (!metrics.leastSuccessfulActions().isEmpty()) {
            sb.append("### Least Successful Actions\n");
            metrics.leastSuccessfulActions().forEach(a -> sb.append("- ").append(a).append("\n"));
            sb.append("\n");
        }

        sb.append("## Tool Cooldown Status\n\n");
        cooldowns.forEach((tool, remaining) -> sb.append("- **").append(tool).append(":** ")
                .append(remaining.isZero() ? "Ready" : remaining.toSeconds() + "s remaining").append("\n"));
        sb.append("\n");

        sb.append(feedbackStore.renderInsights(insights));
        return sb.toString();
    }

    public MonitorDiagnostics getDiagnostics() {
        return new MonitorDiagnostics(running, active, window.size(), decisionEngine.getCooldownStatus(),
                patternAnalyzer.getPatternTrends());
    }

    /**
     * Daily report for the day that just ended, learning insights, retention
     * sweep and the reset of today's action counter.
     */
    public void runDailyMaintenance() {
        log.info("[Monitor] Running daily maintenance");
        LocalDate reportDate = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        try {
            feedbackStore.generateDailyReport(reportDate);
            feedbackStore.generateLearningInsights();
            feedbackStore.cleanup(properties.getFeedback().getRetentionDays());
        } finally {
            synchronized (stateLock) {
                actionsToday = 0;
            }
        }
        log.info("[Monitor] Daily maintenance completed");
    }

    private void tick() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("[Monitor] Cycle failed", e);
        }
    }

    private void maintenanceTick() {
        try {
            runDailyMaintenance();
        } catch (Exception e) {
            log.error("[Monitor] Daily maintenance failed", e);
        }
    }

    private ChatAnalysisResult analyzeWindow() {
        ChatAnalysisResult analysis = patternAnalyzer.analyze(window.snapshot(), window.userRates());
        synchronized (stateLock) {
            lastAnalysis = clock.instant();
        }
        return analysis;
    }

    private List<ActionDecision> executeAndRecord(List<ActionDecision> decisions) {
        List<ActionDecision> executed = new ArrayList<>();
        for (int i = 0; i < decisions.size(); i++) {
            if (i > 0 && !pauseBetweenActions()) {
                log.warn("[Monitor] Interrupted, skipping {} remaining action(s)", decisions.size() - i);
                break;
            }
            ActionDecision decision = decisions.get(i);
            try {
                log.info("[Monitor] Executing {} (confidence {})", decision.action(), decision.confidence());
                ActionResult result = actionExecutor.execute(decision.action(), decision.parameters()).join();
                if (result != null && result.success()) {
                    executed.add(decision);
                    feedbackStore.recordAction(decision);
                    log.info("[Monitor] Executed {}: {}", decision.action(), decision.reason());
                } else {
                    log.warn("[Monitor] {} failed: {}", decision.action(),
                            result != null ? result.error() : "no result");
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Monitor] {} failed: {}", decision.action(), cause.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Monitor] {} failed: {}", decision.action(), e.getMessage());
            }
        }

        if (!executed.isEmpty()) {
            updateStatistics(executed);
        }
        return executed;
    }

    private void updateStatistics(List<ActionDecision> executed) {
        synchronized (stateLock) {
            recentActions.addAll(executed);
            while (recentActions.size() > RECENT_ACTIONS_CAP) {
                recentActions.remove(0);
            }

            actionsToday += executed.size();
            averageConfidence = executed.stream().mapToDouble(ActionDecision::confidence).average().orElse(0);

            Map<String, Integer> counts = new LinkedHashMap<>();
            for (ActionDecision action : recentActions) {
                counts.merge(action.action(), 1, Integer::sum);
            }
            int best = 0;
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                if (entry.getValue() > best) {
                    best = entry.getValue();
                    mostCommonAction = entry.getKey();
                }
            }
        }
    }

    /**
     * @return false once the executing thread has been interrupted
     */
    private boolean pauseBetweenActions() {
        long pauseMs = properties.getActionPause().toMillis();
        if (pauseMs > 0) {
            try {
                Thread.sleep(pauseMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return !Thread.currentThread().isInterrupted();
    }

    private Duration untilNextLocalMidnight() {
        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime midnight = now.toLocalDate().plusDays(1).atStartOfDay(zone);
        return Duration.between(now, midnight);
    }
}
