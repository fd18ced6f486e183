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
import me.golemcore.sentinel.domain.model.ChatAnalysisResult;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.ModerationAction;
import me.golemcore.sentinel.domain.model.PatternType;
import me.golemcore.sentinel.domain.model.ToolDefinition;
import me.golemcore.sentinel.domain.service.OracleResponseParser.DecisionProposal;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.port.outbound.OraclePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns an analysis into concrete tool invocations.
 *
 * <p>
 * Flow per call:
 * <ol>
 * <li>Candidates: catalog tools that configuration permits and that are not on
 * cooldown. No candidates means no oracle call.</li>
 * <li>The oracle proposes actions as a JSON array. Proposals without action or
 * reason, naming a non-candidate tool, or targeting a pattern type absent from
 * the analysis are dropped.</li>
 * <li>Messages, polls, predictions and titles get a second oracle call to word
 * their parameters; canned parameters cover failures and any required
 * parameter left unset.</li>
 * <li>Every returned decision puts its tool on cooldown, whether or not it is
 * later executed successfully.</li>
 * </ol>
 *
 * <p>
 * When the selection call throws or its output cannot be parsed, fixed rules
 * apply instead: high-severity toxicity leads to the configured timeout or ban,
 * high-severity spam to a timeout. The rules never call the oracle.
 *
 * <p>
 * Not thread-safe on its own; the monitor serializes calls to
 * {@link #decide(ChatAnalysisResult)}.
 */
@Service
@Slf4j
public class DecisionEngine {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final double FALLBACK_CONFIDENCE = 0.6;
    private static final double FALLBACK_MIN_PATTERN_CONFIDENCE = 0.7;
    private static final int FALLBACK_TOXICITY_SEVERITY = 7;
    private static final int FALLBACK_SPAM_SEVERITY = 6;

    private static final Set<String> SYNTHESIZED_ACTIONS = Set.of(
            ToolCatalog.SEND_MESSAGE,
            ToolCatalog.CREATE_POLL,
            ToolCatalog.CREATE_PREDICTION,
            ToolCatalog.UPDATE_TITLE);

    private final OraclePort oraclePort;
    private final OracleResponseParser parser;
    private final ToolCatalog toolCatalog;
    private final SentinelProperties properties;
    private final Clock clock;

    private final Map<String, Instant> lastProposed = new ConcurrentHashMap<>();

    public DecisionEngine(OraclePort oraclePort, OracleResponseParser parser, ToolCatalog toolCatalog,
            SentinelProperties properties, Clock clock) {
        this.oraclePort = oraclePort;
        this.parser = parser;
        this.toolCatalog = toolCatalog;
        this.properties = properties;
        this.clock = clock;
    }

    public List<ActionDecision> decide(ChatAnalysisResult analysis) {
        Instant now = clock.instant();
        List<ToolDefinition> candidates = availableTools(now);
        if (candidates.isEmpty()) {
            log.debug("[Decision] No tools available (cooldowns/configuration)");
            return List.of();
        }

        List<ActionDecision> decisions;
        try {
            String response = oraclePort
                    .complete(DecisionPrompts.actionSelection(analysis, candidates, properties))
                    .join();
            List<DecisionProposal> proposals = parser.parseDecisions(response);
            decisions = fromProposals(proposals, analysis, candidates, now);
        } catch (OracleParseException e) {
            log.warn("[Decision] Unparseable action selection, applying fallback rules: {}", e.getMessage());
            decisions = fallbackDecisions(analysis, candidates, now);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Decision] Action selection failed, applying fallback rules: {}", cause.getMessage());
            decisions = fallbackDecisions(analysis, candidates, now);
        } catch (RuntimeException e) {
            log.warn("[Decision] Action selection failed, applying fallback rules: {}", e.getMessage());
            decisions = fallbackDecisions(analysis, candidates, now);
        }

        for (ActionDecision decision : decisions) {
            lastProposed.put(decision.action(), now);
        }
        if (!decisions.isEmpty()) {
            log.info("[Decision] {} decision(s): {}", decisions.size(),
                    decisions.stream().map(ActionDecision::action).collect(Collectors.joining(", ")));
        }
        return decisions;
    }

    /**
     * Remaining cooldown per catalog tool; {@link Duration#ZERO} when ready.
     */
    public Map<String, Duration> getCooldownStatus() {
        Instant now = clock.instant();
        Map<String, Duration> status = new LinkedHashMap<>();
        for (ToolDefinition tool : toolCatalog.getTools()) {
            status.put(tool.getName(), remainingCooldown(tool, now));
        }
        return status;
    }

    List<ToolDefinition> availableTools(Instant now) {
        return toolCatalog.getTools().stream()
                .filter(tool -> remainingCooldown(tool, now).isZero())
                .filter(toolCatalog::isPermitted)
                .toList();
    }

    private Duration remainingCooldown(ToolDefinition tool, Instant now) {
        Instant last = lastProposed.get(tool.getName());
        if (last == null || !tool.hasCooldown()) {
            return Duration.ZERO;
        }
        Duration remaining = tool.getCooldown().minus(Duration.between(last, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private List<ActionDecision> fromProposals(List<DecisionProposal> proposals, ChatAnalysisResult analysis,
            List<ToolDefinition> candidates, Instant now) {
        Map<String, ToolDefinition> byName = candidates.stream()
                .collect(Collectors.toMap(ToolDefinition::getName, Function.identity()));
        Set<String> claimed = new HashSet<>();
        List<ActionDecision> decisions = new ArrayList<>();

        for (DecisionProposal proposal : proposals) {
            if (isBlank(proposal.action()) || isBlank(proposal.reason())) {
                log.debug("[Decision] Dropping proposal without action or reason");
                continue;
            }
            ToolDefinition tool = byName.get(proposal.action());
            if (tool == null) {
                log.debug("[Decision] Dropping proposal for unavailable tool: {}", proposal.action());
                continue;
            }

            ChatPattern target = null;
            if (!isBlank(proposal.targetPattern())) {
                target = resolveTarget(proposal.targetPattern(), analysis);
                if (target == null) {
                    log.debug("[Decision] Dropping {}: target pattern '{}' not found", proposal.action(),
                            proposal.targetPattern());
                    continue;
                }
            }

            if (tool.hasCooldown() && !claimed.add(tool.getName())) {
                log.debug("[Decision] Dropping repeated proposal for {}", tool.getName());
                continue;
            }

            Map<String, Object> parameters = new LinkedHashMap<>(proposal.parameters());
            if (target != null && SYNTHESIZED_ACTIONS.contains(tool.getName())) {
                parameters.putAll(synthesizeParameters(tool.getName(), target, analysis));
            }
            fillRequired(tool, parameters, target);

            double confidence = proposal.confidence() != null
                    ? Math.max(0.0, Math.min(1.0, proposal.confidence()))
                    : DEFAULT_CONFIDENCE;

            decisions.add(ActionDecision.builder()
                    .action(tool.getName())
                    .parameters(parameters)
                    .reason(proposal.reason())
                    .confidence(confidence)
                    .patterns(target != null ? List.of(target) : List.of())
                    .timestamp(now)
                    .build());
        }
        return decisions;
    }

    private ChatPattern resolveTarget(String targetPattern, ChatAnalysisResult analysis) {
        PatternType type = PatternType.fromId(targetPattern).orElse(null);
        if (type == null) {
            return null;
        }
        return analysis.patterns().stream()
                .filter(p -> p.type() == type)
                .findFirst()
                .orElse(null);
    }

    private Map<String, Object> synthesizeParameters(String action, ChatPattern pattern,
            ChatAnalysisResult analysis) {
        try {
            String response = oraclePort
                    .complete(DecisionPrompts.parameterGeneration(action, pattern, context(pattern, analysis)))
                    .join();
            return parser.parseParameters(response);
        } catch (RuntimeException e) {
            log.debug("[Decision] Parameter synthesis failed for {}, using canned parameters: {}", action,
                    e.getMessage());
            return CannedParameters.forAction(action, pattern);
        }
    }

    private void fillRequired(ToolDefinition tool, Map<String, Object> parameters, ChatPattern pattern) {
        Map<String, Object> canned = null;
        for (String required : tool.getRequiredParameters()) {
            Object value = parameters.get(required);
            if (value == null || (value instanceof String s && s.isBlank())) {
                if (canned == null) {
                    canned = CannedParameters.forAction(tool.getName(), pattern);
                }
                parameters.put(required, canned.get(required));
            }
        }
    }

    private String context(ChatPattern pattern, ChatAnalysisResult analysis) {
        String mood = analysis.overallSentiment() > 0 ? "positive"
                : analysis.overallSentiment() < 0 ? "negative" : "neutral";
        List<String> parts = new ArrayList<>();
        parts.add("Overall chat sentiment: " + mood);
        parts.add("Activity level: " + analysis.activityLevel() + "/10");
        parts.add("Pattern confidence: " + pattern.confidence());
        parts.add("Severity: " + pattern.severity() + "/10");
        String reason = pattern.metadataText(ChatPattern.META_REASON);
        if (reason != null) {
            parts.add("Detected: " + reason);
        }
        return String.join(", ", parts);
    }

    private List<ActionDecision> fallbackDecisions(ChatAnalysisResult analysis, List<ToolDefinition> candidates,
            Instant now) {
        Set<String> available = candidates.stream().map(ToolDefinition::getName).collect(Collectors.toSet());
        SentinelProperties.RulesProperties rules = properties.getRules();
        Set<String> claimed = new HashSet<>();
        List<ActionDecision> decisions = new ArrayList<>();

        for (ChatPattern pattern : analysis.patterns()) {
            if (pattern.confidence() < FALLBACK_MIN_PATTERN_CONFIDENCE) {
                continue;
            }

            String action;
            String paramReason;
            Integer duration;
            if (pattern.type() == PatternType.TOXICITY && pattern.severity() >= FALLBACK_TOXICITY_SEVERITY
                    && rules.getToxicityDetection().isEnabled()) {
                action = rules.getToxicityDetection().getAction() == ModerationAction.BAN
                        ? ToolCatalog.BAN_USER
                        : ToolCatalog.TIMEOUT_USER;
                paramReason = "Toxic behavior detected";
                duration = rules.getToxicityDetection().getDuration();
            } else if (pattern.type() == PatternType.SPAM && pattern.severity() >= FALLBACK_SPAM_SEVERITY
                    && rules.getSpamDetection().isEnabled()) {
                action = ToolCatalog.TIMEOUT_USER;
                paramReason = "Spam detected";
                duration = rules.getSpamDetection().getDuration();
            } else {
                continue;
            }

            if (!available.contains(action) || !claimed.add(action + ':' + pattern.firstUser())) {
                continue;
            }

            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("usernameOrDescriptor", pattern.firstUser());
            parameters.put("reason", paramReason);
            if (ToolCatalog.TIMEOUT_USER.equals(action) && duration != null) {
                parameters.put("duration", duration);
            }

            decisions.add(ActionDecision.builder()
                    .action(action)
                    .parameters(parameters)
                    .reason(String.format(Locale.ROOT, "Fallback action for %s (%d/10)",
                            pattern.type() == PatternType.TOXICITY ? "high toxicity" : "spam",
                            pattern.severity()))
                    .confidence(FALLBACK_CONFIDENCE)
                    .patterns(List.of(pattern))
                    .timestamp(now)
                    .build());
        }
        return decisions;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
