package me.golemcore.sentinel.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sentinel.domain.model.ActionDecision;
import me.golemcore.sentinel.domain.model.ChatAnalysisResult;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.ModerationAction;
import me.golemcore.sentinel.domain.model.PatternType;
import me.golemcore.sentinel.domain.model.ToolDefinition;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.testsupport.MutableClock;
import me.golemcore.sentinel.testsupport.ScriptedOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionEngineTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String BAN_PROPOSAL = "[{\"action\": \"banUser\", \"parameters\": "
            + "{\"usernameOrDescriptor\": \"u1\", \"reason\": \"harassment\"}, \"reason\": \"Severe toxicity\", "
            + "\"confidence\": 0.9, \"targetPattern\": \"toxicity\"}]";

    private ScriptedOracle oracle;
    private MutableClock clock;
    private SentinelProperties properties;
    private DecisionEngine engine;

    @BeforeEach
    void setUp() {
        oracle = new ScriptedOracle();
        clock = new MutableClock(FIXED_NOW);
        properties = new SentinelProperties();
        engine = new DecisionEngine(oracle, new OracleResponseParser(new ObjectMapper()),
                new ToolCatalog(properties), properties, clock);
    }

    @Test
    void shouldAcceptValidProposal() {
        oracle.reply(ScriptedOracle.DECISION, BAN_PROPOSAL);
        ChatPattern toxic = pattern(PatternType.TOXICITY, 9, 0.9);

        List<ActionDecision> decisions = engine.decide(analysis(toxic));

        assertEquals(1, decisions.size());
        ActionDecision decision = decisions.get(0);
        assertEquals(ToolCatalog.BAN_USER, decision.action());
        assertEquals("u1", decision.parameters().get("usernameOrDescriptor"));
        assertEquals("Severe toxicity", decision.reason());
        assertEquals(0.9, decision.confidence(), 0.0001);
        assertEquals(List.of(toxic), decision.patterns());
        assertEquals(FIXED_NOW, decision.timestamp());
    }

    @Test
    void shouldKeepBanOnCooldownForFiveMinutes() {
        oracle.reply(ScriptedOracle.DECISION, BAN_PROPOSAL);
        ChatAnalysisResult analysis = analysis(pattern(PatternType.TOXICITY, 9, 0.9));

        assertEquals(1, engine.decide(analysis).size());

        clock.advance(Duration.ofMinutes(4));
        assertFalse(toolNames(engine.availableTools(clock.instant())).contains(ToolCatalog.BAN_USER));
        assertTrue(engine.decide(analysis).isEmpty());
        assertEquals(Duration.ofMinutes(1), engine.getCooldownStatus().get(ToolCatalog.BAN_USER));

        clock.advance(Duration.ofMinutes(2));
        assertTrue(toolNames(engine.availableTools(clock.instant())).contains(ToolCatalog.BAN_USER));
        assertEquals(Duration.ZERO, engine.getCooldownStatus().get(ToolCatalog.BAN_USER));
    }

    @Test
    void shouldCreateAtMostOnePollWithinPollCooldown() {
        properties.getRules().getPollAutomation().setEnabled(true);
        oracle.reply(ScriptedOracle.DECISION, "[{\"action\": \"createTwitchPoll\", \"reason\": \"Viewers want a vote\","
                + " \"targetPattern\": \"question\"},"
                + " {\"action\": \"createTwitchPoll\", \"reason\": \"Again\", \"targetPattern\": \"question\"}]")
                .reply(ScriptedOracle.PARAMETERS,
                        "{\"title\": \"Next game?\", \"choices\": \"Chess, Golf\", \"duration\": 120}");
        ChatAnalysisResult analysis = analysis(pattern(PatternType.QUESTION, 7, 0.7));

        List<ActionDecision> all = new ArrayList<>(engine.decide(analysis));
        clock.advance(Duration.ofMinutes(10));
        all.addAll(engine.decide(analysis));

        List<ActionDecision> polls = all.stream()
                .filter(d -> ToolCatalog.CREATE_POLL.equals(d.action()))
                .toList();
        assertEquals(1, polls.size());
        assertEquals("Next game?", polls.get(0).parameters().get("title"));
        assertEquals(120, polls.get(0).parameters().get("duration"));
    }

    @Test
    void shouldApplyFallbackWhenOracleFails() {
        oracle.fail(ScriptedOracle.DECISION);
        ChatPattern toxic = pattern(PatternType.TOXICITY, 8, 0.8);

        List<ActionDecision> decisions = engine.decide(analysis(toxic));

        assertEquals(1, decisions.size());
        ActionDecision decision = decisions.get(0);
        assertEquals(ToolCatalog.TIMEOUT_USER, decision.action());
        assertEquals(DecisionEngine.FALLBACK_CONFIDENCE, decision.confidence(), 0.0001);
        assertEquals("Fallback action for high toxicity (8/10)", decision.reason());
        assertEquals("u1", decision.parameters().get("usernameOrDescriptor"));
        assertEquals("Toxic behavior detected", decision.parameters().get("reason"));
        assertEquals(300, decision.parameters().get("duration"));
        assertEquals(List.of(toxic), decision.patterns());
    }

    @Test
    void shouldApplyFallbackWhenSelectionIsUnparseable() {
        oracle.reply(ScriptedOracle.DECISION, "I would ban them all");

        List<ActionDecision> decisions = engine.decide(analysis(pattern(PatternType.SPAM, 6, 0.8)));

        assertEquals(1, decisions.size());
        assertEquals(ToolCatalog.TIMEOUT_USER, decisions.get(0).action());
        assertEquals("Fallback action for spam (6/10)", decisions.get(0).reason());
        assertEquals(60, decisions.get(0).parameters().get("duration"));
    }

    @Test
    void shouldBanInFallbackWhenConfigured() {
        properties.getRules().getToxicityDetection().setAction(ModerationAction.BAN);
        oracle.fail(ScriptedOracle.DECISION);

        List<ActionDecision> decisions = engine.decide(analysis(pattern(PatternType.TOXICITY, 9, 0.9)));

        assertEquals(1, decisions.size());
        assertEquals(ToolCatalog.BAN_USER, decisions.get(0).action());
        assertFalse(decisions.get(0).parameters().containsKey("duration"));
    }

    @Test
    void shouldSkipWeakOrDuplicatePatternsInFallback() {
        oracle.fail(ScriptedOracle.DECISION);
        ChatAnalysisResult analysis = analysis(
                pattern(PatternType.SPAM, 9, 0.6),
                pattern(PatternType.TOXICITY, 6, 0.9),
                pattern(PatternType.SPAM, 7, 0.8),
                pattern(PatternType.SPAM, 8, 0.8));

        List<ActionDecision> decisions = engine.decide(analysis);

        assertEquals(1, decisions.size());
        assertEquals("Fallback action for spam (7/10)", decisions.get(0).reason());
    }

    @Test
    void shouldTimeOutEachOffenderInFallback() {
        oracle.fail(ScriptedOracle.DECISION);
        ChatAnalysisResult analysis = analysis(
                pattern(PatternType.TOXICITY, 8, 0.8, "u1"),
                pattern(PatternType.TOXICITY, 8, 0.8, "u2"),
                pattern(PatternType.SPAM, 7, 0.8, "u2"));

        List<ActionDecision> decisions = engine.decide(analysis);

        assertEquals(2, decisions.size());
        assertEquals(List.of("u1", "u2"), decisions.stream()
                .map(decision -> decision.parameters().get("usernameOrDescriptor"))
                .toList());
        assertTrue(decisions.stream().allMatch(decision -> ToolCatalog.TIMEOUT_USER.equals(decision.action())));
    }

    @Test
    void shouldDropProposalWithUnresolvedTarget() {
        oracle.reply(ScriptedOracle.DECISION, "[{\"action\": \"timeoutUser\", \"reason\": \"spam\","
                + " \"targetPattern\": \"spam\"}]");

        List<ActionDecision> decisions = engine.decide(analysis(pattern(PatternType.TOXICITY, 5, 0.9)));

        assertTrue(decisions.isEmpty());
    }

    @Test
    void shouldDropInvalidProposals() {
        oracle.reply(ScriptedOracle.DECISION, "[{\"action\": \"timeoutUser\"},"
                + " {\"reason\": \"no action\"},"
                + " {\"action\": \"launchRockets\", \"reason\": \"fun\"},"
                + " {\"action\": \"createTwitchPoll\", \"reason\": \"polls are off\"}]");

        List<ActionDecision> decisions = engine.decide(analysis(pattern(PatternType.TOXICITY, 5, 0.9)));

        assertTrue(decisions.isEmpty());
    }

    @Test
    void shouldUseCannedParametersWhenSynthesisFails() {
        oracle.reply(ScriptedOracle.DECISION, "[{\"action\": \"sendMessageToChat\", \"reason\": \"Answer viewer\","
                + " \"targetPattern\": \"question\"}]")
                .fail(ScriptedOracle.PARAMETERS);

        List<ActionDecision> decisions = engine.decide(analysis(pattern(PatternType.QUESTION, 7, 0.7)));

        assertEquals(1, decisions.size());
        assertEquals("Thanks for the question! Let me think about that...",
                decisions.get(0).parameters().get("message"));
        assertEquals(DecisionEngine.DEFAULT_CONFIDENCE, decisions.get(0).confidence(), 0.0001);
        assertEquals(1, oracle.countPrompts(ScriptedOracle.PARAMETERS));
    }

    @Test
    void shouldFillMissingRequiredParametersAndClampConfidence() {
        oracle.reply(ScriptedOracle.DECISION, "[{\"action\": \"createTwitchPrediction\", \"reason\": \"Hype\","
                + " \"confidence\": 1.7, \"parameters\": {\"title\": \"Boss down first try?\"}}]");

        List<ActionDecision> decisions = engine.decide(analysis());

        assertEquals(1, decisions.size());
        Map<String, Object> parameters = decisions.get(0).parameters();
        assertEquals("Boss down first try?", parameters.get("title"));
        assertEquals("Yes, No", parameters.get("outcomes"));
        assertEquals(300, parameters.get("duration"));
        assertEquals(1.0, decisions.get(0).confidence(), 0.0001);
        assertEquals(0, oracle.countPrompts(ScriptedOracle.PARAMETERS));
    }

    @Test
    void shouldNotCallOracleWhenNoToolIsAvailable() {
        properties.getRules().getChatEngagement().setEnabled(false);
        properties.getRules().getSpamDetection().setEnabled(false);
        properties.getRules().getToxicityDetection().setEnabled(false);
        oracle.reply(ScriptedOracle.DECISION, "["
                + "{\"action\": \"createTwitchPrediction\", \"reason\": \"r\"},"
                + "{\"action\": \"createTwitchClip\", \"reason\": \"r\"},"
                + "{\"action\": \"updateStreamTitle\", \"reason\": \"r\"},"
                + "{\"action\": \"updateStreamCategory\", \"reason\": \"r\"}]");

        assertEquals(4, engine.decide(analysis()).size());
        assertEquals(1, oracle.countPrompts(ScriptedOracle.DECISION));

        assertTrue(engine.decide(analysis()).isEmpty());
        assertEquals(1, oracle.countPrompts(ScriptedOracle.DECISION));
    }

    @Test
    void shouldListOnlyPermittedToolsInSelectionPrompt() {
        oracle.reply(ScriptedOracle.DECISION, "[]");

        engine.decide(analysis(pattern(PatternType.QUESTION, 6, 0.7)));

        String prompt = oracle.prompts().get(0);
        assertTrue(prompt.contains(ToolCatalog.SEND_MESSAGE));
        assertFalse(prompt.contains(ToolCatalog.CREATE_POLL));
    }

    private ChatAnalysisResult analysis(ChatPattern... patterns) {
        return new ChatAnalysisResult(List.of(patterns), 0.2, 6, false, List.of());
    }

    private ChatPattern pattern(PatternType type, int severity, double confidence) {
        return pattern(type, severity, confidence, "u1");
    }

    private ChatPattern pattern(PatternType type, int severity, double confidence, String user) {
        return ChatPattern.builder()
                .type(type)
                .severity(severity)
                .confidence(confidence)
                .users(List.of(user))
                .messages(List.of("message from " + user))
                .timestamp(FIXED_NOW)
                .metadata(Map.of(ChatPattern.META_REASON, type.id() + " detected"))
                .build();
    }

    private List<String> toolNames(List<ToolDefinition> tools) {
        return tools.stream().map(ToolDefinition::getName).toList();
    }
}
