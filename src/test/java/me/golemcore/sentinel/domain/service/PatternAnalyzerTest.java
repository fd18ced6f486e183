package me.golemcore.sentinel.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sentinel.domain.model.ChatAnalysisResult;
import me.golemcore.sentinel.domain.model.ChatMessage;
import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.PatternType;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.testsupport.MutableClock;
import me.golemcore.sentinel.testsupport.ScriptedOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternAnalyzerTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String CALM_SENTIMENT = "{\"overallSentiment\": 0.1}";
    private static final String CALM_ACTIVITY = "{\"activityLevel\": 4, \"description\": \"steady\", "
            + "\"recommendations\": []}";

    private ScriptedOracle oracle;
    private MutableClock clock;
    private PatternAnalyzer analyzer;
    private List<ChatMessage> batch;

    @BeforeEach
    void setUp() {
        oracle = new ScriptedOracle();
        clock = new MutableClock(FIXED_NOW);
        analyzer = new PatternAnalyzer(oracle, new OracleResponseParser(new ObjectMapper()),
                new SentinelProperties(), clock);
        batch = List.of(
                ChatMessage.of("alice", "hello everyone", FIXED_NOW),
                ChatMessage.of("bob", "you are trash", FIXED_NOW),
                ChatMessage.of("carol", "what game is next?", FIXED_NOW));
    }

    private void calmChat() {
        oracle.reply(ScriptedOracle.TOXICITY, "[]")
                .reply(ScriptedOracle.SPAM, "[]")
                .reply(ScriptedOracle.ENGAGEMENT, "[]")
                .reply(ScriptedOracle.SENTIMENT, CALM_SENTIMENT)
                .reply(ScriptedOracle.ACTIVITY, CALM_ACTIVITY);
    }

    @Test
    void shouldReturnNeutralForEmptyBatchWithoutCallingOracle() {
        ChatAnalysisResult result = analyzer.analyze(List.of());

        assertTrue(result.patterns().isEmpty());
        assertEquals(0.0, result.activityLevel(), 0.0001);
        assertEquals(List.of(PatternAnalyzer.NO_ACTIVITY), result.recommendations());
        assertTrue(oracle.prompts().isEmpty());
    }

    @Test
    void shouldReturnHealthyResultForCalmChat() {
        calmChat();

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertTrue(result.patterns().isEmpty());
        assertFalse(result.needsAttention());
        assertEquals(0.1, result.overallSentiment(), 0.0001);
        assertEquals(4.0, result.activityLevel(), 0.0001);
        assertEquals(List.of(PatternAnalyzer.HEALTHY), result.recommendations());
        assertEquals(5, oracle.prompts().size());
    }

    @Test
    void shouldBuildToxicityPatternFromFinding() {
        calmChat();
        oracle.reply(ScriptedOracle.TOXICITY, "[{\"messageIndex\": 2, \"toxicityScore\": 8, "
                + "\"reason\": \"insult\", \"action\": \"timeout\"}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertEquals(1, result.patterns().size());
        ChatPattern pattern = result.patterns().get(0);
        assertEquals(PatternType.TOXICITY, pattern.type());
        assertEquals(8, pattern.severity());
        assertEquals(0.9, pattern.confidence(), 0.0001);
        assertEquals(List.of("bob"), pattern.users());
        assertEquals(List.of("you are trash"), pattern.messages());
        assertEquals("insult", pattern.metadata().get(ChatPattern.META_REASON));
        assertEquals("timeout", pattern.metadata().get(ChatPattern.META_RECOMMENDED_ACTION));
        assertEquals(true, pattern.metadata().get(ChatPattern.META_AI_GENERATED));
        assertTrue(result.needsAttention());
        assertTrue(result.recommendations().contains("timeout bob - insult"));
    }

    @Test
    void shouldDropFindingsBelowMaterialityFloors() {
        calmChat();
        oracle.reply(ScriptedOracle.TOXICITY, "[{\"messageIndex\": 2, \"toxicityScore\": 3}]")
                .reply(ScriptedOracle.SPAM, "[{\"messageIndex\": 1, \"spamScore\": 2}]")
                .reply(ScriptedOracle.ENGAGEMENT, "[{\"messageIndex\": 3, \"engagementScore\": 5}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertTrue(result.patterns().isEmpty());
    }

    @Test
    void shouldCompareUnroundedScoresAgainstFloors() {
        calmChat();
        oracle.reply(ScriptedOracle.TOXICITY, "[{\"messageIndex\": 2, \"toxicityScore\": 3.6}]")
                .reply(ScriptedOracle.SPAM, "[{\"messageIndex\": 1, \"spamScore\": 3.5}]")
                .reply(ScriptedOracle.ENGAGEMENT, "[{\"messageIndex\": 3, \"engagementScore\": 5.5}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertTrue(result.patterns().isEmpty());
    }

    @Test
    void shouldRoundSeverityOnlyAfterPassingFloor() {
        calmChat();
        oracle.reply(ScriptedOracle.TOXICITY, "[{\"messageIndex\": 2, \"toxicityScore\": 6.6}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertEquals(1, result.patterns().size());
        assertEquals(7, result.patterns().get(0).severity());
    }

    @Test
    void shouldCreateQuestionPatternAtEngagementFloor() {
        calmChat();
        oracle.reply(ScriptedOracle.ENGAGEMENT, "[{\"messageIndex\": 3, \"engagementScore\": 6, "
                + "\"suggestedResponse\": \"Answer carol about the next game\"}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertEquals(1, result.patterns().size());
        ChatPattern pattern = result.patterns().get(0);
        assertEquals(PatternType.QUESTION, pattern.type());
        assertEquals(0.7, pattern.confidence(), 0.0001);
        assertEquals("Answer carol about the next game",
                pattern.metadata().get(ChatPattern.META_SUGGESTED_RESPONSE));
        assertFalse(result.needsAttention());
        assertTrue(result.recommendations().contains("Answer carol about the next game"));
    }

    @Test
    void shouldIgnoreOutOfRangeMessageIndexes() {
        calmChat();
        oracle.reply(ScriptedOracle.TOXICITY, "[{\"messageIndex\": 0, \"toxicityScore\": 9},"
                + "{\"messageIndex\": 4, \"toxicityScore\": 9}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertTrue(result.patterns().isEmpty());
    }

    @Test
    void shouldKeepOtherQueriesWhenOneFails() {
        calmChat();
        oracle.fail(ScriptedOracle.SENTIMENT)
                .reply(ScriptedOracle.SPAM, "[{\"messageIndex\": 1, \"spamScore\": 7}]");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertEquals(1, result.patterns().size());
        assertEquals(PatternType.SPAM, result.patterns().get(0).type());
        assertEquals(0.0, result.overallSentiment(), 0.0001);
        assertTrue(result.needsAttention());
    }

    @Test
    void shouldUseNeutralActivityWhenActivityResponseIsMalformed() {
        calmChat();
        oracle.reply(ScriptedOracle.ACTIVITY, "I think the chat is fine");

        ChatAnalysisResult result = analyzer.analyze(batch);

        assertEquals(5.0, result.activityLevel(), 0.0001);
        assertTrue(result.recommendations().contains("Activity: " + PatternAnalyzer.DEGRADED_ACTIVITY));
    }

    @Test
    void shouldReturnNeutralWhenEveryOracleCallFails() {
        ScriptedOracle failing = ScriptedOracle.failingEverything();
        PatternAnalyzer degraded = new PatternAnalyzer(failing, new OracleResponseParser(new ObjectMapper()),
                new SentinelProperties(), clock);

        ChatAnalysisResult result = degraded.analyze(batch);

        assertTrue(result.patterns().isEmpty());
        assertFalse(result.needsAttention());
        assertEquals(3.0, result.activityLevel(), 0.0001);
        assertEquals(List.of(PatternAnalyzer.ORACLE_UNAVAILABLE), result.recommendations());
    }

    @Test
    void shouldPassUserRatesToSpamQuery() {
        calmChat();

        analyzer.analyze(batch, Map.of("alice", 9));

        String spamPrompt = oracle.prompts().stream()
                .filter(p -> p.contains(ScriptedOracle.SPAM))
                .findFirst()
                .orElseThrow();
        assertTrue(spamPrompt.contains("\"alice\": 9"));
        assertTrue(spamPrompt.contains("above 5 messages per minute"));
    }

    @Test
    void shouldRequireAttentionForRepeatedOrSevereModerationPatterns() {
        ChatPattern mildSpam = pattern(PatternType.SPAM, 4);
        ChatPattern severeSpam = pattern(PatternType.SPAM, 7);
        ChatPattern toxic = pattern(PatternType.TOXICITY, 6);
        ChatPattern mildToxic = pattern(PatternType.TOXICITY, 5);

        assertFalse(PatternAnalyzer.needsAttention(List.of(mildSpam, mildToxic)));
        assertTrue(PatternAnalyzer.needsAttention(List.of(mildSpam, mildSpam)));
        assertTrue(PatternAnalyzer.needsAttention(List.of(severeSpam)));
        assertTrue(PatternAnalyzer.needsAttention(List.of(toxic)));
        assertFalse(PatternAnalyzer.needsAttention(List.of(pattern(PatternType.QUESTION, 10))));
    }

    @Test
    void shouldTrackPatternTrendsOverTenMinutes() {
        calmChat();
        oracle.reply(ScriptedOracle.TOXICITY, "[{\"messageIndex\": 2, \"toxicityScore\": 6}]");

        analyzer.analyze(batch);
        analyzer.analyze(batch);

        assertEquals(2, analyzer.getPatternTrends().get(PatternType.TOXICITY));

        clock.advance(Duration.ofMinutes(11));

        assertTrue(analyzer.getPatternTrends().isEmpty());
    }

    private ChatPattern pattern(PatternType type, int severity) {
        return ChatPattern.builder()
                .type(type)
                .severity(severity)
                .confidence(0.8)
                .users(List.of("u1"))
                .messages(List.of("msg"))
                .timestamp(FIXED_NOW)
                .build();
    }
}
