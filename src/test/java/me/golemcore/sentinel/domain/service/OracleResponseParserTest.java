package me.golemcore.sentinel.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OracleResponseParserTest {

    private OracleResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new OracleResponseParser(new ObjectMapper());
    }

    @Test
    void shouldParseFindingsFromFencedBlock() {
        String response = "Here you go:\n```json\n[{\"messageIndex\": 2, \"toxicityScore\": 7.4, "
                + "\"reason\": \"insult\", \"action\": \"timeout\"}]\n```";

        List<OracleResponseParser.MessageFinding> findings = parser.parseFindings(response, "toxicityScore");

        assertEquals(1, findings.size());
        assertEquals(2, findings.get(0).messageIndex());
        assertEquals(7.4, findings.get(0).score(), 1e-9);
        assertEquals("insult", findings.get(0).reason());
        assertEquals("timeout", findings.get(0).action());
        assertNull(findings.get(0).suggestedResponse());
    }

    @Test
    void shouldExtractJsonEmbeddedInProse() {
        String response = "Findings: [{\"messageIndex\": 1, \"spamScore\": 6}] end.";

        List<OracleResponseParser.MessageFinding> findings = parser.parseFindings(response, "spamScore");

        assertEquals(1, findings.size());
        assertEquals(6.0, findings.get(0).score(), 1e-9);
    }

    @Test
    void shouldSkipFindingsWithoutNumericFields() {
        String response = "[{\"messageIndex\": \"two\", \"toxicityScore\": 9},"
                + "{\"messageIndex\": 3},"
                + "{\"messageIndex\": 4, \"toxicityScore\": 5}]";

        List<OracleResponseParser.MessageFinding> findings = parser.parseFindings(response, "toxicityScore");

        assertEquals(1, findings.size());
        assertEquals(4, findings.get(0).messageIndex());
    }

    @Test
    void shouldRejectFindingsThatAreNotArray() {
        assertThrows(OracleParseException.class,
                () -> parser.parseFindings("{\"messageIndex\": 1}", "toxicityScore"));
    }

    @Test
    void shouldRejectBlankAndInvalidResponses() {
        assertThrows(OracleParseException.class, () -> parser.parseSentiment("  "));
        assertThrows(OracleParseException.class, () -> parser.parseSentiment(null));
        assertThrows(OracleParseException.class, () -> parser.parseFindings("[{broken", "spamScore"));
    }

    @Test
    void shouldClampSentiment() {
        assertEquals(1.0, parser.parseSentiment("{\"overallSentiment\": 3.5}"), 0.0001);
        assertEquals(-0.4, parser.parseSentiment("{\"overallSentiment\": -0.4, \"dominantEmotions\": []}"),
                0.0001);
        assertThrows(OracleParseException.class, () -> parser.parseSentiment("{\"mood\": \"good\"}"));
    }

    @Test
    void shouldParseActivityAssessment() {
        OracleResponseParser.ActivityAssessment assessment = parser.parseActivity(
                "{\"activityLevel\": 14, \"description\": \"busy\", \"recommendations\": [\"Slow mode\", \"\"]}");

        assertEquals(10.0, assessment.activityLevel(), 0.0001);
        assertEquals("busy", assessment.description());
        assertEquals(List.of("Slow mode"), assessment.recommendations());
    }

    @Test
    void shouldParseDecisionProposals() {
        String response = "[{\"action\": \"timeoutUser\", \"parameters\": {\"user\": \"u1\", \"duration\": 60},"
                + " \"reason\": \"spam\", \"confidence\": 0.85, \"targetPattern\": \"spam\"},"
                + " \"garbage\","
                + " {\"action\": \"sendMessageToChat\", \"reason\": \"quiet\"}]";

        List<OracleResponseParser.DecisionProposal> proposals = parser.parseDecisions(response);

        assertEquals(2, proposals.size());
        OracleResponseParser.DecisionProposal first = proposals.get(0);
        assertEquals("timeoutUser", first.action());
        assertEquals("u1", first.parameters().get("user"));
        assertEquals(60, first.parameters().get("duration"));
        assertEquals(0.85, first.confidence(), 0.0001);
        assertEquals("spam", first.targetPattern());

        OracleResponseParser.DecisionProposal second = proposals.get(1);
        assertTrue(second.parameters().isEmpty());
        assertNull(second.confidence());
        assertNull(second.targetPattern());
    }

    @Test
    void shouldParseParameterObjectAndDropNulls() {
        Map<String, Object> parameters = parser.parseParameters(
                "```json\n{\"title\": \"Next game?\", \"options\": [\"A\", \"B\"], \"note\": null}\n```");

        assertEquals("Next game?", parameters.get("title"));
        assertEquals(List.of("A", "B"), parameters.get("options"));
        assertFalse(parameters.containsKey("note"));
        assertThrows(OracleParseException.class, () -> parser.parseParameters("[1, 2]"));
    }
}
