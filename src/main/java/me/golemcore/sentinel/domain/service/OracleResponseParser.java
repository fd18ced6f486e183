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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed parsing of oracle completions.
 *
 * <p>
 * Completions are located first inside a fenced {@code ```json} block, then as
 * the outermost JSON array or object in the text, then as the whole trimmed
 * text. Each method either returns a fully typed value or throws
 * {@link OracleParseException}; nothing half-parsed leaks out.
 *
 * <p>
 * Array elements that miss a mandatory field are skipped individually, so one
 * malformed finding does not discard the rest.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleResponseParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    /**
     * Parses a per-message finding list such as
     * {@code [{"messageIndex": 2, "toxicityScore": 7, "reason": "...", ...}]}.
     *
     * @param scoreField
     *            name of the score property for this query
     */
    public List<MessageFinding> parseFindings(String response, String scoreField) {
        JsonNode root = readTree(response);
        if (!root.isArray()) {
            throw new OracleParseException("Expected JSON array of findings, got " + root.getNodeType());
        }

        List<MessageFinding> findings = new ArrayList<>();
        for (JsonNode node : root) {
            JsonNode index = node.get("messageIndex");
            JsonNode score = node.get(scoreField);
            if (index == null || !index.isNumber() || score == null || !score.isNumber()) {
                log.debug("[Parser] Skipping finding without numeric messageIndex/{}: {}", scoreField, node);
                continue;
            }
            findings.add(new MessageFinding(
                    index.asInt(),
                    score.asDouble(),
                    text(node, "reason"),
                    text(node, "action"),
                    text(node, "suggestedResponse"),
                    text(node, "username")));
        }
        return findings;
    }

    /**
     * Parses {@code {"overallSentiment": number, ...}}, clamped to [-1, 1].
     */
    public double parseSentiment(String response) {
        JsonNode root = readTree(response);
        JsonNode value = root.get("overallSentiment");
        if (value == null || !value.isNumber()) {
            throw new OracleParseException("Missing numeric overallSentiment");
        }
        return clamp(value.asDouble(), -1.0, 1.0);
    }

    /**
     * Parses {@code {"activityLevel": number, "description": string,
     * "recommendations": [string]}}, activity clamped to [0, 10].
     */
    public ActivityAssessment parseActivity(String response) {
        JsonNode root = readTree(response);
        JsonNode level = root.get("activityLevel");
        if (level == null || !level.isNumber()) {
            throw new OracleParseException("Missing numeric activityLevel");
        }
        List<String> recommendations = new ArrayList<>();
        JsonNode recs = root.get("recommendations");
        if (recs != null && recs.isArray()) {
            for (JsonNode rec : recs) {
                if (rec.isTextual() && !rec.asText().isBlank()) {
                    recommendations.add(rec.asText());
                }
            }
        }
        return new ActivityAssessment(clamp(level.asDouble(), 0.0, 10.0), text(root, "description"),
                recommendations);
    }

    /**
     * Parses the action-selection array. Elements that are not objects are
     * skipped; field-level validation is left to the decision engine.
     */
    public List<DecisionProposal> parseDecisions(String response) {
        JsonNode root = readTree(response);
        if (!root.isArray()) {
            throw new OracleParseException("Expected JSON array of decisions, got " + root.getNodeType());
        }

        List<DecisionProposal> proposals = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                continue;
            }
            JsonNode confidence = node.get("confidence");
            JsonNode parameters = node.get("parameters");
            proposals.add(new DecisionProposal(
                    text(node, "action"),
                    parameters != null && parameters.isObject() ? toMap(parameters) : Map.of(),
                    text(node, "reason"),
                    confidence != null && confidence.isNumber() ? confidence.asDouble() : null,
                    text(node, "targetPattern")));
        }
        return proposals;
    }

    /**
     * Parses a flat parameter object for a tool invocation.
     */
    public Map<String, Object> parseParameters(String response) {
        JsonNode root = readTree(response);
        if (!root.isObject()) {
            throw new OracleParseException("Expected JSON object of parameters, got " + root.getNodeType());
        }
        return toMap(root);
    }

    private JsonNode readTree(String response) {
        if (response == null || response.isBlank()) {
            throw new OracleParseException("Empty oracle response");
        }
        String json = extractJson(response);
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new OracleParseException("Empty oracle response");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new OracleParseException("Oracle response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String extractJson(String response) {
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }

        String trimmed = response.trim();
        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            return trimmed;
        }

        int start = firstIndexOf(trimmed, '[', '{');
        if (start >= 0) {
            char close = trimmed.charAt(start) == '[' ? ']' : '}';
            int end = trimmed.lastIndexOf(close);
            if (end > start) {
                return trimmed.substring(start, end + 1);
            }
        }
        return trimmed;
    }

    private int firstIndexOf(String text, char first, char second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }

    private Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            result.put(field.getKey(), objectMapper.convertValue(value, Object.class));
        }
        return result;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isTextual() ? value.asText() : value.toString();
        return text.isBlank() ? null : text;
    }

    private double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * One scored message from a toxicity, spam or engagement query.
     *
     * @param messageIndex
     *            1-based index into the analyzed batch
     */
    public record MessageFinding(
            int messageIndex,
            double score,
            String reason,
            String action,
            String suggestedResponse,
            String username) {
    }

    public record ActivityAssessment(double activityLevel, String description, List<String> recommendations) {
        public ActivityAssessment {
            recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        }
    }

    /**
     * An action proposed by the oracle before validation.
     *
     * @param confidence
     *            {@code null} when the oracle omitted it
     */
    public record DecisionProposal(
            String action,
            Map<String, Object> parameters,
            String reason,
            Double confidence,
            String targetPattern) {
    }
}
