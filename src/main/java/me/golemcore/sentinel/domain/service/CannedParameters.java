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

import me.golemcore.sentinel.domain.model.ChatPattern;
import me.golemcore.sentinel.domain.model.PatternType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic parameters used when the oracle cannot supply them, keyed by
 * action and the type of the pattern that triggered it.
 */
final class CannedParameters {

    private CannedParameters() {
    }

    static Map<String, Object> forAction(String action, ChatPattern pattern) {
        String user = pattern != null ? pattern.firstUser() : "unknown";
        String type = pattern != null ? pattern.type().id() : "rule";
        Map<String, Object> params = new LinkedHashMap<>();

        switch (action) {
        case ToolCatalog.TIMEOUT_USER -> {
            params.put("usernameOrDescriptor", user);
            params.put("reason", type + " behavior detected");
        }
        case ToolCatalog.BAN_USER -> {
            params.put("usernameOrDescriptor", user);
            params.put("reason", "Severe " + type + " violation");
        }
        case ToolCatalog.SEND_MESSAGE -> params.put("message", chatMessage(pattern));
        case ToolCatalog.CREATE_POLL -> {
            params.put("title", "What should we do next?");
            params.put("choices", "Option A, Option B, Option C");
            params.put("duration", 300);
        }
        case ToolCatalog.CREATE_PREDICTION -> {
            params.put("title", "Will we pull this off?");
            params.put("outcomes", "Yes, No");
            params.put("duration", 300);
        }
        case ToolCatalog.UPDATE_TITLE -> params.put("title", "Live now - come hang out in chat");
        case ToolCatalog.UPDATE_CATEGORY -> params.put("category", "Just Chatting");
        default -> {
            // no parameters
        }
        }
        return params;
    }

    private static String chatMessage(ChatPattern pattern) {
        PatternType type = pattern != null ? pattern.type() : null;
        if (type == PatternType.QUESTION) {
            return "Thanks for the question! Let me think about that...";
        }
        if (type == PatternType.QUIET) {
            return "How's everyone doing? What would you like to see next?";
        }
        return "Thanks for being part of the chat!";
    }
}
