package me.golemcore.sentinel.infrastructure.config;

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

import me.golemcore.sentinel.domain.model.ModerationAction;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the sentinel, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code sentinel.*} prefix:
 * <ul>
 * <li>{@link WindowProperties} - message window capacity and horizons</li>
 * <li>{@link RulesProperties} - detection rules and the gates they open</li>
 * <li>{@link ToolsProperties} - per-tool cooldown overrides</li>
 * <li>{@link FeedbackProperties} - feedback matching, metrics and
 * retention</li>
 * <li>{@link OracleProperties} - language-model oracle provider</li>
 * <li>{@link ExecutorProperties} - outbound action executor</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "sentinel")
@Data
public class SentinelProperties {

    private boolean enabled = true;
    private boolean autoStart = true;
    private Duration monitoringInterval = Duration.ofSeconds(30);
    private Duration actionPause = Duration.ofSeconds(1);
    private WindowProperties window = new WindowProperties();
    private RulesProperties rules = new RulesProperties();
    private ToolsProperties tools = new ToolsProperties();
    private FeedbackProperties feedback = new FeedbackProperties();
    private StorageProperties storage = new StorageProperties();
    private OracleProperties oracle = new OracleProperties();
    private ExecutorProperties executor = new ExecutorProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class WindowProperties {
        private int capacity = 100;
        private Duration userHistoryHorizon = Duration.ofMinutes(10);
        private Duration rateWindow = Duration.ofSeconds(60);
    }

    // ==================== RULES ====================

    @Data
    public static class RulesProperties {
        private SpamDetectionProperties spamDetection = new SpamDetectionProperties();
        private ToxicityDetectionProperties toxicityDetection = new ToxicityDetectionProperties();
        private ChatEngagementProperties chatEngagement = new ChatEngagementProperties();
        private PollAutomationProperties pollAutomation = new PollAutomationProperties();
    }

    @Data
    public static class SpamDetectionProperties {
        private boolean enabled = true;
        private int threshold = 5; // messages per minute from the same user
        private ModerationAction action = ModerationAction.TIMEOUT;
        private Integer duration = 60; // timeout seconds
    }

    @Data
    public static class ToxicityDetectionProperties {
        private boolean enabled = true;
        private int severityThreshold = 6;
        private ModerationAction action = ModerationAction.TIMEOUT;
        private Integer duration = 300;
    }

    @Data
    public static class ChatEngagementProperties {
        private boolean enabled = true;
        private int quietPeriodThreshold = 5; // minutes without chat
        private List<String> responses = new ArrayList<>();
    }

    @Data
    public static class PollAutomationProperties {
        private boolean enabled = false;
        private PollTrigger trigger = PollTrigger.VIEWER_REQUEST;
        private Duration cooldown = Duration.ofMinutes(15);
    }

    public enum PollTrigger {
        VIEWER_REQUEST, SCHEDULED, GAME_EVENT
    }

    @Data
    public static class ToolsProperties {
        private Map<String, Duration> cooldowns = new HashMap<>();
    }

    @Data
    public static class FeedbackProperties {
        private String directory = "feedback";
        private int retentionDays = 30;
        private Duration metricsWindow = Duration.ofDays(7);
        private Duration matchTolerance = Duration.ofSeconds(60);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/sentinel";
    }

    @Data
    public static class OracleProperties {
        private String provider = "none";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ExecutorProperties {
        private String webhookUrl;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
