package me.golemcore.sentinel;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Chat Sentinel.
 *
 * <p>
 * Chat Sentinel watches a live chat stream and runs an autonomous decision
 * loop over it: a language-model oracle scores recent messages for toxicity,
 * spam and engagement, a decision engine turns significant patterns into
 * throttled tool invocations, and a feedback store correlates executed actions
 * with later ratings to produce performance insights.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → MessageWindow, PatternAnalyzer, DecisionEngine,
 *                      FeedbackStore, AutonomousMonitor
 * Outbound Ports     → OraclePort, ActionExecutorPort, StoragePort
 * Infrastructure     → langchain4j oracle, webhook executor, local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code sentinel.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }

}
