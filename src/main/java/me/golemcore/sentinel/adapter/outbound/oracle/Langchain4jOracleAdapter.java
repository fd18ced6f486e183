package me.golemcore.sentinel.adapter.outbound.oracle;

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

import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Oracle backed by an OpenAI-compatible chat model through langchain4j.
 *
 * <p>
 * Each prompt is sent as a single user message; the raw completion text is
 * returned unparsed. Rate-limit errors are retried with exponential backoff,
 * anything else fails the future.
 *
 * <p>
 * Provider ID: {@code "openai"}. Configured via {@code sentinel.oracle.*}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jOracleAdapter implements OracleProviderAdapter {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final SentinelProperties properties;

    private volatile ChatModel chatModel;

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public synchronized void initialize() {
        if (chatModel != null) {
            return;
        }
        SentinelProperties.OracleProperties config = properties.getOracle();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Oracle] No API key configured for provider '{}'", getProviderId());
            return;
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(config.getTemperature())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }

        chatModel = builder.build();
        log.info("[Oracle] Initialized model {}", config.getModel());
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = chatModel;
            if (model == null) {
                throw new IllegalStateException("Langchain4j oracle not available");
            }

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return model.chat(prompt);
                } catch (RateLimitException e) {
                    if (attempt >= MAX_RETRIES) {
                        throw e;
                    }
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Oracle] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleep(backoffMs);
                }
            }
            throw new IllegalStateException("Oracle call failed: max retries exhausted");
        });
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Oracle call interrupted during retry backoff", e);
        }
    }
}
