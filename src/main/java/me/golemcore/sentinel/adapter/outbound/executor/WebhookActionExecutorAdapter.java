package me.golemcore.sentinel.adapter.outbound.executor;

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

import me.golemcore.sentinel.domain.model.ActionResult;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards tool invocations to an HTTP endpoint.
 *
 * <p>
 * Each call is a {@code POST} of {@code {"tool": ..., "parameters": {...}}} to
 * {@code sentinel.executor.webhook-url}. The reply is mapped to
 * {@link ActionResult}:
 * <ul>
 * <li>a JSON body with a boolean {@code success} field is taken as-is
 * ({@code result}, {@code error} optional)
 * <li>any other 2xx reply is a success carrying the raw body
 * <li>non-2xx replies are failures carrying the HTTP status
 * </ul>
 *
 * <p>
 * Transport errors complete the future exceptionally; the monitor logs them
 * and moves on to the next decision.
 */
@Component
@Slf4j
public class WebhookActionExecutorAdapter implements ActionExecutorAdapter {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final SentinelProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookActionExecutorAdapter(SentinelProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getExecutorId() {
        return "webhook";
    }

    @Override
    public boolean isConfigured() {
        String url = properties.getExecutor().getWebhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public CompletableFuture<ActionResult> execute(String toolName, Map<String, Object> parameters) {
        if (!isConfigured()) {
            return CompletableFuture.completedFuture(ActionResult.failure("Webhook URL not configured"));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                String body = objectMapper.writeValueAsString(new ToolInvocation(toolName, parameters));
                Request request = new Request.Builder()
                        .url(properties.getExecutor().getWebhookUrl())
                        .post(RequestBody.create(body, JSON))
                        .build();

                try (Response response = httpClient.newCall(request).execute()) {
                    ResponseBody responseBody = response.body();
                    String responseStr = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        log.warn("[Executor] {} failed: HTTP {}", toolName, response.code());
                        return ActionResult.failure("HTTP " + response.code());
                    }
                    return parseResult(responseStr);
                }
            } catch (IOException e) {
                throw new RuntimeException("Webhook call failed for " + toolName, e);
            }
        });
    }

    private ActionResult parseResult(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return ActionResult.success(null);
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            if (node != null && node.has("success") && node.get("success").isBoolean()) {
                Object result = node.has("result") ? objectMapper.treeToValue(node.get("result"), Object.class) : null;
                String error = node.hasNonNull("error") ? node.get("error").asText() : null;
                return new ActionResult(node.get("success").asBoolean(), result, error);
            }
        } catch (JsonProcessingException e) {
            log.debug("[Executor] Non-JSON webhook reply, using raw text");
        }
        return ActionResult.success(responseBody.trim());
    }

    record ToolInvocation(String tool, Map<String, Object> parameters) {
    }
}
