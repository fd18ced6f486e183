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
import me.golemcore.sentinel.port.outbound.ActionExecutorPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes tool invocations to the webhook executor when
 * {@code sentinel.executor.webhook-url} is set, otherwise to the dry-run
 * executor.
 *
 * @see WebhookActionExecutorAdapter
 * @see DryRunActionExecutorAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class ActionExecutorAdapterFactory implements ActionExecutorPort {

    private static final String EXECUTOR_DRY_RUN = "dry-run";

    private final List<ActionExecutorAdapter> adapters;

    private ActionExecutorAdapter activeAdapter;

    @PostConstruct
    public void init() {
        activeAdapter = adapters.stream()
                .filter(adapter -> !EXECUTOR_DRY_RUN.equals(adapter.getExecutorId()))
                .filter(ActionExecutorAdapter::isConfigured)
                .findFirst()
                .orElseGet(() -> adapters.stream()
                        .filter(adapter -> EXECUTOR_DRY_RUN.equals(adapter.getExecutorId()))
                        .findFirst()
                        .orElse(null));

        log.info("[Executor] Active executor: {}", getExecutorId());
    }

    @Override
    public String getExecutorId() {
        return activeAdapter != null ? activeAdapter.getExecutorId() : "none";
    }

    @Override
    public CompletableFuture<ActionResult> execute(String toolName, Map<String, Object> parameters) {
        if (activeAdapter == null) {
            return CompletableFuture.completedFuture(ActionResult.failure("No action executor registered"));
        }
        return activeAdapter.execute(toolName, parameters);
    }
}
