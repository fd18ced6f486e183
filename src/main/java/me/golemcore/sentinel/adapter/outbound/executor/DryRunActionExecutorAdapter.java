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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executor that only logs tool invocations and reports success. Active when no
 * webhook is configured.
 */
@Component
@Slf4j
public class DryRunActionExecutorAdapter implements ActionExecutorAdapter {

    @Override
    public String getExecutorId() {
        return "dry-run";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public CompletableFuture<ActionResult> execute(String toolName, Map<String, Object> parameters) {
        log.info("[Executor] Dry run: {} {}", toolName, parameters);
        return CompletableFuture.completedFuture(ActionResult.success("dry-run"));
    }
}
