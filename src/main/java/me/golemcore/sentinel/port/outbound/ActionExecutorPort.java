package me.golemcore.sentinel.port.outbound;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for performing an external action (timeout, poll, chat message, ...).
 * The core never inspects side effects beyond the returned envelope.
 */
public interface ActionExecutorPort {

    /**
     * Returns the executor identifier used in startup logs.
     */
    String getExecutorId();

    /**
     * Executes the named tool with bound parameters.
     */
    CompletableFuture<ActionResult> execute(String toolName, Map<String, Object> parameters);
}
