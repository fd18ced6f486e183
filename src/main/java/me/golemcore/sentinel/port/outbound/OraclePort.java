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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language-model oracle: maps a natural-language analysis or
 * decision prompt to a text response. Responses are expected to be JSON per the
 * calling prompt's contract, but callers must tolerate anything.
 *
 * <p>
 * Implementations enforce their own timeouts; the core only sees the future
 * complete normally or exceptionally.
 */
public interface OraclePort {

    /**
     * Returns the provider identifier (e.g., "openai", "none").
     */
    String getProviderId();

    /**
     * Sends the prompt and returns the raw completion text.
     */
    CompletableFuture<String> complete(String prompt);

    /**
     * Checks if the oracle is configured and operational.
     */
    boolean isAvailable();
}
