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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Oracle used when no language model is configured.
 *
 * <p>
 * Every call completes exceptionally, which drives the analyzer to its neutral
 * result and the decision engine to its deterministic rules.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpOracleAdapter implements OracleProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public void initialize() {
        // No-op, nothing to build
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        log.debug("[Oracle] complete() called with no oracle configured");
        return CompletableFuture.failedFuture(new IllegalStateException("No oracle configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
