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
import me.golemcore.sentinel.port.outbound.OraclePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active oracle provider based on
 * {@code sentinel.oracle.provider}:
 * <ul>
 * <li>openai - OpenAI-compatible endpoint via langchain4j
 * <li>none - always-failing oracle, degraded analysis only
 * </ul>
 *
 * <p>
 * All providers are Spring beans; selection happens in {@link #init()}.
 * Unknown providers fall back to {@code none}.
 *
 * @see Langchain4jOracleAdapter
 * @see NoOpOracleAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class OracleAdapterFactory implements OraclePort {

    private static final String PROVIDER_NONE = "none";

    private final SentinelProperties properties;
    private final List<OracleProviderAdapter> adapters;

    private final Map<String, OracleProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private OracleProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (OracleProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[Oracle] Registered provider: {}", adapter.getProviderId());
        }

        String provider = properties.getOracle().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            log.warn("[Oracle] Provider '{}' not found, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("[Oracle] Active provider: {}", provider);
        }

        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No oracle provider registered"));
        }
        return activeAdapter.complete(prompt);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
