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

import me.golemcore.sentinel.port.outbound.ActionExecutorPort;
import me.golemcore.sentinel.port.outbound.OraclePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared beans and startup logging.
 *
 * <p>
 * Provides the {@link Clock} every time-dependent component reads from and the
 * {@link ObjectMapper} used for oracle parsing, JSONL snapshots and webhook
 * bodies.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final SentinelProperties properties;
    private final OraclePort oraclePort;
    private final ActionExecutorPort actionExecutorPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Chat Sentinel starting...");
        log.info("Monitoring: {} (interval {})", properties.isEnabled() ? "enabled" : "disabled",
                properties.getMonitoringInterval());
        log.info("Oracle: {} ({})", oraclePort.getProviderId(),
                oraclePort.isAvailable() ? "available" : "unavailable, degraded analysis only");
        log.info("Action executor: {}", actionExecutorPort.getExecutorId());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
    }
}
