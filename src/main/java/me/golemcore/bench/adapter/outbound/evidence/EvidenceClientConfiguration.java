package me.golemcore.bench.adapter.outbound.evidence;

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
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.infrastructure.http.FeignClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class EvidenceClientConfiguration {

    @Bean
    public EvidenceServiceApi evidenceServiceApi(FeignClientFactory feignClientFactory, BenchProperties properties) {
        BenchProperties.EvidenceProperties evidence = properties.getEvidence();
        long readTimeoutMs = readTimeoutMs(properties);
        log.info("[Tools] Evidence service: {} (timeout {}ms)", evidence.getBaseUrl(), readTimeoutMs);
        return feignClientFactory.create(EvidenceServiceApi.class, evidence.getBaseUrl(), readTimeoutMs);
    }

    @Bean
    public TranscriptApi transcriptApi(FeignClientFactory feignClientFactory, BenchProperties properties) {
        return feignClientFactory.create(TranscriptApi.class, properties.getVideo().getBaseUrl(),
                readTimeoutMs(properties));
    }

    /**
     * A single request never outlives the tool call it serves.
     */
    static long readTimeoutMs(BenchProperties properties) {
        long toolTimeoutMs = properties.getToolLoop().getToolTimeout().toMillis();
        return Math.min(properties.getEvidence().getTimeoutMs(), toolTimeoutMs);
    }
}
