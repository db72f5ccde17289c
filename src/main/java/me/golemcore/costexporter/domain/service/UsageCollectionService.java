package me.golemcore.costexporter.domain.service;

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

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.port.outbound.ProviderException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the per-provider pipeline: fetch and normalize, then price.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageCollectionService {

    private final PricingService pricingService;

    public UsageRecord collect(UsageProviderPort provider) throws ProviderException {
        ProviderIdentity identity = provider.getIdentity();
        UsageRecord raw = provider.fetchUsage();
        UsageRecord priced = pricingService.price(identity.modelName(), raw);
        log.debug("[Usage] {}: cost=${} (reported={}), prompt={}, completion={}, requests={}",
                identity, priced.costUsd(), priced.costReported(), priced.promptTokens(),
                priced.completionTokens(), priced.requestCount());
        return priced;
    }
}
