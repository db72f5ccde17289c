package me.golemcore.costexporter.port.outbound;

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

/**
 * Port for polling usage from one LLM provider.
 *
 * <p>
 * One adapter per provider. Implementations hold no shared mutable state and
 * perform network I/O only; they never write to the metrics registry.
 *
 * @since 1.0
 */
public interface UsageProviderPort {

    /**
     * Label pair under which this provider's usage is published. Fixed at
     * startup.
     */
    ProviderIdentity getIdentity();

    /**
     * Check if this provider is enabled by configuration.
     */
    boolean isEnabled();

    /**
     * Fetch and normalize the provider's usage for the current billing period.
     * The returned record may still need pricing.
     *
     * @throws ProviderException
     *             on transport, authentication or decode failure
     */
    UsageRecord fetchUsage() throws ProviderException;
}
