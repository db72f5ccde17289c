package me.golemcore.costexporter.domain.model;

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

/**
 * Label pair under which a provider's usage is published.
 *
 * @param providerName
 *            stable provider name, unique across enabled providers
 * @param modelName
 *            model label configured for the provider
 */
public record ProviderIdentity(String providerName, String modelName) {

    public ProviderIdentity {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName must not be blank");
        }
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank for provider " + providerName);
        }
    }

    @Override
    public String toString() {
        return providerName + "/" + modelName;
    }
}
