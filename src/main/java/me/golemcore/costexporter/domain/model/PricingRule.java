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
 * USD rates per 1000 tokens for one model.
 */
public record PricingRule(double promptRatePer1k, double completionRatePer1k) {

    public PricingRule {
        if (promptRatePer1k < 0 || completionRatePer1k < 0) {
            throw new IllegalArgumentException("pricing rates must be >= 0");
        }
    }
}
