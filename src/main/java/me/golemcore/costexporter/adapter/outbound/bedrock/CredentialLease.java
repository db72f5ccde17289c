package me.golemcore.costexporter.adapter.outbound.bedrock;

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

import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;

import java.time.Duration;
import java.time.Instant;

/**
 * Temporary credentials obtained by assuming a role. {@link #toString()} never
 * prints the secret parts.
 */
record CredentialLease(String accessKeyId, String secretAccessKey, String sessionToken, Instant expiration) {

    boolean isExpired(Instant now) {
        return !now.isBefore(expiration);
    }

    boolean needsRefresh(Instant now, Duration skew) {
        return !now.isBefore(expiration.minus(skew));
    }

    AwsSessionCredentials toSessionCredentials() {
        return AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken);
    }

    @Override
    public String toString() {
        return "CredentialLease[accessKeyId=" + accessKeyId + ", expiration=" + expiration + "]";
    }
}
