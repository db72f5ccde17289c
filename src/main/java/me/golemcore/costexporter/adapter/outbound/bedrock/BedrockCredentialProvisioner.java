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

import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Holds the role lease used for Bedrock usage calls and renews it through STS.
 *
 * <p>
 * A lease is reused until it is within {@code refreshSkew} of its expiry, then
 * exactly one renewal is made. If renewal fails while the old lease is still
 * valid, the old lease keeps being used and the next call retries. If there is
 * no usable lease the failure is a {@link ConfigurationException}.
 */
@Slf4j
class BedrockCredentialProvisioner {

    enum LeaseState {
        NO_LEASE, LEASED, EXPIRED
    }

    private final StsClient stsClient;
    private final String roleArn;
    private final String sessionName;
    private final Duration duration;
    private final Duration refreshSkew;
    private final Clock clock;

    private CredentialLease lease;

    BedrockCredentialProvisioner(StsClient stsClient, String roleArn, String sessionName, Duration duration,
            Duration refreshSkew, Clock clock) {
        this.stsClient = stsClient;
        this.roleArn = roleArn;
        this.sessionName = sessionName;
        this.duration = duration;
        this.refreshSkew = refreshSkew;
        this.clock = clock;
    }

    /**
     * Returns a lease that is valid now, renewing it first when it is close to
     * expiry.
     *
     * @throws ConfigurationException
     *             if the role cannot be assumed and no valid lease is held
     */
    synchronized CredentialLease currentLease() {
        Instant now = clock.instant();
        if (lease != null && !lease.needsRefresh(now, refreshSkew)) {
            return lease;
        }
        try {
            lease = assumeRole();
            log.info("[Bedrock] Assumed role {} (expires {})", roleArn, lease.expiration());
            return lease;
        } catch (ConfigurationException e) {
            if (lease != null && !lease.isExpired(now)) {
                log.warn("[Bedrock] Lease renewal failed, keeping current lease until {}: {}",
                        lease.expiration(), e.getMessage());
                return lease;
            }
            throw e;
        }
    }

    AwsCredentialsProvider credentialsProvider() {
        return StaticCredentialsProvider.create(currentLease().toSessionCredentials());
    }

    synchronized LeaseState getState() {
        if (lease == null) {
            return LeaseState.NO_LEASE;
        }
        return lease.isExpired(clock.instant()) ? LeaseState.EXPIRED : LeaseState.LEASED;
    }

    private CredentialLease assumeRole() {
        AssumeRoleResponse response;
        try {
            response = stsClient.assumeRole(AssumeRoleRequest.builder()
                    .roleArn(roleArn)
                    .roleSessionName(sessionName)
                    .durationSeconds((int) duration.getSeconds())
                    .build());
        } catch (SdkException e) {
            throw new ConfigurationException("Failed to assume role " + roleArn + ": " + e.getMessage(), e);
        }

        Credentials credentials = response.credentials();
        if (credentials == null
                || isBlank(credentials.accessKeyId())
                || isBlank(credentials.secretAccessKey())
                || isBlank(credentials.sessionToken())
                || credentials.expiration() == null) {
            throw new ConfigurationException("Assume role " + roleArn + " returned incomplete credentials");
        }
        return new CredentialLease(credentials.accessKeyId(), credentials.secretAccessKey(),
                credentials.sessionToken(), credentials.expiration());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
