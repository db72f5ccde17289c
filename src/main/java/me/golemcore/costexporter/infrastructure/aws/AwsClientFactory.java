package me.golemcore.costexporter.infrastructure.aws;

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

import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.sts.StsClient;

import java.time.Duration;

/**
 * Factory for AWS SDK clients used by the Bedrock provider.
 *
 * <p>
 * Clients resolve their base identity through the default credentials chain
 * (environment, profile, container or instance role). They share the call
 * timeouts from {@code exporter.http} and do not retry: a failed call fails
 * the provider for the current tick.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class AwsClientFactory {

    private final ExporterProperties properties;

    public CloudWatchClient cloudWatch(String region) {
        return CloudWatchClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    public StsClient sts(String region) {
        return StsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    private ClientOverrideConfiguration overrideConfiguration() {
        ExporterProperties.HttpProperties http = properties.getHttp();
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofMillis(http.getCallTimeout()))
                .apiCallAttemptTimeout(Duration.ofMillis(http.getReadTimeout()))
                .retryPolicy(RetryPolicy.none())
                .build();
    }
}
