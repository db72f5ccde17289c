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

import me.golemcore.costexporter.domain.model.BillingPeriod;
import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.infrastructure.aws.AwsClientFactory;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import me.golemcore.costexporter.port.outbound.ProviderException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;
import software.amazon.awssdk.services.sts.StsClient;

import java.time.Clock;
import java.util.Set;

/**
 * Usage adapter for Amazon Bedrock, reading the runtime metrics Bedrock
 * publishes to CloudWatch.
 *
 * <p>
 * Each fetch reads month-to-date daily sums of {@code InputTokenCount},
 * {@code OutputTokenCount} and {@code Invocations} in the {@code AWS/Bedrock}
 * namespace for the configured model id. With assume-role enabled every call
 * carries credentials from a {@link BedrockCredentialProvisioner} lease;
 * otherwise the default AWS credentials chain is used.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code exporter.providers.bedrock.enabled} - Enable/disable</li>
 * <li>{@code exporter.providers.bedrock.region} - AWS region</li>
 * <li>{@code exporter.providers.bedrock.model} - Bedrock model id</li>
 * <li>{@code exporter.providers.bedrock.assume-role.*} - role ARN, session
 * name, lease duration and refresh skew</li>
 * </ul>
 *
 * <p>
 * Provider name: {@code "bedrock"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BedrockUsageAdapter implements UsageProviderPort {

    static final String PROVIDER_NAME = "bedrock";
    static final String NAMESPACE = "AWS/Bedrock";
    static final String DIMENSION_MODEL_ID = "ModelId";
    static final String METRIC_INPUT_TOKENS = "InputTokenCount";
    static final String METRIC_OUTPUT_TOKENS = "OutputTokenCount";
    static final String METRIC_INVOCATIONS = "Invocations";
    static final int PERIOD_SECONDS = 86400;

    private static final Set<String> AUTH_ERROR_CODES = Set.of(
            "AccessDenied", "AccessDeniedException", "ExpiredToken", "ExpiredTokenException",
            "InvalidClientTokenId", "UnrecognizedClientException", "InvalidSignatureException");

    private final ExporterProperties properties;
    private final AwsClientFactory awsClientFactory;
    private final Clock clock;

    private CloudWatchClient cloudWatchClient;
    private StsClient stsClient;
    private BedrockCredentialProvisioner provisioner;
    private ProviderIdentity identity;
    private boolean enabled;

    @PostConstruct
    public void init() {
        ExporterProperties.BedrockProperties config = properties.getProviders().getBedrock();
        this.enabled = config.isEnabled();
        this.identity = new ProviderIdentity(PROVIDER_NAME, config.getModel());

        if (!enabled) {
            log.info("[Bedrock] Provider disabled");
            return;
        }

        ExporterProperties.AssumeRoleProperties assumeRole = config.getAssumeRole();
        if (assumeRole.isEnabled()) {
            if (assumeRole.getRoleArn() == null || assumeRole.getRoleArn().isBlank()) {
                throw new ConfigurationException(assumeRole.getRoleArnVariable()
                        + " is not set; it is required while Bedrock assume-role is enabled");
            }
            this.stsClient = awsClientFactory.sts(config.getRegion());
            this.provisioner = new BedrockCredentialProvisioner(stsClient, assumeRole.getRoleArn(),
                    assumeRole.getSessionName(), assumeRole.getDuration(), assumeRole.getRefreshSkew(), clock);
        }
        this.cloudWatchClient = awsClientFactory.cloudWatch(config.getRegion());
        log.info("[Bedrock] Provider initialized (region: {}, model: {}, assume-role: {})",
                config.getRegion(), identity.modelName(), assumeRole.isEnabled());
    }

    @PreDestroy
    public void shutdown() {
        if (cloudWatchClient != null) {
            cloudWatchClient.close();
        }
        if (stsClient != null) {
            stsClient.close();
        }
    }

    @Override
    public ProviderIdentity getIdentity() {
        return identity;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public UsageRecord fetchUsage() throws ProviderException {
        if (cloudWatchClient == null) {
            throw new IllegalStateException("Bedrock provider is not enabled");
        }
        BillingPeriod period = BillingPeriod.monthToDate(clock);
        if (!period.end().isAfter(period.start())) {
            return UsageRecord.builder().build();
        }

        AwsCredentialsProvider leaseCredentials = provisioner != null ? provisioner.credentialsProvider() : null;
        try {
            GetMetricStatisticsResponse input = statistics(METRIC_INPUT_TOKENS, period, leaseCredentials);
            GetMetricStatisticsResponse output = statistics(METRIC_OUTPUT_TOKENS, period, leaseCredentials);
            GetMetricStatisticsResponse invocations = statistics(METRIC_INVOCATIONS, period, leaseCredentials);
            return BedrockUsageNormalizer.normalize(input, output, invocations);
        } catch (AwsServiceException e) {
            throw translate(e);
        } catch (SdkClientException e) {
            throw ProviderException.network(PROVIDER_NAME, "CloudWatch call failed: " + e.getMessage(), e);
        }
    }

    BedrockCredentialProvisioner getProvisioner() {
        return provisioner;
    }

    private GetMetricStatisticsResponse statistics(String metricName, BillingPeriod period,
            AwsCredentialsProvider leaseCredentials) {
        GetMetricStatisticsRequest.Builder request = GetMetricStatisticsRequest.builder()
                .namespace(NAMESPACE)
                .metricName(metricName)
                .dimensions(Dimension.builder().name(DIMENSION_MODEL_ID).value(identity.modelName()).build())
                .startTime(period.start())
                .endTime(period.end())
                .period(PERIOD_SECONDS)
                .statistics(Statistic.SUM);
        if (leaseCredentials != null) {
            request.overrideConfiguration(o -> o.credentialsProvider(leaseCredentials));
        }
        return cloudWatchClient.getMetricStatistics(request.build());
    }

    private static ProviderException translate(AwsServiceException e) {
        String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        int status = e.statusCode();
        if (status == 401 || status == 403 || (errorCode != null && AUTH_ERROR_CODES.contains(errorCode))) {
            return ProviderException.auth(PROVIDER_NAME, "CloudWatch rejected credentials: " + errorCode, e);
        }
        return ProviderException.network(PROVIDER_NAME,
                "CloudWatch call failed (HTTP " + status + ", " + errorCode + ")", e);
    }
}
