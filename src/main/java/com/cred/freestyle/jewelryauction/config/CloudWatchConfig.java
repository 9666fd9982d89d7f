package com.cred.freestyle.jewelryauction.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics configuration for the auction service.
 * Every auction meter carries the service and environment tags, and per-session tags are
 * capped at a configurable number of distinct sessions per deployment. The CloudWatch
 * registry itself is only created when enabled; otherwise Spring Boot's default
 * in-memory registry backs the metrics service with the same filters.
 *
 * @author Jewelry Auction Team
 */
@Configuration
public class CloudWatchConfig {

    static final String AUCTION_METER_PREFIX = "auction.";
    static final String SESSION_TAG = "session_id";
    static final String OVERFLOW_SESSION = "other";

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:JewelryAuction}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step; // ISO-8601 duration

    @Value("${auction.environment:local}")
    private String environment;

    @Value("${cloud.aws.cloudwatch.max-session-tags:200}")
    private Integer maxSessionTags;

    @Bean
    public MeterFilter auctionCommonTagsFilter() {
        return commonTags(environment);
    }

    @Bean
    public MeterFilter sessionTagLimitFilter() {
        return sessionTagLimit(maxSessionTags);
    }

    /**
     * Tags identifying this service on every meter.
     */
    static MeterFilter commonTags(String environment) {
        return MeterFilter.commonTags(Tags.of("service", "jewelry-auction", "environment", environment));
    }

    /**
     * Once {@code maxSessions} distinct session ids have been seen on auction meters,
     * further sessions are folded into a single {@value #OVERFLOW_SESSION} series.
     */
    static MeterFilter sessionTagLimit(int maxSessions) {
        Set<String> observedSessions = ConcurrentHashMap.newKeySet();
        return new MeterFilter() {
            @Override
            public Meter.Id map(Meter.Id id) {
                if (!id.getName().startsWith(AUCTION_METER_PREFIX)) {
                    return id;
                }
                String sessionId = id.getTag(SESSION_TAG);
                if (sessionId == null || observedSessions.contains(sessionId)) {
                    return id;
                }
                synchronized (observedSessions) {
                    if (observedSessions.size() < maxSessions) {
                        observedSessions.add(sessionId);
                        return id;
                    }
                }
                return id.replaceTags(Tags.of(id.getTags()).and(SESSION_TAG, OVERFLOW_SESSION));
            }
        };
    }

    @Bean
    @ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Configure CloudWatch meter registry.
     *
     * @param cloudWatchAsyncClient CloudWatch client
     * @return MeterRegistry
     */
    @Bean
    @ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        io.micrometer.cloudwatch2.CloudWatchConfig cloudWatchConfig = new io.micrometer.cloudwatch2.CloudWatchConfig() {
            private final Map<String, String> configuration = Map.of(
                    "cloudwatch.namespace", namespace,
                    "cloudwatch.batchSize", String.valueOf(batchSize),
                    "cloudwatch.step", step
            );

            @Override
            public String get(String key) {
                return configuration.get(key);
            }

            @Override
            public String namespace() {
                return namespace;
            }

            @Override
            public int batchSize() {
                return batchSize;
            }

            @Override
            public Duration step() {
                return Duration.parse(step);
            }
        };

        return new CloudWatchMeterRegistry(
                cloudWatchConfig,
                Clock.SYSTEM,
                cloudWatchAsyncClient
        );
    }
}
