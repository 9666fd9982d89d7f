package com.cred.freestyle.jewelryauction.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CloudWatchConfig Meter Filter Tests")
class CloudWatchConfigTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        registry.config()
                .meterFilter(CloudWatchConfig.commonTags("staging"))
                .meterFilter(CloudWatchConfig.sessionTagLimit(2));
    }

    private void bidAccepted(String sessionId) {
        Counter.builder("auction.bid.accepted").tag("session_id", sessionId).register(registry).increment();
    }

    @Test
    @DisplayName("Auction meters carry the service and environment tags")
    void commonTags_Applied() {
        bidAccepted("session-1");

        Counter counter = registry.get("auction.bid.accepted").counter();
        assertThat(counter.getId().getTag("service")).isEqualTo("jewelry-auction");
        assertThat(counter.getId().getTag("environment")).isEqualTo("staging");
    }

    @Test
    @DisplayName("Sessions beyond the limit share one overflow series")
    void sessionTagLimit_FoldsOverflow() {
        // Given / When
        bidAccepted("session-1");
        bidAccepted("session-2");
        bidAccepted("session-3");
        bidAccepted("session-4");
        bidAccepted("session-1");

        // Then
        assertThat(registry.get("auction.bid.accepted").tag("session_id", "session-1").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("auction.bid.accepted").tag("session_id", "session-2").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("auction.bid.accepted").tag("session_id", CloudWatchConfig.OVERFLOW_SESSION)
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.find("auction.bid.accepted").tag("session_id", "session-3").counter()).isNull();
    }

    @Test
    @DisplayName("Meters outside the auction namespace keep their tags")
    void sessionTagLimit_IgnoresOtherMeters() {
        for (int i = 0; i < 5; i++) {
            Counter.builder("http.requests").tag("session_id", "s-" + i).register(registry).increment();
        }

        assertThat(registry.find("http.requests").counters()).hasSize(5);
    }
}
