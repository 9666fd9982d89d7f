package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for BidRepository using Testcontainers.
 * Checks the constraints the bidding engine relies on against a real PostgreSQL database.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("BidRepository Integration Tests")
class BidRepositoryIntegrationTest {

    private static final String LOT_ID = "lot-0001";
    private static final String SESSION_ID = "session-0001";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("jewelry_auction_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private BidRepository bidRepository;

    @BeforeEach
    void setUp() {
        bidRepository.deleteAll();
    }

    private static Bid bid(String bidderId, String amount, String idempotencyKey) {
        return Bid.builder()
                .bidId(UUID.randomUUID().toString())
                .sessionItemId(LOT_ID)
                .sessionId(SESSION_ID)
                .bidderId(bidderId)
                .amount(new BigDecimal(amount))
                .idempotencyKey(idempotencyKey)
                .status(BidStatus.VALID)
                .build();
    }

    // ========================================
    // Winning bid constraint Tests
    // ========================================

    @Test
    @DisplayName("Second WINNING bid on the same lot violates the constraint")
    void secondWinningBid_Rejected() {
        // Given
        Bid first = bid("bidder-001", "1100.00", null);
        first.markWinning();
        bidRepository.saveAndFlush(first);

        Bid second = bid("bidder-002", "1200.00", null);
        second.markWinning();

        // When / Then
        assertThatThrownBy(() -> bidRepository.saveAndFlush(second))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Outbid bids release the winning slot")
    void outbidThenWinning_Allowed() {
        Bid first = bid("bidder-001", "1100.00", null);
        first.markWinning();
        first = bidRepository.saveAndFlush(first);
        first.markOutbid();
        bidRepository.saveAndFlush(first);

        Bid second = bid("bidder-002", "1200.00", null);
        second.markWinning();
        bidRepository.saveAndFlush(second);

        assertThat(bidRepository.findBySessionItemIdAndStatus(LOT_ID, BidStatus.WINNING))
                .get()
                .extracting(Bid::getBidderId)
                .isEqualTo("bidder-002");
        assertThat(bidRepository.countBySessionItemIdAndStatus(LOT_ID, BidStatus.OUTBID)).isEqualTo(1);
    }

    // ========================================
    // Idempotency key Tests
    // ========================================

    @Test
    @DisplayName("Same idempotency key from the same bidder is unique per lot")
    void duplicateIdempotencyKey_Rejected() {
        bidRepository.saveAndFlush(bid("bidder-001", "1100.00", "key-1"));

        assertThatThrownBy(() -> bidRepository.saveAndFlush(bid("bidder-001", "1150.00", "key-1")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Bids without a key never collide")
    void nullIdempotencyKeys_Allowed() {
        bidRepository.saveAndFlush(bid("bidder-001", "1100.00", null));
        bidRepository.saveAndFlush(bid("bidder-001", "1150.00", null));

        assertThat(bidRepository.count()).isEqualTo(2);
        assertThat(bidRepository.findBySessionItemIdAndBidderIdAndIdempotencyKey(LOT_ID, "bidder-001", "missing"))
                .isEmpty();
    }

    // ========================================
    // History Tests
    // ========================================

    @Test
    @DisplayName("Lot history is ordered by amount, highest first")
    void lotHistory_OrderedByAmount() {
        bidRepository.saveAndFlush(bid("bidder-001", "1100.00", null));
        bidRepository.saveAndFlush(bid("bidder-002", "1300.00", null));
        bidRepository.saveAndFlush(bid("bidder-003", "1200.00", null));

        Page<Bid> page = bidRepository.findBySessionItemIdOrderByAmountDescCreatedAtAsc(LOT_ID, PageRequest.of(0, 2));

        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.getContent())
                .extracting(Bid::getBidderId)
                .containsExactly("bidder-002", "bidder-003");
    }
}
