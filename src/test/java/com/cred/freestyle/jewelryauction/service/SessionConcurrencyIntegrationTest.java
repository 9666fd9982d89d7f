package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.AuctionNotOpenException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.repository.BidRepository;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import com.cred.freestyle.jewelryauction.testutil.AuctionFixtures;
import com.cred.freestyle.jewelryauction.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrency guarantees around session assembly, settlement and session transitions,
 * run against a real database.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Session Concurrency Integration Tests")
class SessionConcurrencyIntegrationTest {

    @Autowired
    private SellRequestService sellRequestService;

    @Autowired
    private AuctionSessionService sessionService;

    @Autowired
    private BiddingService biddingService;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private SessionItemRepository sessionItemRepository;

    @Autowired
    private BidRepository bidRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private PayoutRepository payoutRepository;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    private AuctionFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new AuctionFixtures(sellRequestService, sessionService);
    }

    // ========================================
    // Lot numbering
    // ========================================

    @Test
    @DisplayName("Concurrent addItem calls number lots 1..N without gaps or duplicates")
    void concurrentAddItem_ContiguousLotNumbers() throws Exception {
        // Given
        int lots = 8;
        AuctionSession session = fixtures.draftSession(false);
        List<SellRequest> requests = new ArrayList<>();
        for (int i = 0; i < lots; i++) {
            requests.add(fixtures.acceptedSellRequest("Cameo " + i, new BigDecimal("200.00")));
        }

        // When
        List<Callable<SessionItem>> tasks = requests.stream()
                .<Callable<SessionItem>>map(r -> () -> fixtures.addLot(session, r, "200.00", "10.00"))
                .toList();
        List<SessionItem> added = runTogether(tasks);

        // Then
        List<Integer> numbers = sessionItemRepository.findAll().stream()
                .filter(i -> i.getSessionId().equals(session.getSessionId()))
                .map(SessionItem::getLotNumber)
                .sorted()
                .collect(Collectors.toList());
        assertThat(added).hasSize(lots);
        assertThat(numbers).containsExactlyElementsOf(
                IntStream.rangeClosed(1, lots).boxed().collect(Collectors.toList()));
    }

    // ========================================
    // Settlement
    // ========================================

    @Test
    @DisplayName("Concurrent settlement of one lot creates a single payment and payout")
    void concurrentSettle_SinglePaymentAndPayout() throws Exception {
        // Given - a SOLD lot whose settlement has not run yet
        SellRequest request = fixtures.acceptedSellRequest("Ruby bracelet", new BigDecimal("4000.00"));
        AuctionSession session = fixtures.draftSession(false);
        SessionItem lot = fixtures.addLot(session, request, "4000.00", "100.00");
        fixtures.scheduleAndOpen(session);
        biddingService.placeBid(lot.getSessionItemId(), TestDataBuilder.member("buyer-s1"),
                new BigDecimal("5200.00"), null);
        sessionService.close(session.getSessionId(), TestDataBuilder.staff());
        assertThat(sessionItemRepository.findById(lot.getSessionItemId()).orElseThrow().getStatus())
                .isEqualTo(SessionItemStatus.SOLD);

        // When
        int callers = 4;
        List<Callable<SettlementResult>> tasks = IntStream.range(0, callers)
                .<Callable<SettlementResult>>mapToObj(i -> () -> settlementService.settleLot(lot.getSessionItemId()))
                .toList();
        List<SettlementResult> results = runTogether(tasks);

        // Then
        assertThat(paymentRepository.findAll())
                .filteredOn(p -> p.getSessionItemId().equals(lot.getSessionItemId()))
                .hasSize(1);
        assertThat(payoutRepository.findAll())
                .filteredOn(p -> p.getSessionItemId().equals(lot.getSessionItemId()))
                .hasSize(1);
        assertThat(results).filteredOn(SettlementResult::isCreated).hasSize(1);
        assertThat(results).extracting(r -> r.getPayment().getPaymentId()).containsOnly(
                results.get(0).getPayment().getPaymentId());
    }

    // ========================================
    // Transitions racing a bid
    // ========================================

    @Test
    @DisplayName("A bid racing a pause either commits first or fails with AuctionNotOpen")
    void pauseDuringBid_BidCommitsOrIsRejected() throws Exception {
        // Given
        SellRequest request = fixtures.acceptedSellRequest("Pearl choker", new BigDecimal("800.00"));
        AuctionSession session = fixtures.draftSession(false);
        SessionItem lot = fixtures.addLot(session, request, "800.00", "20.00");
        fixtures.scheduleAndOpen(session);

        // When
        Throwable bidFailure = raceBidAgainst(lot, "bidder-p1", new BigDecimal("820.00"),
                () -> sessionService.pause(session.getSessionId(), TestDataBuilder.staff()));

        // Then
        List<Bid> winning = winningBids(lot);
        if (bidFailure == null) {
            assertThat(winning).hasSize(1);
        } else {
            assertThat(bidFailure).isInstanceOf(AuctionNotOpenException.class);
            assertThat(winning).isEmpty();
        }

        // A bid after the pause has committed is always rejected
        assertThatThrownBy(() -> biddingService.placeBid(lot.getSessionItemId(),
                TestDataBuilder.member("bidder-p2"), new BigDecimal("2000.00"), null))
                .isInstanceOf(AuctionNotOpenException.class);
    }

    @Test
    @DisplayName("A bid racing a close is either part of the result or fails with AuctionNotOpen")
    void closeDuringBid_BidCountedOrRejected() throws Exception {
        // Given
        SellRequest request = fixtures.acceptedSellRequest("Diamond studs", new BigDecimal("1500.00"));
        AuctionSession session = fixtures.draftSession(false);
        SessionItem lot = fixtures.addLot(session, request, "1500.00", "50.00");
        fixtures.scheduleAndOpen(session);

        // When
        Throwable bidFailure = raceBidAgainst(lot, "bidder-c1", new BigDecimal("1550.00"),
                () -> sessionService.close(session.getSessionId(), TestDataBuilder.staff()));

        // Then
        SessionItem closed = sessionItemRepository.findById(lot.getSessionItemId()).orElseThrow();
        if (bidFailure == null) {
            assertThat(closed.getStatus()).isEqualTo(SessionItemStatus.SOLD);
            assertThat(closed.getCurrentWinnerId()).isEqualTo("bidder-c1");
            assertThat(winningBids(lot)).hasSize(1);
        } else {
            assertThat(bidFailure).isInstanceOf(AuctionNotOpenException.class);
            assertThat(closed.getStatus()).isEqualTo(SessionItemStatus.UNSOLD);
            assertThat(winningBids(lot)).isEmpty();
        }
    }

    // ========================================
    // Helpers
    // ========================================

    private List<Bid> winningBids(SessionItem lot) {
        return bidRepository.findAll().stream()
                .filter(b -> b.getSessionItemId().equals(lot.getSessionItemId()))
                .filter(b -> b.getStatus() == BidStatus.WINNING)
                .toList();
    }

    /**
     * Start a bid and a session transition at the same instant.
     *
     * @return The bid's failure, or null when the bid was accepted
     */
    private Throwable raceBidAgainst(SessionItem lot, String bidderId, BigDecimal amount, Runnable transition)
            throws Exception {
        AtomicReference<Throwable> bidFailure = new AtomicReference<>();
        List<Callable<Object>> tasks = List.of(
                () -> {
                    try {
                        return biddingService.placeBid(lot.getSessionItemId(),
                                TestDataBuilder.member(bidderId), amount, null);
                    } catch (AuctionNotOpenException e) {
                        bidFailure.set(e);
                        return null;
                    }
                },
                () -> {
                    transition.run();
                    return null;
                });
        runTogether(tasks);
        return bidFailure.get();
    }

    /**
     * Release every task at once and wait for all of them. Any task failure fails the test.
     */
    private <T> List<T> runTogether(List<Callable<T>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
        List<Future<T>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < tasks.size(); i++) {
                int index = i;
                Callable<T> task = tasks.get(i);
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        return task.call();
                    } catch (Throwable t) {
                        failures.put(index, t);
                        return null;
                    }
                }));
            }
            start.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }
            assertThat(failures).isEmpty();
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
