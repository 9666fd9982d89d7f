package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.api.dto.DashboardOverviewResponse;
import com.cred.freestyle.jewelryauction.api.dto.RevenueReportResponse;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment.EnrollmentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Payout.PayoutStatus;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.domain.model.Refund.RefundStatus;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest.SellRequestStatus;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.repository.AuctionSessionRepository;
import com.cred.freestyle.jewelryauction.repository.EnrollmentRepository;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.repository.RefundRepository;
import com.cred.freestyle.jewelryauction.repository.SellRequestRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import com.cred.freestyle.jewelryauction.repository.UserRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Read-only dashboard figures for staff and managers.
 *
 * @author Jewelry Auction Team
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    static final Duration DEFAULT_REVENUE_WINDOW = Duration.ofDays(30);

    private final SellRequestRepository sellRequestRepository;
    private final AuctionSessionRepository sessionRepository;
    private final SessionItemRepository sessionItemRepository;
    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final RefundRepository refundRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final UserRepository userRepository;

    public ReportService(
            SellRequestRepository sellRequestRepository,
            AuctionSessionRepository sessionRepository,
            SessionItemRepository sessionItemRepository,
            PaymentRepository paymentRepository,
            PayoutRepository payoutRepository,
            RefundRepository refundRepository,
            EnrollmentRepository enrollmentRepository,
            UserRepository userRepository
    ) {
        this.sellRequestRepository = sellRequestRepository;
        this.sessionRepository = sessionRepository;
        this.sessionItemRepository = sessionItemRepository;
        this.paymentRepository = paymentRepository;
        this.payoutRepository = payoutRepository;
        this.refundRepository = refundRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.userRepository = userRepository;
    }

    /**
     * Counts by status for every stage of the pipeline. Staff and above.
     */
    public DashboardOverviewResponse overview(AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "View dashboard");
        return DashboardOverviewResponse.builder()
                .generatedAt(Instant.now())
                .sellRequests(countEach(SellRequestStatus.values(), sellRequestRepository::countByStatus))
                .sessions(countEach(SessionStatus.values(), sessionRepository::countByStatus))
                .lots(countEach(SessionItemStatus.values(), sessionItemRepository::countByStatus))
                .payments(countEach(PaymentStatus.values(), paymentRepository::countByStatus))
                .payouts(countEach(PayoutStatus.values(), payoutRepository::countByStatus))
                .pendingEnrollments(enrollmentRepository.countByStatus(EnrollmentStatus.PENDING))
                .activeUsers(userRepository.countByActiveTrue())
                .build();
    }

    /**
     * Revenue for money that moved in [from, to]. Managers and above.
     *
     * @param from Window start, null for 30 days before {@code to}
     * @param to Window end, null for now
     * @throws ValidationException if the window is empty or inverted
     */
    public RevenueReportResponse revenue(AuthenticatedUser actor, Instant from, Instant to) {
        AuthorizationGate.requireAtLeast(actor, Role.MANAGER, "View revenue report");
        Instant windowEnd = to != null ? to : Instant.now();
        Instant windowStart = from != null ? from : windowEnd.minus(DEFAULT_REVENUE_WINDOW);
        if (!windowStart.isBefore(windowEnd)) {
            throw new ValidationException("from", "Report start must be before its end");
        }

        List<Payment> payments = paymentRepository.findByStatusAndProcessedAtBetween(
                PaymentStatus.COMPLETED, windowStart, windowEnd);
        List<Payout> payouts = payoutRepository.findByStatusAndProcessedAtBetween(
                PayoutStatus.COMPLETED, windowStart, windowEnd);
        List<Refund> refunds = refundRepository.findByStatusAndProcessedAtBetween(
                RefundStatus.REFUNDED, windowStart, windowEnd);

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal hammer = BigDecimal.ZERO;
        BigDecimal premium = BigDecimal.ZERO;
        for (Payment payment : payments) {
            gross = gross.add(payment.getAmount());
            hammer = hammer.add(payment.getHammerPrice());
            premium = premium.add(payment.getBuyerPremium());
        }

        BigDecimal paidOut = BigDecimal.ZERO;
        BigDecimal commission = BigDecimal.ZERO;
        for (Payout payout : payouts) {
            paidOut = paidOut.add(payout.getAmount());
            commission = commission.add(payout.getSellerCommission());
        }

        BigDecimal refunded = BigDecimal.ZERO;
        for (Refund refund : refunds) {
            refunded = refunded.add(refund.getAmount());
        }

        logger.debug("Revenue report {}..{}: {} payments, {} payouts, {} refunds",
                windowStart, windowEnd, payments.size(), payouts.size(), refunds.size());

        return RevenueReportResponse.builder()
                .from(windowStart)
                .to(windowEnd)
                .completedPayments(payments.size())
                .grossPayments(gross)
                .totalHammer(hammer)
                .totalBuyerPremium(premium)
                .completedPayouts(payouts.size())
                .totalPayouts(paidOut)
                .totalSellerCommission(commission)
                .refunds(refunds.size())
                .totalRefunded(refunded)
                .platformRevenue(premium.add(commission))
                .build();
    }

    private static <S extends Enum<S>> Map<String, Long> countEach(S[] statuses, ToLongFunction<S> counter) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (S status : statuses) {
            counts.put(status.name(), counter.applyAsLong(status));
        }
        return counts;
    }
}
