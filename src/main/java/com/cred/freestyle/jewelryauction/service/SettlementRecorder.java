package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Payout.PayoutStatus;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.repository.BidRepository;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Writes the payment and payout of a SOLD lot in one transaction.
 *
 * No row lock is taken: a concurrent duplicate fails on the unique
 * {@code session_item_id} columns and the caller reads back the winner's records.
 *
 * @author Jewelry Auction Team
 */
@Component
public class SettlementRecorder {

    private static final Logger logger = LoggerFactory.getLogger(SettlementRecorder.class);

    private final SessionItemRepository sessionItemRepository;
    private final BidRepository bidRepository;
    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final FeeCalculator feeCalculator;

    public SettlementRecorder(
            SessionItemRepository sessionItemRepository,
            BidRepository bidRepository,
            PaymentRepository paymentRepository,
            PayoutRepository payoutRepository,
            FeeCalculator feeCalculator
    ) {
        this.sessionItemRepository = sessionItemRepository;
        this.bidRepository = bidRepository;
        this.paymentRepository = paymentRepository;
        this.payoutRepository = payoutRepository;
        this.feeCalculator = feeCalculator;
    }

    @Transactional
    public SettlementResult record(String sessionItemId) {
        SessionItem item = sessionItemRepository.findById(sessionItemId)
                .orElseThrow(() -> new ResourceNotFoundException("SessionItem", sessionItemId));
        if (item.getStatus() != SessionItemStatus.SOLD) {
            throw new InvalidStateTransitionException("SessionItem", sessionItemId, item.getStatus(),
                    SessionItemStatus.SOLD);
        }

        Optional<SettlementResult> existing = findExisting(sessionItemId);
        if (existing.isPresent()) {
            logger.info("Lot {} already settled, payment {}", sessionItemId, existing.get().getPayment().getPaymentId());
            return existing.get();
        }

        Bid winningBid = bidRepository.findBySessionItemIdAndStatus(sessionItemId, BidStatus.WINNING)
                .orElseThrow(() -> new ResourceNotFoundException("WinningBid", sessionItemId));

        FeeCharges charges = feeCalculator.calculate(winningBid.getAmount());

        Payment payment = Payment.builder()
                .sessionItemId(sessionItemId)
                .sessionId(item.getSessionId())
                .buyerId(winningBid.getBidderId())
                .hammerPrice(charges.getHammerPrice())
                .buyerPremium(charges.getBuyerPremium())
                .amount(charges.buyerTotal())
                .feeScheduleId(charges.getFeeScheduleId())
                .status(PaymentStatus.PENDING)
                .build();

        Payout payout = Payout.builder()
                .sessionItemId(sessionItemId)
                .sessionId(item.getSessionId())
                .sellerId(item.getSellerId())
                .hammerPrice(charges.getHammerPrice())
                .sellerCommission(charges.getSellerCommission())
                .amount(charges.sellerNet())
                .feeScheduleId(charges.getFeeScheduleId())
                .status(PayoutStatus.PENDING)
                .build();

        payment = paymentRepository.saveAndFlush(payment);
        payout = payoutRepository.saveAndFlush(payout);

        logger.info("Settled lot {}: hammer {}, buyer owes {}, seller receives {}",
                sessionItemId, charges.getHammerPrice(), payment.getAmount(), payout.getAmount());
        return new SettlementResult(payment, payout, charges, true);
    }

    @Transactional(readOnly = true)
    public Optional<SettlementResult> findExisting(String sessionItemId) {
        Optional<Payment> payment = paymentRepository.findBySessionItemId(sessionItemId);
        Optional<Payout> payout = payoutRepository.findBySessionItemId(sessionItemId);
        if (payment.isPresent() && payout.isPresent()) {
            return Optional.of(SettlementResult.existing(payment.get(), payout.get()));
        }
        return Optional.empty();
    }
}
