package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.TransactionFee;
import com.cred.freestyle.jewelryauction.repository.TransactionFeeRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes buyer premium and seller commission from the active fee schedule.
 *
 * fee = hammer × percentage / 100, rounded HALF_UP to 2 decimals, then raised to the
 * minimum fee and capped at the maximum fee. Without an active schedule the configured
 * defaults apply.
 *
 * @author Jewelry Auction Team
 */
@Component
public class FeeCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final TransactionFeeRepository transactionFeeRepository;
    private final FeeSchedule defaults;

    public FeeCalculator(
            TransactionFeeRepository transactionFeeRepository,
            @Value("${auction.fees.default-buyer-percentage:10.00}") BigDecimal buyerPercentage,
            @Value("${auction.fees.default-seller-percentage:5.00}") BigDecimal sellerPercentage,
            @Value("${auction.fees.default-min-fee:1.00}") BigDecimal minFee,
            @Value("${auction.fees.default-max-fee:1000.00}") BigDecimal maxFee
    ) {
        this.transactionFeeRepository = transactionFeeRepository;
        this.defaults = new FeeSchedule(null, "default", buyerPercentage, sellerPercentage, minFee, maxFee);
    }

    /**
     * @return the active schedule, or the configured defaults when none is active
     */
    public FeeSchedule currentSchedule() {
        return transactionFeeRepository.findFirstByActiveTrueOrderByCreatedAtDesc()
                .map(FeeSchedule::from)
                .orElse(defaults);
    }

    /**
     * Charges for a hammer price under the current schedule.
     */
    public FeeCharges calculate(BigDecimal hammerPrice) {
        return calculate(hammerPrice, currentSchedule());
    }

    public FeeCharges calculate(BigDecimal hammerPrice, FeeSchedule schedule) {
        BigDecimal premium = fee(hammerPrice, schedule.getBuyerPercentage(), schedule);
        BigDecimal commission = fee(hammerPrice, schedule.getSellerPercentage(), schedule);
        return new FeeCharges(hammerPrice, premium, commission, schedule.getFeeId());
    }

    static BigDecimal fee(BigDecimal hammerPrice, BigDecimal percentage, FeeSchedule schedule) {
        BigDecimal fee = hammerPrice.multiply(percentage)
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        if (schedule.getMinFee() != null && fee.compareTo(schedule.getMinFee()) < 0) {
            fee = schedule.getMinFee();
        }
        if (schedule.getMaxFee() != null && fee.compareTo(schedule.getMaxFee()) > 0) {
            fee = schedule.getMaxFee();
        }
        return fee.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Fee parameters in force. {@code feeId} is null for the configured defaults.
     */
    public static final class FeeSchedule {

        private final String feeId;
        private final String name;
        private final BigDecimal buyerPercentage;
        private final BigDecimal sellerPercentage;
        private final BigDecimal minFee;
        private final BigDecimal maxFee;

        public FeeSchedule(String feeId, String name, BigDecimal buyerPercentage, BigDecimal sellerPercentage,
                           BigDecimal minFee, BigDecimal maxFee) {
            this.feeId = feeId;
            this.name = name;
            this.buyerPercentage = buyerPercentage;
            this.sellerPercentage = sellerPercentage;
            this.minFee = minFee;
            this.maxFee = maxFee;
        }

        public static FeeSchedule from(TransactionFee fee) {
            return new FeeSchedule(fee.getFeeId(), fee.getName(), fee.getBuyerPercentage(),
                    fee.getSellerPercentage(), fee.getMinFee(), fee.getMaxFee());
        }

        public String getFeeId() {
            return feeId;
        }

        public String getName() {
            return name;
        }

        public BigDecimal getBuyerPercentage() {
            return buyerPercentage;
        }

        public BigDecimal getSellerPercentage() {
            return sellerPercentage;
        }

        public BigDecimal getMinFee() {
            return minFee;
        }

        public BigDecimal getMaxFee() {
            return maxFee;
        }
    }
}
