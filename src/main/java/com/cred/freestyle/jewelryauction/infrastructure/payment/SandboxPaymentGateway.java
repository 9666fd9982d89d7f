package com.cred.freestyle.jewelryauction.infrastructure.payment;

import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic in-process payment processor.
 *
 * Rules:
 * - Methods listed in auction.payment.gateway.declined-methods are declined
 * - Amounts above auction.payment.gateway.max-amount are declined
 * - Everything else succeeds with a "TXN-" transaction ID
 * - Refunds succeed only for transactions this gateway issued, up to the original amount
 *
 * @author Jewelry Auction Team
 */
@Component
public class SandboxPaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(SandboxPaymentGateway.class);

    private static final String TRANSACTION_PREFIX = "TXN-";

    private final Set<PaymentMethod> declinedMethods;
    private final BigDecimal maxAmount;

    // Issued transaction ID -> amount
    private final Map<String, BigDecimal> issuedTransactions = new ConcurrentHashMap<>();

    public SandboxPaymentGateway(
            @Value("${auction.payment.gateway.declined-methods:}") String declinedMethods,
            @Value("${auction.payment.gateway.max-amount:1000000.00}") BigDecimal maxAmount
    ) {
        this.declinedMethods = parseMethods(declinedMethods);
        this.maxAmount = maxAmount;
    }

    @Override
    public GatewayResult processPayment(BigDecimal amount, PaymentMethod method, Map<String, String> details) {
        if (amount == null || amount.signum() <= 0) {
            return GatewayResult.failure("Amount must be positive");
        }
        if (method != null && declinedMethods.contains(method)) {
            logger.info("Sandbox gateway declined {} for method {}", amount, method);
            return GatewayResult.failure("Payment method " + method + " declined");
        }
        if (amount.compareTo(maxAmount) > 0) {
            logger.info("Sandbox gateway declined {} above limit {}", amount, maxAmount);
            return GatewayResult.failure("Amount exceeds gateway limit");
        }

        String transactionId = issue(amount);
        logger.debug("Sandbox gateway accepted {} via {}, transaction: {}, details: {}",
                amount, method, transactionId, details);
        return GatewayResult.success(transactionId);
    }

    @Override
    public GatewayResult processRefund(String transactionId, BigDecimal amount) {
        BigDecimal original = transactionId != null ? issuedTransactions.get(transactionId) : null;
        if (original == null) {
            return GatewayResult.failure("Unknown transaction " + transactionId);
        }
        if (amount == null || amount.signum() <= 0 || amount.compareTo(original) > 0) {
            return GatewayResult.failure("Refund amount must be between 0 and " + original.toPlainString());
        }
        return GatewayResult.success(issue(amount));
    }

    @Override
    public boolean verifyPayment(String transactionId) {
        return transactionId != null && issuedTransactions.containsKey(transactionId);
    }

    private String issue(BigDecimal amount) {
        String transactionId = TRANSACTION_PREFIX + UUID.randomUUID();
        issuedTransactions.put(transactionId, amount);
        return transactionId;
    }

    private static Set<PaymentMethod> parseMethods(String value) {
        Set<PaymentMethod> methods = EnumSet.noneOf(PaymentMethod.class);
        if (value == null || value.isBlank()) {
            return methods;
        }
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(s -> methods.add(PaymentMethod.valueOf(s.toUpperCase())));
        return methods;
    }
}
