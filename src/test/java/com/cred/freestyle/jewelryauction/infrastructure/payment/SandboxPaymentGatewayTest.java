package com.cred.freestyle.jewelryauction.infrastructure.payment;

import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SandboxPaymentGateway Tests")
class SandboxPaymentGatewayTest {

    private SandboxPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new SandboxPaymentGateway("digital_wallet", new BigDecimal("50000.00"));
    }

    @Test
    @DisplayName("Accepted payment issues a verifiable transaction")
    void processPayment_Success() {
        GatewayResult result = gateway.processPayment(new BigDecimal("1100.00"), PaymentMethod.CREDIT_CARD, Map.of());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTransactionId()).startsWith("TXN-");
        assertThat(gateway.verifyPayment(result.getTransactionId())).isTrue();
    }

    @Test
    @DisplayName("Configured method is declined")
    void processPayment_DeclinedMethod() {
        GatewayResult result = gateway.processPayment(BigDecimal.TEN, PaymentMethod.DIGITAL_WALLET, Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).contains("DIGITAL_WALLET");
    }

    @Test
    @DisplayName("Amount above the limit is declined")
    void processPayment_OverLimit() {
        assertThat(gateway.processPayment(new BigDecimal("50000.01"), PaymentMethod.BANK_TRANSFER, Map.of())
                .isSuccess()).isFalse();
        assertThat(gateway.processPayment(new BigDecimal("50000.00"), PaymentMethod.BANK_TRANSFER, Map.of())
                .isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Refund is bounded by the original amount")
    void processRefund_Bounds() {
        String transactionId = gateway.processPayment(new BigDecimal("500.00"), PaymentMethod.DEBIT_CARD, Map.of())
                .getTransactionId();

        assertThat(gateway.processRefund(transactionId, new BigDecimal("500.01")).isSuccess()).isFalse();
        assertThat(gateway.processRefund(transactionId, BigDecimal.ZERO).isSuccess()).isFalse();
        assertThat(gateway.processRefund(transactionId, new BigDecimal("200.00")).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Unknown transactions cannot be refunded or verified")
    void unknownTransaction() {
        assertThat(gateway.processRefund("TXN-unknown", BigDecimal.ONE).isSuccess()).isFalse();
        assertThat(gateway.verifyPayment("TXN-unknown")).isFalse();
        assertThat(gateway.verifyPayment(null)).isFalse();
    }
}
