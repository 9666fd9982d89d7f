package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import com.cred.freestyle.jewelryauction.exception.BusinessRuleViolationException;
import com.cred.freestyle.jewelryauction.exception.ExternalServiceException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage.Kind;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.infrastructure.payment.GatewayResult;
import com.cred.freestyle.jewelryauction.infrastructure.payment.PaymentGateway;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PaymentService.
 * The ledger and the Kafka producer are mocked; dispatch success and failure are driven
 * through the returned future.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentService Unit Tests")
class PaymentServiceTest {

    @Mock
    private PaymentLedger ledger;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private PayoutRepository payoutRepository;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private CloudWatchMetricsService metricsService;

    private PaymentService paymentService;

    private Payment payment;

    @BeforeEach
    void setUp() {
        paymentService = new PaymentService(ledger, paymentRepository, payoutRepository, paymentGateway,
                kafkaProducerService, metricsService, 1000L);
        payment = Payment.builder()
                .paymentId("pay-1")
                .buyerId(TestDataBuilder.BIDDER_ID)
                .amount(new BigDecimal("1100.00"))
                .status(PaymentStatus.PENDING)
                .build();
    }

    private void dispatchSucceeds() {
        when(kafkaProducerService.publishPaymentDispatch(any(PaymentDispatchMessage.class)))
                .thenReturn(CompletableFuture.completedFuture(null));
    }

    private void dispatchFails() {
        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new RuntimeException("broker unavailable"));
        when(kafkaProducerService.publishPaymentDispatch(any(PaymentDispatchMessage.class))).thenReturn(failed);
    }

    // ========================================
    // requestPayment() Tests
    // ========================================

    @Test
    @DisplayName("requestPayment - Buyer's request is marked PROCESSING and dispatched")
    void requestPayment_Success() {
        // Given
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(ledger.markPaymentProcessing("pay-1", PaymentMethod.CREDIT_CARD)).thenAnswer(inv -> {
            payment.startProcessing(PaymentMethod.CREDIT_CARD);
            return payment;
        });
        dispatchSucceeds();

        // When
        Payment result = paymentService.requestPayment("pay-1", PaymentMethod.CREDIT_CARD, TestDataBuilder.bidder());

        // Then
        assertThat(result.getStatus()).isEqualTo(PaymentStatus.PROCESSING);
        ArgumentCaptor<PaymentDispatchMessage> message = ArgumentCaptor.forClass(PaymentDispatchMessage.class);
        verify(kafkaProducerService).publishPaymentDispatch(message.capture());
        assertThat(message.getValue().getKind()).isEqualTo(Kind.PAYMENT);
        assertThat(message.getValue().getReferenceId()).isEqualTo("pay-1");
        verify(ledger, never()).revertPayment(anyString());
    }

    @Test
    @DisplayName("requestPayment - Failed dispatch puts the payment back to PENDING")
    void requestPayment_DispatchFails() {
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(ledger.markPaymentProcessing("pay-1", PaymentMethod.CREDIT_CARD)).thenReturn(payment);
        dispatchFails();

        assertThatThrownBy(() -> paymentService.requestPayment("pay-1", PaymentMethod.CREDIT_CARD,
                TestDataBuilder.bidder()))
                .isInstanceOf(ExternalServiceException.class);

        verify(ledger).revertPayment("pay-1");
    }

    @Test
    @DisplayName("requestPayment - Only the buyer may pay")
    void requestPayment_NotBuyer() {
        when(ledger.findPayment("pay-1")).thenReturn(payment);

        assertThatThrownBy(() -> paymentService.requestPayment("pay-1", PaymentMethod.CREDIT_CARD,
                TestDataBuilder.staff()))
                .isInstanceOf(AuthorizationException.class);

        verify(ledger, never()).markPaymentProcessing(anyString(), any());
    }

    @Test
    @DisplayName("requestPayment - Method is required")
    void requestPayment_NoMethod() {
        assertThatThrownBy(() -> paymentService.requestPayment("pay-1", null, TestDataBuilder.bidder()))
                .isInstanceOf(ValidationException.class);
    }

    // ========================================
    // requestPayout() Tests
    // ========================================

    @Test
    @DisplayName("requestPayout - Staff release is dispatched")
    void requestPayout_Success() {
        Payout payout = Payout.builder().payoutId("po-1").sellerId(TestDataBuilder.SELLER_ID)
                .amount(new BigDecimal("950")).build();
        when(ledger.markPayoutProcessing("po-1")).thenReturn(payout);
        dispatchSucceeds();

        assertThat(paymentService.requestPayout("po-1", TestDataBuilder.staff())).isSameAs(payout);
    }

    @Test
    @DisplayName("requestPayout - Failed dispatch reverts the payout")
    void requestPayout_DispatchFails() {
        when(ledger.markPayoutProcessing("po-1")).thenReturn(Payout.builder().payoutId("po-1").build());
        dispatchFails();

        assertThatThrownBy(() -> paymentService.requestPayout("po-1", TestDataBuilder.staff()))
                .isInstanceOf(ExternalServiceException.class);
        verify(ledger).revertPayout("po-1");
    }

    @Test
    @DisplayName("requestPayout - Sellers cannot release their own payout")
    void requestPayout_SellerDenied() {
        assertThatThrownBy(() -> paymentService.requestPayout("po-1", TestDataBuilder.seller()))
                .isInstanceOf(AuthorizationException.class);
        verifyNoInteractions(ledger);
    }

    // ========================================
    // requestRefund() Tests
    // ========================================

    @Test
    @DisplayName("requestRefund - Failed dispatch records the refund as FAILED")
    void requestRefund_DispatchFails() {
        Refund refund = Refund.builder().refundId("rf-1").paymentId("pay-1").amount(new BigDecimal("100")).build();
        when(ledger.createRefund("pay-1", new BigDecimal("100"), "Damaged in transit", TestDataBuilder.STAFF_ID))
                .thenReturn(refund);
        dispatchFails();

        assertThatThrownBy(() -> paymentService.requestRefund("pay-1", new BigDecimal("100"),
                "Damaged in transit", TestDataBuilder.staff()))
                .isInstanceOf(ExternalServiceException.class);

        ArgumentCaptor<GatewayResult> result = ArgumentCaptor.forClass(GatewayResult.class);
        verify(ledger).recordRefundResult(eq("rf-1"), result.capture());
        assertThat(result.getValue().isSuccess()).isFalse();
        verify(metricsService).recordPaymentOutcome("REFUND", "DISPATCH_FAILED");
    }

    @Test
    @DisplayName("requestRefund - Reason is required")
    void requestRefund_NoReason() {
        assertThatThrownBy(() -> paymentService.requestRefund("pay-1", BigDecimal.TEN, " ", TestDataBuilder.staff()))
                .isInstanceOf(ValidationException.class);
    }

    // ========================================
    // verifyPayment() Tests
    // ========================================

    @Test
    @DisplayName("verifyPayment - Asks the gateway about the stored transaction")
    void verifyPayment_Success() {
        payment.setGatewayTransactionId("TXN-1");
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(paymentGateway.verifyPayment("TXN-1")).thenReturn(true);

        assertThat(paymentService.verifyPayment("pay-1", TestDataBuilder.bidder())).isTrue();
    }

    @Test
    @DisplayName("verifyPayment - Payment never charged has nothing to verify")
    void verifyPayment_NoTransaction() {
        when(ledger.findPayment("pay-1")).thenReturn(payment);

        assertThatThrownBy(() -> paymentService.verifyPayment("pay-1", TestDataBuilder.staff()))
                .isInstanceOf(BusinessRuleViolationException.class);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("verifyPayment - Gateway error surfaces as ExternalServiceException")
    void verifyPayment_GatewayError() {
        payment.setGatewayTransactionId("TXN-1");
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(paymentGateway.verifyPayment("TXN-1")).thenThrow(new IllegalStateException("timeout"));

        assertThatThrownBy(() -> paymentService.verifyPayment("pay-1", TestDataBuilder.bidder()))
                .isInstanceOf(ExternalServiceException.class);
    }
}
