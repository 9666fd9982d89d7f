package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Payout.PayoutStatus;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.domain.model.Refund.RefundStatus;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage.Kind;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.infrastructure.payment.GatewayResult;
import com.cred.freestyle.jewelryauction.infrastructure.payment.PaymentGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentDispatchService Unit Tests")
class PaymentDispatchServiceTest {

    @Mock
    private PaymentLedger ledger;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private PaymentDispatchService dispatchService;

    private static Payment processingPayment() {
        return Payment.builder()
                .paymentId("pay-1")
                .buyerId("bidder-001")
                .sessionItemId("lot-1")
                .amount(new BigDecimal("1100.00"))
                .method(PaymentMethod.CREDIT_CARD)
                .status(PaymentStatus.PROCESSING)
                .build();
    }

    @Test
    @DisplayName("PAYMENT - Gateway success is recorded on the ledger")
    void payment_Success() {
        Payment payment = processingPayment();
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(paymentGateway.processPayment(eq(new BigDecimal("1100.00")), eq(PaymentMethod.CREDIT_CARD), anyMap()))
                .thenReturn(GatewayResult.success("TXN-9"));
        when(ledger.recordPaymentResult(eq("pay-1"), any(GatewayResult.class))).thenAnswer(inv -> {
            payment.complete(((GatewayResult) inv.getArgument(1)).getTransactionId());
            return payment;
        });

        dispatchService.dispatch(new PaymentDispatchMessage(Kind.PAYMENT, "pay-1", "bidder-001"));

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(payment.getGatewayTransactionId()).isEqualTo("TXN-9");
        verify(metricsService).recordPaymentOutcome("PAYMENT", "COMPLETED");
        verify(metricsService).recordGatewayLatency(eq("PAYMENT"), anyLong());
    }

    @Test
    @DisplayName("PAYMENT - Gateway exception becomes a FAILED result, not a thrown error")
    void payment_GatewayThrows() {
        Payment payment = processingPayment();
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(paymentGateway.processPayment(any(), any(), anyMap())).thenThrow(new IllegalStateException("socket closed"));
        when(ledger.recordPaymentResult(eq("pay-1"), any(GatewayResult.class))).thenAnswer(inv -> {
            payment.fail(((GatewayResult) inv.getArgument(1)).getFailureReason());
            return payment;
        });

        dispatchService.dispatch(new PaymentDispatchMessage(Kind.PAYMENT, "pay-1", "bidder-001"));

        ArgumentCaptor<GatewayResult> result = ArgumentCaptor.forClass(GatewayResult.class);
        verify(ledger).recordPaymentResult(eq("pay-1"), result.capture());
        assertThat(result.getValue().isSuccess()).isFalse();
        assertThat(result.getValue().getFailureReason()).contains("socket closed");
        verify(metricsService).recordError(eq("EXTERNAL_SERVICE_ERROR"), eq("gateway_payment"));
        verify(metricsService).recordPaymentOutcome("PAYMENT", "FAILED");
    }

    @Test
    @DisplayName("PAYMENT - Redelivered message for a finished payment is skipped")
    void payment_AlreadyCompleted() {
        Payment payment = processingPayment();
        payment.setStatus(PaymentStatus.COMPLETED);
        when(ledger.findPayment("pay-1")).thenReturn(payment);

        dispatchService.dispatch(new PaymentDispatchMessage(Kind.PAYMENT, "pay-1", "bidder-001"));

        verifyNoInteractions(paymentGateway);
        verify(ledger, never()).recordPaymentResult(anyString(), any());
    }

    @Test
    @DisplayName("PAYOUT - Paid out by bank transfer")
    void payout_BankTransfer() {
        Payout payout = Payout.builder().payoutId("po-1").sellerId("seller-001").sessionItemId("lot-1")
                .amount(new BigDecimal("950.00")).status(PayoutStatus.PROCESSING).build();
        when(ledger.findPayout("po-1")).thenReturn(payout);
        when(paymentGateway.processPayment(eq(new BigDecimal("950.00")), eq(PaymentMethod.BANK_TRANSFER), anyMap()))
                .thenReturn(GatewayResult.success("TXN-10"));
        when(ledger.recordPayoutResult(eq("po-1"), any(GatewayResult.class))).thenAnswer(inv -> {
            payout.complete("TXN-10");
            return payout;
        });

        dispatchService.dispatch(new PaymentDispatchMessage(Kind.PAYOUT, "po-1", "staff-001"));

        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.COMPLETED);
    }

    @Test
    @DisplayName("REFUND - Refunds against the original transaction")
    void refund_Success() {
        Payment payment = processingPayment();
        payment.setGatewayTransactionId("TXN-9");
        Refund refund = Refund.builder().refundId("rf-1").paymentId("pay-1")
                .amount(new BigDecimal("100.00")).status(RefundStatus.PENDING).build();
        when(ledger.findRefund("rf-1")).thenReturn(refund);
        when(ledger.findPayment("pay-1")).thenReturn(payment);
        when(paymentGateway.processRefund("TXN-9", new BigDecimal("100.00"))).thenReturn(GatewayResult.success("TXN-11"));
        when(ledger.recordRefundResult(eq("rf-1"), any(GatewayResult.class))).thenAnswer(inv -> {
            refund.complete("TXN-11");
            return refund;
        });

        dispatchService.dispatch(new PaymentDispatchMessage(Kind.REFUND, "rf-1", "staff-001"));

        assertThat(refund.getStatus()).isEqualTo(RefundStatus.REFUNDED);
        verify(metricsService).recordPaymentOutcome("REFUND", "REFUNDED");
    }

    @Test
    @DisplayName("Malformed message is ignored")
    void malformedMessage() {
        dispatchService.dispatch(new PaymentDispatchMessage(null, "pay-1", "x"));

        verifyNoInteractions(ledger, paymentGateway);
    }
}
