package com.cred.freestyle.jewelryauction.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Fee schedule applied at settlement.
 * Percentages are expressed in percent (10.00 means 10%); min/max bound each computed fee.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "transaction_fees", indexes = {
    @Index(name = "idx_fee_active", columnList = "active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionFee {

    @Id
    @Column(name = "fee_id", nullable = false, length = 36)
    private String feeId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "buyer_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal buyerPercentage;

    @Column(name = "seller_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal sellerPercentage;

    @Column(name = "min_fee", precision = 14, scale = 2)
    private BigDecimal minFee;

    @Column(name = "max_fee", precision = 14, scale = 2)
    private BigDecimal maxFee;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (feeId == null) {
            feeId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }
}
