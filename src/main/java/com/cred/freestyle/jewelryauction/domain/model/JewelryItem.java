package com.cred.freestyle.jewelryauction.domain.model;

import jakarta.persistence.*;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A consigned piece of jewelry.
 * Created together with its sell request; the status follows the consignment workflow
 * and the item is immutable once SOLD.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "jewelry_items", indexes = {
    @Index(name = "idx_jewelry_code", columnList = "code", unique = true),
    @Index(name = "idx_jewelry_owner", columnList = "owner_id"),
    @Index(name = "idx_jewelry_status", columnList = "status"),
    @Index(name = "idx_jewelry_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JewelryItem {

    @Id
    @Column(name = "jewelry_item_id", nullable = false, length = 36)
    private String jewelryItemId;

    /**
     * Human-facing catalogue code, e.g. JWL0000042.
     */
    @Column(name = "code", nullable = false, unique = true, length = 20)
    private String code;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    /**
     * Free-form attributes such as metal, stone, carat, hallmark.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "jewelry_attributes", joinColumns = @JoinColumn(name = "jewelry_item_id"))
    @MapKeyColumn(name = "attribute_name", length = 100)
    @Column(name = "attribute_value", length = 500)
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    /**
     * Weight in grams.
     */
    @Column(name = "weight", precision = 10, scale = 3)
    private BigDecimal weight;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "jewelry_photos", joinColumns = @JoinColumn(name = "jewelry_item_id"))
    @OrderColumn(name = "position")
    @Column(name = "photo_url", length = 1000)
    @Builder.Default
    private List<String> photos = new ArrayList<>();

    @Column(name = "owner_id", nullable = false, length = 36)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private JewelryStatus status;

    @Column(name = "estimated_price", precision = 14, scale = 2)
    private BigDecimal estimatedPrice;

    @Column(name = "reserve_price", precision = 14, scale = 2)
    private BigDecimal reservePrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (jewelryItemId == null) {
            jewelryItemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = JewelryStatus.PENDING_APPRAISAL;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Move the item to a new status. A SOLD item cannot change any further.
     *
     * @param next Target status
     * @throws InvalidStateTransitionException if the item is already SOLD
     */
    public void moveTo(JewelryStatus next) {
        if (status == JewelryStatus.SOLD) {
            throw new InvalidStateTransitionException("JewelryItem", jewelryItemId, status, "any status but SOLD");
        }
        this.status = next;
    }

    /**
     * Jewelry lifecycle status.
     */
    public enum JewelryStatus {
        PENDING_APPRAISAL,
        APPRAISED,
        APPROVED,
        IN_AUCTION,
        SOLD,
        UNSOLD,
        RETURNED,
        WITHDRAWN
    }
}
