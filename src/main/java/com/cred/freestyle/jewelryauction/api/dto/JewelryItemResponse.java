package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for catalogue items.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class JewelryItemResponse {

    private String jewelryItemId;
    private String code;
    private String title;
    private String description;
    private Map<String, String> attributes;
    private BigDecimal weight;
    private List<String> photos;
    private String ownerId;
    private String status;
    private BigDecimal estimatedPrice;
    private BigDecimal reservePrice;
    private Instant createdAt;

    public static JewelryItemResponse fromEntity(JewelryItem item) {
        JewelryItemResponse response = new JewelryItemResponse();
        response.setJewelryItemId(item.getJewelryItemId());
        response.setCode(item.getCode());
        response.setTitle(item.getTitle());
        response.setDescription(item.getDescription());
        response.setAttributes(new HashMap<>(item.getAttributes()));
        response.setWeight(item.getWeight());
        response.setPhotos(new ArrayList<>(item.getPhotos()));
        response.setOwnerId(item.getOwnerId());
        response.setStatus(item.getStatus().name());
        response.setEstimatedPrice(item.getEstimatedPrice());
        response.setReservePrice(item.getReservePrice());
        response.setCreatedAt(item.getCreatedAt());
        return response;
    }
}
