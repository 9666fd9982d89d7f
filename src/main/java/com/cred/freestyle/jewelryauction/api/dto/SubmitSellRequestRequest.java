package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for consigning a jewelry item.
 * The code is optional; one is generated when absent.
 *
 * @author Jewelry Auction Team
 */
public class SubmitSellRequestRequest {

    @Size(max = 20, message = "Code must be at most 20 characters")
    private String code;

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @NotBlank(message = "Description is required")
    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private Map<String, String> attributes = new HashMap<>();

    @DecimalMin(value = "0.0", inclusive = false, message = "Weight must be positive")
    private BigDecimal weight;

    @NotEmpty(message = "At least one photo is required")
    @Size(max = 10, message = "At most 10 photos are allowed")
    private List<String> photos = new ArrayList<>();

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String sellerNotes;

    public SubmitSellRequestRequest() {
    }

    public SubmitSellRequestRequest(String code, String title, String description, List<String> photos) {
        this.code = code;
        this.title = title;
        this.description = description;
        this.photos = photos;
    }

    // Getters and setters
    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public BigDecimal getWeight() {
        return weight;
    }

    public void setWeight(BigDecimal weight) {
        this.weight = weight;
    }

    public List<String> getPhotos() {
        return photos;
    }

    public void setPhotos(List<String> photos) {
        this.photos = photos;
    }

    public String getSellerNotes() {
        return sellerNotes;
    }

    public void setSellerNotes(String sellerNotes) {
        this.sellerNotes = sellerNotes;
    }
}
