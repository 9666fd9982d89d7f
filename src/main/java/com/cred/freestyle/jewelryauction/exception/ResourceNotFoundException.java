package com.cred.freestyle.jewelryauction.exception;

/**
 * Exception thrown when a referenced entity (lot, session, payment, etc.) does not exist.
 *
 * @author Jewelry Auction Team
 */
public class ResourceNotFoundException extends AuctionException {

    public static final String CODE = "NOT_FOUND";

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(CODE, String.format("%s with ID %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
