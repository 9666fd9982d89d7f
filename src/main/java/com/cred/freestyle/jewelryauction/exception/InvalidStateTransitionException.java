package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when a status change is requested from a status that does not allow it.
 *
 * @author Jewelry Auction Team
 */
public class InvalidStateTransitionException extends BusinessRuleViolationException {

    public static final String CODE = "INVALID_STATE_TRANSITION";

    private final String entityType;
    private final String entityId;
    private final String currentStatus;
    private final String expectedStatus;

    public InvalidStateTransitionException(String entityType, String entityId,
                                           Enum<?> currentStatus, String expectedStatus) {
        super(CODE, String.format("%s %s is in status %s, expected %s",
                entityType, entityId, currentStatus, expectedStatus));
        this.entityType = entityType;
        this.entityId = entityId;
        this.currentStatus = currentStatus == null ? null : currentStatus.name();
        this.expectedStatus = expectedStatus;
    }

    public InvalidStateTransitionException(String entityType, String entityId,
                                           Enum<?> currentStatus, Enum<?> expectedStatus) {
        this(entityType, entityId, currentStatus, expectedStatus.name());
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    public String getExpectedStatus() {
        return expectedStatus;
    }
}
